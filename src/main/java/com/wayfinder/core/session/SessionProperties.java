package com.wayfinder.core.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "wayfinder.session")
public class SessionProperties {

    private Duration ttl = Duration.ofHours(1);
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private Duration resourceCleanupTimeout = Duration.ofSeconds(35);
    private String store = "memory";
    private String storeDirectory = "data/sessions";

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    public Duration getResourceCleanupTimeout() { return resourceCleanupTimeout; }
    public void setResourceCleanupTimeout(Duration resourceCleanupTimeout) { this.resourceCleanupTimeout = resourceCleanupTimeout; }
    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public String getStoreDirectory() { return storeDirectory; }
    public void setStoreDirectory(String storeDirectory) { this.storeDirectory = storeDirectory; }

    public boolean isFileStore() {
        return "file".equalsIgnoreCase(store);
    }
}
