package com.wayfinder.core.conversation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "wayfinder.conversation")
public class ConversationProperties {

    private String store = "memory";
    private String directory = "data/conversations";
    private int maxMessages = 50;
    private Duration memoryTtl = Duration.ofHours(1);
    private Duration fileTtl = Duration.ofDays(7);
    private Duration cleanupInterval = Duration.ofMinutes(5);

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }
    public int getMaxMessages() { return maxMessages; }
    public void setMaxMessages(int maxMessages) { this.maxMessages = maxMessages; }
    public Duration getMemoryTtl() { return memoryTtl; }
    public void setMemoryTtl(Duration memoryTtl) { this.memoryTtl = memoryTtl; }
    public Duration getFileTtl() { return fileTtl; }
    public void setFileTtl(Duration fileTtl) { this.fileTtl = fileTtl; }
    public Duration getCleanupInterval() { return cleanupInterval; }
    public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }

    public boolean isFileStore() {
        return "file".equalsIgnoreCase(store);
    }
}
