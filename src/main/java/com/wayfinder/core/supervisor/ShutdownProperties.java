package com.wayfinder.core.supervisor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Time bounds for the shutdown sequence.
 */
@Component
@ConfigurationProperties(prefix = "wayfinder.shutdown")
public class ShutdownProperties {

    private Duration sessionTimeout = Duration.ofSeconds(2);
    private Duration workerTimeout = Duration.ofSeconds(1);
    private Duration processKillGrace = Duration.ofMillis(300);

    public Duration getSessionTimeout() { return sessionTimeout; }
    public void setSessionTimeout(Duration sessionTimeout) { this.sessionTimeout = sessionTimeout; }
    public Duration getWorkerTimeout() { return workerTimeout; }
    public void setWorkerTimeout(Duration workerTimeout) { this.workerTimeout = workerTimeout; }
    public Duration getProcessKillGrace() { return processKillGrace; }
    public void setProcessKillGrace(Duration processKillGrace) { this.processKillGrace = processKillGrace; }
}
