package com.wayfinder.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the per-session browser worker process.
 *
 * <pre>
 * wayfinder:
 *   worker:
 *     command: python
 *     args: [nova_act_server.py]
 *     env:
 *       NOVA_ACT_API_KEY: ...
 *     max-workers: 10
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "wayfinder.worker")
public class WorkerProperties {

    private String command = "python";
    private List<String> args = new ArrayList<>();
    private Map<String, String> env = new HashMap<>();
    private boolean headless = true;
    private String startUrl = "https://www.google.com";
    private int maxWorkers = 10;
    private int maxSteps = 3;
    private Duration initTimeout = Duration.ofSeconds(60);
    private Duration callTimeout = Duration.ofSeconds(100);
    private Duration probeTimeout = Duration.ofSeconds(2);
    private Duration urlCaptureTimeout = Duration.ofSeconds(1);
    private Duration closeTimeout = Duration.ofSeconds(30);
    private Duration closeAllTimeout = Duration.ofSeconds(10);
    private int screenshotMaxWidth = 800;
    private int screenshotQuality = 70;

    public String getCommand() { return command; }
    public void setCommand(String command) { this.command = command; }
    public List<String> getArgs() { return args; }
    public void setArgs(List<String> args) { this.args = args; }
    public Map<String, String> getEnv() { return env; }
    public void setEnv(Map<String, String> env) { this.env = env; }
    public boolean isHeadless() { return headless; }
    public void setHeadless(boolean headless) { this.headless = headless; }
    public String getStartUrl() { return startUrl; }
    public void setStartUrl(String startUrl) { this.startUrl = startUrl; }
    public int getMaxWorkers() { return maxWorkers; }
    public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
    public int getMaxSteps() { return maxSteps; }
    public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
    public Duration getInitTimeout() { return initTimeout; }
    public void setInitTimeout(Duration initTimeout) { this.initTimeout = initTimeout; }
    public Duration getCallTimeout() { return callTimeout; }
    public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
    public Duration getUrlCaptureTimeout() { return urlCaptureTimeout; }
    public void setUrlCaptureTimeout(Duration urlCaptureTimeout) { this.urlCaptureTimeout = urlCaptureTimeout; }
    public Duration getCloseTimeout() { return closeTimeout; }
    public void setCloseTimeout(Duration closeTimeout) { this.closeTimeout = closeTimeout; }
    public Duration getCloseAllTimeout() { return closeAllTimeout; }
    public void setCloseAllTimeout(Duration closeAllTimeout) { this.closeAllTimeout = closeAllTimeout; }
    public int getScreenshotMaxWidth() { return screenshotMaxWidth; }
    public void setScreenshotMaxWidth(int screenshotMaxWidth) { this.screenshotMaxWidth = screenshotMaxWidth; }
    public int getScreenshotQuality() { return screenshotQuality; }
    public void setScreenshotQuality(int screenshotQuality) { this.screenshotQuality = screenshotQuality; }
}
