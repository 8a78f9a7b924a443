package com.wayfinder.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "wayfinder.llm")
public class LlmProperties {

    private String model = "";
    private double temperature = 0.7;
    private int maxTokens = 4096;
    private double classifierTemperature = 0.1;
    private int classifierMaxTokens = 1000;
    private Retry retry = new Retry();

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getClassifierTemperature() {
        return classifierTemperature;
    }

    public void setClassifierTemperature(double classifierTemperature) {
        this.classifierTemperature = classifierTemperature;
    }

    public int getClassifierMaxTokens() {
        return classifierMaxTokens;
    }

    public void setClassifierMaxTokens(int classifierMaxTokens) {
        this.classifierMaxTokens = classifierMaxTokens;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(20);
        private double jitter = 0.2;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
    }
}
