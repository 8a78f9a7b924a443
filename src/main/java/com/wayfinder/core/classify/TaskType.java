package com.wayfinder.core.classify;

/**
 * How a user request gets executed.
 */
public enum TaskType {
    CONVERSATION,
    NAVIGATE,
    ACT,
    AGENT;

    public String wireName() {
        return name().toLowerCase();
    }

    /** Parses a browser task type; {@code null} for anything else, including "conversation". */
    static TaskType browserTask(Object value) {
        if (!(value instanceof String s)) {
            return null;
        }
        return switch (s.trim().toLowerCase()) {
            case "navigate" -> NAVIGATE;
            case "act" -> ACT;
            case "agent" -> AGENT;
            default -> null;
        };
    }
}
