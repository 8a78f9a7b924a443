package com.wayfinder.core.error;

/**
 * Stable error codes surfaced to callers, each paired with the message an end user sees.
 */
public enum ErrorCode {

    UNKNOWN_ERROR("An unexpected error occurred. Please try again.", ErrorSeverity.MEDIUM),
    VALIDATION_ERROR("The request contains invalid data. Please check your input.", ErrorSeverity.LOW),
    BROWSER_INITIALIZATION_ERROR("Failed to initialize browser. Please try again.", ErrorSeverity.HIGH),
    BROWSER_CONNECTION_ERROR("Could not connect to browser. Please check your connection.", ErrorSeverity.HIGH),
    BROWSER_NAVIGATION_ERROR("Failed to navigate to the requested page.", ErrorSeverity.MEDIUM),
    BROWSER_ACTION_ERROR("Browser action could not be completed.", ErrorSeverity.MEDIUM),
    AGENT_TIMEOUT_ERROR("The operation timed out. Please try again with a simpler request.", ErrorSeverity.MEDIUM),
    SESSION_NOT_FOUND("Session not found. Please start a new session.", ErrorSeverity.LOW),
    SESSION_EXPIRED("Your session has expired. Please start a new session.", ErrorSeverity.LOW),
    TASK_CLASSIFICATION_ERROR("Unable to understand your request. Please be more specific.", ErrorSeverity.MEDIUM),
    TASK_EXECUTION_ERROR("Failed to execute the requested task.", ErrorSeverity.MEDIUM),
    SERVER_CONNECTION_ERROR("Server connection failed. Please try again later.", ErrorSeverity.HIGH),
    SERVICE_UNAVAILABLE("Service is temporarily unavailable. Please try again later.", ErrorSeverity.HIGH),
    RESOURCE_EXHAUSTED("System resources are exhausted. Please try again later.", ErrorSeverity.HIGH);

    private final String userMessage;
    private final ErrorSeverity defaultSeverity;

    ErrorCode(String userMessage, ErrorSeverity defaultSeverity) {
        this.userMessage = userMessage;
        this.defaultSeverity = defaultSeverity;
    }

    public String userMessage() {
        return userMessage;
    }

    public ErrorSeverity defaultSeverity() {
        return defaultSeverity;
    }
}
