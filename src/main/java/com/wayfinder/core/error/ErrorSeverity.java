package com.wayfinder.core.error;

public enum ErrorSeverity {
    LOW, MEDIUM, HIGH, CRITICAL
}
