package com.wayfinder.core.error;

import java.time.Instant;

/**
 * User-safe description of a failure.
 *
 * @param errorCode        stable code
 * @param message          friendly text for the end user
 * @param technicalDetails raw exception text, for logs and operators only
 * @param severity         how loudly the failure was logged
 * @param sessionId        session the failure happened in (nullable)
 * @param timestamp        when the failure was reported
 */
public record ErrorReport(
    ErrorCode errorCode,
    String message,
    String technicalDetails,
    ErrorSeverity severity,
    String sessionId,
    Instant timestamp
) {}
