package com.wayfinder.core.error;

import com.wayfinder.core.events.ThoughtEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions to {@link ErrorReport}s, logs them at a severity-appropriate level
 * and mirrors them onto the session's event stream.
 */
@Component
public class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private final ThoughtEventBus eventBus;

    public ErrorReporter(ThoughtEventBus eventBus) {
        this.eventBus = eventBus;
    }

    public ErrorReport report(Throwable exception, String context, String sessionId) {
        Throwable cause = unwrap(exception);
        ErrorCode code = classify(cause);
        ErrorSeverity severity = severityFor(cause, code);
        String technical = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String logMessage = context + ": " + technical;

        switch (severity) {
            case CRITICAL, HIGH -> log.error(logMessage, cause);
            case MEDIUM -> log.warn(logMessage, cause);
            default -> log.info(logMessage);
        }

        if (sessionId != null) {
            eventBus.emit(sessionId, "error", "system_error", "ErrorHandler", logMessage,
                    Map.of("error_code", code.name(), "error", technical));
        }

        return new ErrorReport(code, code.userMessage(), technical, severity, sessionId, Instant.now());
    }

    static ErrorCode classify(Throwable exception) {
        if (exception instanceof WayfinderException we) {
            return we.getErrorCode();
        }
        if (exception instanceof TimeoutException) {
            return ErrorCode.AGENT_TIMEOUT_ERROR;
        }
        if (exception instanceof IOException || exception instanceof UncheckedIOException) {
            return ErrorCode.SERVER_CONNECTION_ERROR;
        }
        if (exception instanceof IllegalArgumentException) {
            return ErrorCode.VALIDATION_ERROR;
        }
        String message = exception.getMessage() != null ? exception.getMessage().toLowerCase() : "";
        if (message.contains("browser")) {
            return ErrorCode.BROWSER_ACTION_ERROR;
        }
        if (message.contains("session")) {
            return ErrorCode.SESSION_NOT_FOUND;
        }
        return ErrorCode.UNKNOWN_ERROR;
    }

    private static ErrorSeverity severityFor(Throwable exception, ErrorCode code) {
        if (exception instanceof IOException || exception instanceof UncheckedIOException) {
            return ErrorSeverity.HIGH;
        }
        return code.defaultSeverity();
    }

    private static Throwable unwrap(Throwable exception) {
        Throwable current = exception;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
