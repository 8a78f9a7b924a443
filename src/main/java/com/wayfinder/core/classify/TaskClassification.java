package com.wayfinder.core.classify;

/**
 * Result of routing a user request.
 *
 * @param type     execution strategy
 * @param details  the target URL for {@link TaskType#NAVIGATE}, otherwise {@code null}
 * @param answer   the model's direct reply, used for {@link TaskType#CONVERSATION}
 * @param fallback {@code true} when no classification could be read from the model and
 *                 the request defaulted to {@link TaskType#AGENT}
 */
public record TaskClassification(TaskType type, String details, String answer, boolean fallback) {

    public static TaskClassification conversation(String answer) {
        return new TaskClassification(TaskType.CONVERSATION, null, answer, false);
    }

    public static TaskClassification of(TaskType type, String details) {
        return new TaskClassification(type, details, null, false);
    }

    public static TaskClassification agentFallback() {
        return new TaskClassification(TaskType.AGENT, null, null, true);
    }
}
