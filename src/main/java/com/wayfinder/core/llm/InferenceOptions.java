package com.wayfinder.core.llm;

/**
 * Per-call sampling overrides; {@code null} fields fall back to the configured defaults.
 */
public record InferenceOptions(Double temperature, Integer maxTokens) {

    public static final InferenceOptions DEFAULT = new InferenceOptions(null, null);
}
