package com.wayfinder.core.llm;

/**
 * Why the model stopped producing output.
 */
public enum StopReason {
    TOOL_USE,
    END_TURN,
    MAX_TOKENS,
    STOP_SEQUENCE,
    CONTENT_FILTERED;

    /** Every reason except {@link #TOOL_USE} ends the loop it occurs in. */
    public boolean isTerminal() {
        return this != TOOL_USE;
    }

    /**
     * Normalizes provider finish reasons (OpenAI, Anthropic and Bedrock spellings).
     */
    public static StopReason fromProvider(String finishReason, boolean hasToolCalls) {
        if (hasToolCalls) {
            return TOOL_USE;
        }
        if (finishReason == null) {
            return END_TURN;
        }
        return switch (finishReason.trim().toLowerCase()) {
            case "tool_use", "tool_calls", "function_call" -> TOOL_USE;
            case "length", "max_tokens" -> MAX_TOKENS;
            case "stop_sequence" -> STOP_SEQUENCE;
            case "content_filter", "content_filtered", "safety" -> CONTENT_FILTERED;
            default -> END_TURN;
        };
    }
}
