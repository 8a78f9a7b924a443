package com.wayfinder.core.llm;

import com.wayfinder.core.conversation.ConversationEntry;
import com.wayfinder.core.metrics.WayfinderMetrics;

import java.util.List;

/**
 * Decorates a {@link ConverseClient} with a {@link RetryPolicy}.
 */
public class RetryingConverseClient implements ConverseClient {

    private final ConverseClient delegate;
    private final RetryPolicy policy;
    private final WayfinderMetrics metrics;

    public RetryingConverseClient(ConverseClient delegate, RetryPolicy policy, WayfinderMetrics metrics) {
        this.delegate = delegate;
        this.policy = policy;
        this.metrics = metrics;
    }

    @Override
    public ConverseResult converse(List<ConversationEntry> messages, String systemPrompt,
                                   List<ToolSpec> tools, InferenceOptions options) {
        return policy.execute(
                () -> delegate.converse(messages, systemPrompt, tools, options),
                attempt -> metrics.recordLlmRetry());
    }
}
