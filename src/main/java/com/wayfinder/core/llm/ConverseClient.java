package com.wayfinder.core.llm;

import com.wayfinder.core.conversation.ConversationEntry;

import java.util.List;

/**
 * Synchronous tool-calling model access: one call per turn.
 * <p>
 * Tool calls requested by the model are returned, never executed by the client.
 */
public interface ConverseClient {

    ConverseResult converse(List<ConversationEntry> messages, String systemPrompt,
                            List<ToolSpec> tools, InferenceOptions options);

    default ConverseResult converse(List<ConversationEntry> messages, String systemPrompt, List<ToolSpec> tools) {
        return converse(messages, systemPrompt, tools, InferenceOptions.DEFAULT);
    }
}
