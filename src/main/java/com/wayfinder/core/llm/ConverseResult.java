package com.wayfinder.core.llm;

import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.conversation.ConversationEntry;

import java.util.List;

/**
 * One model turn.
 *
 * @param stopReason normalized stop reason
 * @param output     the assistant entry produced (text and/or tool uses)
 */
public record ConverseResult(StopReason stopReason, ConversationEntry output) {

    public String text() {
        return output.text();
    }

    public List<ContentBlock.ToolUse> toolUses() {
        return output.toolUses();
    }
}
