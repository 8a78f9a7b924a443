package com.wayfinder.core.conversation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One message in a session's conversation log.
 *
 * @param role      who produced the message
 * @param content   ordered content blocks
 * @param timestamp when the entry was written
 * @param metadata  free-form annotations (e.g. {@code source} of an assistant answer)
 */
public record ConversationEntry(
    Role role,
    List<ContentBlock> content,
    Instant timestamp,
    Map<String, String> metadata
) {

    public ConversationEntry {
        content = content != null ? List.copyOf(content) : List.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static ConversationEntry user(String text) {
        return new ConversationEntry(Role.USER, List.of(new ContentBlock.Text(text)), Instant.now(), null);
    }

    public static ConversationEntry user(String text, List<ContentBlock.Image> images) {
        var blocks = new ArrayList<ContentBlock>();
        blocks.add(new ContentBlock.Text(text));
        if (images != null) {
            blocks.addAll(images);
        }
        return new ConversationEntry(Role.USER, blocks, Instant.now(), null);
    }

    public static ConversationEntry assistant(String text) {
        return new ConversationEntry(Role.ASSISTANT, List.of(new ContentBlock.Text(text)), Instant.now(), null);
    }

    public static ConversationEntry assistant(String text, String source) {
        return new ConversationEntry(Role.ASSISTANT, List.of(new ContentBlock.Text(text)), Instant.now(),
                Map.of("source", source));
    }

    public static ConversationEntry toolUse(String toolUseId, String name, Map<String, Object> input) {
        return new ConversationEntry(Role.ASSISTANT,
                List.of(new ContentBlock.ToolUse(toolUseId, name, input)), Instant.now(), null);
    }

    public static ConversationEntry toolResult(ContentBlock.ToolResult result) {
        return new ConversationEntry(Role.USER, List.of(result), Instant.now(), null);
    }

    /** Concatenated text blocks, or an empty string. */
    public String text() {
        var sb = new StringBuilder();
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.Text t && t.text() != null) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(t.text());
            }
        }
        return sb.toString();
    }

    public List<ContentBlock.ToolUse> toolUses() {
        var uses = new ArrayList<ContentBlock.ToolUse>();
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.ToolUse use) uses.add(use);
        }
        return uses;
    }

    public List<ContentBlock.ToolResult> toolResults() {
        var results = new ArrayList<ContentBlock.ToolResult>();
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.ToolResult result) results.add(result);
        }
        return results;
    }

    public boolean hasOnlyToolResults() {
        return !content.isEmpty() && content.stream().allMatch(b -> b instanceof ContentBlock.ToolResult);
    }

    public ConversationEntry withContent(List<ContentBlock> newContent) {
        return new ConversationEntry(role, newContent, timestamp, metadata);
    }
}
