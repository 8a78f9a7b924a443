package com.wayfinder.core.conversation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Projects a stored conversation into the form that may be sent to the model.
 * <ul>
 *   <li>images survive only in the most recent user entry; tool results emptied by
 *       stripping get a placeholder text</li>
 *   <li>every tool use keeps exactly one matching tool result before the next assistant
 *       entry; unmatched uses and orphaned or duplicate results are dropped</li>
 *   <li>blank text blocks and entries left empty are dropped</li>
 * </ul>
 */
public final class ConversationReplay {

    public static final String IMAGE_PLACEHOLDER = "[Screenshot omitted]";

    private ConversationReplay() {}

    public static List<ConversationEntry> prepare(List<ConversationEntry> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<ConversationEntry> stripped = stripOldImages(history);
        Set<ContentBlock> paired = findPairedBlocks(stripped);

        var result = new ArrayList<ConversationEntry>(stripped.size());
        for (ConversationEntry entry : stripped) {
            var blocks = new ArrayList<ContentBlock>(entry.content().size());
            for (ContentBlock block : entry.content()) {
                if (block instanceof ContentBlock.Text t) {
                    if (t.text() != null && !t.text().isBlank()) blocks.add(t);
                } else if (block instanceof ContentBlock.Image) {
                    blocks.add(block);
                } else if (paired.contains(block)) {
                    blocks.add(block);
                }
            }
            if (!blocks.isEmpty()) {
                result.add(entry.withContent(blocks));
            }
        }
        return result;
    }

    /**
     * Checks the pairing rule on an already prepared history.
     */
    public static boolean isPairingValid(List<ConversationEntry> entries) {
        Map<String, Boolean> open = new LinkedHashMap<>();
        for (ConversationEntry entry : entries) {
            if (entry.role() == Role.ASSISTANT) {
                if (!open.isEmpty()) {
                    return false;
                }
                for (ContentBlock.ToolUse use : entry.toolUses()) {
                    open.put(use.toolUseId(), Boolean.TRUE);
                }
            } else {
                for (ContentBlock.ToolResult result : entry.toolResults()) {
                    if (open.remove(result.toolUseId()) == null) {
                        return false;
                    }
                }
            }
        }
        return open.isEmpty();
    }

    private static List<ConversationEntry> stripOldImages(List<ConversationEntry> history) {
        int lastUser = -1;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).role() == Role.USER) {
                lastUser = i;
                break;
            }
        }
        var result = new ArrayList<ConversationEntry>(history.size());
        for (int i = 0; i < history.size(); i++) {
            ConversationEntry entry = history.get(i);
            if (i == lastUser) {
                result.add(entry);
                continue;
            }
            var blocks = new ArrayList<ContentBlock>(entry.content().size());
            for (ContentBlock block : entry.content()) {
                if (block instanceof ContentBlock.Image) {
                    continue;
                }
                if (block instanceof ContentBlock.ToolResult tr && !tr.images().isEmpty()) {
                    blocks.add(tr.withoutImages(IMAGE_PLACEHOLDER));
                } else {
                    blocks.add(block);
                }
            }
            result.add(entry.withContent(blocks));
        }
        return result;
    }

    private static Set<ContentBlock> findPairedBlocks(List<ConversationEntry> entries) {
        Set<ContentBlock> paired = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < entries.size(); i++) {
            ConversationEntry entry = entries.get(i);
            if (entry.role() != Role.ASSISTANT) {
                continue;
            }
            Map<String, ContentBlock.ToolUse> pending = new LinkedHashMap<>();
            for (ContentBlock.ToolUse use : entry.toolUses()) {
                pending.putIfAbsent(use.toolUseId(), use);
            }
            for (int j = i + 1; j < entries.size() && !pending.isEmpty(); j++) {
                ConversationEntry next = entries.get(j);
                if (next.role() == Role.ASSISTANT) {
                    break;
                }
                for (ContentBlock.ToolResult result : next.toolResults()) {
                    ContentBlock.ToolUse use = pending.remove(result.toolUseId());
                    if (use != null) {
                        paired.add(use);
                        paired.add(result);
                    }
                }
            }
        }
        return paired;
    }
}
