package com.wayfinder.core.conversation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConversationReplay}.
 */
class ConversationReplayTest {

    private static final ContentBlock.Image SHOT = new ContentBlock.Image("jpeg", new byte[]{1, 2, 3});

    @Nested
    @DisplayName("image stripping")
    class ImageStrippingTests {

        @Test
        @DisplayName("keeps images only in the most recent user entry")
        void keepsLatestImages() {
            var history = List.of(
                    ConversationEntry.user("first", List.of(SHOT)),
                    ConversationEntry.assistant("ok"),
                    ConversationEntry.user("second", List.of(SHOT)));

            List<ConversationEntry> prepared = ConversationReplay.prepare(history);

            assertEquals(3, prepared.size());
            assertTrue(prepared.get(0).content().stream().noneMatch(b -> b instanceof ContentBlock.Image));
            assertTrue(prepared.get(2).content().stream().anyMatch(b -> b instanceof ContentBlock.Image));
        }

        @Test
        @DisplayName("replaces a tool result emptied by stripping with a placeholder")
        void placeholderForEmptiedResult() {
            var history = List.of(
                    ConversationEntry.toolUse("t-1", "take_screenshot", Map.of()),
                    ConversationEntry.toolResult(new ContentBlock.ToolResult("t-1", "success", Map.of(), null,
                            List.of(SHOT))),
                    ConversationEntry.assistant("done"),
                    ConversationEntry.user("next"));

            List<ConversationEntry> prepared = ConversationReplay.prepare(history);

            ContentBlock.ToolResult result = prepared.get(1).toolResults().get(0);
            assertTrue(result.images().isEmpty());
            assertEquals(ConversationReplay.IMAGE_PLACEHOLDER, result.text());
        }
    }

    @Nested
    @DisplayName("tool pairing")
    class PairingTests {

        @Test
        @DisplayName("drops a tool use that never got a result")
        void dropsUnmatchedUse() {
            var history = List.of(
                    ConversationEntry.user("go"),
                    ConversationEntry.toolUse("t-1", "navigate", Map.of("url", "https://a.test")),
                    ConversationEntry.assistant("gave up"));

            List<ConversationEntry> prepared = ConversationReplay.prepare(history);

            assertEquals(2, prepared.size());
            assertTrue(prepared.stream().allMatch(e -> e.toolUses().isEmpty()));
            assertTrue(ConversationReplay.isPairingValid(prepared));
        }

        @Test
        @DisplayName("drops orphaned and duplicate results")
        void dropsOrphans() {
            var history = List.of(
                    ConversationEntry.toolResult(ContentBlock.ToolResult.of("ghost", Map.of("status", "success"), null)),
                    ConversationEntry.toolUse("t-1", "act", Map.of("instruction", "click")),
                    ConversationEntry.toolResult(ContentBlock.ToolResult.of("t-1", Map.of("status", "success"), null)),
                    ConversationEntry.toolResult(ContentBlock.ToolResult.of("t-1", Map.of("status", "success"), null)));

            List<ConversationEntry> prepared = ConversationReplay.prepare(history);

            assertEquals(2, prepared.size());
            assertEquals("t-1", prepared.get(0).toolUses().get(0).toolUseId());
            assertEquals("t-1", prepared.get(1).toolResults().get(0).toolUseId());
            assertTrue(ConversationReplay.isPairingValid(prepared));
        }

        @Test
        @DisplayName("a result after the next assistant turn does not count as a match")
        void lateResultIsDropped() {
            var history = List.of(
                    ConversationEntry.toolUse("t-1", "act", Map.of()),
                    ConversationEntry.assistant("moving on"),
                    ConversationEntry.toolResult(ContentBlock.ToolResult.of("t-1", Map.of("ok", true), null)));

            List<ConversationEntry> prepared = ConversationReplay.prepare(history);

            assertEquals(1, prepared.size());
            assertEquals("moving on", prepared.get(0).text());
        }

        @Test
        @DisplayName("isPairingValid rejects an assistant turn while results are pending")
        void validationRejectsPending() {
            var entries = List.of(
                    ConversationEntry.toolUse("t-1", "act", Map.of()),
                    ConversationEntry.assistant("too early"));

            assertFalse(ConversationReplay.isPairingValid(entries));
        }
    }

    @Test
    @DisplayName("drops blank text and entries left empty")
    void dropsEmptyEntries() {
        var history = List.of(ConversationEntry.user(" "), ConversationEntry.assistant("hi"));

        List<ConversationEntry> prepared = ConversationReplay.prepare(history);

        assertEquals(1, prepared.size());
        assertEquals(Role.ASSISTANT, prepared.get(0).role());
        assertTrue(ConversationReplay.prepare(null).isEmpty());
    }
}
