package com.wayfinder.core.conversation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One piece of a {@link ConversationEntry}: text, a tool request, a tool result or an image.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContentBlock.Text.class, name = "text"),
        @JsonSubTypes.Type(value = ContentBlock.ToolUse.class, name = "toolUse"),
        @JsonSubTypes.Type(value = ContentBlock.ToolResult.class, name = "toolResult"),
        @JsonSubTypes.Type(value = ContentBlock.Image.class, name = "image")
})
public sealed interface ContentBlock
        permits ContentBlock.Text, ContentBlock.ToolUse, ContentBlock.ToolResult, ContentBlock.Image {

    record Text(String text) implements ContentBlock {}

    /**
     * A model's request to invoke a tool. {@code toolUseId} correlates it with its {@link ToolResult}.
     */
    record ToolUse(String toolUseId, String name, Map<String, Object> input) implements ContentBlock {
        public ToolUse {
            input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
        }
    }

    /**
     * Outcome of a tool call.
     *
     * @param toolUseId correlation id of the matching {@link ToolUse}
     * @param status    "success" or "error"
     * @param data      structured result (screenshot payloads removed)
     * @param text      free-text content, used when there is no structured data
     * @param images    screenshots produced by the call
     */
    record ToolResult(String toolUseId, String status, Map<String, Object> data, String text,
                      List<Image> images) implements ContentBlock {

        public static final String STATUS_SUCCESS = "success";
        public static final String STATUS_ERROR = "error";

        public ToolResult {
            status = status != null ? status : STATUS_SUCCESS;
            data = data != null ? data : Map.of();
            images = images != null ? List.copyOf(images) : List.of();
        }

        public static ToolResult of(String toolUseId, Map<String, Object> data, List<Image> images) {
            Object status = data != null ? data.get("status") : null;
            return new ToolResult(toolUseId,
                    STATUS_ERROR.equals(status) ? STATUS_ERROR : STATUS_SUCCESS, data, null, images);
        }

        @JsonIgnore
        public boolean isEmpty() {
            return data.isEmpty() && (text == null || text.isBlank()) && images.isEmpty();
        }

        public ToolResult withoutImages(String placeholder) {
            var stripped = new ToolResult(toolUseId, status, data, text, List.of());
            if (stripped.isEmpty()) {
                return new ToolResult(toolUseId, status, data, placeholder, List.of());
            }
            return stripped;
        }
    }

    /**
     * A binary image, typically a browser screenshot.
     *
     * @param format image format such as "jpeg" or "png"
     * @param data   raw bytes
     */
    record Image(String format, byte[] data) implements ContentBlock {

        public static Image fromBase64(String format, String base64) {
            return new Image(format != null ? format : "jpeg", Base64.getDecoder().decode(base64));
        }

        public String base64() {
            return Base64.getEncoder().encodeToString(data);
        }
    }
}
