package com.wayfinder.worker;

import com.wayfinder.core.conversation.ContentBlock;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accessors for the JSON maps workers return.
 */
public final class WorkerResponses {

    private WorkerResponses() {}

    public static String string(Map<String, Object> response, String key) {
        if (response == null) {
            return "";
        }
        Object value = response.get(key);
        return value != null ? String.valueOf(value) : "";
    }

    public static boolean isError(Map<String, Object> response) {
        return response != null && "error".equals(response.get("status"));
    }

    /** The {@code screenshot{data,format}} payload as an image, if present and well formed. */
    public static Optional<ContentBlock.Image> screenshot(Map<String, Object> response) {
        if (response == null || !(response.get("screenshot") instanceof Map<?, ?> shot)) {
            return Optional.empty();
        }
        if (!(shot.get("data") instanceof String data) || data.isBlank()) {
            return Optional.empty();
        }
        Object format = shot.get("format");
        try {
            return Optional.of(ContentBlock.Image.fromBase64(format != null ? format.toString() : "jpeg", data));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Copy of the response without its screenshot payload. */
    public static Map<String, Object> withoutScreenshot(Map<String, Object> response) {
        Map<String, Object> copy = new LinkedHashMap<>(response != null ? response : Map.of());
        copy.remove("screenshot");
        return copy;
    }
}
