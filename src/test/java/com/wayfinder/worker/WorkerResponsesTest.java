package com.wayfinder.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WorkerResponses}.
 */
class WorkerResponsesTest {

    private static final String PIXELS = Base64.getEncoder().encodeToString(new byte[]{1, 2, 3});

    @Test
    @DisplayName("string returns an empty string for missing keys and null responses")
    void string() {
        assertEquals("https://example.com", WorkerResponses.string(Map.of("current_url", "https://example.com"), "current_url"));
        assertEquals("", WorkerResponses.string(Map.of(), "current_url"));
        assertEquals("", WorkerResponses.string(null, "current_url"));
    }

    @Test
    @DisplayName("extracts a screenshot and strips it from the copy")
    void screenshot() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("screenshot", Map.of("format", "png", "data", PIXELS));

        var image = WorkerResponses.screenshot(response).orElseThrow();

        assertEquals("png", image.format());
        assertArrayEquals(new byte[]{1, 2, 3}, image.data());
        assertEquals(Map.of("status", "success"), WorkerResponses.withoutScreenshot(response));
        assertTrue(response.containsKey("screenshot"));
    }

    @Test
    @DisplayName("ignores missing or malformed screenshots")
    void malformedScreenshot() {
        assertTrue(WorkerResponses.screenshot(Map.of("status", "success")).isEmpty());
        assertTrue(WorkerResponses.screenshot(Map.of("screenshot", Map.of("data", ""))).isEmpty());
        assertTrue(WorkerResponses.screenshot(Map.of("screenshot", Map.of("data", "%%not-base64%%"))).isEmpty());
    }
}
