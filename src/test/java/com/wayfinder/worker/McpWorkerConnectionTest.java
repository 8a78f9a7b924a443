package com.wayfinder.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link McpWorkerConnection} response handling. No worker process is started.
 */
class McpWorkerConnectionTest {

    private McpWorkerConnection connection;

    @BeforeEach
    void setUp() {
        connection = new McpWorkerConnection("s1", new WorkerProperties(), new ObjectMapper());
    }

    @Test
    @DisplayName("parses a JSON tool result into a map")
    void parsesJson() {
        Map<String, Object> response = connection.parse(
                "{\"status\":\"success\",\"current_url\":\"https://example.com\",\"screenshot\":{\"format\":\"jpeg\",\"data\":\"AAAA\"}}");

        assertEquals("success", response.get("status"));
        assertEquals("https://example.com", response.get("current_url"));
        assertInstanceOf(Map.class, response.get("screenshot"));
    }

    @Test
    @DisplayName("blank text yields an unknown status")
    void blankText() {
        assertEquals(Map.of("status", "unknown"), connection.parse("  "));
        assertEquals(Map.of("status", "unknown"), connection.parse(null));
    }

    @Test
    @DisplayName("non-JSON text is kept as the message")
    void plainText() {
        Map<String, Object> response = connection.parse("Browser crashed");

        assertEquals("unknown", response.get("status"));
        assertEquals("Browser crashed", response.get("message"));
    }

    @Test
    @DisplayName("an error status is recognised")
    void errorStatus() {
        assertTrue(McpWorkerConnection.isError(Map.of("status", "error", "error", "boom")));
        assertFalse(McpWorkerConnection.isError(Map.of("status", "success")));
    }

    @Test
    @DisplayName("a connection that was never initialized reports so and closes quietly")
    void neverInitialized() {
        assertFalse(connection.isInitialized());
        assertEquals("s1", connection.sessionId());
        assertDoesNotThrow(connection::close);
    }
}
