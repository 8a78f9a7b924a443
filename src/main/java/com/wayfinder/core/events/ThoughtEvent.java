package com.wayfinder.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress or result event emitted while a session request is being handled,
 * consumed by whatever streaming or UI layer embeds the supervisor.
 *
 * @param sessionId        the session this event belongs to
 * @param type             event type (e.g. "processing", "tool_call", "answer", "task_status")
 * @param category         coarse grouping (e.g. "status", "tool", "result", "error")
 * @param node             the component that produced the event (e.g. "Supervisor", "Agent", "Browser")
 * @param content          human-readable text
 * @param technicalDetails optional structured details (never shown verbatim to end users)
 * @param timestamp        when the event occurred
 */
public record ThoughtEvent(
    String sessionId,
    String type,
    String category,
    String node,
    String content,
    Map<String, Object> technicalDetails,
    Instant timestamp
) implements Serializable {

    public static ThoughtEvent of(String sessionId, String type, String category, String node, String content) {
        return new ThoughtEvent(sessionId, type, category, node, content, Map.of(), Instant.now());
    }

    public static ThoughtEvent of(String sessionId, String type, String category, String node, String content,
                                  Map<String, Object> technicalDetails) {
        return new ThoughtEvent(sessionId, type, category, node, content,
                technicalDetails != null ? technicalDetails : Map.of(), Instant.now());
    }
}
