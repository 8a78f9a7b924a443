package com.wayfinder.core.execution;

import com.wayfinder.core.conversation.ContentBlock;

import java.util.List;
import java.util.Map;

/**
 * Result of one nested agent mission, in the shape recorded as the supervisor's tool result.
 *
 * @param answer  the agent's answer; never empty
 * @param data    {@code answer}, {@code current_url}, {@code page_title} and, on failure, {@code error}
 * @param images  final screenshot, if any
 * @param stopped {@code true} when the mission ended on a stop request
 */
public record MissionOutcome(String answer, Map<String, Object> data, List<ContentBlock.Image> images,
                             boolean stopped) {

    public MissionOutcome {
        data = data != null ? Map.copyOf(data) : Map.of();
        images = images != null ? List.copyOf(images) : List.of();
    }
}
