package com.wayfinder.core.execution;

import com.wayfinder.core.conversation.ContentBlock;

import java.util.List;

/**
 * What the session's browser showed at one moment.
 *
 * @param screenshot latest screenshot, or {@code null}
 */
public record WorkerSnapshot(boolean initialized, String currentUrl, String pageTitle,
                             ContentBlock.Image screenshot) {

    public static final WorkerSnapshot NONE = new WorkerSnapshot(false, "", "", null);

    public List<ContentBlock.Image> images() {
        return screenshot != null ? List.of(screenshot) : List.of();
    }
}
