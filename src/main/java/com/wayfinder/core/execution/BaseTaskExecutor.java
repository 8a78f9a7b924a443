package com.wayfinder.core.execution;

import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.browser.BrowserStateUpdate;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.events.ThoughtEventBus;
import com.wayfinder.worker.SessionWorkerRegistry;
import com.wayfinder.worker.WorkerConnection;
import com.wayfinder.worker.WorkerResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for executors: reading the worker's current page and reporting
 * screenshots and results as thought events.
 */
public abstract class BaseTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(BaseTaskExecutor.class);

    protected final SessionWorkerRegistry registry;
    protected final BrowserStateManager browserStates;
    protected final ThoughtEventBus eventBus;

    protected BaseTaskExecutor(SessionWorkerRegistry registry, BrowserStateManager browserStates,
                               ThoughtEventBus eventBus) {
        this.registry = registry;
        this.browserStates = browserStates;
        this.eventBus = eventBus;
    }

    /**
     * Current page of the session's live worker, or {@link WorkerSnapshot#NONE} when
     * there is no worker. Never launches one.
     */
    public WorkerSnapshot getWorkerState(String sessionId) {
        return registry.getWorkerIfExists(sessionId)
                .map(worker -> snapshot(worker, sessionId, false))
                .orElse(WorkerSnapshot.NONE);
    }

    protected WorkerSnapshot snapshot(WorkerConnection worker, String sessionId, boolean report) {
        try {
            Map<String, Object> response = worker.callTool(WorkerConnection.TOOL_SCREENSHOT, registry.screenshotArgs());
            if (WorkerResponses.isError(response)) {
                log.debug("Screenshot failed for session {}: {}", sessionId, WorkerResponses.string(response, "message"));
                return WorkerSnapshot.NONE;
            }
            if (report) {
                reportScreenshot(sessionId, response, "Browser state retrieved");
            }
            return new WorkerSnapshot(true,
                    WorkerResponses.string(response, "current_url"),
                    WorkerResponses.string(response, "page_title"),
                    WorkerResponses.screenshot(response).orElse(null));
        } catch (RuntimeException e) {
            log.warn("Could not read browser state for session {}: {}", sessionId, e.getMessage());
            return WorkerSnapshot.NONE;
        }
    }

    /** Emits a {@code visualization} event when the response carries a screenshot. */
    protected Optional<ContentBlock.Image> reportScreenshot(String sessionId, Map<String, Object> response,
                                                           String caption) {
        Optional<ContentBlock.Image> image = WorkerResponses.screenshot(response);
        if (image.isPresent()) {
            Map<String, Object> details = new HashMap<>();
            details.put("screenshot", response.get("screenshot"));
            details.put("url", WorkerResponses.string(response, "current_url"));
            eventBus.emit(sessionId, "visualization", "screenshot", "Browser", caption, details);
        }
        return image;
    }

    /** Records the page a tool call left the browser on. */
    protected void recordPage(String sessionId, Map<String, Object> response) {
        String url = WorkerResponses.string(response, "current_url");
        if (url.isBlank()) {
            return;
        }
        browserStates.update(sessionId, BrowserStateUpdate.fields()
                .currentUrl(url)
                .pageTitle(WorkerResponses.string(response, "page_title"))
                .hasScreenshot(response.get("screenshot") != null));
    }

    protected void emitAnswer(String sessionId, String answer, Map<String, Object> details) {
        eventBus.emit(sessionId, "answer", "result", "Answer", answer, details);
    }

    protected static Map<String, Object> resultDetails(String currentUrl, String pageTitle, long startMillis) {
        Map<String, Object> details = new HashMap<>();
        details.put("current_url", currentUrl != null ? currentUrl : "");
        details.put("page_title", pageTitle != null ? pageTitle : "");
        details.put("processing_time_sec", elapsedSeconds(startMillis));
        return details;
    }

    protected static double elapsedSeconds(long startMillis) {
        return Math.round((System.currentTimeMillis() - startMillis) / 10.0) / 100.0;
    }
}
