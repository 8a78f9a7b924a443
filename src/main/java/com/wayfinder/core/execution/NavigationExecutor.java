package com.wayfinder.core.execution;

import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.browser.BrowserStateUpdate;
import com.wayfinder.core.browser.BrowserStatus;
import com.wayfinder.core.classify.TaskClassification;
import com.wayfinder.core.classify.TaskType;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.events.ThoughtEventBus;
import com.wayfinder.worker.SessionWorkerRegistry;
import com.wayfinder.worker.WorkerConnection;
import com.wayfinder.worker.WorkerResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Opens a URL in the session's browser with a single {@code navigate} call.
 */
@Service
public class NavigationExecutor extends BaseTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(NavigationExecutor.class);

    static final String DEFAULT_URL = "https://www.google.com";

    public NavigationExecutor(SessionWorkerRegistry registry, BrowserStateManager browserStates,
                              ThoughtEventBus eventBus) {
        super(registry, browserStates, eventBus);
    }

    public TaskResult execute(TaskClassification classification, String sessionId) {
        long start = System.currentTimeMillis();
        WorkerConnection worker = registry.getOrCreateWorker(sessionId);
        String url = classification.details() != null && !classification.details().isBlank()
                ? classification.details() : DEFAULT_URL;

        eventBus.emit(sessionId, "navigation", "execution", "Navigation", "Navigating to URL: " + url);
        browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.NAVIGATING).currentUrl(url));

        Map<String, Object> response;
        try {
            response = worker.callTool(WorkerConnection.TOOL_NAVIGATE, Map.of("url", url));
        } catch (RuntimeException e) {
            return failed(sessionId, url, e.getMessage(), start);
        }
        if (WorkerResponses.isError(response)) {
            String error = WorkerResponses.string(response, "error");
            return failed(sessionId, url, error.isBlank() ? WorkerResponses.string(response, "message") : error, start);
        }

        String currentUrl = WorkerResponses.string(response, "current_url");
        String title = WorkerResponses.string(response, "page_title");
        browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.INITIALIZED)
                .currentUrl(currentUrl.isBlank() ? url : currentUrl)
                .pageTitle(title)
                .hasScreenshot(response.get("screenshot") != null));
        Optional<ContentBlock.Image> screenshot = reportScreenshot(sessionId, response, "Navigation result for: " + url);

        String answer = "Successfully navigated to " + url + ". The page title is: "
                + (title.isBlank() ? "Unknown" : title);
        emitAnswer(sessionId, answer, resultDetails(currentUrl.isBlank() ? url : currentUrl, title, start));
        log.info("Navigated session {} to {}", sessionId, url);
        return new TaskResult(TaskType.NAVIGATE, TaskResult.SUCCESS, answer, currentUrl, title, null,
                screenshot.map(List::of).orElse(List.of()));
    }

    private TaskResult failed(String sessionId, String url, String error, long start) {
        log.error("Navigation to {} failed for session {}: {}", url, sessionId, error);
        browserStates.update(sessionId, BrowserStateUpdate.status(BrowserStatus.INITIALIZED));
        String answer = "Navigation error: " + error;
        emitAnswer(sessionId, answer, Map.of("error", String.valueOf(error),
                "processing_time_sec", elapsedSeconds(start)));
        eventBus.emit(sessionId, "error", "error", "Navigation", answer);
        return new TaskResult(TaskType.NAVIGATE, TaskResult.ERROR, answer, "", "", error, List.of());
    }
}
