package com.wayfinder.core.execution;

import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.classify.TaskType;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.events.ThoughtEventBus;
import com.wayfinder.worker.SessionWorkerRegistry;
import com.wayfinder.worker.WorkerConnection;
import com.wayfinder.worker.WorkerProperties;
import com.wayfinder.worker.WorkerResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Performs one browser action with a single {@code act} call.
 * <p>
 * Running out of the worker's step budget is not a failure: the result is reported as
 * {@code in_progress} together with whatever page state is available.
 */
@Service
public class SingleActionExecutor extends BaseTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(SingleActionExecutor.class);

    static final String DEFAULT_ANSWER = "Action completed successfully";
    static final String IN_PROGRESS_ANSWER =
            "I'm still analyzing the page to find what you're looking for. Here's what I see so far.";

    private final WorkerProperties workerProperties;

    public SingleActionExecutor(SessionWorkerRegistry registry, BrowserStateManager browserStates,
                                ThoughtEventBus eventBus, WorkerProperties workerProperties) {
        super(registry, browserStates, eventBus);
        this.workerProperties = workerProperties;
    }

    public TaskResult execute(String instruction, String sessionId) {
        long start = System.currentTimeMillis();
        WorkerConnection worker = registry.getOrCreateWorker(sessionId);

        eventBus.emit(sessionId, "act_execution", "execution", "Action", "Executing browser action: " + instruction);

        Map<String, Object> args = new LinkedHashMap<>();
        args.put("instruction", instruction);
        args.put("max_steps", workerProperties.getMaxSteps());
        Map<String, Object> response;
        try {
            response = worker.callTool(WorkerConnection.TOOL_ACT, args);
        } catch (RuntimeException e) {
            return failed(sessionId, e.getMessage(), start);
        }

        if (isStepBudgetExhausted(response)) {
            return inProgress(worker, sessionId, response, start);
        }
        if (WorkerResponses.isError(response)) {
            String error = WorkerResponses.string(response, "error");
            return failed(sessionId, error.isBlank() ? WorkerResponses.string(response, "message") : error, start);
        }

        recordPage(sessionId, response);
        Optional<ContentBlock.Image> screenshot = reportScreenshot(sessionId, response, "Action result");
        String message = WorkerResponses.string(response, "message");
        String answer = message.isBlank() ? DEFAULT_ANSWER : message;
        String url = WorkerResponses.string(response, "current_url");
        String title = WorkerResponses.string(response, "page_title");
        emitAnswer(sessionId, answer, resultDetails(url, title, start));
        return new TaskResult(TaskType.ACT, TaskResult.SUCCESS, answer, url, title, null,
                screenshot.map(List::of).orElse(List.of()));
    }

    static boolean isStepBudgetExhausted(Map<String, Object> response) {
        if (TaskResult.IN_PROGRESS.equals(response.get("status"))) {
            return true;
        }
        if (!WorkerResponses.isError(response)) {
            return false;
        }
        String detail = WorkerResponses.string(response, "error") + " "
                + WorkerResponses.string(response, "technical_details");
        return detail.contains("ExceededMaxSteps");
    }

    private TaskResult inProgress(WorkerConnection worker, String sessionId, Map<String, Object> response, long start) {
        log.info("Action for session {} ran out of steps; reporting progress", sessionId);
        WorkerSnapshot state = WorkerResponses.string(response, "current_url").isBlank()
                ? snapshot(worker, sessionId, true)
                : new WorkerSnapshot(true, WorkerResponses.string(response, "current_url"),
                        WorkerResponses.string(response, "page_title"),
                        reportScreenshot(sessionId, response, "Action progress").orElse(null));
        String message = TaskResult.IN_PROGRESS.equals(response.get("status"))
                ? WorkerResponses.string(response, "message") : "";
        String answer = message.isBlank() ? IN_PROGRESS_ANSWER : message;
        emitAnswer(sessionId, answer, resultDetails(state.currentUrl(), state.pageTitle(), start));
        return new TaskResult(TaskType.ACT, TaskResult.IN_PROGRESS, answer, state.currentUrl(), state.pageTitle(),
                null, state.images());
    }

    private TaskResult failed(String sessionId, String error, long start) {
        log.error("Action failed for session {}: {}", sessionId, error);
        String answer = "I couldn't complete the action: " + error;
        emitAnswer(sessionId, answer, Map.of("error", String.valueOf(error),
                "processing_time_sec", elapsedSeconds(start)));
        eventBus.emit(sessionId, "error", "error", "Action", "Action error: " + error);
        return new TaskResult(TaskType.ACT, TaskResult.ERROR, answer, "", "", error, List.of());
    }
}
