package com.wayfinder.core.supervisor;

import com.wayfinder.core.browser.BrowserState;
import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.classify.TaskClassification;
import com.wayfinder.core.classify.TaskClassifier;
import com.wayfinder.core.classify.TaskType;
import com.wayfinder.core.conversation.ConversationManager;
import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.error.ErrorReport;
import com.wayfinder.core.error.ErrorReporter;
import com.wayfinder.core.error.ValidationException;
import com.wayfinder.core.error.WayfinderException;
import com.wayfinder.core.events.ThoughtEventBus;
import com.wayfinder.core.execution.AgentOrchestrator;
import com.wayfinder.core.execution.NavigationExecutor;
import com.wayfinder.core.execution.SingleActionExecutor;
import com.wayfinder.core.execution.TaskResult;
import com.wayfinder.core.logging.MdcContext;
import com.wayfinder.core.metrics.WayfinderMetrics;
import com.wayfinder.core.session.Session;
import com.wayfinder.core.session.SessionLocks;
import com.wayfinder.core.session.SessionManager;
import com.wayfinder.core.session.SessionStoreUnavailableException;
import com.wayfinder.worker.SessionWorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for user requests.
 * <p>
 * Resolves the session, records the request in the conversation, classifies it and hands it
 * to the matching executor. Requests for one session run one at a time in arrival order;
 * requests for different sessions run in parallel. Every request ends with exactly one
 * {@code answer} event, including failed ones.
 */
@Service
public class TaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(TaskSupervisor.class);

    static final String ERROR_ANSWER = "I'm sorry, I encountered an error while processing your request.";

    private final SessionManager sessions;
    private final ConversationManager conversations;
    private final TaskClassifier classifier;
    private final NavigationExecutor navigationExecutor;
    private final SingleActionExecutor actionExecutor;
    private final AgentOrchestrator agentOrchestrator;
    private final SessionWorkerRegistry registry;
    private final BrowserStateManager browserStates;
    private final ThoughtEventBus eventBus;
    private final ErrorReporter errorReporter;
    private final WayfinderMetrics metrics;

    private final SessionLocks sessionLocks = new SessionLocks(true);
    private volatile boolean accepting = true;

    public TaskSupervisor(SessionManager sessions, ConversationManager conversations, TaskClassifier classifier,
                          NavigationExecutor navigationExecutor, SingleActionExecutor actionExecutor,
                          AgentOrchestrator agentOrchestrator, SessionWorkerRegistry registry,
                          BrowserStateManager browserStates, ThoughtEventBus eventBus,
                          ErrorReporter errorReporter, WayfinderMetrics metrics) {
        this.sessions = sessions;
        this.conversations = conversations;
        this.classifier = classifier;
        this.navigationExecutor = navigationExecutor;
        this.actionExecutor = actionExecutor;
        this.agentOrchestrator = agentOrchestrator;
        this.registry = registry;
        this.browserStates = browserStates;
        this.eventBus = eventBus;
        this.errorReporter = errorReporter;
        this.metrics = metrics;
    }

    /**
     * Processes one user request.
     *
     * @param message   the user's message, must not be blank
     * @param sessionId the caller's session, or {@code null} to start a new one
     * @throws ValidationException if {@code message} is blank
     * @throws WayfinderException  with {@link ErrorCode#SERVICE_UNAVAILABLE} during shutdown
     */
    public TaskResponse processRequest(String message, String sessionId) {
        if (message == null || message.isBlank()) {
            throw new ValidationException("Message must not be blank");
        }
        if (!accepting || sessions.isShuttingDown()) {
            throw new WayfinderException(ErrorCode.SERVICE_UNAVAILABLE, "Shutting down, request rejected");
        }

        Session session;
        try {
            session = sessions.getOrCreate(sessionId);
        } catch (SessionStoreUnavailableException e) {
            return failedAnswer(e, sessionId, null);
        }
        String sid = session.getId();
        ReentrantLock lock = sessionLocks.acquire(sid);
        MdcContext.setSession(sid);
        long start = System.currentTimeMillis();
        TaskResponse response = null;
        try {
            response = handle(message, sid);
            return response;
        } finally {
            String type = response != null && response.type() != null ? response.type().wireName() : "unknown";
            metrics.recordTaskDuration(type, System.currentTimeMillis() - start);
            MdcContext.clear();
            sessionLocks.release(sid, lock);
        }
    }

    private TaskResponse handle(String message, String sid) {
        TaskClassification classification = null;
        try {
            conversations.ensureSession(sid);
            conversations.addUserMessage(sid, message);
            eventBus.emit(sid, "processing", "status", "Supervisor", "Processing user request...");

            classification = classifier.classify(message, sid, conversations.getHistory(sid));
            TaskClassification routed = classification;
            TaskType type = routed.type();
            MdcContext.setTask(sid, type.wireName());
            metrics.recordRequest(type.wireName());
            log.info("Request for session {} classified as {}{}", sid, type.wireName(),
                    classification.fallback() ? " (fallback)" : "");

            if (type == TaskType.CONVERSATION) {
                String answer = classification.answer();
                conversations.addAssistantMessage(sid, answer, "direct_response");
                eventBus.emit(sid, "answer", "result", "Answer", answer);
                return new TaskResponse(type, TaskResult.SUCCESS, answer, sid, "", "", null, false);
            }

            conversations.addAssistantMessage(sid, "I'll handle this as a " + type.wireName() + " task.", "classification");
            eventBus.emit(sid, "reasoning", "analysis", "Supervisor",
                    "I've analyzed the request and determined it to be a " + type.wireName() + " task.");

            TaskResult result = switch (type) {
                case NAVIGATE -> runAsTool(sid, "navigate", Map.of("url", Objects.requireNonNullElse(routed.details(), "")),
                        () -> navigationExecutor.execute(routed, sid));
                case ACT -> runAsTool(sid, "act", Map.of("instruction", message),
                        () -> actionExecutor.execute(message, sid));
                default -> agentOrchestrator.execute(message, sid);
            };
            return new TaskResponse(type, result.status(), result.answer(), sid,
                    result.currentUrl(), result.pageTitle(), null, classification.fallback());
        } catch (RuntimeException e) {
            try {
                conversations.addAssistantMessage(sid, ERROR_ANSWER, "error");
            } catch (RuntimeException recordFailure) {
                e.addSuppressed(recordFailure);
            }
            return failedAnswer(e, sid, classification);
        }
    }

    private TaskResponse failedAnswer(RuntimeException e, String sid, TaskClassification classification) {
        ErrorReport report = errorReporter.report(e, "Error processing request", sid);
        eventBus.emit(sid, "answer", "result", "Answer", ERROR_ANSWER,
                Map.of("error_code", report.errorCode().name()));
        return new TaskResponse(classification != null ? classification.type() : null, TaskResult.ERROR,
                ERROR_ANSWER, sid, "", "", report, classification != null && classification.fallback());
    }

    /**
     * Runs a navigate or act executor as a recorded tool call. The executor emits the answer
     * itself, so a failure to record its result afterwards is reported without a second answer.
     */
    private TaskResult runAsTool(String sid, String toolName, Map<String, Object> input,
                                 Supplier<TaskResult> executor) {
        String toolUseId = conversations.addToolUsage(sid, toolName, input);
        TaskResult result = executor.get();
        try {
            conversations.addToolResult(sid, toolUseId, result.toToolResultData(), result.images());
            conversations.addAssistantMessage(sid, result.answer(), toolName);
        } catch (RuntimeException e) {
            errorReporter.report(e, "Error recording " + toolName + " result", sid);
        }
        return result;
    }

    /**
     * Asks the task running in {@code sessionId} to stop at its next turn boundary.
     *
     * @return {@code true} if a running task received the request
     */
    public boolean requestStop(String sessionId) {
        boolean requested = registry.requestStop(sessionId);
        log.info("Stop requested for session {}: {}", sessionId, requested ? "accepted" : "no running task");
        return requested;
    }

    /** Clears the conversation and closes the browser; the session itself stays valid. */
    public void resetSession(String sessionId) {
        ReentrantLock lock = sessionLocks.acquire(sessionId);
        try {
            conversations.clear(sessionId);
            registry.close(sessionId);
            eventBus.clearSession(sessionId);
            log.info("Reset session {}", sessionId);
        } finally {
            sessionLocks.release(sessionId, lock);
        }
    }

    public Optional<BrowserState> getBrowserState(String sessionId) {
        return browserStates.get(sessionId);
    }

    int sessionLockCount() {
        return sessionLocks.size();
    }

    /** Makes every later {@link #processRequest} call fail fast. */
    void stopAccepting() {
        accepting = false;
    }
}
