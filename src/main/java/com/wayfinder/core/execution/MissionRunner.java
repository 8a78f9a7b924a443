package com.wayfinder.core.execution;

import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.browser.BrowserStateUpdate;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.conversation.ConversationEntry;
import com.wayfinder.core.conversation.ConversationReplay;
import com.wayfinder.core.conversation.Role;
import com.wayfinder.core.events.ThoughtEventBus;
import com.wayfinder.core.llm.ConverseClient;
import com.wayfinder.core.llm.ConverseResult;
import com.wayfinder.core.llm.StopReason;
import com.wayfinder.core.llm.ToolSpec;
import com.wayfinder.core.metrics.WayfinderMetrics;
import com.wayfinder.worker.SessionWorkerRegistry;
import com.wayfinder.worker.WorkerConnection;
import com.wayfinder.worker.WorkerResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one mission handed down by the supervisor: a tool-calling loop in which the
 * model drives the session's browser through the worker's own tools.
 * <p>
 * The loop ends on a terminal stop reason, when the turn budget is spent (after one
 * request for a final answer), or when the session's stop token is set. The token is
 * checked before every model call, so a stop takes effect after at most one tool round trip.
 */
@Service
public class MissionRunner extends BaseTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(MissionRunner.class);

    /** Session lifecycle tools stay with the registry; the agent cannot use them. */
    static final Set<String> EXCLUDED_TOOLS = Set.of(
            WorkerConnection.TOOL_CLOSE, WorkerConnection.TOOL_INITIALIZE,
            WorkerConnection.TOOL_RESTART, WorkerConnection.TOOL_SCREENSHOT);

    static final String NO_ANSWER = "Task completed without specific answer";
    static final String TOOL_FAILURE_MESSAGE = "Couldn't complete the requested action";
    static final String FINAL_ANSWER_REQUEST = "Please provide a final summary and response based on the "
            + "information gathered so far. What conclusions can you draw and what answer can you "
            + "provide to my original question?";

    private static final String SYSTEM_PROMPT = """
            You operate a web browser on behalf of the user through the tools provided.

            ## Tools
            - navigate: open a URL. Use it to go straight to a known site.
            - act: give the browser ONE short, concrete instruction, such as "click the Sign in button"
              or "type 'laptops' into the search box and press Enter". Split longer work into several
              act calls. A result with status "in_progress" means the step budget ran out before the
              instruction finished; look at the screenshot and continue from there.
            - extract_data: read structured information from the current page. Describe exactly what
              you need. Prefer it over act whenever the goal is to read rather than to interact.

            ## Working style
            - Look at the latest screenshot before choosing the next step.
            - Do one thing at a time and check the result before moving on.
            - If the same step fails three times, stop and explain what blocked you.
            - Never invent data you did not see on the page.

            ## Finishing
            When the mission is done, or cannot be completed, answer in plain text without calling a
            tool. Summarize what you did and give the information that was asked for.
            """;

    private final ConverseClient converseClient;
    private final AgentProperties agentProperties;
    private final WayfinderMetrics metrics;

    public MissionRunner(SessionWorkerRegistry registry, BrowserStateManager browserStates,
                         ThoughtEventBus eventBus, ConverseClient converseClient,
                         AgentProperties agentProperties, WayfinderMetrics metrics) {
        super(registry, browserStates, eventBus);
        this.converseClient = converseClient;
        this.agentProperties = agentProperties;
        this.metrics = metrics;
    }

    /**
     * Runs a mission. Failures are folded into the outcome; this method does not throw for
     * model or worker errors.
     */
    public MissionOutcome run(WorkerConnection worker, String mission, String taskContext,
                              String sessionId, CancellationToken stopToken) {
        log.info("Starting mission for session {}: {}", sessionId, abbreviate(mission, 100));
        Map<String, Object> missionDetails = new HashMap<>();
        missionDetails.put("mission", mission);
        missionDetails.put("task_context", taskContext != null ? taskContext : "");
        eventBus.emit(sessionId, "agent_mission", "execution", "Supervisor", "Executing mission: " + mission,
                missionDetails);

        try {
            WorkerSnapshot before = snapshot(worker, sessionId, false);
            eventBus.emit(sessionId, "processing", "status", "Agent", "Received request from Supervisor: '" + mission + "'");

            List<ConversationEntry> messages = new ArrayList<>();
            messages.add(ConversationEntry.user(missionText(mission, taskContext, before), before.images()));
            List<ToolSpec> tools = worker.listTools().stream()
                    .filter(tool -> !EXCLUDED_TOOLS.contains(tool.name()))
                    .toList();

            LoopResult loop = loop(worker, messages, tools, sessionId, stopToken);

            WorkerSnapshot after = snapshot(worker, sessionId, true);
            if (after.initialized()) {
                browserStates.update(sessionId, BrowserStateUpdate.fields()
                        .currentUrl(after.currentUrl())
                        .pageTitle(after.pageTitle())
                        .hasScreenshot(after.screenshot() != null));
            }
            String answer = loop.answer().isBlank() ? NO_ANSWER : loop.answer();
            eventBus.emit(sessionId, "agent_result", "intermediate_answer", "Agent",
                    "Mission completed: " + abbreviate(answer, 200));

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("answer", answer);
            data.put("current_url", after.currentUrl());
            data.put("page_title", after.pageTitle());
            return new MissionOutcome(answer, data, after.images(), loop.stopped());
        } catch (RuntimeException e) {
            log.error("Mission failed for session {}: {}", sessionId, e.getMessage(), e);
            eventBus.emit(sessionId, "error", "execution_error", "Agent", "Error during mission execution: " + e.getMessage());
            WorkerSnapshot state = snapshot(worker, sessionId, false);
            String answer = "Error executing mission: " + e.getMessage();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("answer", answer);
            data.put("error", String.valueOf(e.getMessage()));
            data.put("current_url", state.currentUrl());
            data.put("page_title", state.pageTitle());
            data.put("status", ContentBlock.ToolResult.STATUS_ERROR);
            return new MissionOutcome(answer, data, state.images(), false);
        }
    }

    private record LoopResult(String answer, boolean stopped) {}

    private LoopResult loop(WorkerConnection worker, List<ConversationEntry> messages, List<ToolSpec> tools,
                            String sessionId, CancellationToken stopToken) {
        List<String> thinking = new ArrayList<>();
        int turns = 0;
        try {
            while (true) {
                if (stopToken.isCancellationRequested()) {
                    log.info("Mission for session {} stopping after {} turn(s)", sessionId, turns);
                    return new LoopResult(interruptedAnswer(thinking), true);
                }
                if (turns >= agentProperties.getMaxAgentTurns()) {
                    return new LoopResult(finalAnswer(messages, tools, sessionId), false);
                }

                ConverseResult result = converseClient.converse(ConversationReplay.prepare(messages), SYSTEM_PROMPT, tools);
                String text = result.text();

                if (result.stopReason() == StopReason.TOOL_USE) {
                    messages.add(result.output());
                    if (!text.isBlank()) {
                        thinking.add(text);
                        eventBus.emit(sessionId, "reasoning", "analysis", "Agent", text);
                    }
                    List<ContentBlock> toolResults = new ArrayList<>();
                    for (ContentBlock.ToolUse use : result.toolUses()) {
                        toolResults.add(executeTool(worker, use, sessionId));
                    }
                    messages.add(new ConversationEntry(Role.USER, toolResults, null, null));
                    turns++;
                    continue;
                }

                if (result.stopReason() != StopReason.END_TURN) {
                    log.info("Mission for session {} ended with stop reason {}", sessionId, result.stopReason());
                }
                return new LoopResult(text, false);
            }
        } finally {
            metrics.recordAgentTurns("agent", turns);
        }
    }

    private String finalAnswer(List<ConversationEntry> messages, List<ToolSpec> tools, String sessionId) {
        log.info("Agent turn budget of {} spent for session {}, asking for a final answer",
                agentProperties.getMaxAgentTurns(), sessionId);
        messages.add(ConversationEntry.user(FINAL_ANSWER_REQUEST));
        try {
            ConverseResult result = converseClient.converse(ConversationReplay.prepare(messages), SYSTEM_PROMPT, tools);
            return result.text();
        } catch (RuntimeException e) {
            log.warn("Final answer request failed for session {}: {}", sessionId, e.getMessage());
            return "";
        }
    }

    /**
     * Runs one tool call. A failure becomes an error result (with a fresh screenshot when
     * one can be taken) so the model sees it and the call stays paired with its result.
     */
    ContentBlock.ToolResult executeTool(WorkerConnection worker, ContentBlock.ToolUse use, String sessionId) {
        Map<String, Object> callDetails = new HashMap<>();
        callDetails.put("tool_name", use.name());
        callDetails.put("arguments", use.input());
        eventBus.emit(sessionId, "tool_call", "tool", "Agent", describeCall(use), callDetails);

        Map<String, Object> response;
        List<ContentBlock.Image> images = new ArrayList<>();
        boolean success;
        try {
            response = new LinkedHashMap<>(worker.callTool(use.name(), use.input()));
            success = true;
        } catch (RuntimeException e) {
            success = false;
            response = new LinkedHashMap<>();
            response.put("error", String.valueOf(e.getMessage()));
            response.put("message", TOOL_FAILURE_MESSAGE);
            response.put("status", ContentBlock.ToolResult.STATUS_ERROR);
            images.addAll(snapshot(worker, sessionId, false).images());
        }

        Object status = response.get("status");
        Map<String, Object> resultDetails = new HashMap<>();
        resultDetails.put("tool_name", use.name());
        if (TaskResult.IN_PROGRESS.equals(status)) {
            resultDetails.put("execution_state", TaskResult.IN_PROGRESS);
            resultDetails.put("technical_details", WorkerResponses.string(response, "technical_details"));
            String message = WorkerResponses.string(response, "message");
            eventBus.emit(sessionId, "tool_result", "tool", "Browser",
                    message.isBlank() ? "I'm analyzing the page to find what you're looking for" : message, resultDetails);
        } else if (!success || ContentBlock.ToolResult.STATUS_ERROR.equals(status)) {
            String technical = WorkerResponses.string(response, "technical_details");
            resultDetails.put("error", technical.isBlank() ? WorkerResponses.string(response, "error") : technical);
            String message = WorkerResponses.string(response, "message");
            eventBus.emit(sessionId, "tool_result", "error", "Browser",
                    message.isBlank() ? "Operation couldn't be completed" : message, resultDetails);
        } else {
            resultDetails.put("url", WorkerResponses.string(response, "current_url"));
            String message = WorkerResponses.string(response, "message");
            eventBus.emit(sessionId, "tool_result", "tool", "Browser",
                    message.isBlank() ? "Tool " + use.name() + " execution complete" : message, resultDetails);
        }

        if (success) {
            recordPage(sessionId, response);
            reportScreenshot(sessionId, response, "Browser screenshot").ifPresent(images::add);
            response = WorkerResponses.withoutScreenshot(response);
        }
        return ContentBlock.ToolResult.of(use.toolUseId(), response, images);
    }

    private static String missionText(String mission, String taskContext, WorkerSnapshot state) {
        StringBuilder text = new StringBuilder(mission);
        if (taskContext != null && !taskContext.isBlank()) {
            text.append("\n\nContext: ").append(taskContext);
        }
        if (state.initialized() && !state.currentUrl().isBlank()) {
            text.append("\n\nThe browser is currently at ").append(state.currentUrl());
        }
        return text.toString();
    }

    private static String interruptedAnswer(List<String> thinking) {
        if (thinking.isEmpty()) {
            return "The mission was stopped before any progress was made.";
        }
        return "The mission was stopped. Progress so far: " + abbreviate(thinking.get(thinking.size() - 1), 300);
    }

    static String describeCall(ContentBlock.ToolUse use) {
        Object instruction = use.input().get("instruction");
        Object url = use.input().get("url");
        Object description = use.input().get("description");
        if (WorkerConnection.TOOL_ACT.equals(use.name()) && instruction != null) {
            return "Instructing browser: \"" + instruction + "\"";
        }
        if (WorkerConnection.TOOL_NAVIGATE.equals(use.name()) && url != null) {
            return "Navigating to: " + url;
        }
        if (WorkerConnection.TOOL_EXTRACT.equals(use.name()) && description != null) {
            return "Extracting data: " + description;
        }
        return "Calling tool: " + use.name();
    }

    static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
