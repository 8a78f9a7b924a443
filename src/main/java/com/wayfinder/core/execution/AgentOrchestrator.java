package com.wayfinder.core.execution;

import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.classify.TaskType;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.conversation.ConversationEntry;
import com.wayfinder.core.conversation.ConversationManager;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes multi-step browser tasks with a two-level agent.
 * <p>
 * The supervisor model plans and hands missions to {@link MissionRunner} through a single
 * {@code agentExecutor} tool, then reviews each mission's result. It runs for at most
 * {@link AgentProperties#getMaxSupervisorTurns()} turns, after which a final summary is
 * requested. A stop request ends the run with a summary of the progress made so far.
 */
@Service
public class AgentOrchestrator extends BaseTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    static final String TOOL_NAME = "agentExecutor";
    static final String STOPPED_PREFIX = "Task stopped by user request.";

    private static final String SYSTEM_PROMPT = """
            ## Role
            You help users get things done in a web browser. You plan the work and hand each concrete
            piece of it to a browser agent through the agentExecutor tool.

            ## Browser context
            The user message may include the current URL, page title and a screenshot. Build on the page
            that is already open instead of starting over, and refer to what is visible when it helps.

            ## Delegating
            - Give the agent one clear mission at a time, with the context it needs to continue earlier work.
            - When the user lists several tasks (1., 2., 3.), run them one by one as separate missions
              and check each result before starting the next.
            - Example: "Create a Gmail account named test123" becomes: open the signup page, fill in the
              form, handle verification, then confirm the account exists.

            ## Finishing
            - Stop once everything the user asked for is done.
            - Stop if an action still fails after three attempts, or the site keeps blocking access.
            - Finish with a plain-text answer that says what was done, what was found, and what could not
              be completed and why.
            """;

    private static final ToolSpec AGENT_EXECUTOR_TOOL = new ToolSpec(TOOL_NAME,
            "Run a browser task to fulfil the user's request. Handle the request directly or split "
                    + "complex requests into sequential missions with specific goals.",
            """
            {
              "type": "object",
              "properties": {
                "mission": {
                  "type": "string",
                  "description": "Precise description of what the agent should accomplish in this run"
                },
                "task_context": {
                  "type": "string",
                  "description": "What happened earlier in the conversation that the agent needs to continue the work"
                }
              },
              "required": ["mission"]
            }
            """);

    private final ConverseClient converseClient;
    private final ConversationManager conversations;
    private final MissionRunner missionRunner;
    private final AgentProperties agentProperties;
    private final WayfinderMetrics metrics;
    private final Clock clock;

    public AgentOrchestrator(SessionWorkerRegistry registry, BrowserStateManager browserStates,
                             ThoughtEventBus eventBus, ConverseClient converseClient,
                             ConversationManager conversations, MissionRunner missionRunner,
                             AgentProperties agentProperties, WayfinderMetrics metrics, Clock clock) {
        super(registry, browserStates, eventBus);
        this.converseClient = converseClient;
        this.conversations = conversations;
        this.missionRunner = missionRunner;
        this.agentProperties = agentProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs the agent for {@code userMessage}, which must already be the last user entry of the
     * session's conversation. Appends the final answer to the conversation and emits it.
     */
    public TaskResult execute(String userMessage, String sessionId) {
        long start = System.currentTimeMillis();
        CancellationToken stopToken = registry.stopToken(sessionId);
        int turns = 0;
        boolean statusOpen = false;
        try {
            eventBus.emit(sessionId, "planning", "status", "Supervisor",
                    "Received request from user: '" + userMessage + "'. Creating execution plan...");

            List<ConversationEntry> conversation = new ArrayList<>(conversations.getHistory(sessionId));
            enrichLatestUserMessage(conversation, userMessage, getWorkerState(sessionId));

            WorkerConnection worker = registry.getOrCreateWorker(sessionId);
            Progress progress = new Progress();
            String finalAnswer;
            boolean stopped = false;

            while (true) {
                if (stopToken.isCancellationRequested()) {
                    eventBus.emit(sessionId, "task_status", "status", "System",
                            "Agent is gracefully stopping - please wait...", Map.of("status", "stopping"));
                    statusOpen = false;
                    finalAnswer = stopSummary(sessionId, userMessage, turns, progress);
                    stopped = true;
                    break;
                }
                if (turns == 0) {
                    eventBus.emit(sessionId, "task_status", "status", "System",
                            "Supervisor processing started - Stop button now active", Map.of("status", "start"));
                    statusOpen = true;
                }
                if (turns >= agentProperties.getMaxSupervisorTurns()) {
                    finalAnswer = finalSummary(conversation, sessionId);
                    break;
                }

                ConverseResult result = converseClient.converse(ConversationReplay.prepare(conversation),
                        SYSTEM_PROMPT, List.of(AGENT_EXECUTOR_TOOL));
                String text = result.text();

                if (result.stopReason() == StopReason.TOOL_USE) {
                    record(conversation, sessionId, result.output());
                    if (!text.isBlank()) {
                        progress.reasoning.add(text);
                        eventBus.emit(sessionId, "reasoning", "analysis", "Supervisor", text);
                    }
                    List<ContentBlock> toolResults = new ArrayList<>();
                    for (ContentBlock.ToolUse use : result.toolUses()) {
                        toolResults.add(runTool(worker, use, sessionId, stopToken, progress));
                    }
                    record(conversation, sessionId, new ConversationEntry(Role.USER, toolResults, null, null));
                    eventBus.emit(sessionId, "reasoning", "analysis", "Supervisor",
                            "Analyzing agent results to provide comprehensive answer...");
                    turns++;
                    continue;
                }

                if (result.stopReason() == StopReason.END_TURN) {
                    finalAnswer = text.isBlank() ? finalSummary(conversation, sessionId) : text;
                } else {
                    eventBus.emit(sessionId, "warning", "limit", "Supervisor",
                            "Conversation ended with stop reason: " + result.stopReason().name().toLowerCase());
                    finalAnswer = isMeaningful(text) ? text : finalSummary(conversation, sessionId);
                }
                break;
            }

            conversations.addAssistantMessage(sessionId, finalAnswer, TaskType.AGENT.wireName());
            if (!stopped) {
                statusOpen = false;
                emitComplete(sessionId);
            }

            WorkerSnapshot state = getWorkerState(sessionId);
            emitAnswer(sessionId, finalAnswer, resultDetails(state.currentUrl(), state.pageTitle(), start));
            return new TaskResult(TaskType.AGENT, stopped ? TaskResult.STOPPED : TaskResult.SUCCESS, finalAnswer,
                    state.currentUrl(), state.pageTitle(), null, state.images());
        } finally {
            // a failed run still closes the start/complete bracket
            if (statusOpen) {
                emitComplete(sessionId);
            }
            metrics.recordAgentTurns("supervisor", turns);
            registry.clearStop(sessionId);
        }
    }

    private void emitComplete(String sessionId) {
        eventBus.emit(sessionId, "task_status", "status", "System",
                "Supervisor processing completed - Stop button now inactive", Map.of("status", "complete"));
    }

    /** What the run has produced so far, for summaries. */
    private static final class Progress {
        final List<String> reasoning = new ArrayList<>();
        final List<String> agentResults = new ArrayList<>();
    }

    private ContentBlock.ToolResult runTool(WorkerConnection worker, ContentBlock.ToolUse use, String sessionId,
                                            CancellationToken stopToken, Progress progress) {
        if (!TOOL_NAME.equals(use.name())) {
            log.warn("Supervisor requested unknown tool '{}' for session {}", use.name(), sessionId);
            return new ContentBlock.ToolResult(use.toolUseId(), ContentBlock.ToolResult.STATUS_ERROR,
                    Map.of("error", "Unknown tool: " + use.name()), null, null);
        }
        String mission = stringArg(use.input().get("mission"));
        String taskContext = stringArg(use.input().get("task_context"));
        MissionOutcome outcome = missionRunner.run(worker, mission, taskContext, sessionId, stopToken);
        progress.agentResults.add(outcome.answer());
        return ContentBlock.ToolResult.of(use.toolUseId(), outcome.data(), outcome.images());
    }

    private void record(List<ConversationEntry> conversation, String sessionId, ConversationEntry entry) {
        conversation.add(entry);
        conversations.append(sessionId, entry);
    }

    /**
     * Replaces the latest user turn, in this run's copy of the history only, with one that
     * carries today's date and, when a browser is open, its page and screenshot.
     */
    void enrichLatestUserMessage(List<ConversationEntry> conversation, String userMessage, WorkerSnapshot browser) {
        String date = LocalDate.now(clock).toString();
        for (int i = conversation.size() - 1; i >= 0; i--) {
            ConversationEntry entry = conversation.get(i);
            if (entry.role() != Role.USER || entry.hasOnlyToolResults()) {
                continue;
            }
            String original = entry.text().isBlank() ? userMessage : entry.text();
            if (browser.initialized()) {
                String text = "Today's date: " + date + "\n\nCurrent browser context:\n- URL: " + browser.currentUrl()
                        + "\n- Page: " + browser.pageTitle() + "\n\nUser request: " + original;
                conversation.set(i, entry.withContent(ConversationEntry.user(text, browser.images()).content()));
            } else {
                String text = "Today's date: " + date + "\n\nUser request: " + original;
                conversation.set(i, entry.withContent(List.of(new ContentBlock.Text(text))));
            }
            return;
        }
        conversation.add(ConversationEntry.user("Today's date: " + date + "\n\nUser request: " + userMessage));
    }

    /**
     * Asks the model, without tools, to summarize the run. Falls back to a fixed text that
     * lists the agent results when the call fails.
     */
    String finalSummary(List<ConversationEntry> conversation, String sessionId) {
        eventBus.emit(sessionId, "summary_generation", "analysis", "Supervisor",
                "Generating comprehensive summary of completed tasks...");
        List<String> agentResults = agentAnswers(conversation);

        StringBuilder prompt = new StringBuilder("Please provide a comprehensive summary of what you've accomplished. ");
        if (!agentResults.isEmpty()) {
            prompt.append("The following results were obtained from agent executions: ")
                    .append(String.join(" | ", agentResults.subList(0, Math.min(3, agentResults.size()))));
        }
        prompt.append(" Provide a clear, detailed answer to the user's original request based on all available information.");

        List<ConversationEntry> messages = new ArrayList<>(conversation);
        messages.add(ConversationEntry.user(prompt.toString()));
        try {
            String text = converseClient.converse(ConversationReplay.prepare(messages), SYSTEM_PROMPT, List.of()).text();
            if (!text.isBlank()) {
                return text;
            }
        } catch (RuntimeException e) {
            log.error("Error generating final summary for session {}: {}", sessionId, e.getMessage());
        }

        if (!agentResults.isEmpty()) {
            return "I completed the requested tasks and obtained the following results: "
                    + String.join(" | ", agentResults)
                    + ". Please let me know if you need more specific information about any of these findings.";
        }
        return "I worked on your request but encountered some issues in generating a complete response. "
                + "Please let me know if you'd like me to try again or if you need clarification on any specific aspect.";
    }

    /**
     * Builds the answer for a stopped run: a model-written progress summary when possible,
     * otherwise a fixed report. Either way it starts with {@value #STOPPED_PREFIX}.
     */
    private String stopSummary(String sessionId, String userMessage, int turns, Progress progress) {
        eventBus.emit(sessionId, "task_status", "status", "System",
                "Agent stopped by user request - Stop button now inactive", Map.of("status", "stopped"));
        WorkerSnapshot browser = getWorkerState(sessionId);
        List<String> reasoning = progress.reasoning.stream()
                .filter(text -> text.length() > 50)
                .map(text -> MissionRunner.abbreviate(text, 500))
                .toList();
        List<String> results = progress.agentResults.stream()
                .map(text -> MissionRunner.abbreviate(text, 300))
                .toList();

        try {
            StringBuilder request = new StringBuilder("Original user request: ").append(userMessage);
            if (!reasoning.isEmpty()) {
                request.append("\n\nKey supervisor analysis:\n").append(String.join("\n\n", lastThree(reasoning)));
            }
            if (!results.isEmpty()) {
                request.append("\n\nAgent execution results:\n").append(String.join("\n\n", lastThree(results)));
            }
            request.append("\n\nThe user has requested to stop the current task. Please provide a comprehensive summary "
                            + "that includes:\n\n1. What specific progress was made toward the original request: '")
                    .append(userMessage)
                    .append("'\n2. What agent actions were executed and their results"
                            + "\n3. Any insights, findings, or partial results discovered"
                            + "\n4. Current status and what remains to be done");
            if (!browser.currentUrl().isBlank()) {
                request.append("\n\nCurrent browser context:\n- URL: ").append(browser.currentUrl())
                        .append("\n- Page: ").append(browser.pageTitle());
            }
            request.append("\n\nBe specific and actionable in your summary.");

            ConverseResult result = converseClient.converse(
                    List.of(ConversationEntry.user(request.toString(), browser.images())), SYSTEM_PROMPT, List.of());
            if (result.stopReason() == StopReason.END_TURN && !result.text().isBlank()) {
                return STOPPED_PREFIX + "\n\nSupervisor Summary:\n" + result.text();
            }
        } catch (RuntimeException e) {
            log.error("Error generating stop summary for session {}: {}", sessionId, e.getMessage());
        }
        return stopFallback(userMessage, turns, results, reasoning, browser);
    }

    static String stopFallback(String userMessage, int turns, List<String> agentResults,
                               List<String> reasoning, WorkerSnapshot browser) {
        List<String> parts = new ArrayList<>();
        parts.add(STOPPED_PREFIX);
        parts.add("\nOriginal request: " + userMessage);
        parts.add("\nProgress: " + turns + " supervisor turns completed");
        if (!browser.currentUrl().isBlank()) {
            parts.add("\nCurrent browser state:");
            parts.add("  - URL: " + browser.currentUrl());
            parts.add("  - Page: " + browser.pageTitle());
        }
        if (!agentResults.isEmpty()) {
            parts.add("\nAgent results (" + agentResults.size() + " executions):");
            for (int i = 0; i < Math.min(3, agentResults.size()); i++) {
                parts.add("  " + (i + 1) + ". " + MissionRunner.abbreviate(agentResults.get(i), 150));
            }
        }
        if (!reasoning.isEmpty()) {
            parts.add("\nKey analysis points:");
            for (int i = 0; i < Math.min(2, reasoning.size()); i++) {
                parts.add("  - " + MissionRunner.abbreviate(reasoning.get(i), 100));
            }
        }
        if (agentResults.isEmpty() && reasoning.isEmpty()) {
            parts.add("\nTask was stopped in early planning stages.");
        }
        return String.join("\n", parts);
    }

    private static List<String> agentAnswers(List<ConversationEntry> conversation) {
        List<String> answers = new ArrayList<>();
        for (ConversationEntry entry : conversation) {
            if (entry.role() != Role.USER) {
                continue;
            }
            for (ContentBlock.ToolResult result : entry.toolResults()) {
                Object answer = result.data().get("answer");
                if (answer instanceof String s && !s.isBlank()) {
                    answers.add(s);
                }
            }
        }
        return answers;
    }

    private static boolean isMeaningful(String text) {
        String trimmed = text.trim();
        return trimmed.length() > 10 && !trimmed.toLowerCase().startsWith("action completed");
    }

    private static List<String> lastThree(List<String> items) {
        return items.subList(Math.max(0, items.size() - 3), items.size());
    }

    private static String stringArg(Object value) {
        return value != null ? value.toString() : "";
    }
}
