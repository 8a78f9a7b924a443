package com.wayfinder.core.execution;

import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.conversation.ConversationEntry;
import com.wayfinder.core.conversation.Role;
import com.wayfinder.core.events.ThoughtEvent;
import com.wayfinder.core.events.ThoughtEventBus;
import com.wayfinder.core.llm.ConverseClient;
import com.wayfinder.core.llm.ConverseResult;
import com.wayfinder.core.llm.StopReason;
import com.wayfinder.core.llm.ToolSpec;
import com.wayfinder.core.metrics.WayfinderMetrics;
import com.wayfinder.worker.SessionWorkerRegistry;
import com.wayfinder.worker.ToolExecutionException;
import com.wayfinder.worker.WorkerConnection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link MissionRunner}.
 */
class MissionRunnerTest {

    private SessionWorkerRegistry registry;
    private WorkerConnection worker;
    private ConverseClient converseClient;
    private AgentProperties agentProperties;
    private SimpleMeterRegistry meterRegistry;
    private final List<ThoughtEvent> events = new CopyOnWriteArrayList<>();
    private CancellationToken stopToken;
    private MissionRunner runner;

    @BeforeEach
    void setUp() {
        registry = mock(SessionWorkerRegistry.class);
        when(registry.screenshotArgs()).thenReturn(Map.of("max_width", 800, "quality", 70));
        worker = mock(WorkerConnection.class);
        when(worker.listTools()).thenReturn(List.of(
                new ToolSpec("navigate", "Open a URL", "{}"),
                new ToolSpec("act", "Perform an action", "{}"),
                new ToolSpec("take_screenshot", "Screenshot", "{}"),
                new ToolSpec("close_browser", "Close", "{}")));
        when(worker.callTool(eq(WorkerConnection.TOOL_SCREENSHOT), anyMap()))
                .thenReturn(Map.of("status", "success", "current_url", "https://example.com", "page_title", "Example"));
        converseClient = mock(ConverseClient.class);
        agentProperties = new AgentProperties();
        meterRegistry = new SimpleMeterRegistry();
        ThoughtEventBus eventBus = new ThoughtEventBus(Runnable::run);
        eventBus.subscribeAll(events::add);
        stopToken = new CancellationToken();
        runner = new MissionRunner(registry, new BrowserStateManager(Clock.systemUTC()), eventBus, converseClient,
                agentProperties, new WayfinderMetrics(meterRegistry));
    }

    private static ConverseResult text(String text) {
        return new ConverseResult(StopReason.END_TURN, ConversationEntry.assistant(text));
    }

    private static ConverseResult toolUse(String thought, String id, String name, Map<String, Object> input) {
        return new ConverseResult(StopReason.TOOL_USE, new ConversationEntry(Role.ASSISTANT,
                List.of(new ContentBlock.Text(thought), new ContentBlock.ToolUse(id, name, input)), null, null));
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("executes tool calls until the model answers")
        void toolLoop() {
            when(worker.callTool(eq("act"), anyMap())).thenReturn(Map.of("status", "success", "message", "Clicked"));
            when(converseClient.converse(anyList(), anyString(), anyList()))
                    .thenReturn(toolUse("Clicking search", "call-1", "act", Map.of("instruction", "click search")))
                    .thenReturn(text("The price is $10."));

            MissionOutcome outcome = runner.run(worker, "Find the price", null, "s1", stopToken);

            verify(worker).callTool("act", Map.of("instruction", "click search"));
            assertEquals("The price is $10.", outcome.answer());
            assertFalse(outcome.stopped());
            assertEquals("https://example.com", outcome.data().get("current_url"));
            assertTrue(events.stream().anyMatch(e -> "tool_call".equals(e.type())));
            assertTrue(events.stream().anyMatch(e -> "reasoning".equals(e.type()) && "Clicking search".equals(e.content())));
        }

        @Test
        @DisplayName("hides session lifecycle tools from the model")
        void excludesLifecycleTools() {
            when(converseClient.converse(anyList(), anyString(), anyList())).thenReturn(text("done"));

            runner.run(worker, "Look around", null, "s1", stopToken);

            verify(converseClient).converse(anyList(), anyString(), argThat(tools -> tools.size() == 2
                    && tools.stream().map(ToolSpec::name).toList().containsAll(List.of("navigate", "act"))));
        }

        @Test
        @DisplayName("asks for a final answer once the turn budget is spent")
        void turnBudget() {
            agentProperties.setMaxAgentTurns(2);
            when(worker.callTool(eq("act"), anyMap())).thenReturn(Map.of("status", "success"));
            when(converseClient.converse(anyList(), anyString(), anyList()))
                    .thenReturn(toolUse("step 1", "call-1", "act", Map.of("instruction", "a")))
                    .thenReturn(toolUse("step 2", "call-2", "act", Map.of("instruction", "b")))
                    .thenReturn(text("Here is what I found."));

            MissionOutcome outcome = runner.run(worker, "Research", null, "s1", stopToken);

            verify(converseClient, times(3)).converse(anyList(), anyString(), anyList());
            assertEquals("Here is what I found.", outcome.answer());
            assertEquals(2.0, meterRegistry.summary("wayfinder.agent.turns", "level", "agent").totalAmount());
        }

        @Test
        @DisplayName("never returns an empty answer")
        void neverEmpty() {
            agentProperties.setMaxAgentTurns(1);
            when(worker.callTool(eq("act"), anyMap())).thenReturn(Map.of("status", "success"));
            when(converseClient.converse(anyList(), anyString(), anyList()))
                    .thenReturn(toolUse("", "call-1", "act", Map.of("instruction", "a")));

            MissionOutcome outcome = runner.run(worker, "Research", null, "s1", stopToken);

            assertEquals(MissionRunner.NO_ANSWER, outcome.answer());
        }

        @Test
        @DisplayName("a model failure is folded into an error outcome")
        void modelFailure() {
            when(converseClient.converse(anyList(), anyString(), anyList()))
                    .thenThrow(new IllegalStateException("model unavailable"));

            MissionOutcome outcome = runner.run(worker, "Research", null, "s1", stopToken);

            assertEquals("Error executing mission: model unavailable", outcome.answer());
            assertEquals(ContentBlock.ToolResult.STATUS_ERROR, outcome.data().get("status"));
            assertFalse(outcome.stopped());
        }
    }

    @Nested
    @DisplayName("stop requests")
    class StopTests {

        @Test
        @DisplayName("a stop requested before the first turn skips the model entirely")
        void stopBeforeStart() {
            stopToken.cancel();

            MissionOutcome outcome = runner.run(worker, "Research", null, "s1", stopToken);

            assertTrue(outcome.stopped());
            assertEquals("The mission was stopped before any progress was made.", outcome.answer());
            verify(converseClient, never()).converse(anyList(), anyString(), anyList());
        }

        @Test
        @DisplayName("a stop during a turn takes effect at the next turn boundary")
        void stopBetweenTurns() {
            when(worker.callTool(eq("act"), anyMap())).thenAnswer(inv -> {
                stopToken.cancel();
                return Map.of("status", "success");
            });
            when(converseClient.converse(anyList(), anyString(), anyList()))
                    .thenReturn(toolUse("Opening the cart", "call-1", "act", Map.of("instruction", "open cart")));

            MissionOutcome outcome = runner.run(worker, "Check out", null, "s1", stopToken);

            assertTrue(outcome.stopped());
            assertTrue(outcome.answer().contains("Opening the cart"));
            verify(converseClient, times(1)).converse(anyList(), anyString(), anyList());
        }
    }

    @Nested
    @DisplayName("executeTool")
    class ExecuteToolTests {

        @Test
        @DisplayName("a failing tool call becomes an error result paired with its call")
        void failureInBand() {
            when(worker.callTool(eq("act"), anyMap())).thenThrow(new ToolExecutionException("act", "element detached"));

            ContentBlock.ToolResult result = runner.executeTool(worker,
                    new ContentBlock.ToolUse("call-7", "act", Map.of("instruction", "click")), "s1");

            assertEquals("call-7", result.toolUseId());
            assertEquals(ContentBlock.ToolResult.STATUS_ERROR, result.status());
            assertEquals("element detached", result.data().get("error"));
            assertEquals(MissionRunner.TOOL_FAILURE_MESSAGE, result.data().get("message"));
        }

        @Test
        @DisplayName("screenshots are moved out of the structured result")
        void screenshotStripped() {
            when(worker.callTool(eq("navigate"), anyMap())).thenReturn(Map.of(
                    "status", "success",
                    "current_url", "https://example.com",
                    "screenshot", Map.of("format", "jpeg", "data", "AQID")));

            ContentBlock.ToolResult result = runner.executeTool(worker,
                    new ContentBlock.ToolUse("call-1", "navigate", Map.of("url", "https://example.com")), "s1");

            assertFalse(result.data().containsKey("screenshot"));
            assertEquals(1, result.images().size());
            assertEquals(ContentBlock.ToolResult.STATUS_SUCCESS, result.status());
        }

        @Test
        @DisplayName("describes calls in plain words")
        void describeCall() {
            assertEquals("Instructing browser: \"click\"",
                    MissionRunner.describeCall(new ContentBlock.ToolUse("1", "act", Map.of("instruction", "click"))));
            assertEquals("Navigating to: https://a.test",
                    MissionRunner.describeCall(new ContentBlock.ToolUse("2", "navigate", Map.of("url", "https://a.test"))));
            assertEquals("Calling tool: scroll",
                    MissionRunner.describeCall(new ContentBlock.ToolUse("3", "scroll", Map.of())));
            assertEquals("abc...", MissionRunner.abbreviate("abcdef", 3));
        }
    }
}
