package com.wayfinder.core.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.core.browser.BrowserState;
import com.wayfinder.core.browser.BrowserStateManager;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.conversation.ConversationEntry;
import com.wayfinder.core.conversation.ConversationReplay;
import com.wayfinder.core.events.ThoughtEventBus;
import com.wayfinder.core.llm.ConverseClient;
import com.wayfinder.core.llm.ConverseResult;
import com.wayfinder.core.llm.InferenceOptions;
import com.wayfinder.core.llm.LlmProperties;
import com.wayfinder.core.llm.StopReason;
import com.wayfinder.core.llm.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Routes a user request to one of the execution strategies in {@link TaskType}.
 * <p>
 * The model is offered a single {@code classifyRequest} tool. When it answers in plain
 * text instead, a JSON classification is looked for in the text; failing that the text is
 * taken as a conversational reply. An empty reply with no classification defaults to
 * {@link TaskType#AGENT} and is flagged as a fallback.
 */
@Service
public class TaskClassifier {

    private static final Logger log = LoggerFactory.getLogger(TaskClassifier.class);

    static final String TOOL_NAME = "classifyRequest";
    static final String DEFAULT_URL = "https://www.google.com";

    private static final String SYSTEM_PROMPT = """
            You are a browser assistant. For each user message, first decide whether a web browser is needed.

            Answer directly, without tools, for greetings, small talk, general knowledge and anything
            that does not need a website.

            If the user wants to visit, use or read something on the web, call the classifyRequest tool
            with one of these types:

            1. "navigate": open a specific site or run a basic web search, without reading results.
               Example: {"type": "navigate", "url": "https://example.com"}
            2. "act": exactly ONE simple interaction with something visible on the current page,
               such as clicking one button or typing into one field.
               Example: {"type": "act", "url": ""}
            3. "agent": everything else that needs the browser. Always use "agent" when the request
               has numbered steps or bullet points, touches several fields or elements, chains actions
               ("click X, then type Y"), or asks for information that must be read from a page.
               Example: {"type": "agent", "url": ""}

            If the message includes current browser context (URL, page title), take it into account:
            the user may be referring to the page that is already open.

            When unsure between "act" and "agent", choose "agent".
            """;

    private static final ToolSpec ROUTER_TOOL = new ToolSpec(TOOL_NAME,
            "Classify the user request into an execution type",
            """
            {
              "type": "object",
              "properties": {
                "type": {
                  "type": "string",
                  "enum": ["navigate", "act", "agent"],
                  "description": "The execution strategy"
                },
                "url": {
                  "type": "string",
                  "description": "Target URL, only for the navigate type; leave empty otherwise"
                }
              },
              "required": ["type"]
            }
            """);

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(\\{[\\s\\S]*?})\\s*```");
    private static final Pattern STRICT_JSON =
            Pattern.compile("(\\{\\s*\"type\"\\s*:\\s*\"(?:navigate|act|agent)\"[\\s\\S]*?})");
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final ConverseClient converseClient;
    private final LlmProperties llmProperties;
    private final BrowserStateManager browserStates;
    private final ThoughtEventBus eventBus;
    private final ObjectMapper mapper = new ObjectMapper();

    public TaskClassifier(ConverseClient converseClient, LlmProperties llmProperties,
                          BrowserStateManager browserStates, ThoughtEventBus eventBus) {
        this.converseClient = converseClient;
        this.llmProperties = llmProperties;
        this.browserStates = browserStates;
        this.eventBus = eventBus;
    }

    /**
     * Classifies {@code userMessage}.
     *
     * @param history the session's conversation, ending with the user message; may be empty
     */
    public TaskClassification classify(String userMessage, String sessionId, List<ConversationEntry> history) {
        List<ConversationEntry> messages = history == null || history.isEmpty()
                ? List.of(ConversationEntry.user(userMessage))
                : ConversationReplay.prepare(history);

        ConverseResult result = converseClient.converse(messages, systemPrompt(sessionId), List.of(ROUTER_TOOL),
                new InferenceOptions(llmProperties.getClassifierTemperature(), llmProperties.getClassifierMaxTokens()));

        TaskClassification classification = interpret(result);
        if (classification.fallback()) {
            log.warn("No classification in model output for session {}, defaulting to agent", sessionId);
            eventBus.emit(sessionId, "warning", "classification", "Router",
                    "Could not determine the request type; treating it as a browser task",
                    Map.of("fallback", true, "stop_reason", result.stopReason().name().toLowerCase()));
        } else {
            log.info("Request classified as {} for session {}", classification.type().wireName(), sessionId);
        }
        return classification;
    }

    TaskClassification interpret(ConverseResult result) {
        String text = result.text().trim();

        if (result.stopReason() == StopReason.TOOL_USE) {
            for (ContentBlock.ToolUse use : result.toolUses()) {
                Optional<TaskClassification> fromTool = fromToolUse(use);
                if (fromTool.isPresent()) {
                    return fromTool.get();
                }
            }
        }

        Optional<TaskClassification> fromText = extractJson(text);
        if (fromText.isPresent()) {
            return fromText.get();
        }
        if (!text.isEmpty()) {
            return TaskClassification.conversation(text);
        }
        return TaskClassification.agentFallback();
    }

    private Optional<TaskClassification> fromToolUse(ContentBlock.ToolUse use) {
        Map<String, Object> input = use.input();
        if (TOOL_NAME.equals(use.name())) {
            TaskType type = TaskType.browserTask(input.get("type"));
            if (type == null) {
                return Optional.empty();
            }
            return Optional.of(TaskClassification.of(type, type == TaskType.NAVIGATE ? url(input.get("url")) : null));
        }
        // some models call the type itself as a tool
        TaskType type = TaskType.browserTask(use.name());
        if (type == null) {
            return Optional.empty();
        }
        String details = null;
        if (type == TaskType.NAVIGATE) {
            Object candidate = input.containsKey("url") ? input.get("url") : input.get("details");
            details = url(candidate);
        }
        return Optional.of(TaskClassification.of(type, details));
    }

    /**
     * Looks for a JSON classification in free text: a ```json fence first, then a strict
     * {@code {"type": ...}} object. Loose matches are rejected.
     */
    Optional<TaskClassification> extractJson(String text) {
        List<String> candidates = new ArrayList<>();
        Matcher fenced = FENCED_JSON.matcher(text);
        while (fenced.find()) {
            candidates.add(fenced.group(1));
        }
        if (candidates.isEmpty()) {
            Matcher strict = STRICT_JSON.matcher(text);
            while (strict.find()) {
                candidates.add(strict.group(1));
            }
        }
        for (String candidate : candidates) {
            Map<String, Object> parsed;
            try {
                parsed = mapper.readValue(candidate.trim(), JSON_OBJECT);
            } catch (JsonProcessingException e) {
                continue;
            }
            TaskType type = TaskType.browserTask(parsed.get("type"));
            if (type != null) {
                return Optional.of(TaskClassification.of(type, type == TaskType.NAVIGATE ? url(parsed.get("url")) : null));
            }
        }
        return Optional.empty();
    }

    /** Normalizes a navigation target; missing values default to the search page. */
    static String url(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return DEFAULT_URL;
        }
        String trimmed = s.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }

    private String systemPrompt(String sessionId) {
        Optional<BrowserState> state = browserStates.get(sessionId);
        if (state.isEmpty() || !state.get().status().isActive()) {
            return SYSTEM_PROMPT;
        }
        BrowserState browser = state.get();
        return SYSTEM_PROMPT + "\nCurrent browser context:\n- URL: " + browser.currentUrl()
                + "\n- Page: " + browser.pageTitle() + "\n";
    }
}
