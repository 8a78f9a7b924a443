package com.wayfinder.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.core.conversation.ContentBlock;
import com.wayfinder.core.conversation.ConversationEntry;
import com.wayfinder.core.conversation.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.content.Media;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ConverseClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Tools are declared with internal tool execution disabled, so a tool-use response
 * comes back to the caller instead of being resolved inside the client.
 */
public class SpringAiConverseClient implements ConverseClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiConverseClient.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    public SpringAiConverseClient(ChatClient chatClient, LlmProperties properties) {
        this.chatClient = chatClient;
        this.properties = properties;
    }

    @Override
    public ConverseResult converse(List<ConversationEntry> messages, String systemPrompt,
                                   List<ToolSpec> tools, InferenceOptions options) {
        List<Message> prompt = toSpringMessages(messages);
        ChatOptions chatOptions = buildOptions(tools, options);

        log.debug("LLM call started ({} messages, {} tools)", prompt.size(), tools != null ? tools.size() : 0);
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            var request = chatClient.prompt();
            if (systemPrompt != null && !systemPrompt.isBlank()) {
                request = request.system(systemPrompt);
            }
            response = request.messages(prompt).options(chatOptions).call().chatResponse();
        } catch (NonTransientAiException e) {
            throw new LlmCallException("LLM call rejected: " + e.getMessage(), e, false);
        } catch (RuntimeException e) {
            boolean retryable = e instanceof TransientAiException || RetryPolicy.isTransient(e);
            throw new LlmCallException("LLM call failed: " + e.getMessage(), e, retryable);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete ({}s)", String.format("%.1f", elapsed / 1000.0));

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmEmptyResponseException("LLM returned no generation. Check that the model is reachable.");
        }
        return toResult(response.getResult());
    }

    private ChatOptions buildOptions(List<ToolSpec> tools, InferenceOptions options) {
        InferenceOptions effective = options != null ? options : InferenceOptions.DEFAULT;
        ToolCallingChatOptions.Builder builder = ToolCallingChatOptions.builder();
        builder.internalToolExecutionEnabled(false);
        if (properties.hasModel()) {
            builder.model(properties.getModel());
        }
        builder.temperature(effective.temperature() != null ? effective.temperature() : properties.getTemperature());
        builder.maxTokens(effective.maxTokens() != null ? effective.maxTokens() : properties.getMaxTokens());
        if (tools != null && !tools.isEmpty()) {
            List<ToolCallback> callbacks = new ArrayList<>();
            for (ToolSpec spec : tools) {
                callbacks.add(new DeclaredToolCallback(spec));
            }
            builder.toolCallbacks(callbacks);
        }
        return builder.build();
    }

    private ConverseResult toResult(Generation generation) {
        AssistantMessage output = generation.getOutput();
        var blocks = new ArrayList<ContentBlock>();
        String text = output.getText();
        if (text != null && !text.isBlank()) {
            blocks.add(new ContentBlock.Text(text));
        }
        boolean hasToolCalls = output.hasToolCalls();
        if (hasToolCalls) {
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                blocks.add(new ContentBlock.ToolUse(call.id(), call.name(), parseArguments(call.arguments())));
            }
        }
        String finishReason = generation.getMetadata() != null ? generation.getMetadata().getFinishReason() : null;
        StopReason stopReason = StopReason.fromProvider(finishReason, hasToolCalls);
        if (blocks.isEmpty()) {
            throw new LlmEmptyResponseException("LLM returned empty content (finish reason: " + finishReason + ")");
        }
        if (stopReason == StopReason.TOOL_USE && !hasToolCalls) {
            // provider said tool use but sent none; nothing to execute
            stopReason = StopReason.END_TURN;
        }
        return new ConverseResult(stopReason, new ConversationEntry(Role.ASSISTANT, blocks, null, null));
    }

    List<Message> toSpringMessages(List<ConversationEntry> entries) {
        var messages = new ArrayList<Message>();
        Map<String, String> toolNames = new HashMap<>();
        for (ConversationEntry entry : entries) {
            if (entry.role() == Role.ASSISTANT) {
                var toolCalls = new ArrayList<AssistantMessage.ToolCall>();
                for (ContentBlock.ToolUse use : entry.toolUses()) {
                    toolNames.put(use.toolUseId(), use.name());
                    toolCalls.add(new AssistantMessage.ToolCall(use.toolUseId(), "function", use.name(),
                            toJson(use.input())));
                }
                messages.add(new AssistantMessage(entry.text(), Map.of(), toolCalls));
                continue;
            }

            var responses = new ArrayList<ToolResponseMessage.ToolResponse>();
            var media = new ArrayList<Media>();
            for (ContentBlock block : entry.content()) {
                if (block instanceof ContentBlock.ToolResult result) {
                    responses.add(new ToolResponseMessage.ToolResponse(result.toolUseId(),
                            toolNames.getOrDefault(result.toolUseId(), "tool"), toolResultPayload(result)));
                    for (ContentBlock.Image image : result.images()) {
                        media.add(toMedia(image));
                    }
                } else if (block instanceof ContentBlock.Image image) {
                    media.add(toMedia(image));
                }
            }
            if (!responses.isEmpty()) {
                messages.add(new ToolResponseMessage(responses));
            }
            String text = entry.text();
            if (!text.isBlank() || (!media.isEmpty() && responses.isEmpty())) {
                messages.add(UserMessage.builder().text(text.isBlank() ? "Current screenshot:" : text)
                        .media(media).build());
            } else if (!media.isEmpty()) {
                // tool results cannot carry images, so forward them as the next user turn
                messages.add(UserMessage.builder().text("Screenshot after the tool call:").media(media).build());
            }
        }
        return messages;
    }

    private String toolResultPayload(ContentBlock.ToolResult result) {
        if (!result.data().isEmpty()) {
            Map<String, Object> payload = new LinkedHashMap<>(result.data());
            payload.putIfAbsent("status", result.status());
            return toJson(payload);
        }
        return result.text() != null ? result.text() : "";
    }

    private static Media toMedia(ContentBlock.Image image) {
        String format = image.format() != null ? image.format().toLowerCase() : "jpeg";
        MimeType mimeType = "png".equals(format) ? MimeTypeUtils.IMAGE_PNG
                : MimeTypeUtils.parseMimeType("image/" + ("jpg".equals(format) ? "jpeg" : format));
        return new Media(mimeType, new ByteArrayResource(image.data()));
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(arguments, JSON_OBJECT);
        } catch (JsonProcessingException e) {
            log.warn("Tool call arguments are not a JSON object, passing as raw input: {}", e.getOriginalMessage());
            return Map.of("input", arguments);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tool payload", e);
        }
    }
}
