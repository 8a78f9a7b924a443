package com.wayfinder.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfinder.core.error.ErrorCode;
import com.wayfinder.core.llm.ToolSpec;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Worker connection that launches the browser automation server as a child process
 * and talks MCP to it over stdio.
 */
public class McpWorkerConnection implements WorkerConnection {

    private static final Logger log = LoggerFactory.getLogger(McpWorkerConnection.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    static final String SESSION_ENV = "WAYFINDER_SESSION_ID";

    private final String sessionId;
    private final WorkerProperties props;
    private final ObjectMapper mapper;

    private volatile McpSyncClient client;
    private volatile boolean initialized;

    public McpWorkerConnection(String sessionId, WorkerProperties props, ObjectMapper mapper) {
        this.sessionId = sessionId;
        this.props = props;
        this.mapper = mapper;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public Map<String, Object> initialize(boolean headless, String url) {
        if (client == null) {
            connect();
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("headless", headless);
        args.put("url", url);
        Map<String, Object> response = callTool(TOOL_INITIALIZE, args);
        if (isError(response)) {
            throw new WorkerUnavailableException(ErrorCode.BROWSER_INITIALIZATION_ERROR,
                    "Browser initialization failed for session " + sessionId + ": " + errorText(response), null);
        }
        initialized = true;
        log.info("Browser initialized for session {} (headless: {}, url: {})", sessionId, headless, url);
        return response;
    }

    private void connect() {
        Map<String, String> env = new HashMap<>(props.getEnv());
        env.put(SESSION_ENV, sessionId);
        var params = ServerParameters.builder(props.getCommand())
                .args(props.getArgs())
                .env(env)
                .build();
        McpSyncClient created = McpClient.sync(new StdioClientTransport(params, mapper))
                .requestTimeout(props.getCallTimeout())
                .initializationTimeout(props.getInitTimeout())
                .build();
        try {
            created.initialize();
        } catch (RuntimeException e) {
            closeQuietly(created);
            throw new WorkerUnavailableException(ErrorCode.BROWSER_INITIALIZATION_ERROR,
                    "Failed to launch worker '" + props.getCommand() + "' for session " + sessionId
                            + ": " + e.getMessage(), e);
        }
        client = created;
        log.info("Worker process connected for session {}", sessionId);
    }

    @Override
    public Map<String, Object> callTool(String name, Map<String, Object> arguments) {
        if (client == null) {
            throw new WorkerUnavailableException("Worker for session " + sessionId + " is not connected");
        }
        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(name,
                    arguments != null ? arguments : Map.of()));
        } catch (RuntimeException e) {
            throw new ToolExecutionException(name, "Tool '" + name + "' failed: " + e.getMessage(), e);
        }
        Map<String, Object> response = parse(firstText(result));
        if (Boolean.TRUE.equals(result.isError())) {
            response.putIfAbsent("status", "error");
            response.putIfAbsent("error", response.getOrDefault("message", "Tool '" + name + "' reported an error"));
        }
        return response;
    }

    @Override
    public List<ToolSpec> listTools() {
        if (client == null) {
            throw new WorkerUnavailableException("Worker for session " + sessionId + " is not connected");
        }
        var specs = new ArrayList<ToolSpec>();
        for (McpSchema.Tool tool : client.listTools().tools()) {
            specs.add(new ToolSpec(tool.name(), tool.description(), schemaJson(tool)));
        }
        return specs;
    }

    @Override
    public Map<String, Object> restart(boolean headless, String url) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("headless", headless);
        args.put("url", url);
        Map<String, Object> response = callTool(TOOL_RESTART, args);
        initialized = !isError(response);
        return response;
    }

    @Override
    public boolean isInitialized() {
        return initialized && client != null;
    }

    @Override
    public void close() {
        McpSyncClient current = client;
        if (current == null) {
            return;
        }
        try {
            if (initialized) {
                try {
                    callTool(TOOL_CLOSE, Map.of());
                } catch (RuntimeException e) {
                    log.debug("close_browser failed for session {}: {}", sessionId, e.getMessage());
                }
            }
            closeQuietly(current);
            log.info("Worker closed for session {}", sessionId);
        } finally {
            client = null;
            initialized = false;
        }
    }

    private void closeQuietly(McpSyncClient target) {
        try {
            if (!target.closeGracefully()) {
                target.close();
            }
        } catch (RuntimeException e) {
            log.debug("Graceful MCP close failed for session {}, forcing: {}", sessionId, e.getMessage());
            target.close();
        }
    }

    private String firstText(McpSchema.CallToolResult result) {
        if (result == null || result.content() == null) {
            return "";
        }
        for (McpSchema.Content content : result.content()) {
            if (content instanceof McpSchema.TextContent text) {
                return text.text();
            }
        }
        return "";
    }

    Map<String, Object> parse(String text) {
        if (text == null || text.isBlank()) {
            Map<String, Object> empty = new LinkedHashMap<>();
            empty.put("status", "unknown");
            return empty;
        }
        try {
            return new LinkedHashMap<>(mapper.readValue(text, JSON_OBJECT));
        } catch (JsonProcessingException e) {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("status", "unknown");
            raw.put("message", text);
            return raw;
        }
    }

    private String schemaJson(McpSchema.Tool tool) {
        try {
            return mapper.writeValueAsString(tool.inputSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize input schema of tool " + tool.name(), e);
        }
    }

    static boolean isError(Map<String, Object> response) {
        return "error".equals(response.get("status"));
    }

    private static String errorText(Map<String, Object> response) {
        Object error = response.get("error");
        return String.valueOf(error != null ? error : response.getOrDefault("message", "unknown error"));
    }
}
