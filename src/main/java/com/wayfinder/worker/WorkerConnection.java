package com.wayfinder.worker;

import com.wayfinder.core.llm.ToolSpec;

import java.util.List;
import java.util.Map;

/**
 * Owned channel to one session's browser worker.
 * <p>
 * Implementations are not thread-safe; {@link SessionWorkerRegistry} serializes all
 * calls for a session onto one lane.
 */
public interface WorkerConnection {

    String TOOL_INITIALIZE = "initialize_browser";
    String TOOL_NAVIGATE = "navigate";
    String TOOL_ACT = "act";
    String TOOL_EXTRACT = "extract_data";
    String TOOL_SCREENSHOT = "take_screenshot";
    String TOOL_CLOSE = "close_browser";
    String TOOL_RESTART = "restart_browser";

    String sessionId();

    /**
     * Starts the worker if needed and opens the browser at {@code url}.
     *
     * @return the worker's initialization response
     * @throws WorkerUnavailableException if the worker cannot be launched
     */
    Map<String, Object> initialize(boolean headless, String url);

    /**
     * Invokes a worker tool.
     *
     * @return the parsed JSON response; a worker-side failure may come back as
     *         {@code status: "error"} instead of an exception
     * @throws ToolExecutionException when the call cannot be completed
     */
    Map<String, Object> callTool(String name, Map<String, Object> arguments);

    List<ToolSpec> listTools();

    /** Re-opens the browser without relaunching the worker process. */
    Map<String, Object> restart(boolean headless, String url);

    boolean isInitialized();

    /** Closes the browser and releases the worker process. Safe to call twice. */
    void close();
}
