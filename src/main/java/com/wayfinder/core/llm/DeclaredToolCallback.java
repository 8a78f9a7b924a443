package com.wayfinder.core.llm;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Advertises a {@link ToolSpec} to the model without executing it: tool calls are
 * returned to the caller, which runs them against the session's worker.
 */
class DeclaredToolCallback implements ToolCallback {

    private final ToolDefinition definition;

    DeclaredToolCallback(ToolSpec spec) {
        this.definition = new DefaultToolDefinition(spec.name(), spec.description(), spec.inputSchema());
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        throw new UnsupportedOperationException(
                "Tool '" + definition.name() + "' is executed by the caller, not by the chat client");
    }
}
