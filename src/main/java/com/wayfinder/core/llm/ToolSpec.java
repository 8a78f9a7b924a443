package com.wayfinder.core.llm;

/**
 * A tool offered to the model.
 *
 * @param name        tool name the model must use
 * @param description what the tool does
 * @param inputSchema JSON schema of the arguments, as a JSON string (passed through untouched)
 */
public record ToolSpec(String name, String description, String inputSchema) {}
