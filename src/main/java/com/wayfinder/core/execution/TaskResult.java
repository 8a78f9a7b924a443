package com.wayfinder.core.execution;

import com.wayfinder.core.classify.TaskType;
import com.wayfinder.core.conversation.ContentBlock;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of executing one classified request.
 *
 * @param type       strategy that ran
 * @param status     {@code success}, {@code error}, {@code in_progress} or {@code stopped}
 * @param answer     text shown to the user; never empty
 * @param currentUrl browser URL after execution, may be empty
 * @param pageTitle  page title after execution, may be empty
 * @param error      technical error text when {@code status} is {@code error}
 * @param images     screenshots produced during execution
 */
public record TaskResult(
    TaskType type,
    String status,
    String answer,
    String currentUrl,
    String pageTitle,
    String error,
    List<ContentBlock.Image> images
) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String IN_PROGRESS = "in_progress";
    public static final String STOPPED = "stopped";

    public TaskResult {
        currentUrl = currentUrl != null ? currentUrl : "";
        pageTitle = pageTitle != null ? pageTitle : "";
        images = images != null ? List.copyOf(images) : List.of();
    }

    public boolean isError() {
        return ERROR.equals(status);
    }

    /** Structured form recorded as the tool result in conversation history. */
    public Map<String, Object> toToolResultData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", status);
        data.put("answer", answer);
        data.put("current_url", currentUrl);
        data.put("page_title", pageTitle);
        if (error != null) {
            data.put("error", error);
        }
        return data;
    }
}
