package com.wayfinder.core.supervisor;

import com.wayfinder.core.classify.TaskType;
import com.wayfinder.core.error.ErrorReport;

/**
 * What {@link TaskSupervisor#processRequest} returns to the caller.
 *
 * @param type        how the request was handled; {@code null} when it failed before classification
 * @param status      "success", "in_progress", "stopped" or "error"
 * @param answer      the user-facing answer, always non-empty
 * @param sessionId   the session the request ran in, which may differ from the one supplied
 * @param currentUrl  browser URL after the request, or empty
 * @param pageTitle   browser page title after the request, or empty
 * @param error       failure details when {@code status} is "error", otherwise {@code null}
 * @param fallback    {@code true} when classification fell back to the agent strategy
 */
public record TaskResponse(
    TaskType type,
    String status,
    String answer,
    String sessionId,
    String currentUrl,
    String pageTitle,
    ErrorReport error,
    boolean fallback
) {

    public boolean isError() {
        return error != null;
    }
}
