package com.todoflow.core.model;

import java.util.Locale;

/**
 * Normalized answer to a plan-guidance request.
 */
public enum GuidanceAction {
    CONTINUE,
    SKIP_CURRENT,
    REORDER,
    ADD_TODO,
    REMOVE_TODO,
    PAUSE;

    /**
     * Normalize a raw response. Anything not recognized stops the loop (PAUSE).
     */
    public static GuidanceAction fromResponse(String response) {
        String normalized = response == null ? "" : response.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "continue", "proceed", "next" -> CONTINUE;
            case "skip_current", "skip" -> SKIP_CURRENT;
            case "reorder" -> REORDER;
            case "add_todo", "add" -> ADD_TODO;
            case "remove_todo", "remove" -> REMOVE_TODO;
            default -> PAUSE;
        };
    }

    /**
     * Check if this action edits the plan before execution continues.
     */
    public boolean editsPlan() {
        return this == REORDER || this == ADD_TODO || this == REMOVE_TODO;
    }
}
