package com.todoflow.core.model;

import java.util.Locale;

/**
 * Normalized answer to a result-validation request.
 */
public enum ValidationDecision {
    ACCEPT,
    RETRY,
    MODIFY,
    SKIP;

    /**
     * Normalize a raw response. Anything not recognized counts as ACCEPT.
     */
    public static ValidationDecision fromResponse(String response) {
        String normalized = response == null ? "" : response.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "retry", "redo" -> RETRY;
            case "modify", "change" -> MODIFY;
            case "skip" -> SKIP;
            default -> ACCEPT;
        };
    }
}
