package com.todoflow.core.model;

import java.util.Locale;

/**
 * Normalized answer to an approval-before-execution request.
 */
public enum ApprovalDecision {
    YES,
    NO,
    SKIP,
    MODIFY;

    /**
     * Normalize a raw response. Anything not recognized counts as NO.
     */
    public static ApprovalDecision fromResponse(String response) {
        String normalized = response == null ? "" : response.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "yes", "y", "proceed", "ok" -> YES;
            case "skip" -> SKIP;
            case "modify", "change", "edit" -> MODIFY;
            default -> NO;
        };
    }
}
