package com.todoflow.core.model;

import java.util.Locale;

/**
 * Normalized answer to an error-handling request.
 *
 * Invariants:
 * - suggestionIndex >= 0 iff action == USE_SUGGESTION
 */
public record RecoveryDecision(RecoveryAction action, int suggestionIndex) {

    private static final String SUGGESTION_PREFIX = "suggestion_";

    public RecoveryDecision {
        if ((action == RecoveryAction.USE_SUGGESTION) != (suggestionIndex >= 0)) {
            throw new IllegalArgumentException(
                "suggestionIndex must be >= 0 exactly for USE_SUGGESTION, got " + action + "/" + suggestionIndex);
        }
    }

    public static RecoveryDecision of(RecoveryAction action) {
        return new RecoveryDecision(action, -1);
    }

    public static RecoveryDecision suggestion(int index) {
        return new RecoveryDecision(RecoveryAction.USE_SUGGESTION, index);
    }

    /**
     * Token offered to the responder for the suggestion at the given zero-based index.
     */
    public static String suggestionToken(int index) {
        return SUGGESTION_PREFIX + (index + 1);
    }

    /**
     * Normalize a raw response. Suggestion tokens outside [1, suggestionCount] and
     * anything else not recognized count as SKIP.
     */
    public static RecoveryDecision fromResponse(String response, int suggestionCount) {
        String normalized = response == null ? "" : response.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(SUGGESTION_PREFIX)) {
            try {
                int number = Integer.parseInt(normalized.substring(SUGGESTION_PREFIX.length()));
                if (number >= 1 && number <= suggestionCount) {
                    return suggestion(number - 1);
                }
            } catch (NumberFormatException e) {
                return of(RecoveryAction.SKIP);
            }
            return of(RecoveryAction.SKIP);
        }
        return switch (normalized) {
            case "retry", "try_again" -> of(RecoveryAction.RETRY);
            case "modify_todo", "modify" -> of(RecoveryAction.MODIFY);
            case "break_down", "split" -> of(RecoveryAction.BREAK_DOWN);
            default -> of(RecoveryAction.SKIP);
        };
    }
}
