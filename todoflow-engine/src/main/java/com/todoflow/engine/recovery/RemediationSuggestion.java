package com.todoflow.engine.recovery;

import com.todoflow.core.model.RecoveryAction;

/**
 * A ranked remediation proposal: what to do, and how to phrase it to the responder.
 * The action is what gets applied when the responder picks this suggestion.
 */
public record RemediationSuggestion(RecoveryAction action, String text) {

    public RemediationSuggestion {
        if (action == RecoveryAction.USE_SUGGESTION) {
            throw new IllegalArgumentException("A suggestion cannot point at another suggestion");
        }
    }
}
