package com.todoflow.core.model;

import java.util.List;

/**
 * Kinds of feedback the gateway can request.
 */
public enum FeedbackKind {
    /** Yes/no approval before proceeding. */
    APPROVAL,
    /** Direction on how the plan should continue. */
    GUIDANCE,
    /** Validation of an execution result. */
    VALIDATION,
    /** Pick one of several options. */
    CHOICE,
    /** Free-text input. */
    INPUT,
    /** Review and possibly amend a result. */
    REVIEW;

    /**
     * Response used when nobody answers and the request carries no default of its own.
     *
     * @param options The options offered with the request, may be empty
     */
    public String builtInDefault(List<String> options) {
        return switch (this) {
            case APPROVAL -> "no";
            case VALIDATION, REVIEW -> "accept";
            case GUIDANCE -> "continue";
            case CHOICE -> options == null || options.isEmpty() ? "skip" : options.get(0);
            case INPUT -> "";
        };
    }
}
