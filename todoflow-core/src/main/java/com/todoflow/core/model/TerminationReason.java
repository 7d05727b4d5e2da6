package com.todoflow.core.model;

/**
 * Why the orchestration loop stopped. All three are normal terminations.
 */
public enum TerminationReason {
    /** Ready and in-progress sets are both empty. */
    ALL_DONE,
    /** The iteration counter reached the configured maximum with work left. */
    BUDGET_EXHAUSTED,
    /** A gate asked to pause; the store is left resumable. */
    USER_PAUSED;

    public SessionState toSessionState() {
        return switch (this) {
            case ALL_DONE -> SessionState.DONE;
            case BUDGET_EXHAUSTED -> SessionState.EXHAUSTED;
            case USER_PAUSED -> SessionState.PAUSED;
        };
    }
}
