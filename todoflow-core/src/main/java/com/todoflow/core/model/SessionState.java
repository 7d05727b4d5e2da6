package com.todoflow.core.model;

/**
 * Lifecycle states for a session.
 */
public enum SessionState {
    /** Todos generated, loop not started. */
    CREATED,
    /** Loop currently running. */
    RUNNING,
    /** Halted by the user; resumable. */
    PAUSED,
    /** Iteration budget ran out with work left; resumable. */
    EXHAUSTED,
    /** No ready or in-progress todos left. */
    DONE
}
