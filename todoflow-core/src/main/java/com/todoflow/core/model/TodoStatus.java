package com.todoflow.core.model;

/**
 * Lifecycle states for a todo.
 */
public enum TodoStatus {
    /**
     * Waiting for its dependencies and for the scheduler to pick it.
     * Transitions: -> IN_PROGRESS, FAILED (skipped before execution)
     */
    PENDING,

    /**
     * Selected, approved and currently executing.
     * Transitions: -> COMPLETED, FAILED, PENDING (validation asked for a retry)
     */
    IN_PROGRESS,

    /**
     * Execution succeeded and the result was accepted.
     */
    COMPLETED,

    /**
     * Execution failed or the todo was skipped.
     * Transitions: -> PENDING (retry or modify)
     */
    FAILED
}
