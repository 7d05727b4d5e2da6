package com.todoflow.core.model;

/**
 * What to do with a failed todo.
 */
public enum RecoveryAction {
    /** Reset to PENDING with unchanged content. */
    RETRY,
    /** Leave FAILED and note why. */
    SKIP,
    /** Replace content and reset to PENDING. */
    MODIFY,
    /** Split into new dependency-free sub-todos. */
    BREAK_DOWN,
    /** Apply one of the offered remediation suggestions. */
    USE_SUGGESTION
}
