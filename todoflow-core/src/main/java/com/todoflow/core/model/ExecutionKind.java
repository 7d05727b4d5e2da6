package com.todoflow.core.model;

/**
 * Capability tag chosen for a todo; selects the execution strategy.
 */
public enum ExecutionKind {
    MATH,
    FILE,
    RESEARCH,
    PLANNING,
    GENERIC
}
