package com.todoflow.core.model;

/**
 * Category of a ledger entry attached to a todo.
 */
public enum FeedbackEntryType {
    SUCCESS,
    ERROR,
    IMPROVEMENT,
    ANALYSIS
}
