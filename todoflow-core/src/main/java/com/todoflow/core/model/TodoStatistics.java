package com.todoflow.core.model;

/**
 * Point-in-time counts of todos per status.
 */
public record TodoStatistics(
    int total,
    int pending,
    int inProgress,
    int completed,
    int failed
) {
    public static TodoStatistics empty() {
        return new TodoStatistics(0, 0, 0, 0, 0);
    }

    /**
     * True when every todo that did not fail has completed.
     */
    public boolean allSettledWork() {
        return completed == total - failed;
    }
}
