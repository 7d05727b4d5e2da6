package com.todoflow.core.model;

/**
 * Final output of one orchestration run.
 */
public record LoopResult(
    int iterations,
    TodoStatistics statistics,
    boolean completed,
    TerminationReason terminationReason,
    FeedbackSummary feedbackSummary
) {
    public static LoopResult of(
            int iterations,
            TodoStatistics statistics,
            TerminationReason reason,
            FeedbackSummary feedbackSummary) {
        return new LoopResult(iterations, statistics, statistics.allSettledWork(), reason, feedbackSummary);
    }
}
