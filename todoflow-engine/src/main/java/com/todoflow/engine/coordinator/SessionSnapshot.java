package com.todoflow.engine.coordinator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.todoflow.core.model.ExecutionRecord;
import com.todoflow.core.model.FeedbackEntry;
import com.todoflow.core.model.FeedbackSummary;
import com.todoflow.core.model.LoopResult;
import com.todoflow.core.model.PlanSource;
import com.todoflow.core.model.ReasoningStep;
import com.todoflow.core.model.SessionState;
import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatistics;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Plain, serializable view of a session at one point in time.
 * {@code lastResult} is absent until the loop has run once.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
    UUID sessionId,
    String query,
    SessionState state,
    PlanSource planSource,
    Instant createdAt,
    List<ReasoningStep> steps,
    List<Todo> todos,
    TodoStatistics statistics,
    List<FeedbackEntry> feedbackEntries,
    List<ExecutionRecord> executionHistory,
    FeedbackSummary feedbackSummary,
    LoopResult lastResult
) {
    public SessionSnapshot {
        steps = List.copyOf(steps);
        todos = List.copyOf(todos);
        feedbackEntries = List.copyOf(feedbackEntries);
        executionHistory = List.copyOf(executionHistory);
    }
}
