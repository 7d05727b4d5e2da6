package com.todoflow.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The scope created for one originating query: its reasoning steps and how the plan was derived.
 * The todos of a session live in the session's own todo store.
 */
public record Session(
    UUID sessionId,
    String query,
    List<ReasoningStep> steps,
    PlanSource planSource,
    Instant createdAt
) {
    public Session {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Session create(String query, List<ReasoningStep> steps, PlanSource planSource) {
        return new Session(UUID.randomUUID(), query, steps, planSource, Instant.now());
    }
}
