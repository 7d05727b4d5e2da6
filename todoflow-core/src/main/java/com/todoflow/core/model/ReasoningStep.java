package com.todoflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One step of the upstream reasoning. Opaque to the orchestration loop.
 */
public record ReasoningStep(
    String stepId,
    String description,
    String reasoning,
    double confidence,
    Instant createdAt
) {
    public static ReasoningStep create(String description, String reasoning) {
        return new ReasoningStep(UUID.randomUUID().toString(), description, reasoning, 0.0, Instant.now());
    }
}
