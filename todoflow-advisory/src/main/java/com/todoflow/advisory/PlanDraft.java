package com.todoflow.advisory;

import java.util.Map;

/**
 * A proposed todo, before the store assigns it an id, priority and dependencies.
 */
public record PlanDraft(String content, String reasoning, Map<String, String> metadata) {

    public PlanDraft {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PlanDraft of(String content, String reasoning) {
        return new PlanDraft(content, reasoning, Map.of());
    }
}
