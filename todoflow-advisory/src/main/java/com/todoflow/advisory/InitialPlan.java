package com.todoflow.advisory;

import com.todoflow.core.model.PlanSource;
import com.todoflow.core.model.ReasoningStep;

import java.util.List;

/**
 * Result of planning a query. Drafts are in execution order: draft {@code i} gets priority
 * {@code i + 1} and depends on draft {@code i - 1}.
 */
public record InitialPlan(List<ReasoningStep> steps, List<PlanDraft> drafts, PlanSource source) {

    public InitialPlan {
        steps = List.copyOf(steps);
        drafts = List.copyOf(drafts);
    }
}
