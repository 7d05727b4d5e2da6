package com.todoflow.advisory;

import com.todoflow.core.model.ReasoningStep;

import java.util.List;

/**
 * Upstream reasoning collaborator.
 * 
 * Turns a free-text query into ordered reasoning steps. It only proposes a plan;
 * the orchestrator decides what becomes a todo and never lets the provider touch state.
 */
@FunctionalInterface
public interface ReasoningProvider {

    /**
     * Produce reasoning steps for a query.
     * 
     * @param query The originating query
     * @param thinkingDepth Maximum number of steps the provider should aim for
     * @return Ordered steps, possibly empty
     * @throws ReasoningException if the provider could not produce an answer
     */
    List<ReasoningStep> reason(String query, int thinkingDepth) throws ReasoningException;

    /**
     * Provider used when no reasoning backend is configured. Always fails, so planning
     * falls back to the template plans.
     */
    static ReasoningProvider unavailable() {
        return (query, depth) -> {
            throw new ReasoningException(ReasoningException.UNAVAILABLE, "No reasoning provider configured");
        };
    }
}
