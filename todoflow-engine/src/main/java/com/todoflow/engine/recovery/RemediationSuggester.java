package com.todoflow.engine.recovery;

import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.Todo;

import java.util.List;

/**
 * Produces remediation suggestions for a failed todo, best first.
 */
@FunctionalInterface
public interface RemediationSuggester {

    List<RemediationSuggestion> suggest(Todo todo, ExecutionResult result);
}
