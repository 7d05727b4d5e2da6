package com.todoflow.worker;

import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.Todo;

/**
 * Classifies a todo and dispatches it to the matching execution strategy.
 * Implementations never throw for a failed execution; failures come back as results.
 */
public interface ExecutionRouter {

    /**
     * Choose the capability tag for a todo.
     *
     * @param todo The todo to classify
     * @return The execution kind
     */
    ExecutionKind classify(Todo todo);

    /**
     * Execute a todo with the strategy registered for its kind, or the fallback strategy.
     *
     * @param todo The todo to execute
     * @return The result; {@code success == false} on any strategy failure
     */
    ExecutionResult execute(Todo todo);
}
