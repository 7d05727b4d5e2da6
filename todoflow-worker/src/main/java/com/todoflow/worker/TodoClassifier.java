package com.todoflow.worker;

import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.Todo;

/**
 * Chooses an execution kind by inspecting a todo.
 */
@FunctionalInterface
public interface TodoClassifier {

    ExecutionKind classify(Todo todo);
}
