package com.todoflow.engine.recovery;

import com.todoflow.core.model.RecoveryAction;
import com.todoflow.core.model.RecoveryDecision;
import com.todoflow.core.model.Todo;

import java.util.List;

/**
 * What the recovery planner did about one failure.
 *
 * @param todoId The failed todo
 * @param decision The normalized responder decision, null when nothing was asked
 * @param applied The action actually applied, null when nothing changed
 * @param createdTodos Todos created by a break-down
 * @param note Human-readable account of the outcome
 */
public record RecoveryOutcome(
    String todoId,
    RecoveryDecision decision,
    RecoveryAction applied,
    List<Todo> createdTodos,
    String note
) {
    public RecoveryOutcome {
        createdTodos = createdTodos == null ? List.of() : List.copyOf(createdTodos);
    }

    static RecoveryOutcome notApplied(String todoId, RecoveryDecision decision, String note) {
        return new RecoveryOutcome(todoId, decision, null, List.of(), note);
    }

    public boolean wasApplied() {
        return applied != null;
    }
}
