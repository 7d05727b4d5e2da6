package com.todoflow.engine.scheduler;

import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatus;
import com.todoflow.engine.store.TodoStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the ready set from the current store state on every call.
 * 
 * A todo is ready when it is PENDING and every dependency is a COMPLETED todo.
 * Ready todos are ordered by priority (1 first), then by creation order.
 */
public class ReadySetScheduler {

    static final Comparator<Todo> READY_ORDER = Comparator
        .comparingInt(Todo::priority)
        .thenComparingLong(Todo::sequence);

    private final TodoStore store;

    public ReadySetScheduler(TodoStore store) {
        this.store = store;
    }

    public List<Todo> readySet() {
        Set<String> completed = completedIds();
        return store.byStatus(TodoStatus.PENDING).stream()
            .filter(todo -> todo.dependenciesSatisfiedBy(completed))
            .sorted(READY_ORDER)
            .collect(Collectors.toList());
    }

    public Optional<Todo> next() {
        return readySet().stream().findFirst();
    }

    /**
     * Pending todos waiting on at least one dependency that is not completed.
     */
    public List<Todo> blockedTodos() {
        Set<String> completed = completedIds();
        return store.byStatus(TodoStatus.PENDING).stream()
            .filter(todo -> !todo.dependenciesSatisfiedBy(completed))
            .collect(Collectors.toList());
    }

    /**
     * True while something is ready or still in progress.
     */
    public boolean hasOutstandingWork() {
        return !store.inProgress().isEmpty() || next().isPresent();
    }

    private Set<String> completedIds() {
        return store.byStatus(TodoStatus.COMPLETED).stream()
            .map(Todo::id)
            .collect(Collectors.toSet());
    }
}
