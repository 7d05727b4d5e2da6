package com.todoflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work produced by the reasoning step or by plan edits.
 * Instances are immutable snapshots; the todo store swaps in a new copy on every mutation.
 *
 * Invariants:
 * - completedAt set iff status == COMPLETED
 * - priority >= 1 (1 = highest)
 * - sequence is unique per store and orders todos by creation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Todo(
    String id,
    String content,
    TodoStatus status,
    int priority,
    Set<String> dependencies,
    long sequence,

    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,

    // Annotations
    String feedback,
    String reasoning,
    Map<String, String> metadata
) {
    public Todo {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Todo id cannot be empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Todo status cannot be null");
        }
        if (priority < 1) {
            throw new IllegalArgumentException("Priority must be >= 1, got " + priority);
        }
        if ((status == TodoStatus.COMPLETED) != (completedAt != null)) {
            throw new IllegalArgumentException(
                "completedAt must be set exactly when status is COMPLETED (status=" + status + ")");
        }
        content = content != null ? content : "";
        dependencies = dependencies == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Create a new todo in PENDING state.
     */
    public static Todo create(
            String id,
            String content,
            int priority,
            Set<String> dependencies,
            long sequence,
            Map<String, String> metadata,
            String reasoning,
            Instant now) {
        return new Todo(
            id, content, TodoStatus.PENDING, priority, dependencies, sequence,
            now, null, null,
            null, reasoning, metadata
        );
    }

    /**
     * Check whether every dependency is contained in the given set of completed ids.
     */
    public boolean dependenciesSatisfiedBy(Set<String> completedIds) {
        return completedIds.containsAll(dependencies);
    }

    /**
     * Create a copy in the given status. COMPLETED stamps completedAt, anything else clears it.
     */
    public Todo withStatus(TodoStatus newStatus, Instant now) {
        return new Todo(
            id, content, newStatus, priority, dependencies, sequence,
            createdAt, now, newStatus == TodoStatus.COMPLETED ? now : null,
            feedback, reasoning, metadata
        );
    }

    public Todo withContent(String newContent, Instant now) {
        return new Todo(
            id, newContent, status, priority, dependencies, sequence,
            createdAt, now, completedAt,
            feedback, reasoning, metadata
        );
    }

    public Todo withPriority(int newPriority, Instant now) {
        return new Todo(
            id, content, status, newPriority, dependencies, sequence,
            createdAt, now, completedAt,
            feedback, reasoning, metadata
        );
    }

    public Todo withFeedback(String newFeedback, Instant now) {
        return new Todo(
            id, content, status, priority, dependencies, sequence,
            createdAt, now, completedAt,
            newFeedback, reasoning, metadata
        );
    }

    public Todo withMetadata(String key, String value, Instant now) {
        Map<String, String> updated = new LinkedHashMap<>(metadata);
        updated.put(key, value);
        return new Todo(
            id, content, status, priority, dependencies, sequence,
            createdAt, now, completedAt,
            feedback, reasoning, updated
        );
    }

    /**
     * Create a copy that no longer depends on the given todo.
     */
    public Todo withoutDependency(String dependencyId, Instant now) {
        Set<String> remaining = new LinkedHashSet<>(dependencies);
        remaining.remove(dependencyId);
        return new Todo(
            id, content, status, priority, remaining, sequence,
            createdAt, now, completedAt,
            feedback, reasoning, metadata
        );
    }
}
