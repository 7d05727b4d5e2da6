package com.todoflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TodoTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-15T10:05:00Z");

    @Test
    void create_shouldStartPendingWithoutCompletion() {
        Todo todo = Todo.create("t-1", "Write report", 2, Set.of(), 0, Map.of(), null, T0);

        assertEquals(TodoStatus.PENDING, todo.status());
        assertEquals(T0, todo.createdAt());
        assertNull(todo.completedAt());
        assertNull(todo.updatedAt());
    }

    @Test
    void withStatus_completed_shouldStampCompletedAt() {
        Todo todo = Todo.create("t-1", "Write report", 1, Set.of(), 0, Map.of(), null, T0);

        Todo completed = todo.withStatus(TodoStatus.COMPLETED, T1);

        assertEquals(T1, completed.completedAt());
        assertEquals(T1, completed.updatedAt());
    }

    @Test
    void withStatus_leavingCompleted_shouldClearCompletedAt() {
        Todo completed = Todo.create("t-1", "Write report", 1, Set.of(), 0, Map.of(), null, T0)
            .withStatus(TodoStatus.COMPLETED, T0);

        Todo reopened = completed.withStatus(TodoStatus.PENDING, T1);

        assertNull(reopened.completedAt());
    }

    @Test
    void constructor_shouldRejectCompletedAtOutsideCompletedState() {
        assertThrows(IllegalArgumentException.class, () -> new Todo(
            "t-1", "x", TodoStatus.FAILED, 1, Set.of(), 0, T0, T1, T1, null, null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new Todo(
            "t-1", "x", TodoStatus.COMPLETED, 1, Set.of(), 0, T0, T1, null, null, null, Map.of()));
    }

    @Test
    void constructor_shouldRejectPriorityBelowOne() {
        assertThrows(IllegalArgumentException.class,
            () -> Todo.create("t-1", "x", 0, Set.of(), 0, Map.of(), null, T0));
    }

    @Test
    void dependenciesSatisfiedBy_shouldRequireEveryDependency() {
        Todo todo = Todo.create("t-3", "Merge", 1, Set.of("t-1", "t-2"), 2, Map.of(), null, T0);

        assertFalse(todo.dependenciesSatisfiedBy(Set.of("t-1")));
        assertTrue(todo.dependenciesSatisfiedBy(Set.of("t-1", "t-2", "t-9")));
    }

    @Test
    void withMetadata_shouldNotMutateOriginal() {
        Todo todo = Todo.create("t-1", "x", 1, Set.of(), 0, Map.of("step_id", "s1"), null, T0);

        Todo tagged = todo.withMetadata("source", "user", T1);

        assertEquals(Map.of("step_id", "s1"), todo.metadata());
        assertEquals("user", tagged.metadata().get("source"));
        assertEquals("s1", tagged.metadata().get("step_id"));
    }

    @Test
    void withoutDependency_shouldDropOnlyThatId() {
        Todo todo = Todo.create("t-3", "Merge", 1, Set.of("t-1", "t-2"), 2, Map.of(), null, T0);

        assertEquals(Set.of("t-2"), todo.withoutDependency("t-1", T1).dependencies());
    }
}
