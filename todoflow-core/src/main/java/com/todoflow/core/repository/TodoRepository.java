package com.todoflow.core.repository;

import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatus;

import java.util.List;
import java.util.Optional;

/**
 * Identifier-indexed storage for todos.
 */
public interface TodoRepository {

    /**
     * Insert a todo, or replace the stored copy with the same id.
     *
     * @param todo The todo to store
     */
    void save(Todo todo);

    /**
     * Find a todo by ID.
     *
     * @param todoId The todo ID
     * @return The todo if found
     */
    Optional<Todo> findById(String todoId);

    /**
     * Find all todos.
     *
     * @return All todos ordered by creation sequence
     */
    List<Todo> findAll();

    /**
     * Find todos by status.
     *
     * @param status The todo status
     * @return Todos in the given status, ordered by creation sequence
     */
    List<Todo> findByStatus(TodoStatus status);

    /**
     * Delete a todo.
     *
     * @param todoId The todo ID
     * @return true if a todo was removed
     */
    boolean delete(String todoId);

    /**
     * Check whether a todo exists.
     */
    boolean exists(String todoId);

    /**
     * Remove every todo.
     */
    void deleteAll();
}
