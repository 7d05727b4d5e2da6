package com.todoflow.engine.persistence;

import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatus;
import com.todoflow.core.repository.TodoRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TodoRepository.
 * One instance per session; nothing survives a restart.
 */
public class InMemoryTodoRepository implements TodoRepository {
    
    private static final Comparator<Todo> BY_SEQUENCE = Comparator.comparingLong(Todo::sequence);
    
    private final Map<String, Todo> todos = new ConcurrentHashMap<>();
    
    @Override
    public void save(Todo todo) {
        todos.put(todo.id(), todo);
    }
    
    @Override
    public Optional<Todo> findById(String todoId) {
        return Optional.ofNullable(todos.get(todoId));
    }
    
    @Override
    public List<Todo> findAll() {
        return todos.values().stream()
            .sorted(BY_SEQUENCE)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<Todo> findByStatus(TodoStatus status) {
        return todos.values().stream()
            .filter(t -> t.status() == status)
            .sorted(BY_SEQUENCE)
            .collect(Collectors.toList());
    }
    
    @Override
    public boolean delete(String todoId) {
        return todos.remove(todoId) != null;
    }
    
    @Override
    public boolean exists(String todoId) {
        return todos.containsKey(todoId);
    }
    
    @Override
    public void deleteAll() {
        todos.clear();
    }
}
