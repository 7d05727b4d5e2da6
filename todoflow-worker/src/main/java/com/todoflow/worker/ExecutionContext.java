package com.todoflow.worker;

import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.Todo;

import java.util.Map;

/**
 * Context provided to execution strategies.
 */
public class ExecutionContext {
    
    private final Todo todo;
    private final ExecutionKind kind;
    
    public ExecutionContext(Todo todo, ExecutionKind kind) {
        this.todo = todo;
        this.kind = kind;
    }
    
    /**
     * Get the todo snapshot being executed.
     */
    public Todo getTodo() {
        return todo;
    }
    
    public String getTodoId() {
        return todo.id();
    }
    
    public String getContent() {
        return todo.content();
    }
    
    /**
     * Get the kind the router classified the todo as.
     */
    public ExecutionKind getKind() {
        return kind;
    }
    
    public Map<String, String> getMetadata() {
        return todo.metadata();
    }
}
