package com.todoflow.worker;

/**
 * Performs the actual work for one kind of todo.
 */
@FunctionalInterface
public interface ExecutionStrategy {
    
    /**
     * Execute the todo.
     * 
     * @param context Execution context carrying the todo snapshot
     * @return The execution output
     * @throws ExecutionException if the todo could not be carried out
     */
    ExecutionOutput execute(ExecutionContext context) throws ExecutionException;
}
