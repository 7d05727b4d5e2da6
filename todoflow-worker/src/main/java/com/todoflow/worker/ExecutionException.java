package com.todoflow.worker;

/**
 * Exception thrown by execution strategies on failure.
 */
public class ExecutionException extends Exception {
    
    private final String errorCode;
    private final boolean retryable;
    
    public ExecutionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = true;
    }
    
    public ExecutionException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
    
    public ExecutionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = true;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
    
    /**
     * Create a non-retryable exception (the todo itself needs to change).
     */
    public static ExecutionException permanent(String errorCode, String message) {
        return new ExecutionException(errorCode, message, false);
    }
}
