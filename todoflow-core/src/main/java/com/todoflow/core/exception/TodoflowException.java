package com.todoflow.core.exception;

/**
 * Base exception for all todoflow errors.
 */
public class TodoflowException extends RuntimeException {
    
    private final String errorCode;
    
    public TodoflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public TodoflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
