package com.todoflow.advisory;

/**
 * Thrown when the reasoning collaborator cannot produce steps.
 */
public class ReasoningException extends Exception {

    public static final String UNAVAILABLE = "REASONING_UNAVAILABLE";
    public static final String FAILED = "REASONING_FAILED";

    private final String errorCode;

    public ReasoningException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ReasoningException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
