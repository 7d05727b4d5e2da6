package com.todoflow.core.exception;

/**
 * Thrown when free-text input was rejected by its validator on every allowed attempt.
 */
public class ValidationExhaustedException extends TodoflowException {
    
    public static final String ERROR_CODE = "VALIDATION_EXHAUSTED";
    
    private final int attempts;
    private final String lastResponse;
    
    public ValidationExhaustedException(String prompt, int attempts, String lastResponse) {
        super(ERROR_CODE, String.format(
            "Input rejected %d time(s) for prompt '%s'",
            attempts, prompt
        ));
        this.attempts = attempts;
        this.lastResponse = lastResponse;
    }
    
    public int getAttempts() {
        return attempts;
    }
    
    public String getLastResponse() {
        return lastResponse;
    }
}
