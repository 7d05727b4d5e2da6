package com.todoflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;

/**
 * Outcome of executing one todo. Only {@code success} and {@code feedback} drive state transitions.
 *
 * Invariants:
 * - error set iff success == false
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
    boolean success,
    ExecutionKind kind,
    String output,
    String feedback,
    String error,
    String errorCode,
    Duration duration
) {
    public ExecutionResult {
        if (success && error != null) {
            throw new IllegalArgumentException("Successful result cannot carry an error");
        }
        if (!success && error == null) {
            error = "Execution failed";
        }
        feedback = feedback != null ? feedback : "";
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static ExecutionResult succeeded(ExecutionKind kind, String output, String feedback, Duration duration) {
        return new ExecutionResult(true, kind, output, feedback, null, null, duration);
    }

    public static ExecutionResult failed(
            ExecutionKind kind, String errorCode, String error, String feedback, Duration duration) {
        return new ExecutionResult(false, kind, null, feedback, error, errorCode, duration);
    }
}
