package com.todoflow.worker;

import java.util.Map;

/**
 * Successful output of an execution strategy.
 */
public record ExecutionOutput(String output, String feedback, Map<String, Object> details) {

    public ExecutionOutput {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ExecutionOutput of(String output, String feedback) {
        return new ExecutionOutput(output, feedback, Map.of());
    }
}
