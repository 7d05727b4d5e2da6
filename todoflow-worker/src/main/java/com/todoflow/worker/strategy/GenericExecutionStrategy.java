package com.todoflow.worker.strategy;

import com.todoflow.worker.ExecutionContext;
import com.todoflow.worker.ExecutionOutput;
import com.todoflow.worker.ExecutionStrategy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback strategy: acknowledges the todo without side effects.
 * Details echo the todo metadata alongside the resolved kind.
 */
public class GenericExecutionStrategy implements ExecutionStrategy {

    @Override
    public ExecutionOutput execute(ExecutionContext context) {
        Map<String, Object> details = new LinkedHashMap<>();
        context.getMetadata().forEach((key, value) -> {
            if (value != null) {
                details.put(key, value);
            }
        });
        details.put("kind", context.getKind().name());
        return new ExecutionOutput(
            "Completed: " + context.getContent(),
            "Handled by generic strategy",
            details
        );
    }
}
