package com.todoflow.worker.strategy;

import com.todoflow.worker.ExecutionContext;
import com.todoflow.worker.ExecutionException;
import com.todoflow.worker.ExecutionOutput;
import com.todoflow.worker.ExecutionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Deterministic stand-in for real work, used by demos and tests.
 * Fails any todo whose content mentions "error" or "fail".
 */
public class SimulatedExecutionStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionStrategy.class);

    public static final String SIMULATED_FAILURE = "SIMULATED_FAILURE";

    @Override
    public ExecutionOutput execute(ExecutionContext context) throws ExecutionException {
        String content = context.getContent();
        String lower = content.toLowerCase(Locale.ROOT);

        if (lower.contains("error") || lower.contains("fail")) {
            log.info("Simulating failure for todo {}", context.getTodoId());
            throw new ExecutionException(SIMULATED_FAILURE, "Simulated failure for: " + content);
        }

        return new ExecutionOutput(
            "Simulated " + context.getKind().name().toLowerCase(Locale.ROOT) + " result for: " + content,
            "Simulated execution completed",
            Map.of("kind", context.getKind().name(), "todoId", context.getTodoId())
        );
    }
}
