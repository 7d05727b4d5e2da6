package com.todoflow.worker;

import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.Todo;
import com.todoflow.worker.strategy.GenericExecutionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Router backed by a classifier and a strategy table keyed by execution kind.
 * 
 * Usage:
 * <pre>
 * DefaultExecutionRouter router = new DefaultExecutionRouter(new KeywordTodoClassifier());
 * router.register(ExecutionKind.MATH, context -> ExecutionOutput.of("42", "Computed"));
 * ExecutionResult result = router.execute(todo);
 * </pre>
 */
public class DefaultExecutionRouter implements ExecutionRouter {
    
    private static final Logger log = LoggerFactory.getLogger(DefaultExecutionRouter.class);
    
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";
    
    private final TodoClassifier classifier;
    private final ExecutionStrategy fallback;
    private final Map<ExecutionKind, ExecutionStrategy> strategies = new EnumMap<>(ExecutionKind.class);
    
    public DefaultExecutionRouter(TodoClassifier classifier) {
        this(classifier, new GenericExecutionStrategy());
    }
    
    public DefaultExecutionRouter(TodoClassifier classifier, ExecutionStrategy fallback) {
        this.classifier = classifier;
        this.fallback = fallback;
    }
    
    /**
     * Register the strategy used for a kind. Replaces any earlier registration.
     */
    public synchronized DefaultExecutionRouter register(ExecutionKind kind, ExecutionStrategy strategy) {
        strategies.put(kind, strategy);
        log.info("Registered execution strategy for kind {}", kind);
        return this;
    }
    
    @Override
    public ExecutionKind classify(Todo todo) {
        return classifier.classify(todo);
    }
    
    @Override
    public ExecutionResult execute(Todo todo) {
        ExecutionKind kind = classify(todo);
        ExecutionStrategy strategy = strategyFor(kind);
        long started = System.nanoTime();
        
        try {
            ExecutionOutput output = strategy.execute(new ExecutionContext(todo, kind));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.debug("Todo {} executed as {} in {}ms", todo.id(), kind, elapsed.toMillis());
            return ExecutionResult.succeeded(kind, output.output(), output.feedback(), elapsed);
            
        } catch (ExecutionException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.warn("Todo {} failed as {}: [{}] {}", todo.id(), kind, e.getErrorCode(), e.getMessage());
            return ExecutionResult.failed(kind, e.getErrorCode(), e.getMessage(),
                failureFeedback(e.isRetryable()), elapsed);
            
        } catch (RuntimeException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.error("Unexpected error executing todo {}", todo.id(), e);
            return ExecutionResult.failed(kind, UNEXPECTED_ERROR, describe(e),
                failureFeedback(true), elapsed);
        }
    }
    
    private synchronized ExecutionStrategy strategyFor(ExecutionKind kind) {
        return strategies.getOrDefault(kind, fallback);
    }
    
    private static String failureFeedback(boolean retryable) {
        return retryable
            ? "Execution failed; retrying may succeed"
            : "Execution failed; the todo needs to change before it can succeed";
    }
    
    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
