package com.todoflow.engine.metrics;

import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.FeedbackKind;
import com.todoflow.core.model.FeedbackResolution;
import com.todoflow.core.model.RecoveryAction;
import com.todoflow.core.model.TerminationReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer metrics for todo orchestration.
 * 
 * Metrics exposed:
 * - Todo outcomes
 * - Executions by kind and outcome, with latency
 * - Feedback requests by kind and resolution
 * - Recovery actions and loop terminations
 */
public class TodoflowMetrics {

    // Metric names
    public static final String TODOS_COMPLETED = "todoflow.todos.completed";
    public static final String TODOS_FAILED = "todoflow.todos.failed";
    public static final String EXECUTIONS = "todoflow.executions";
    public static final String EXECUTION_DURATION = "todoflow.execution.duration";
    public static final String FEEDBACK_REQUESTS = "todoflow.feedback.requests";
    public static final String RECOVERY_ACTIONS = "todoflow.recovery.actions";
    public static final String LOOP_TERMINATIONS = "todoflow.loop.terminations";

    private final MeterRegistry registry;

    public TodoflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics backed by a private registry, for callers with nothing to export to.
     */
    public static TodoflowMetrics standalone() {
        return new TodoflowMetrics(new SimpleMeterRegistry());
    }

    public void todoCompleted() {
        Counter.builder(TODOS_COMPLETED)
            .description("Todos completed")
            .register(registry)
            .increment();
    }

    public void todoFailed() {
        Counter.builder(TODOS_FAILED)
            .description("Todos marked failed")
            .register(registry)
            .increment();
    }

    public void executionRecorded(ExecutionKind kind, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        Counter.builder(EXECUTIONS)
            .tag("kind", tag(kind))
            .tag("outcome", outcome)
            .description("Todo executions")
            .register(registry)
            .increment();

        Timer.builder(EXECUTION_DURATION)
            .tag("kind", tag(kind))
            .tag("outcome", outcome)
            .description("Todo execution duration")
            .register(registry)
            .record(duration);
    }

    public void feedbackResolved(FeedbackKind kind, FeedbackResolution resolution) {
        Counter.builder(FEEDBACK_REQUESTS)
            .tag("kind", tag(kind))
            .tag("resolution", resolutionTag(resolution))
            .description("Feedback requests by resolution")
            .register(registry)
            .increment();
    }

    public void recoveryApplied(RecoveryAction action) {
        Counter.builder(RECOVERY_ACTIONS)
            .tag("action", tag(action))
            .description("Failure recovery actions applied")
            .register(registry)
            .increment();
    }

    public void loopTerminated(TerminationReason reason) {
        Counter.builder(LOOP_TERMINATIONS)
            .tag("state", tag(reason))
            .description("Orchestration loop terminations")
            .register(registry)
            .increment();
    }

    private static String resolutionTag(FeedbackResolution resolution) {
        return switch (resolution) {
            case ANSWERED -> "answered";
            case TIMED_OUT -> "timeout";
            case DEFAULTED -> "default";
            case RESPONDER_ERROR -> "error";
        };
    }

    private static String tag(Enum<?> value) {
        return value == null ? "unknown" : value.name().toLowerCase(Locale.ROOT);
    }
}
