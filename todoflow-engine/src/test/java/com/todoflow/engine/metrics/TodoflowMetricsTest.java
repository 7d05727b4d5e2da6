package com.todoflow.engine.metrics;

import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.FeedbackKind;
import com.todoflow.core.model.FeedbackResolution;
import com.todoflow.core.model.RecoveryAction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TodoflowMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TodoflowMetrics metrics = new TodoflowMetrics(registry);

    @Test
    void executionRecorded_shouldCountAndTimeByKindAndOutcome() {
        metrics.executionRecorded(ExecutionKind.MATH, true, Duration.ofMillis(20));
        metrics.executionRecorded(ExecutionKind.MATH, true, Duration.ofMillis(40));
        metrics.executionRecorded(ExecutionKind.FILE, false, Duration.ofMillis(5));

        assertThat(registry.get(TodoflowMetrics.EXECUTIONS).tags("kind", "math", "outcome", "success")
            .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(TodoflowMetrics.EXECUTIONS).tags("kind", "file", "outcome", "failure")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(TodoflowMetrics.EXECUTION_DURATION).tags("kind", "math")
            .timer().count()).isEqualTo(2);
    }

    @Test
    void feedbackResolved_shouldUseShortResolutionTags() {
        metrics.feedbackResolved(FeedbackKind.APPROVAL, FeedbackResolution.TIMED_OUT);
        metrics.feedbackResolved(FeedbackKind.INPUT, FeedbackResolution.DEFAULTED);
        metrics.feedbackResolved(FeedbackKind.INPUT, FeedbackResolution.RESPONDER_ERROR);

        assertThat(registry.get(TodoflowMetrics.FEEDBACK_REQUESTS).tags("kind", "approval", "resolution", "timeout")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(TodoflowMetrics.FEEDBACK_REQUESTS).tags("kind", "input", "resolution", "default")
            .counter().count()).isEqualTo(1.0);
        assertThat(registry.get(TodoflowMetrics.FEEDBACK_REQUESTS).tags("resolution", "error")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    void recoveryApplied_shouldTagAction() {
        metrics.recoveryApplied(RecoveryAction.BREAK_DOWN);

        assertThat(registry.get(TodoflowMetrics.RECOVERY_ACTIONS).tag("action", "break_down")
            .counter().count()).isEqualTo(1.0);
    }
}
