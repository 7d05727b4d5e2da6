package com.todoflow.engine.feedback;

import com.todoflow.core.exception.ValidationExhaustedException;
import com.todoflow.core.model.ApprovalDecision;
import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.FeedbackKind;
import com.todoflow.core.model.FeedbackRequest;
import com.todoflow.core.model.FeedbackResolution;
import com.todoflow.core.model.FeedbackSummary;
import com.todoflow.core.model.OrchestrationConfig;
import com.todoflow.core.model.RecoveryAction;
import com.todoflow.core.model.RecoveryDecision;
import com.todoflow.core.model.Todo;
import com.todoflow.engine.metrics.TodoflowMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedbackGatewayTest {

    private static final OrchestrationConfig NON_INTERACTIVE = OrchestrationConfig.defaults();
    private static final OrchestrationConfig INTERACTIVE = OrchestrationConfig.builder().interactive(true).build();

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private FeedbackGateway gateway;

    @AfterEach
    void tearDown() {
        if (gateway != null) {
            gateway.close();
        }
    }

    @Test
    @DisplayName("Non-interactive approval without a default answers no")
    void nonInteractive_approvalWithoutDefault() {
        gateway = gateway(NON_INTERACTIVE, request -> "yes");

        String response = gateway.request(FeedbackKind.APPROVAL, "Go?", Map.of(), List.of("yes", "no"), null, null);

        assertThat(response).isEqualTo("no");
        FeedbackRequest recorded = gateway.history().get(0);
        assertThat(recorded.getResolution()).contains(FeedbackResolution.DEFAULTED);
        assertThat(recorded.getResponse()).contains("no");
    }

    @Test
    @DisplayName("Non-interactive requests use kind defaults and never call the responder")
    void nonInteractive_kindDefaults() {
        ScriptedFeedbackResponder responder = ScriptedFeedbackResponder.of("ignored");
        gateway = gateway(NON_INTERACTIVE, responder);

        assertThat(gateway.request(FeedbackKind.VALIDATION, "ok?", null, null, null, null)).isEqualTo("accept");
        assertThat(gateway.request(FeedbackKind.GUIDANCE, "next?", null, null, null, null)).isEqualTo("continue");
        assertThat(gateway.request(FeedbackKind.CHOICE, "pick", null, List.of("b", "a"), null, null)).isEqualTo("b");
        assertThat(gateway.request(FeedbackKind.CHOICE, "pick", null, List.of(), null, null)).isEqualTo("skip");
        assertThat(gateway.request(FeedbackKind.INPUT, "type", null, null, null, null)).isEmpty();
        assertThat(gateway.request(FeedbackKind.REVIEW, "look", null, null, "revise", null)).isEqualTo("revise");
        assertThat(responder.received()).isEmpty();
    }

    @Test
    @DisplayName("Auto-approve answers yes to approvals without a default")
    void nonInteractive_autoApprove() {
        gateway = gateway(OrchestrationConfig.builder().autoApproveSimple(true).build(), request -> "no");

        assertThat(gateway.request(FeedbackKind.APPROVAL, "Go?", null, null, null, null)).isEqualTo("yes");
        assertThat(gateway.request(FeedbackKind.APPROVAL, "Go?", null, null, "skip", null)).isEqualTo("skip");
    }

    @Test
    @DisplayName("Approval builder defaults to yes")
    void requestApproval_defaultsToYes() {
        gateway = gateway(NON_INTERACTIVE, request -> "no");

        assertThat(gateway.requestApproval(todo("Deploy"), ExecutionKind.GENERIC)).isEqualTo(ApprovalDecision.YES);
        assertThat(gateway.history().get(0).getOptions()).containsExactly("yes", "no", "skip", "modify");
    }

    @Test
    @DisplayName("Unanswered request times out to its default after roughly the timeout")
    void interactive_timeoutFallsBack() {
        gateway = gateway(INTERACTIVE, slowResponder(Duration.ofSeconds(5)));

        String response = gateway.request(
            FeedbackKind.APPROVAL, "Go?", null, List.of("yes", "no"), "skip", Duration.ofMillis(200));

        assertThat(response).isEqualTo("skip");
        FeedbackRequest recorded = gateway.history().get(0);
        assertThat(recorded.isTimedOut()).isTrue();
        assertThat(recorded.getLatency()).hasValueSatisfying(latency -> {
            assertThat(latency).isGreaterThanOrEqualTo(Duration.ofMillis(150));
            assertThat(latency).isLessThan(Duration.ofSeconds(2));
        });
        assertThat(gateway.summary().timedOut()).isEqualTo(1);
    }

    @Test
    @DisplayName("Timed-out request without a default uses the kind default")
    void interactive_timeoutUsesKindDefault() {
        gateway = gateway(INTERACTIVE, slowResponder(Duration.ofSeconds(5)));

        assertThat(gateway.request(FeedbackKind.APPROVAL, "Go?", null, null, null, Duration.ofMillis(100)))
            .isEqualTo("no");
    }

    @Test
    @DisplayName("Responder answers are trimmed; blank answers mean the default")
    void interactive_answers() {
        gateway = gateway(INTERACTIVE, ScriptedFeedbackResponder.of("  modify ", ""));

        assertThat(gateway.request(FeedbackKind.APPROVAL, "Go?", null, null, "yes", Duration.ofSeconds(5)))
            .isEqualTo("modify");
        assertThat(gateway.request(FeedbackKind.APPROVAL, "Go?", null, null, "yes", Duration.ofSeconds(5)))
            .isEqualTo("yes");
        assertThat(gateway.history()).allSatisfy(r ->
            assertThat(r.getResolution()).contains(FeedbackResolution.ANSWERED));
    }

    @Test
    @DisplayName("Failing responder degrades to the default")
    void interactive_responderError() {
        gateway = gateway(INTERACTIVE, request -> {
            throw new IOException("terminal gone");
        });

        assertThat(gateway.request(FeedbackKind.VALIDATION, "ok?", null, null, null, Duration.ofSeconds(5)))
            .isEqualTo("accept");
        assertThat(gateway.history().get(0).getResolution()).contains(FeedbackResolution.RESPONDER_ERROR);
        assertThat(registry.get("todoflow.feedback.requests")
            .tag("kind", "validation").tag("resolution", "error").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Input is re-prompted while rejected and the first accepted answer wins")
    void requestInput_repromptsUntilAccepted() {
        ScriptedFeedbackResponder responder = ScriptedFeedbackResponder.of("", "abc", "42", "7");
        gateway = gateway(INTERACTIVE, responder);

        String answer = gateway.requestInput("Pick a number", Map.of(), s -> s.matches("\\d+"));

        assertThat(answer).isEqualTo("42");
        assertThat(responder.received()).extracting(FeedbackRequest::getMessage).containsExactly(
            "Pick a number", "Invalid input. Pick a number", "Invalid input. Pick a number");
        assertThat(responder.received()).allSatisfy(r -> {
            assertThat(r.getKind()).isEqualTo(FeedbackKind.INPUT);
            assertThat(r.getTimeout()).contains(Duration.ofSeconds(60));
        });
    }

    @Test
    @DisplayName("Input rejected on every attempt surfaces as exhausted")
    void requestInput_exhausted() {
        gateway = gateway(OrchestrationConfig.builder().interactive(true).maxInputAttempts(2).build(),
            ScriptedFeedbackResponder.of("x", "y", "z"));

        assertThatThrownBy(() -> gateway.requestInput("Number?", Map.of(), s -> s.matches("\\d+")))
            .isInstanceOfSatisfying(ValidationExhaustedException.class, e -> {
                assertThat(e.getAttempts()).isEqualTo(2);
                assertThat(e.getLastResponse()).isEqualTo("y");
            });
        assertThat(gateway.history()).hasSize(2);
    }

    @Test
    @DisplayName("Error handling offers one token per suggestion")
    void requestErrorHandling_suggestionTokens() {
        ScriptedFeedbackResponder responder = ScriptedFeedbackResponder.of("suggestion_2");
        gateway = gateway(INTERACTIVE, responder);

        RecoveryDecision decision = gateway.requestErrorHandling(todo("Fetch data"), "Timeout", List.of("Retry", "Split"));

        assertThat(decision).isEqualTo(RecoveryDecision.suggestion(1));
        assertThat(responder.received().get(0).getOptions()).containsExactly(
            "retry", "skip", "modify_todo", "break_down", "suggestion_1", "suggestion_2");
        assertThat(responder.received().get(0).getDefaultResponse()).contains("retry");
        assertThat(decision.action()).isEqualTo(RecoveryAction.USE_SUGGESTION);
    }

    @Test
    @DisplayName("Summary aggregates history")
    void summary_aggregates() {
        gateway = gateway(NON_INTERACTIVE, request -> "");
        gateway.request(FeedbackKind.APPROVAL, "x".repeat(150), null, null, null, null);
        gateway.request(FeedbackKind.APPROVAL, "short", null, null, null, null);
        gateway.request(FeedbackKind.GUIDANCE, "plan", null, null, null, null);

        FeedbackSummary summary = gateway.summary(2);

        assertThat(summary.totalRequests()).isEqualTo(3);
        assertThat(summary.byKind()).containsEntry(FeedbackKind.APPROVAL, 2).containsEntry(FeedbackKind.GUIDANCE, 1);
        assertThat(summary.interactive()).isFalse();
        assertThat(summary.recentRequests()).extracting(FeedbackSummary.RecentRequest::message)
            .containsExactly("short", "plan");
        assertThat(gateway.summary(5).recentRequests().get(0).message()).hasSize(103).endsWith("...");
    }

    private FeedbackGateway gateway(OrchestrationConfig config, FeedbackResponder responder) {
        return new FeedbackGateway(config, responder, new TodoflowMetrics(registry), Clock.systemUTC());
    }

    private static FeedbackResponder slowResponder(Duration delay) {
        return request -> {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "yes";
        };
    }

    private static Todo todo(String content) {
        return Todo.create("t-" + content.hashCode(), content, 1, Set.of(), 1, Map.of(), null, Instant.now());
    }
}
