package com.todoflow.examples;

import com.todoflow.advisory.ChatModelReasoningProvider;
import com.todoflow.advisory.ReasoningProvider;
import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.FeedbackKind;
import com.todoflow.core.model.LoopResult;
import com.todoflow.core.model.OrchestrationConfig;
import com.todoflow.core.model.Session;
import com.todoflow.engine.coordinator.SessionCoordinator;
import com.todoflow.engine.coordinator.SessionSnapshot;
import com.todoflow.engine.feedback.FeedbackResponder;
import com.todoflow.engine.feedback.ScriptedFeedbackResponder;
import com.todoflow.engine.metrics.TodoflowMetrics;
import com.todoflow.worker.DefaultExecutionRouter;
import com.todoflow.worker.KeywordTodoClassifier;
import com.todoflow.worker.strategy.MathExecutionStrategy;
import com.todoflow.worker.strategy.SimulatedExecutionStrategy;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Demonstration runner for todo orchestration, without Spring.
 *
 * Shows:
 * 1. Non-interactive run on a fallback plan
 * 2. Failure recovery by breaking a todo down
 * 3. Plan guidance: adding a todo, pausing and continuing
 * 4. Responder timeouts falling back to defaults
 */
public class TodoflowDemo {

    private static final Logger log = LoggerFactory.getLogger(TodoflowDemo.class);

    private static final String CANNED_REASONING = """
        Step 1: Collect inputs
        Action: Gather the quarterly sales figures
        Step 2: Produce the report
        Action: Generate the report even where the legacy export fails
        """;

    private final TodoflowMetrics metrics = TodoflowMetrics.standalone();

    public static void main(String[] args) {
        TodoflowDemo demo = new TodoflowDemo();

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║              TODOFLOW - ORCHESTRATION DEMONSTRATION                  ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");

        demo.runScenario1_NonInteractive();
        demo.runScenario2_BreakDownOnFailure();
        demo.runScenario3_PlanGuidance();
        demo.runScenario4_ResponderTimeout();

        log.info("");
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    /**
     * SCENARIO 1: every gate answered from defaults.
     */
    public void runScenario1_NonInteractive() {
        banner("SCENARIO 1: Non-interactive Run on a Fallback Plan");

        SessionCoordinator coordinator = coordinator(
            ReasoningProvider.unavailable(), ScriptedFeedbackResponder.of(), OrchestrationConfig.defaults());
        SessionSnapshot snapshot = coordinator.process("Calculate 12 * 7 + 3");

        report(snapshot);
        log.info("✓ SCENARIO 1 COMPLETE: {} todos completed", snapshot.statistics().completed());
    }

    /**
     * SCENARIO 2: a failing todo is replaced by subtasks supplied by the responder.
     */
    public void runScenario2_BreakDownOnFailure() {
        banner("SCENARIO 2: Failure Recovery by Break Down");

        OrchestrationConfig config = OrchestrationConfig.builder()
            .interactive(true)
            .guidanceBeforeStart(false)
            .guidanceInterval(0)
            .requireApproval(false)
            .validateResults(false)
            .build();

        FeedbackResponder responder = new ScriptedFeedbackResponder(request -> switch (request.getKind()) {
            case CHOICE -> "break_down";
            case INPUT -> "Export the summary table\nRender the report as PDF";
            default -> "";
        });

        SessionCoordinator coordinator = coordinator(
            new ChatModelReasoningProvider(cannedChatModel(CANNED_REASONING)), responder, config);
        SessionSnapshot snapshot = coordinator.process("Prepare the quarterly sales report");

        report(snapshot);
        log.info("✓ SCENARIO 2 COMPLETE: failed todo broken down, {} subtasks completed",
            snapshot.statistics().completed() - 1);
    }

    /**
     * SCENARIO 3: the first guidance gate adds a todo, the second pauses the run.
     */
    public void runScenario3_PlanGuidance() {
        banner("SCENARIO 3: Plan Guidance, Pause and Continue");

        OrchestrationConfig config = OrchestrationConfig.builder()
            .interactive(true)
            .guidanceInterval(2)
            .build();

        AtomicInteger guidanceRequests = new AtomicInteger();
        FeedbackResponder responder = new ScriptedFeedbackResponder(request -> {
            if (request.getKind() == FeedbackKind.GUIDANCE) {
                return switch (guidanceRequests.incrementAndGet()) {
                    case 1 -> "add_todo";
                    case 2 -> "pause";
                    default -> "continue";
                };
            }
            return request.getKind() == FeedbackKind.INPUT ? "Send calendar invites" : "";
        });

        SessionCoordinator coordinator = coordinator(ReasoningProvider.unavailable(), responder, config);
        Session session = coordinator.startSession("Plan a team offsite");

        LoopResult first = coordinator.run(session.sessionId());
        log.info("First run stopped after {} iterations: {}", first.iterations(), first.terminationReason());

        LoopResult second = coordinator.continueSession(session.sessionId());
        log.info("Continued run stopped after {} iterations: {}", second.iterations(), second.terminationReason());

        report(coordinator.snapshot(session.sessionId()));
        log.info("✓ SCENARIO 3 COMPLETE: plan edited and resumed");
    }

    /**
     * SCENARIO 4: a responder slower than the gate timeout never blocks the loop.
     */
    public void runScenario4_ResponderTimeout() {
        banner("SCENARIO 4: Responder Timeouts");

        OrchestrationConfig config = OrchestrationConfig.builder()
            .interactive(true)
            .defaultTimeout(Duration.ofMillis(200))
            .build();

        FeedbackResponder slowResponder = request -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "no";
        };

        SessionCoordinator coordinator = coordinator(ReasoningProvider.unavailable(), slowResponder, config);
        SessionSnapshot snapshot = coordinator.process("2 + 2");

        report(snapshot);
        log.info("✓ SCENARIO 4 COMPLETE: {} of {} requests timed out",
            snapshot.feedbackSummary().timedOut(), snapshot.feedbackSummary().totalRequests());
    }

    // Helper methods

    private SessionCoordinator coordinator(
            ReasoningProvider reasoning,
            FeedbackResponder responder,
            OrchestrationConfig config) {
        DefaultExecutionRouter router =
            new DefaultExecutionRouter(new KeywordTodoClassifier(), new SimulatedExecutionStrategy())
                .register(ExecutionKind.MATH, new MathExecutionStrategy());
        return new SessionCoordinator(router, reasoning, responder, config, metrics, Clock.systemUTC());
    }

    // Stands in for an OpenAI model so the demo runs offline
    private static ChatModel cannedChatModel(String answer) {
        return new ChatModel() {
            @Override
            public ChatResponse chat(List<ChatMessage> messages) {
                return ChatResponse.builder().aiMessage(AiMessage.from(answer)).build();
            }
        };
    }

    private static void report(SessionSnapshot snapshot) {
        log.info("");
        log.info("Session {} ({} plan) is {}", snapshot.sessionId(), snapshot.planSource(), snapshot.state());
        snapshot.todos().forEach(todo ->
            log.info("  [{}] p{} {}", todo.status(), todo.priority(), todo.content()));
        log.info("Feedback requests: {} by kind {}",
            snapshot.feedbackSummary().totalRequests(), snapshot.feedbackSummary().byKind());
        log.info("");
    }

    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }
}
