package com.todoflow.engine.coordinator;

import com.todoflow.core.exception.ValidationExhaustedException;
import com.todoflow.core.model.ApprovalDecision;
import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.ExecutionRecord;
import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.GuidanceAction;
import com.todoflow.core.model.LoopResult;
import com.todoflow.core.model.OrchestrationConfig;
import com.todoflow.core.model.TerminationReason;
import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatus;
import com.todoflow.core.model.ValidationDecision;
import com.todoflow.engine.feedback.FeedbackGateway;
import com.todoflow.engine.history.ExecutionHistory;
import com.todoflow.engine.logging.LoggingContext;
import com.todoflow.engine.metrics.TodoflowMetrics;
import com.todoflow.engine.recovery.FailureRecoveryPlanner;
import com.todoflow.engine.scheduler.ReadySetScheduler;
import com.todoflow.engine.store.TodoStore;
import com.todoflow.worker.DefaultExecutionRouter;
import com.todoflow.worker.ExecutionRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bounded iteration state machine over one session's todos.
 *
 * Each iteration: select the next ready todo, ask for approval, execute it,
 * validate a successful result, and hand a failure to the recovery planner.
 * Plan guidance is requested before iterations according to the configured cadence.
 *
 * Terminates with ALL_DONE (nothing ready or in progress), BUDGET_EXHAUSTED
 * (max iterations reached with work left) or USER_PAUSED.
 */
public class OrchestrationLoop {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoop.class);

    static final String RESULT_REJECTED = "Result rejected by user";

    private final UUID sessionId;
    private final TodoStore store;
    private final ReadySetScheduler scheduler;
    private final FeedbackGateway gateway;
    private final ExecutionRouter router;
    private final FailureRecoveryPlanner recoveryPlanner;
    private final PlanEditor planEditor;
    private final ExecutionHistory history;
    private final OrchestrationConfig config;
    private final TodoflowMetrics metrics;
    private final Clock clock;

    // Iterations across all runs of this session; history entries are numbered with it
    private int totalIterations;

    public OrchestrationLoop(
            UUID sessionId,
            TodoStore store,
            ReadySetScheduler scheduler,
            FeedbackGateway gateway,
            ExecutionRouter router,
            FailureRecoveryPlanner recoveryPlanner,
            PlanEditor planEditor,
            ExecutionHistory history,
            OrchestrationConfig config,
            TodoflowMetrics metrics,
            Clock clock) {
        this.sessionId = sessionId;
        this.store = store;
        this.scheduler = scheduler;
        this.gateway = gateway;
        this.router = router;
        this.recoveryPlanner = recoveryPlanner;
        this.planEditor = planEditor;
        this.history = history;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run until a terminal state, with a fresh iteration budget.
     */
    public LoopResult run() {
        try (LoggingContext ignored = LoggingContext.forSession(sessionId)) {
            int iteration = 0;
            TerminationReason reason = null;

            while (iteration < config.maxIterations()) {
                if (config.guidanceDueBefore(iteration + 1) && planEditor.guide() == GuidanceAction.PAUSE) {
                    log.info("Paused by plan guidance before iteration {}", iteration + 1);
                    reason = TerminationReason.USER_PAUSED;
                    break;
                }

                Optional<Todo> next = scheduler.next();
                if (next.isEmpty()) {
                    reason = TerminationReason.ALL_DONE;
                    break;
                }

                iteration++;
                totalIterations++;
                if (!runIteration(next.get(), totalIterations)) {
                    reason = TerminationReason.USER_PAUSED;
                    break;
                }
            }

            if (reason == null) {
                reason = scheduler.hasOutstandingWork()
                    ? TerminationReason.BUDGET_EXHAUSTED
                    : TerminationReason.ALL_DONE;
            }

            LoopResult result = LoopResult.of(iteration, store.statistics(), reason, gateway.summary());
            metrics.loopTerminated(reason);
            log.info("Loop finished after {} iterations: {} ({})", iteration, reason, result.statistics());
            return result;
        }
    }

    /**
     * @return false when the loop must pause
     */
    private boolean runIteration(Todo selected, int iterationNumber) {
        try (LoggingContext ignored = LoggingContext.forIteration(sessionId, selected.id(), iterationNumber)) {
            Todo todo = selected;

            if (config.requireApproval()) {
                ExecutionKind kind = router.classify(todo);
                ApprovalDecision approval = gateway.requestApproval(todo, kind);
                switch (approval) {
                    case NO -> {
                        log.info("Execution of todo {} not approved, pausing", todo.id());
                        return false;
                    }
                    case SKIP -> {
                        store.setStatus(todo.id(), TodoStatus.FAILED);
                        store.addFeedback(todo.id(), PlanEditor.SKIPPED_BY_USER);
                        metrics.todoFailed();
                        log.info("Todo {} skipped at approval", todo.id());
                        return true;
                    }
                    case MODIFY -> todo = askForNewContent(todo);
                    case YES -> {
                        // proceed
                    }
                }
            }

            log.info("Executing todo: {}", todo.content());
            store.setStatus(todo.id(), TodoStatus.IN_PROGRESS);
            ExecutionResult result = execute(todo);
            metrics.executionRecorded(result.kind(), result.success(), result.duration());

            if (result.success()) {
                ValidationDecision validation = config.validateResults()
                    ? gateway.requestValidation(todo, result)
                    : ValidationDecision.ACCEPT;
                history.record(new ExecutionRecord(
                    iterationNumber, todo.id(), todo.content(), result, validation, clock.instant()));
                applyValidation(todo, result, validation);
            } else {
                store.setStatus(todo.id(), TodoStatus.FAILED);
                metrics.todoFailed();
                log.info("Todo {} failed: {}", todo.id(), result.error());
                history.record(new ExecutionRecord(
                    iterationNumber, todo.id(), todo.content(), result, null, clock.instant()));
                recoveryPlanner.recover(todo.id(), result);
            }
            return true;
        }
    }

    private ExecutionResult execute(Todo todo) {
        try {
            return router.execute(todo);
        } catch (RuntimeException e) {
            log.warn("Execution router threw for todo {}", todo.id(), e);
            return ExecutionResult.failed(ExecutionKind.GENERIC, DefaultExecutionRouter.UNEXPECTED_ERROR,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), "", Duration.ZERO);
        }
    }

    private void applyValidation(Todo todo, ExecutionResult result, ValidationDecision validation) {
        switch (validation) {
            case ACCEPT -> {
                store.setStatus(todo.id(), TodoStatus.COMPLETED);
                if (!result.feedback().isBlank()) {
                    store.addFeedback(todo.id(), result.feedback());
                }
                metrics.todoCompleted();
                log.info("Todo {} completed", todo.id());
            }
            case RETRY -> store.setStatus(todo.id(), TodoStatus.PENDING);
            case MODIFY -> {
                askForNewContent(todo);
                store.setStatus(todo.id(), TodoStatus.PENDING);
            }
            case SKIP -> {
                store.setStatus(todo.id(), TodoStatus.FAILED);
                store.addFeedback(todo.id(), RESULT_REJECTED);
                metrics.todoFailed();
            }
        }
    }

    /**
     * Replace the content of a todo with the responder's input; keep it unchanged if none is usable.
     */
    private Todo askForNewContent(Todo todo) {
        try {
            String content = gateway.requestInput(
                "Enter new content for todo: '" + todo.content() + "'",
                Map.of("todo_id", todo.id(), "current_content", todo.content()),
                response -> !response.isBlank());
            return store.updateContent(todo.id(), content.strip());
        } catch (ValidationExhaustedException e) {
            log.warn("Keeping content of todo {}: {}", todo.id(), e.getMessage());
            return todo;
        }
    }
}
