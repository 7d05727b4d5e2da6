package com.todoflow.engine.recovery;

import com.todoflow.core.exception.ValidationExhaustedException;
import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.FeedbackEntryType;
import com.todoflow.core.model.RecoveryAction;
import com.todoflow.core.model.RecoveryDecision;
import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatus;
import com.todoflow.engine.feedback.FeedbackGateway;
import com.todoflow.engine.metrics.TodoflowMetrics;
import com.todoflow.engine.store.TodoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a failed execution plus the responder's choice into exactly one store mutation.
 *
 * Only a todo that is currently FAILED is acted on, and a todo is broken down at most once,
 * so replaying recovery for the same id does not stack outcomes.
 */
public class FailureRecoveryPlanner {

    private static final Logger log = LoggerFactory.getLogger(FailureRecoveryPlanner.class);

    public static final String PARENT_TODO_ID = "parent_todo_id";
    public static final String SOURCE = "source";
    public static final String BROKEN_DOWN_INTO = "broken_down_into";
    public static final String SOURCE_BREAK_DOWN = "break_down";

    private final TodoStore store;
    private final FeedbackGateway gateway;
    private final RemediationSuggester suggester;
    private final TodoflowMetrics metrics;

    public FailureRecoveryPlanner(
            TodoStore store,
            FeedbackGateway gateway,
            RemediationSuggester suggester,
            TodoflowMetrics metrics) {
        this.store = store;
        this.gateway = gateway;
        this.suggester = suggester;
        this.metrics = metrics;
    }

    /**
     * Handle a failed execution of the given todo.
     */
    public RecoveryOutcome recover(String todoId, ExecutionResult result) {
        Todo todo = store.get(todoId);
        if (todo.status() != TodoStatus.FAILED) {
            log.debug("Todo {} is {}, nothing to recover", todoId, todo.status());
            return RecoveryOutcome.notApplied(todoId, null, "Todo is not failed");
        }

        List<RemediationSuggestion> suggestions = suggester.suggest(todo, result);
        List<String> texts = suggestions.stream()
            .map(RemediationSuggestion::text)
            .collect(Collectors.toList());

        String feedback = result.feedback().isBlank() ? result.error() : result.feedback();
        store.createFeedbackEntry(todoId, FeedbackEntryType.ERROR, feedback, texts);
        store.addFeedback(todoId, feedback);

        RecoveryDecision decision = gateway.requestErrorHandling(todo, result.error(), texts);
        RecoveryAction action = decision.action() == RecoveryAction.USE_SUGGESTION
            ? suggestions.get(decision.suggestionIndex()).action()
            : decision.action();

        log.info("Recovering todo {} with {} (decision {})", todoId, action, decision.action());
        RecoveryOutcome outcome = apply(todo, decision, action, result);
        if (outcome.wasApplied()) {
            metrics.recoveryApplied(outcome.applied());
        }
        return outcome;
    }

    private RecoveryOutcome apply(Todo todo, RecoveryDecision decision, RecoveryAction action, ExecutionResult result) {
        return switch (action) {
            case RETRY -> retry(todo, decision);
            case MODIFY -> modify(todo, decision);
            case BREAK_DOWN -> breakDown(todo, decision);
            case SKIP, USE_SUGGESTION -> skip(todo, decision, result);
        };
    }

    private RecoveryOutcome retry(Todo todo, RecoveryDecision decision) {
        store.setStatus(todo.id(), TodoStatus.PENDING);
        return new RecoveryOutcome(todo.id(), decision, RecoveryAction.RETRY, List.of(), "Reset to pending");
    }

    private RecoveryOutcome skip(Todo todo, RecoveryDecision decision, ExecutionResult result) {
        String note = "Skipped after failure: " + result.error();
        store.addFeedback(todo.id(), note);
        return new RecoveryOutcome(todo.id(), decision, RecoveryAction.SKIP, List.of(), note);
    }

    private RecoveryOutcome modify(Todo todo, RecoveryDecision decision) {
        String content;
        try {
            content = gateway.requestInput(
                "Enter new content for todo: '" + todo.content() + "'",
                Map.of("todo_id", todo.id(), "current_content", todo.content()),
                response -> !response.isBlank());
        } catch (ValidationExhaustedException e) {
            return inputExhausted(todo, decision, e);
        }

        store.updateContent(todo.id(), content.strip());
        store.setStatus(todo.id(), TodoStatus.PENDING);
        return new RecoveryOutcome(todo.id(), decision, RecoveryAction.MODIFY, List.of(),
            "Content replaced and reset to pending");
    }

    private RecoveryOutcome breakDown(Todo todo, RecoveryDecision decision) {
        if (todo.metadata().containsKey(BROKEN_DOWN_INTO)) {
            return RecoveryOutcome.notApplied(todo.id(), decision, "Already broken down");
        }

        String answer;
        try {
            answer = gateway.requestInput(
                "Enter subtasks for '" + todo.content() + "', one per line",
                Map.of("todo_id", todo.id(), "current_content", todo.content()),
                response -> !subtaskLines(response).isEmpty());
        } catch (ValidationExhaustedException e) {
            return inputExhausted(todo, decision, e);
        }

        List<Todo> created = new ArrayList<>();
        for (String line : subtaskLines(answer)) {
            created.add(store.create(
                line,
                todo.priority(),
                List.of(),
                Map.of(PARENT_TODO_ID, todo.id(), SOURCE, SOURCE_BREAK_DOWN),
                "Split from failed todo: " + todo.content()));
        }
        store.putMetadata(todo.id(), BROKEN_DOWN_INTO,
            created.stream().map(Todo::id).collect(Collectors.joining(",")));

        log.info("Todo {} broken down into {} subtasks", todo.id(), created.size());
        return new RecoveryOutcome(todo.id(), decision, RecoveryAction.BREAK_DOWN, created,
            "Created " + created.size() + " subtasks");
    }

    private RecoveryOutcome inputExhausted(Todo todo, RecoveryDecision decision, ValidationExhaustedException e) {
        String note = "No usable input after " + e.getAttempts() + " attempts; todo left failed";
        log.warn("Recovery of todo {} abandoned: {}", todo.id(), e.getMessage());
        store.addFeedback(todo.id(), note);
        return RecoveryOutcome.notApplied(todo.id(), decision, note);
    }

    private static List<String> subtaskLines(String text) {
        return Arrays.stream(text.split("\n"))
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
    }
}
