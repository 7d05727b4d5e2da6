package com.todoflow.engine.coordinator;

import com.todoflow.core.exception.ValidationExhaustedException;
import com.todoflow.core.model.GuidanceAction;
import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatus;
import com.todoflow.engine.feedback.FeedbackGateway;
import com.todoflow.engine.scheduler.ReadySetScheduler;
import com.todoflow.engine.store.TodoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies plan-guidance answers to the todo store.
 *
 * Todos are addressed by their 1-based position in the plan (creation order) or by id.
 */
public class PlanEditor {

    private static final Logger log = LoggerFactory.getLogger(PlanEditor.class);

    public static final String SOURCE = "source";
    public static final String SOURCE_USER = "user";
    static final String SKIPPED_BY_USER = "Skipped by user";

    private final TodoStore store;
    private final ReadySetScheduler scheduler;
    private final FeedbackGateway gateway;

    public PlanEditor(TodoStore store, ReadySetScheduler scheduler, FeedbackGateway gateway) {
        this.store = store;
        this.scheduler = scheduler;
        this.gateway = gateway;
    }

    /**
     * Ask for guidance and apply it.
     *
     * @return The action taken; PAUSE means the loop must stop
     */
    public GuidanceAction guide() {
        String currentId = scheduler.next().map(Todo::id).orElse(null);
        GuidanceAction action = gateway.requestPlanGuidance(store.all(), currentId);
        apply(action);
        if (action.editsPlan()) {
            log.debug("Plan after {}: {} todos, {} ready", action, store.size(), scheduler.readySet().size());
        }
        return action;
    }

    void apply(GuidanceAction action) {
        try {
            switch (action) {
                case SKIP_CURRENT -> skipCurrent();
                case ADD_TODO -> addTodo();
                case REMOVE_TODO -> removeTodo();
                case REORDER -> reorder();
                case CONTINUE, PAUSE -> {
                    // nothing to edit
                }
            }
        } catch (ValidationExhaustedException e) {
            log.warn("Plan edit {} abandoned: {}", action, e.getMessage());
        }
    }

    private void skipCurrent() {
        scheduler.next().ifPresent(todo -> {
            store.setStatus(todo.id(), TodoStatus.FAILED);
            store.addFeedback(todo.id(), SKIPPED_BY_USER);
            log.info("Todo {} skipped by user", todo.id());
        });
    }

    private void addTodo() {
        String content = gateway.requestInput(
            "Enter the content of the new todo",
            Map.of("todo_count", store.size()),
            response -> !response.isBlank());

        int lowestPriority = store.all().stream().mapToInt(Todo::priority).max().orElse(0) + 1;
        Todo created = store.create(content.strip(), lowestPriority, List.of(), Map.of(SOURCE, SOURCE_USER), null);
        log.info("User added todo {} at priority {}", created.id(), lowestPriority);
    }

    private void removeTodo() {
        String reference = gateway.requestInput(
            "Enter the plan number or id of the todo to remove",
            Map.of("todo_count", store.size()),
            response -> resolve(response).isPresent());

        resolve(reference).ifPresent(todo -> store.remove(todo.id()));
    }

    private void reorder() {
        String answer = gateway.requestInput(
            "Enter '<plan number> <new priority>'",
            Map.of("todo_count", store.size()),
            response -> parseReorder(response).isPresent());

        parseReorder(answer).ifPresent(reorder -> {
            store.updatePriority(reorder.todo().id(), reorder.priority());
            log.info("Todo {} moved to priority {}", reorder.todo().id(), reorder.priority());
        });
    }

    /**
     * Resolve a plan number or todo id against the current plan.
     */
    Optional<Todo> resolve(String reference) {
        String ref = reference == null ? "" : reference.strip();
        if (ref.isEmpty()) {
            return Optional.empty();
        }
        List<Todo> plan = store.all();
        try {
            int number = Integer.parseInt(ref);
            return number >= 1 && number <= plan.size() ? Optional.of(plan.get(number - 1)) : Optional.empty();
        } catch (NumberFormatException e) {
            return store.find(ref);
        }
    }

    private Optional<Reorder> parseReorder(String answer) {
        String[] parts = answer.strip().split("\\s+");
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            int priority = Integer.parseInt(parts[1]);
            if (priority < 1) {
                return Optional.empty();
            }
            return resolve(parts[0]).map(todo -> new Reorder(todo, priority));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private record Reorder(Todo todo, int priority) {}
}
