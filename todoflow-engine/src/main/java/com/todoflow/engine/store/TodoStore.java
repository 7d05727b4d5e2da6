package com.todoflow.engine.store;

import com.todoflow.core.exception.DependencyException;
import com.todoflow.core.exception.NotFoundException;
import com.todoflow.core.model.FeedbackEntry;
import com.todoflow.core.model.FeedbackEntryType;
import com.todoflow.core.model.Todo;
import com.todoflow.core.model.TodoStatistics;
import com.todoflow.core.model.TodoStatus;
import com.todoflow.core.repository.FeedbackEntryRepository;
import com.todoflow.core.repository.TodoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Owns the todos of one session and their feedback ledger.
 * 
 * All access goes through todo ids; callers only ever see immutable snapshots.
 * Mutators are serialized on the store so status transitions for one id never interleave.
 */
public class TodoStore {

    private static final Logger log = LoggerFactory.getLogger(TodoStore.class);

    private final TodoRepository todoRepository;
    private final FeedbackEntryRepository feedbackRepository;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public TodoStore(TodoRepository todoRepository, FeedbackEntryRepository feedbackRepository, Clock clock) {
        this.todoRepository = todoRepository;
        this.feedbackRepository = feedbackRepository;
        this.clock = clock;
    }

    /**
     * Create a new PENDING todo with a fresh id.
     *
     * @throws DependencyException if a dependency id is unknown to the store
     */
    public synchronized Todo create(
            String content,
            int priority,
            Collection<String> dependencies,
            Map<String, String> metadata,
            String reasoning) {
        Set<String> deps = dependencies == null ? Set.of() : new LinkedHashSet<>(dependencies);
        List<String> unknown = deps.stream()
            .filter(id -> !todoRepository.exists(id))
            .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new DependencyException(unknown);
        }

        Todo todo = Todo.create(
            UUID.randomUUID().toString(),
            content,
            priority,
            deps,
            sequence.incrementAndGet(),
            metadata,
            reasoning,
            clock.instant()
        );
        todoRepository.save(todo);
        log.debug("Created todo {} (priority {}, {} dependencies)", todo.id(), priority, deps.size());
        return todo;
    }

    public Todo create(String content, int priority) {
        return create(content, priority, Set.of(), Map.of(), null);
    }

    public Optional<Todo> find(String todoId) {
        return todoRepository.findById(todoId);
    }

    public Todo get(String todoId) {
        return todoRepository.findById(todoId)
            .orElseThrow(() -> new NotFoundException("Todo", todoId));
    }

    /**
     * Move a todo to the given status. COMPLETED stamps completedAt; any other status clears it.
     */
    public synchronized Todo setStatus(String todoId, TodoStatus status) {
        Todo current = get(todoId);
        Todo updated = current.withStatus(status, clock.instant());
        todoRepository.save(updated);
        log.debug("Todo {} {} -> {}", todoId, current.status(), status);
        return updated;
    }

    public synchronized Todo addFeedback(String todoId, String feedback) {
        return replace(get(todoId).withFeedback(feedback, clock.instant()));
    }

    public synchronized Todo updateContent(String todoId, String content) {
        return replace(get(todoId).withContent(content, clock.instant()));
    }

    public synchronized Todo updatePriority(String todoId, int priority) {
        if (priority < 1) {
            throw new IllegalArgumentException("Priority must be >= 1, got " + priority);
        }
        return replace(get(todoId).withPriority(priority, clock.instant()));
    }

    public synchronized Todo putMetadata(String todoId, String key, String value) {
        return replace(get(todoId).withMetadata(key, value, clock.instant()));
    }

    /**
     * Remove a todo. Remaining todos that depended on it lose that dependency.
     *
     * @return The removed todo
     */
    public synchronized Todo remove(String todoId) {
        Todo removed = get(todoId);
        todoRepository.delete(todoId);

        for (Todo dependent : todoRepository.findAll()) {
            if (dependent.dependencies().contains(todoId)) {
                todoRepository.save(dependent.withoutDependency(todoId, clock.instant()));
            }
        }
        log.info("Removed todo {}", todoId);
        return removed;
    }

    /**
     * All todos in creation order.
     */
    public List<Todo> all() {
        return todoRepository.findAll();
    }

    public List<Todo> byStatus(TodoStatus status) {
        return todoRepository.findByStatus(status);
    }

    public List<Todo> inProgress() {
        return byStatus(TodoStatus.IN_PROGRESS);
    }

    public int size() {
        return todoRepository.findAll().size();
    }

    public TodoStatistics statistics() {
        List<Todo> todos = todoRepository.findAll();
        Map<TodoStatus, Long> counts = todos.stream()
            .collect(Collectors.groupingBy(Todo::status, () -> new EnumMap<>(TodoStatus.class), Collectors.counting()));
        return new TodoStatistics(
            todos.size(),
            counts.getOrDefault(TodoStatus.PENDING, 0L).intValue(),
            counts.getOrDefault(TodoStatus.IN_PROGRESS, 0L).intValue(),
            counts.getOrDefault(TodoStatus.COMPLETED, 0L).intValue(),
            counts.getOrDefault(TodoStatus.FAILED, 0L).intValue()
        );
    }

    // ========== Feedback ledger ==========

    public FeedbackEntry createFeedbackEntry(
            String todoId, FeedbackEntryType type, String message, List<String> suggestions) {
        get(todoId);
        FeedbackEntry entry = FeedbackEntry.create(todoId, type, message, suggestions, clock.instant());
        feedbackRepository.append(entry);
        return entry;
    }

    public List<FeedbackEntry> feedbackFor(String todoId) {
        return feedbackRepository.findByTodo(todoId);
    }

    public FeedbackEntry feedbackEntry(String entryId) {
        return feedbackRepository.findById(entryId)
            .orElseThrow(() -> new NotFoundException("FeedbackEntry", entryId));
    }

    public List<FeedbackEntry> allFeedbackEntries() {
        return feedbackRepository.findAll();
    }

    /**
     * Drop every todo and ledger entry.
     */
    public synchronized void clear() {
        todoRepository.deleteAll();
        feedbackRepository.deleteAll();
        log.info("Todo store cleared");
    }

    private Todo replace(Todo updated) {
        todoRepository.save(updated);
        return updated;
    }
}
