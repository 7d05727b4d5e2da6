package com.todoflow.engine.coordinator;

import com.todoflow.advisory.InitialPlan;
import com.todoflow.advisory.InitialPlanner;
import com.todoflow.advisory.PlanDraft;
import com.todoflow.advisory.ReasoningProvider;
import com.todoflow.core.exception.InvalidStateTransitionException;
import com.todoflow.core.exception.NotFoundException;
import com.todoflow.core.model.FeedbackEntry;
import com.todoflow.core.model.FeedbackEntryType;
import com.todoflow.core.model.LoopResult;
import com.todoflow.core.model.OrchestrationConfig;
import com.todoflow.core.model.Session;
import com.todoflow.core.model.SessionState;
import com.todoflow.core.model.Todo;
import com.todoflow.engine.feedback.FeedbackGateway;
import com.todoflow.engine.feedback.FeedbackResponder;
import com.todoflow.engine.history.ExecutionHistory;
import com.todoflow.engine.logging.LoggingContext;
import com.todoflow.engine.metrics.TodoflowMetrics;
import com.todoflow.engine.persistence.InMemoryFeedbackEntryRepository;
import com.todoflow.engine.persistence.InMemoryTodoRepository;
import com.todoflow.engine.recovery.FailureRecoveryPlanner;
import com.todoflow.engine.recovery.RemediationSuggester;
import com.todoflow.engine.recovery.RuleBasedRemediationSuggester;
import com.todoflow.engine.scheduler.ReadySetScheduler;
import com.todoflow.engine.store.TodoStore;
import com.todoflow.worker.ExecutionRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for query processing.
 * 
 * Creates one isolated session per query (its own todo store, gateway and loop),
 * plans the initial todos and runs or resumes the orchestration loop.
 */
public class SessionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private final ExecutionRouter router;
    private final InitialPlanner planner;
    private final FeedbackResponder responder;
    private final RemediationSuggester suggester;
    private final OrchestrationConfig config;
    private final TodoflowMetrics metrics;
    private final Clock clock;
    private final Map<UUID, SessionRuntime> sessions = new ConcurrentHashMap<>();

    public SessionCoordinator(
            ExecutionRouter router,
            ReasoningProvider reasoningProvider,
            FeedbackResponder responder,
            OrchestrationConfig config,
            TodoflowMetrics metrics,
            Clock clock) {
        this(router, new InitialPlanner(reasoningProvider), responder,
            new RuleBasedRemediationSuggester(), config, metrics, clock);
    }

    public SessionCoordinator(
            ExecutionRouter router,
            InitialPlanner planner,
            FeedbackResponder responder,
            RemediationSuggester suggester,
            OrchestrationConfig config,
            TodoflowMetrics metrics,
            Clock clock) {
        this.router = router;
        this.planner = planner;
        this.responder = responder;
        this.suggester = suggester;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Plan a query into a new session without running it.
     */
    public Session startSession(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        InitialPlan plan = planner.plan(query, config.thinkingDepth());
        Session session = new Session(UUID.randomUUID(), query, plan.steps(), plan.source(), clock.instant());
        SessionRuntime runtime = new SessionRuntime(session);

        try (LoggingContext ignored = LoggingContext.forSession(session.sessionId())) {
            String previous = null;
            List<PlanDraft> drafts = plan.drafts();
            for (int i = 0; i < drafts.size(); i++) {
                PlanDraft draft = drafts.get(i);
                List<String> deps = previous == null ? List.of() : List.of(previous);
                Todo todo = runtime.store.create(draft.content(), i + 1, deps, draft.metadata(), draft.reasoning());
                previous = todo.id();
            }
            log.info("Session started for query '{}' with {} todos ({})", query, drafts.size(), plan.source());
        }

        sessions.put(session.sessionId(), runtime);
        return session;
    }

    /**
     * Run the loop of a session that has not run yet.
     */
    public LoopResult run(UUID sessionId) {
        return execute(require(sessionId), EnumSet.of(SessionState.CREATED));
    }

    /**
     * Resume a paused or exhausted session with a fresh iteration budget.
     */
    public LoopResult continueSession(UUID sessionId) {
        return execute(require(sessionId), EnumSet.of(SessionState.PAUSED, SessionState.EXHAUSTED));
    }

    /**
     * Start a session for the query and run it to a terminal state.
     */
    public SessionSnapshot process(String query) {
        Session session = startSession(query);
        run(session.sessionId());
        return snapshot(session.sessionId());
    }

    public Session getSession(UUID sessionId) {
        return require(sessionId).session;
    }

    public SessionState state(UUID sessionId) {
        return require(sessionId).state;
    }

    public List<Session> sessions() {
        return sessions.values().stream()
            .map(r -> r.session)
            .sorted(Comparator.comparing(Session::createdAt))
            .toList();
    }

    public SessionSnapshot snapshot(UUID sessionId) {
        SessionRuntime runtime = require(sessionId);
        synchronized (runtime) {
            Session session = runtime.session;
            return new SessionSnapshot(
                session.sessionId(),
                session.query(),
                runtime.state,
                session.planSource(),
                session.createdAt(),
                session.steps(),
                runtime.store.all(),
                runtime.store.statistics(),
                runtime.store.allFeedbackEntries(),
                runtime.history.entries(),
                runtime.gateway.summary(),
                runtime.lastResult
            );
        }
    }

    /**
     * Ledger entries recorded for one todo of a session.
     */
    public List<FeedbackEntry> feedbackFor(UUID sessionId, String todoId) {
        TodoStore store = require(sessionId).store;
        store.get(todoId);
        return store.feedbackFor(todoId);
    }

    /**
     * Attach operator feedback to a todo outside of any gate.
     */
    public FeedbackEntry addManualFeedback(UUID sessionId, String todoId, String feedback) {
        TodoStore store = require(sessionId).store;
        FeedbackEntry entry = store.createFeedbackEntry(todoId, FeedbackEntryType.IMPROVEMENT, feedback, List.of());
        store.addFeedback(todoId, feedback);
        log.info("Manual feedback added to todo {} of session {}", todoId, sessionId);
        return entry;
    }

    /**
     * Drop a session and release its resources.
     *
     * @throws InvalidStateTransitionException if the session is running
     */
    public void discard(UUID sessionId) {
        SessionRuntime runtime = require(sessionId);
        synchronized (runtime) {
            if (runtime.state == SessionState.RUNNING) {
                throw new InvalidStateTransitionException("Session", runtime.state.name(), "DISCARDED");
            }
            sessions.remove(sessionId);
            runtime.gateway.close();
        }
        log.info("Session {} discarded", sessionId);
    }

    private LoopResult execute(SessionRuntime runtime, Set<SessionState> allowedFrom) {
        synchronized (runtime) {
            if (!allowedFrom.contains(runtime.state)) {
                throw new InvalidStateTransitionException("Session", runtime.state.name(), SessionState.RUNNING.name());
            }
            runtime.state = SessionState.RUNNING;
        }

        LoopResult result;
        try {
            result = runtime.loop.run();
        } catch (RuntimeException e) {
            synchronized (runtime) {
                runtime.state = SessionState.PAUSED;
            }
            throw e;
        }

        synchronized (runtime) {
            runtime.lastResult = result;
            runtime.state = result.terminationReason().toSessionState();
        }
        return result;
    }

    private SessionRuntime require(UUID sessionId) {
        SessionRuntime runtime = sessions.get(sessionId);
        if (runtime == null) {
            throw new NotFoundException("Session", String.valueOf(sessionId));
        }
        return runtime;
    }

    /**
     * Everything owned by one session.
     */
    private final class SessionRuntime {
        final Session session;
        final TodoStore store;
        final FeedbackGateway gateway;
        final ExecutionHistory history;
        final OrchestrationLoop loop;
        SessionState state = SessionState.CREATED;
        LoopResult lastResult;

        SessionRuntime(Session session) {
            this.session = session;
            this.store = new TodoStore(new InMemoryTodoRepository(), new InMemoryFeedbackEntryRepository(), clock);
            this.gateway = new FeedbackGateway(config, responder, metrics, clock);
            this.history = new ExecutionHistory();

            ReadySetScheduler scheduler = new ReadySetScheduler(store);
            this.loop = new OrchestrationLoop(
                session.sessionId(),
                store,
                scheduler,
                gateway,
                router,
                new FailureRecoveryPlanner(store, gateway, suggester, metrics),
                new PlanEditor(store, scheduler, gateway),
                history,
                config,
                metrics,
                clock
            );
        }
    }
}
