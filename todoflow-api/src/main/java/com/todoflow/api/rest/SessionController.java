package com.todoflow.api.rest;

import com.todoflow.core.model.ExecutionRecord;
import com.todoflow.core.model.FeedbackEntry;
import com.todoflow.core.model.FeedbackSummary;
import com.todoflow.core.model.LoopResult;
import com.todoflow.core.model.PlanSource;
import com.todoflow.core.model.Session;
import com.todoflow.core.model.SessionState;
import com.todoflow.core.model.Todo;
import com.todoflow.engine.coordinator.SessionCoordinator;
import com.todoflow.engine.coordinator.SessionSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for orchestration sessions.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private final SessionCoordinator coordinator;

    public SessionController(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Plan a query into a new session, and run it unless {@code run} is false.
     */
    @PostMapping
    public ResponseEntity<SessionSnapshot> createSession(@RequestBody CreateSessionRequest request) {
        Session session = coordinator.startSession(request.query());
        if (request.run() == null || request.run()) {
            coordinator.run(session.sessionId());
        }
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(coordinator.snapshot(session.sessionId()));
    }

    @GetMapping
    public ResponseEntity<List<SessionResponse>> listSessions() {
        List<SessionResponse> responses = coordinator.sessions().stream()
            .map(session -> SessionResponse.from(session, coordinator.state(session.sessionId())))
            .toList();
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSnapshot> getSession(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(coordinator.snapshot(sessionId));
    }

    @GetMapping("/{sessionId}/todos")
    public ResponseEntity<List<Todo>> getTodos(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(coordinator.snapshot(sessionId).todos());
    }

    @GetMapping("/{sessionId}/history")
    public ResponseEntity<List<ExecutionRecord>> getHistory(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(coordinator.snapshot(sessionId).executionHistory());
    }

    /**
     * Feedback request summary plus the full feedback ledger.
     */
    @GetMapping("/{sessionId}/feedback")
    public ResponseEntity<FeedbackResponse> getFeedback(@PathVariable UUID sessionId) {
        SessionSnapshot snapshot = coordinator.snapshot(sessionId);
        return ResponseEntity.ok(new FeedbackResponse(snapshot.feedbackSummary(), snapshot.feedbackEntries()));
    }

    /**
     * Run a session that was created with {@code run=false}.
     */
    @PostMapping("/{sessionId}/run")
    public ResponseEntity<RunResponse> runSession(@PathVariable UUID sessionId) {
        LoopResult result = coordinator.run(sessionId);
        return ResponseEntity.ok(RunResponse.from(coordinator.getSession(sessionId), coordinator.state(sessionId), result));
    }

    /**
     * Resume a paused or exhausted session with a fresh iteration budget.
     */
    @PostMapping("/{sessionId}/continue")
    public ResponseEntity<RunResponse> continueSession(@PathVariable UUID sessionId) {
        LoopResult result = coordinator.continueSession(sessionId);
        return ResponseEntity.ok(RunResponse.from(coordinator.getSession(sessionId), coordinator.state(sessionId), result));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> discardSession(@PathVariable UUID sessionId) {
        coordinator.discard(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/todos/{todoId}/feedback")
    public ResponseEntity<List<FeedbackEntry>> getTodoFeedback(
            @PathVariable UUID sessionId,
            @PathVariable String todoId) {
        return ResponseEntity.ok(coordinator.feedbackFor(sessionId, todoId));
    }

    @PostMapping("/{sessionId}/todos/{todoId}/feedback")
    public ResponseEntity<FeedbackEntry> addTodoFeedback(
            @PathVariable UUID sessionId,
            @PathVariable String todoId,
            @RequestBody ManualFeedbackRequest request) {
        FeedbackEntry entry = coordinator.addManualFeedback(sessionId, todoId, request.message());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    // ========== DTOs ==========

    public record CreateSessionRequest(String query, Boolean run) {}

    public record ManualFeedbackRequest(String message) {}

    public record FeedbackResponse(FeedbackSummary summary, List<FeedbackEntry> entries) {}

    public record SessionResponse(
        UUID sessionId,
        String query,
        SessionState state,
        PlanSource planSource,
        Instant createdAt
    ) {
        public static SessionResponse from(Session session, SessionState state) {
            return new SessionResponse(
                session.sessionId(),
                session.query(),
                state,
                session.planSource(),
                session.createdAt()
            );
        }
    }

    public record RunResponse(
        UUID sessionId,
        SessionState state,
        LoopResult result
    ) {
        public static RunResponse from(Session session, SessionState state, LoopResult result) {
            return new RunResponse(session.sessionId(), state, result);
        }
    }
}
