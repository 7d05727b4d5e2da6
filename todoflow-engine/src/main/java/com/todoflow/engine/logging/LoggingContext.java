package com.todoflow.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Each context removes only the keys it added, so contexts nest.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forIteration(sessionId, todoId, iteration)) {
 *     log.info("Executing todo"); // Includes sessionId, todoId, iteration
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String SESSION_ID = "sessionId";
    public static final String TODO_ID = "todoId";
    public static final String ITERATION = "iteration";
    public static final String FEEDBACK_KIND = "feedbackKind";

    private final List<String> keys = new ArrayList<>();

    private LoggingContext() {
        // Use static factory methods
    }

    public static LoggingContext forSession(UUID sessionId) {
        LoggingContext ctx = new LoggingContext();
        if (sessionId != null) {
            ctx.put(SESSION_ID, sessionId.toString());
        }
        return ctx;
    }

    public static LoggingContext forIteration(UUID sessionId, String todoId, int iteration) {
        LoggingContext ctx = forSession(sessionId);
        if (todoId != null) {
            ctx.put(TODO_ID, todoId);
        }
        ctx.put(ITERATION, String.valueOf(iteration));
        return ctx;
    }

    public static LoggingContext forFeedback(Enum<?> kind) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(FEEDBACK_KIND, kind.name());
        return ctx;
    }

    public static String getSessionId() {
        return MDC.get(SESSION_ID);
    }

    public static String getTodoId() {
        return MDC.get(TODO_ID);
    }

    private void put(String key, String value) {
        if (MDC.get(key) == null) {
            keys.add(key);
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
    }
}
