package com.todoflow.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A request for feedback and, once answered, its response.
 *
 * Invariants:
 * - response, respondedAt and resolution are set together, exactly once
 * - nothing changes after the response is recorded
 */
public final class FeedbackRequest {

    private final String requestId;
    private final FeedbackKind kind;
    private final String message;
    private final Map<String, Object> context;
    private final List<String> options;
    private final String defaultResponse;
    private final Duration timeout;
    private final Instant createdAt;

    private String response;
    private Instant respondedAt;
    private FeedbackResolution resolution;

    public FeedbackRequest(
            String requestId,
            FeedbackKind kind,
            String message,
            Map<String, Object> context,
            List<String> options,
            String defaultResponse,
            Duration timeout,
            Instant createdAt) {
        this.requestId = requestId;
        this.kind = kind;
        this.message = message;
        this.context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.options = options == null ? List.of() : List.copyOf(options);
        this.defaultResponse = defaultResponse;
        this.timeout = timeout;
        this.createdAt = createdAt;
    }

    /**
     * Record the response. Fails if a response was already recorded.
     */
    public synchronized void recordResponse(String value, FeedbackResolution how, Instant at) {
        if (resolution != null) {
            throw new IllegalStateException("Feedback request " + requestId + " already answered");
        }
        this.response = value;
        this.resolution = how;
        this.respondedAt = at;
    }

    public String getRequestId() {
        return requestId;
    }

    public FeedbackKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public List<String> getOptions() {
        return options;
    }

    public Optional<String> getDefaultResponse() {
        return Optional.ofNullable(defaultResponse);
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Optional<String> getResponse() {
        return Optional.ofNullable(response);
    }

    public synchronized Optional<Instant> getRespondedAt() {
        return Optional.ofNullable(respondedAt);
    }

    public synchronized Optional<FeedbackResolution> getResolution() {
        return Optional.ofNullable(resolution);
    }

    public synchronized boolean isAnswered() {
        return resolution != null;
    }

    public synchronized boolean isTimedOut() {
        return resolution == FeedbackResolution.TIMED_OUT;
    }

    /**
     * Time between creation and response, if answered.
     */
    public synchronized Optional<Duration> getLatency() {
        return respondedAt == null
            ? Optional.empty()
            : Optional.of(Duration.between(createdAt, respondedAt));
    }

    /**
     * The response that applies when nobody answers: the request default, else the kind default.
     */
    public String fallbackResponse() {
        return defaultResponse != null ? defaultResponse : kind.builtInDefault(options);
    }

    @Override
    public String toString() {
        return "FeedbackRequest[" + requestId + ", " + kind + ", resolution=" + resolution + "]";
    }
}
