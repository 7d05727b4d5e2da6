package com.todoflow.core.model;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over the feedback history of a session.
 */
public record FeedbackSummary(
    int totalRequests,
    Map<FeedbackKind, Integer> byKind,
    int timedOut,
    double averageResponseSeconds,
    boolean interactive,
    List<RecentRequest> recentRequests
) {
    public FeedbackSummary {
        byKind = byKind == null ? Map.of() : Map.copyOf(byKind);
        recentRequests = recentRequests == null ? List.of() : List.copyOf(recentRequests);
    }

    /**
     * Condensed view of one request.
     */
    public record RecentRequest(
        String requestId,
        FeedbackKind kind,
        String message,
        String response,
        FeedbackResolution resolution,
        Double responseSeconds
    ) {}
}
