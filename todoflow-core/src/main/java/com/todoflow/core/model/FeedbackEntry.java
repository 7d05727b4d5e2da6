package com.todoflow.core.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable ledger entry recording feedback about a todo, with ranked suggestions.
 */
public record FeedbackEntry(
    String entryId,
    String todoId,
    FeedbackEntryType type,
    String message,
    List<String> suggestions,
    Instant createdAt
) {
    public FeedbackEntry {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static FeedbackEntry create(
            String todoId,
            FeedbackEntryType type,
            String message,
            List<String> suggestions,
            Instant now) {
        return new FeedbackEntry(UUID.randomUUID().toString(), todoId, type, message, suggestions, now);
    }
}
