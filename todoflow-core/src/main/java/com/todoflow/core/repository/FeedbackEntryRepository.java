package com.todoflow.core.repository;

import com.todoflow.core.model.FeedbackEntry;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for the feedback ledger.
 */
public interface FeedbackEntryRepository {

    /**
     * Append a feedback entry.
     *
     * @param entry The entry to store
     */
    void append(FeedbackEntry entry);

    /**
     * Find an entry by ID.
     *
     * @param entryId The entry ID
     * @return The entry if found
     */
    Optional<FeedbackEntry> findById(String entryId);

    /**
     * Find all entries for a todo.
     *
     * @param todoId The todo ID
     * @return Entries in the order they were appended
     */
    List<FeedbackEntry> findByTodo(String todoId);

    /**
     * Find all entries.
     *
     * @return Entries in the order they were appended
     */
    List<FeedbackEntry> findAll();

    /**
     * Remove every entry.
     */
    void deleteAll();
}
