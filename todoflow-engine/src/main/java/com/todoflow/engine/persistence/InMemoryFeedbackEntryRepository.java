package com.todoflow.engine.persistence;

import com.todoflow.core.model.FeedbackEntry;
import com.todoflow.core.repository.FeedbackEntryRepository;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory, append-only implementation of FeedbackEntryRepository.
 */
public class InMemoryFeedbackEntryRepository implements FeedbackEntryRepository {
    
    private final List<FeedbackEntry> entries = new CopyOnWriteArrayList<>();
    
    @Override
    public void append(FeedbackEntry entry) {
        entries.add(entry);
    }
    
    @Override
    public Optional<FeedbackEntry> findById(String entryId) {
        return entries.stream()
            .filter(e -> e.entryId().equals(entryId))
            .findFirst();
    }
    
    @Override
    public List<FeedbackEntry> findByTodo(String todoId) {
        return entries.stream()
            .filter(e -> e.todoId().equals(todoId))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<FeedbackEntry> findAll() {
        return List.copyOf(entries);
    }
    
    @Override
    public void deleteAll() {
        entries.clear();
    }
}
