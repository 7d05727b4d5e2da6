package com.todoflow.engine.history;

import com.todoflow.core.model.ExecutionRecord;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of executions of one session, for reporting.
 */
public class ExecutionHistory {

    private final List<ExecutionRecord> records = new CopyOnWriteArrayList<>();

    public void record(ExecutionRecord record) {
        records.add(record);
    }

    public List<ExecutionRecord> entries() {
        return List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
