package com.todoflow.worker;

import com.todoflow.core.model.Todo;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

final class TodoFixtures {

    private TodoFixtures() {
    }

    static Todo todo(String id, String content) {
        return Todo.create(id, content, 1, Set.of(), 1, Map.of(), null, Instant.parse("2024-01-01T00:00:00Z"));
    }
}
