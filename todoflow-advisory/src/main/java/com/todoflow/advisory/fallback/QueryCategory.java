package com.todoflow.advisory.fallback;

import java.util.List;
import java.util.Locale;

/**
 * Coarse category of a query, used to pick a template plan.
 */
public enum QueryCategory {
    ARITHMETIC,
    PLANNING,
    GENERIC;

    private static final List<String> ARITHMETIC_MARKERS = List.of("+", "-", "*", "/", "=", "calculate", "compute");
    private static final List<String> PLANNING_WORDS = List.of("plan", "organize", "schedule", "prepare");

    public static QueryCategory of(String query) {
        if (ARITHMETIC_MARKERS.stream().anyMatch(query::contains)) {
            return ARITHMETIC;
        }
        String lower = query.toLowerCase(Locale.ROOT);
        if (PLANNING_WORDS.stream().anyMatch(lower::contains)) {
            return PLANNING;
        }
        return GENERIC;
    }
}
