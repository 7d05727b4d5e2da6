package com.todoflow.advisory;

import java.util.List;
import java.util.Locale;

/**
 * Picks the actionable line out of a step's reasoning.
 */
public class TodoContentExtractor {

    private static final List<String> MARKERS = List.of("todo:", "action:", "task:", "do:", "create:", "implement:");
    private static final int MIN_MEANINGFUL_LENGTH = 10;
    private static final int MAX_SNIPPET_LENGTH = 100;

    /**
     * Order of preference: the first line carrying an action marker, then the first line
     * longer than ten characters that is not a markdown heading, then a truncated snippet.
     */
    public String extract(String reasoning) {
        if (reasoning == null) {
            return "";
        }
        String[] lines = reasoning.split("\n");

        for (String raw : lines) {
            String line = raw.strip();
            String lower = line.toLowerCase(Locale.ROOT);
            if (MARKERS.stream().anyMatch(lower::contains)) {
                return line;
            }
        }

        for (String raw : lines) {
            String line = raw.strip();
            if (line.length() > MIN_MEANINGFUL_LENGTH && !line.startsWith("#")) {
                return line;
            }
        }

        return reasoning.length() > MAX_SNIPPET_LENGTH
            ? reasoning.substring(0, MAX_SNIPPET_LENGTH) + "..."
            : reasoning;
    }
}
