package com.todoflow.advisory;

import com.todoflow.core.model.ReasoningStep;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses free-form reasoning text into steps.
 * A line starting with {@code Step } or {@code ## Step} opens a new step; later non-blank
 * lines are appended to that step's reasoning. Text before the first heading is ignored.
 */
public class StepResponseParser {

    public List<ReasoningStep> parse(String text) {
        List<ReasoningStep> steps = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return steps;
        }

        String heading = null;
        StringBuilder reasoning = null;

        for (String raw : text.split("\n")) {
            String line = raw.strip();
            if (line.startsWith("Step ") || line.startsWith("## Step")) {
                if (heading != null) {
                    steps.add(ReasoningStep.create(heading, reasoning.toString()));
                }
                heading = line;
                reasoning = new StringBuilder(line);
            } else if (heading != null && !line.isEmpty()) {
                reasoning.append('\n').append(line);
            }
        }

        if (heading != null) {
            steps.add(ReasoningStep.create(heading, reasoning.toString()));
        }
        return steps;
    }
}
