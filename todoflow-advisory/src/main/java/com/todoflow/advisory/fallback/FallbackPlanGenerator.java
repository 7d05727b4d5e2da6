package com.todoflow.advisory.fallback;

import com.todoflow.advisory.PlanDraft;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic template plans for when reasoning is unavailable.
 */
public class FallbackPlanGenerator {

    private static final List<PlanDraft> PLANNING_TEMPLATE = List.of(
        PlanDraft.of("Research and gather information about the topic",
            "Good planning starts with thorough research"),
        PlanDraft.of("Break down the plan into major components",
            "Decomposing complex plans makes them manageable"),
        PlanDraft.of("Set priorities and establish timeline",
            "Prioritization and timing are key to successful execution"),
        PlanDraft.of("Create detailed action items for each component",
            "Specific actions make plans actionable")
    );

    private static final List<PlanDraft> GENERIC_TEMPLATE = List.of(
        PlanDraft.of("Analyze and understand the request",
            "Understanding the core request is essential"),
        PlanDraft.of("Research relevant information and context",
            "Background research provides necessary context"),
        PlanDraft.of("Develop a structured approach to address the request",
            "A systematic approach ensures comprehensive coverage"),
        PlanDraft.of("Implement the solution step by step",
            "Step-by-step implementation reduces complexity")
    );

    public List<PlanDraft> generate(String query) {
        return switch (QueryCategory.of(query)) {
            case ARITHMETIC -> arithmetic(query);
            case PLANNING -> PLANNING_TEMPLATE;
            case GENERIC -> GENERIC_TEMPLATE;
        };
    }

    private static List<PlanDraft> arithmetic(String query) {
        String expression = query.strip();
        if (expression.endsWith("=")) {
            expression = expression.substring(0, expression.length() - 1).strip();
        }

        List<PlanDraft> drafts = new ArrayList<>();
        drafts.add(PlanDraft.of("Calculate " + expression, "Perform mathematical calculation: " + expression));

        // Long or multiplicative expressions get a verification step
        if (expression.split("\\s+").length > 3 || expression.matches(".*[*/()].*")) {
            drafts.add(PlanDraft.of("Verify calculation result for " + expression,
                "Double-check the calculation for accuracy"));
        }
        return drafts;
    }
}
