package com.todoflow.advisory;

import com.todoflow.advisory.fallback.FallbackPlanGenerator;
import com.todoflow.core.model.PlanSource;
import com.todoflow.core.model.ReasoningStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Derives the initial plan of a session from the reasoning collaborator,
 * falling back to template plans when it fails or returns nothing.
 */
public class InitialPlanner {

    private static final Logger log = LoggerFactory.getLogger(InitialPlanner.class);

    public static final String STEP_ID = "step_id";

    private final ReasoningProvider provider;
    private final TodoContentExtractor extractor;
    private final FallbackPlanGenerator fallback;

    public InitialPlanner(ReasoningProvider provider) {
        this(provider, new TodoContentExtractor(), new FallbackPlanGenerator());
    }

    public InitialPlanner(ReasoningProvider provider, TodoContentExtractor extractor, FallbackPlanGenerator fallback) {
        this.provider = provider;
        this.extractor = extractor;
        this.fallback = fallback;
    }

    public InitialPlan plan(String query, int thinkingDepth) {
        List<ReasoningStep> steps;
        try {
            steps = provider.reason(query, thinkingDepth);
        } catch (ReasoningException e) {
            log.warn("Reasoning failed [{}]: {}. Using fallback plan", e.getErrorCode(), e.getMessage());
            return fallbackPlan(query);
        } catch (RuntimeException e) {
            log.error("Reasoning provider crashed, using fallback plan", e);
            return fallbackPlan(query);
        }

        if (steps == null || steps.isEmpty()) {
            log.info("Reasoning returned no steps, using fallback plan");
            return fallbackPlan(query);
        }

        List<PlanDraft> drafts = steps.stream()
            .map(step -> new PlanDraft(
                extractor.extract(step.reasoning()),
                step.reasoning(),
                Map.of(STEP_ID, step.stepId())))
            .toList();

        log.info("Planned {} todos from {} reasoning steps", drafts.size(), steps.size());
        return new InitialPlan(steps, drafts, PlanSource.REASONING);
    }

    private InitialPlan fallbackPlan(String query) {
        return new InitialPlan(List.of(), fallback.generate(query), PlanSource.FALLBACK);
    }
}
