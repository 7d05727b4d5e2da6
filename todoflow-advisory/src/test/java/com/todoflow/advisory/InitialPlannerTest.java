package com.todoflow.advisory;

import com.todoflow.core.model.PlanSource;
import com.todoflow.core.model.ReasoningStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InitialPlannerTest {

    @Test
    @DisplayName("Reasoning steps become drafts carrying their step id")
    void plan_fromReasoning() {
        ReasoningStep first = ReasoningStep.create("Step 1", "Step 1\nAction: Collect receipts");
        ReasoningStep second = ReasoningStep.create("Step 2", "Step 2\nAdd up the monthly totals");
        InitialPlanner planner = new InitialPlanner((query, depth) -> List.of(first, second));

        InitialPlan plan = planner.plan("Do my taxes", 3);

        assertThat(plan.source()).isEqualTo(PlanSource.REASONING);
        assertThat(plan.steps()).containsExactly(first, second);
        assertThat(plan.drafts()).extracting(PlanDraft::content)
            .containsExactly("Action: Collect receipts", "Add up the monthly totals");
        assertThat(plan.drafts().get(1).metadata()).containsEntry(InitialPlanner.STEP_ID, second.stepId());
    }

    @Test
    @DisplayName("Unavailable provider falls back to templates")
    void plan_providerUnavailable() {
        InitialPlanner planner = new InitialPlanner(ReasoningProvider.unavailable());

        InitialPlan plan = planner.plan("What is 2 + 3?", 3);

        assertThat(plan.source()).isEqualTo(PlanSource.FALLBACK);
        assertThat(plan.steps()).isEmpty();
        assertThat(plan.drafts()).extracting(PlanDraft::content).containsExactly("Calculate What is 2 + 3?",
            "Verify calculation result for What is 2 + 3?");
    }

    @Test
    @DisplayName("Empty answer or crashing provider falls back to templates")
    void plan_emptyOrCrashing() {
        InitialPlanner empty = new InitialPlanner((query, depth) -> List.of());
        InitialPlanner crashing = new InitialPlanner((query, depth) -> {
            throw new IllegalStateException("backend down");
        });

        assertThat(empty.plan("Tell me a story", 3).source()).isEqualTo(PlanSource.FALLBACK);
        assertThat(crashing.plan("Tell me a story", 3).drafts()).hasSize(4);
    }

    @Test
    @DisplayName("Chat model provider parses steps and caps them at the thinking depth")
    void plan_fromChatModel() {
        ChatModelReasoningProvider provider = new ChatModelReasoningProvider(StubChatModel.answering("""
            Step 1: One
            Do: first thing
            Step 2: Two
            Do: second thing
            Step 3: Three
            Do: third thing
            """));

        InitialPlan plan = new InitialPlanner(provider).plan("Three things", 2);

        assertThat(plan.source()).isEqualTo(PlanSource.REASONING);
        assertThat(plan.drafts()).extracting(PlanDraft::content)
            .containsExactly("Do: first thing", "Do: second thing");
    }

    @Test
    @DisplayName("Failing chat model surfaces as a reasoning failure")
    void plan_chatModelFailure() {
        ChatModelReasoningProvider provider = new ChatModelReasoningProvider(
            StubChatModel.failing(new IllegalStateException("timeout")));

        assertThat(new InitialPlanner(provider).plan("Plan a trip", 3).source()).isEqualTo(PlanSource.FALLBACK);
    }
}
