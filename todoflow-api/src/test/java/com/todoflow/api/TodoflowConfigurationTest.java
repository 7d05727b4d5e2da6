package com.todoflow.api;

import com.todoflow.advisory.ChatModelReasoningProvider;
import com.todoflow.advisory.ReasoningException;
import com.todoflow.advisory.ReasoningProvider;
import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.ExecutionResult;
import com.todoflow.core.model.ReasoningStep;
import com.todoflow.core.model.Todo;
import com.todoflow.worker.ExecutionRouter;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TodoflowConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(TodoflowConfiguration.class)
        .withBean(TodoflowProperties.class, TodoflowProperties::new)
        .withBean(MeterRegistry.class, SimpleMeterRegistry::new);

    @Test
    void reasoningProvider_withoutChatModel_shouldBeUnavailable() {
        runner.run(context -> {
            assertThat(context).doesNotHaveBean(ChatModel.class);
            ReasoningProvider provider = context.getBean(ReasoningProvider.class);

            assertThatThrownBy(() -> provider.reason("Plan a trip", 3))
                .isInstanceOf(ReasoningException.class)
                .extracting(e -> ((ReasoningException) e).getErrorCode())
                .isEqualTo(ReasoningException.UNAVAILABLE);
        });
    }

    @Test
    void reasoningProvider_withChatModel_shouldPlanFromModel() {
        runner.withBean(ChatModel.class, () -> answering("""
                Step 1: Gather
                Action: Collect the receipts
                Step 2: Sum
                Action: Add up the totals
                """))
            .run(context -> {
                ReasoningProvider provider = context.getBean(ReasoningProvider.class);
                assertThat(provider).isInstanceOf(ChatModelReasoningProvider.class);

                List<ReasoningStep> steps = provider.reason("Do my taxes", 3);

                assertThat(steps).extracting(ReasoningStep::description)
                    .containsExactly("Step 1: Gather", "Step 2: Sum");
            });
    }

    @Test
    void executionRouter_shouldEvaluateMathTodos() {
        runner.run(context -> {
            ExecutionRouter router = context.getBean(ExecutionRouter.class);
            Todo todo = Todo.create("t1", "Calculate 12 * 7 + 3", 1, Set.of(), 1, Map.of(), null, Instant.EPOCH);

            ExecutionResult result = router.execute(todo);

            assertThat(result.success()).isTrue();
            assertThat(result.kind()).isEqualTo(ExecutionKind.MATH);
            assertThat(result.output()).isEqualTo("12 * 7 + 3 = 87");
        });
    }

    private static ChatModel answering(String answer) {
        return new ChatModel() {
            @Override
            public ChatResponse chat(List<ChatMessage> messages) {
                return ChatResponse.builder().aiMessage(AiMessage.from(answer)).build();
            }
        };
    }
}
