package com.todoflow.advisory;

import com.todoflow.core.model.ReasoningStep;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatModelReasoningProviderTest {

    private static final String ANSWER = """
        Let me think about this request.

        ## Step 1: Understand the numbers
        The request needs two calculations.
        Action: Calculate 12 * 7

        ## Step 2: Check the result
        Action: Verify calculation result for 12 * 7
        """;

    @Test
    @DisplayName("Model answer is parsed into steps, preamble ignored")
    void reason_parsesAnswer() throws ReasoningException {
        StubChatModel model = StubChatModel.answering(ANSWER);

        List<ReasoningStep> steps = new ChatModelReasoningProvider(model).reason("What is 12 * 7?", 3);

        assertThat(steps).hasSize(2);
        assertThat(steps.get(0).reasoning()).contains("Action: Calculate 12 * 7");
        assertThat(steps.get(1).reasoning()).startsWith("## Step 2: Check the result");
    }

    @Test
    @DisplayName("Model is sent a system prompt with the step limit and the query")
    void reason_sendsPromptAndQuery() throws ReasoningException {
        StubChatModel model = StubChatModel.answering(ANSWER);

        new ChatModelReasoningProvider(model).reason("What is 12 * 7?", 4);

        assertThat(model.calls).hasSize(1);
        List<ChatMessage> sent = model.calls.get(0);
        assertThat(sent).hasSize(2);
        assertThat(((SystemMessage) sent.get(0)).text()).contains("at most 4 logical steps").contains("Action:");
        assertThat(((UserMessage) sent.get(1)).singleText()).isEqualTo("Please analyze this query: What is 12 * 7?");
    }

    @Test
    @DisplayName("Steps beyond the thinking depth are dropped")
    void reason_capsAtDepth() throws ReasoningException {
        List<ReasoningStep> steps = new ChatModelReasoningProvider(StubChatModel.answering(ANSWER))
            .reason("What is 12 * 7?", 1);

        assertThat(steps).extracting(ReasoningStep::description).containsExactly("## Step 1: Understand the numbers");
    }

    @Test
    @DisplayName("Model failures and blank answers become reasoning failures")
    void reason_failures() {
        ChatModelReasoningProvider failing = new ChatModelReasoningProvider(
            StubChatModel.failing(new IllegalStateException("rate limited")));
        ChatModelReasoningProvider blank = new ChatModelReasoningProvider(StubChatModel.answering("  "));

        assertThatThrownBy(() -> failing.reason("Plan a trip", 3))
            .isInstanceOf(ReasoningException.class)
            .hasMessageContaining("rate limited")
            .extracting(e -> ((ReasoningException) e).getErrorCode())
            .isEqualTo(ReasoningException.FAILED);
        assertThatThrownBy(() -> blank.reason("Plan a trip", 3))
            .isInstanceOf(ReasoningException.class);
    }
}
