package com.todoflow.advisory;

import com.todoflow.core.model.ReasoningStep;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reasoning provider backed by a langchain4j chat model.
 *
 * The model is asked for numbered steps with {@code Action:} lines, and its answer is parsed
 * with {@link StepResponseParser}. At most {@code thinkingDepth} steps are returned.
 */
public class ChatModelReasoningProvider implements ReasoningProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatModelReasoningProvider.class);

    private final ChatModel chatModel;
    private final StepResponseParser parser;

    public ChatModelReasoningProvider(ChatModel chatModel) {
        this(chatModel, new StepResponseParser());
    }

    public ChatModelReasoningProvider(ChatModel chatModel, StepResponseParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public List<ReasoningStep> reason(String query, int thinkingDepth) throws ReasoningException {
        String answer;
        try {
            ChatResponse response = chatModel.chat(messages(query, thinkingDepth));
            AiMessage message = response == null ? null : response.aiMessage();
            answer = message == null ? null : message.text();
        } catch (RuntimeException e) {
            throw new ReasoningException(ReasoningException.FAILED, "Chat model call failed: " + e.getMessage(), e);
        }
        if (answer == null || answer.isBlank()) {
            throw new ReasoningException(ReasoningException.FAILED, "Chat model returned no text");
        }

        List<ReasoningStep> steps = parser.parse(answer);
        log.debug("Chat model proposed {} steps for query of {} chars", steps.size(), query.length());
        return steps.size() > thinkingDepth ? steps.subList(0, thinkingDepth) : steps;
    }

    static List<ChatMessage> messages(String query, int thinkingDepth) {
        return List.of(
            SystemMessage.from(systemPrompt(thinkingDepth)),
            UserMessage.from("Please analyze this query: " + query)
        );
    }

    static String systemPrompt(int thinkingDepth) {
        return """
            You break complex requests down into manageable todos using step-by-step reasoning.
            Analyze the request, split it into at most %d logical steps and give each step
            one specific, actionable task. Mention dependencies between steps where they exist.

            Format every step like this:
            ## Step 1: [Step name]
            [Your reasoning]
            Action: [specific actionable task]
            """.formatted(thinkingDepth);
    }
}
