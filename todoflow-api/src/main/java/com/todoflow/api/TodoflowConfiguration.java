package com.todoflow.api;

import com.todoflow.advisory.ChatModelReasoningProvider;
import com.todoflow.advisory.ReasoningProvider;
import com.todoflow.core.model.ExecutionKind;
import com.todoflow.core.model.OrchestrationConfig;
import com.todoflow.engine.coordinator.SessionCoordinator;
import com.todoflow.engine.feedback.ConsoleFeedbackResponder;
import com.todoflow.engine.feedback.FeedbackResponder;
import com.todoflow.engine.feedback.ScriptedFeedbackResponder;
import com.todoflow.engine.metrics.TodoflowMetrics;
import com.todoflow.worker.DefaultExecutionRouter;
import com.todoflow.worker.ExecutionRouter;
import com.todoflow.worker.KeywordTodoClassifier;
import com.todoflow.worker.strategy.MathExecutionStrategy;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engine into the application context. The engine itself carries no Spring annotations;
 * any bean below can be replaced by declaring one of the same type.
 */
@Configuration
public class TodoflowConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TodoflowConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OrchestrationConfig orchestrationConfig(TodoflowProperties properties) {
        OrchestrationConfig config = properties.toConfig();
        log.info("Orchestration config: {}", config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionRouter executionRouter() {
        return new DefaultExecutionRouter(new KeywordTodoClassifier())
            .register(ExecutionKind.MATH, new MathExecutionStrategy());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "todoflow.reasoning", name = "api-key")
    public ChatModel chatModel(TodoflowProperties properties) {
        TodoflowProperties.Reasoning reasoning = properties.getReasoning();
        log.info("Planning with OpenAI model {}", reasoning.getModelName());
        return OpenAiChatModel.builder()
            .apiKey(reasoning.getApiKey())
            .baseUrl(reasoning.getBaseUrl())
            .modelName(reasoning.getModelName())
            .temperature(reasoning.getTemperature())
            .timeout(reasoning.getTimeout())
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReasoningProvider reasoningProvider(ObjectProvider<ChatModel> chatModel) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.info("No reasoning backend configured, sessions start from fallback plans");
            return ReasoningProvider.unavailable();
        }
        return new ChatModelReasoningProvider(model);
    }

    @Bean
    @ConditionalOnMissingBean
    public FeedbackResponder feedbackResponder(OrchestrationConfig config) {
        // A non-interactive gateway never consults its responder
        return config.interactive() ? new ConsoleFeedbackResponder() : ScriptedFeedbackResponder.of();
    }

    @Bean
    public TodoflowMetrics todoflowMetrics(MeterRegistry meterRegistry) {
        return new TodoflowMetrics(meterRegistry);
    }

    @Bean
    public SessionCoordinator sessionCoordinator(
            ExecutionRouter router,
            ReasoningProvider reasoningProvider,
            FeedbackResponder responder,
            OrchestrationConfig config,
            TodoflowMetrics metrics,
            Clock clock) {
        return new SessionCoordinator(router, reasoningProvider, responder, config, metrics, clock);
    }
}
