package com.todoflow.api;

import com.todoflow.core.model.OrchestrationConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized settings under the {@code todoflow} prefix.
 */
@ConfigurationProperties(prefix = "todoflow")
public class TodoflowProperties {

    private int maxIterations = 10;
    private int thinkingDepth = 3;
    private boolean interactive = false;
    private boolean autoApproveSimple = false;
    private int guidanceInterval = 3;
    private boolean guidanceBeforeStart = true;
    private boolean requireApproval = true;
    private boolean validateResults = true;
    private Duration defaultTimeout = Duration.ofSeconds(30);
    private Duration inputTimeout = Duration.ofSeconds(60);
    private int maxInputAttempts = 3;

    // One-shot mode
    private String query;
    private String exportPath;

    private final Reasoning reasoning = new Reasoning();

    public OrchestrationConfig toConfig() {
        return OrchestrationConfig.builder()
            .maxIterations(maxIterations)
            .thinkingDepth(thinkingDepth)
            .interactive(interactive)
            .autoApproveSimple(autoApproveSimple)
            .guidanceInterval(guidanceInterval)
            .guidanceBeforeStart(guidanceBeforeStart)
            .requireApproval(requireApproval)
            .validateResults(validateResults)
            .defaultTimeout(defaultTimeout)
            .inputTimeout(inputTimeout)
            .maxInputAttempts(maxInputAttempts)
            .build();
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public int getThinkingDepth() {
        return thinkingDepth;
    }

    public void setThinkingDepth(int thinkingDepth) {
        this.thinkingDepth = thinkingDepth;
    }

    public boolean isInteractive() {
        return interactive;
    }

    public void setInteractive(boolean interactive) {
        this.interactive = interactive;
    }

    public boolean isAutoApproveSimple() {
        return autoApproveSimple;
    }

    public void setAutoApproveSimple(boolean autoApproveSimple) {
        this.autoApproveSimple = autoApproveSimple;
    }

    public int getGuidanceInterval() {
        return guidanceInterval;
    }

    public void setGuidanceInterval(int guidanceInterval) {
        this.guidanceInterval = guidanceInterval;
    }

    public boolean isGuidanceBeforeStart() {
        return guidanceBeforeStart;
    }

    public void setGuidanceBeforeStart(boolean guidanceBeforeStart) {
        this.guidanceBeforeStart = guidanceBeforeStart;
    }

    public boolean isRequireApproval() {
        return requireApproval;
    }

    public void setRequireApproval(boolean requireApproval) {
        this.requireApproval = requireApproval;
    }

    public boolean isValidateResults() {
        return validateResults;
    }

    public void setValidateResults(boolean validateResults) {
        this.validateResults = validateResults;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getInputTimeout() {
        return inputTimeout;
    }

    public void setInputTimeout(Duration inputTimeout) {
        this.inputTimeout = inputTimeout;
    }

    public int getMaxInputAttempts() {
        return maxInputAttempts;
    }

    public void setMaxInputAttempts(int maxInputAttempts) {
        this.maxInputAttempts = maxInputAttempts;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getExportPath() {
        return exportPath;
    }

    public void setExportPath(String exportPath) {
        this.exportPath = exportPath;
    }

    public Reasoning getReasoning() {
        return reasoning;
    }

    /**
     * OpenAI chat model used for initial planning. Planning falls back to templates
     * while no API key is set.
     */
    public static class Reasoning {

        private String apiKey;
        private String baseUrl;
        private String modelName = "gpt-3.5-turbo";
        private double temperature = 0.7;
        private Duration timeout = Duration.ofSeconds(60);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
