package com.todoflow.core.model;

import java.time.Duration;

/**
 * Settings consumed by the orchestration loop and the feedback gateway.
 * Immutable; one instance is shared by every session created with it.
 *
 * Invariants:
 * - maxIterations >= 0
 * - guidanceInterval >= 0 (0 disables periodic guidance)
 * - defaultTimeout and inputTimeout > 0
 * - maxInputAttempts >= 1
 */
public record OrchestrationConfig(
    int maxIterations,
    int thinkingDepth,
    boolean interactive,
    boolean autoApproveSimple,
    int guidanceInterval,
    boolean guidanceBeforeStart,
    boolean requireApproval,
    boolean validateResults,
    Duration defaultTimeout,
    Duration inputTimeout,
    int maxInputAttempts
) {
    public OrchestrationConfig {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be >= 0");
        }
        if (guidanceInterval < 0) {
            throw new IllegalArgumentException("guidanceInterval must be >= 0");
        }
        if (defaultTimeout == null || defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        if (inputTimeout == null || inputTimeout.isNegative() || inputTimeout.isZero()) {
            throw new IllegalArgumentException("inputTimeout must be positive");
        }
        if (maxInputAttempts < 1) {
            throw new IllegalArgumentException("maxInputAttempts must be >= 1");
        }
    }

    /**
     * Reference policy: 10 iterations, guidance before start and every 3rd iteration,
     * approval and validation gates on, 30s gate timeout, 60s input timeout, 3 input attempts.
     */
    public static OrchestrationConfig defaults() {
        return builder().build();
    }

    /**
     * Check whether a guidance gate is due before the given (1-indexed) iteration.
     */
    public boolean guidanceDueBefore(int iteration) {
        if (iteration == 1) {
            return guidanceBeforeStart;
        }
        return guidanceInterval > 0 && (iteration - 1) % guidanceInterval == 0;
    }

    public Builder toBuilder() {
        return new Builder()
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
            .maxInputAttempts(maxInputAttempts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
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

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder thinkingDepth(int thinkingDepth) {
            this.thinkingDepth = thinkingDepth;
            return this;
        }

        public Builder interactive(boolean interactive) {
            this.interactive = interactive;
            return this;
        }

        public Builder autoApproveSimple(boolean autoApproveSimple) {
            this.autoApproveSimple = autoApproveSimple;
            return this;
        }

        public Builder guidanceInterval(int guidanceInterval) {
            this.guidanceInterval = guidanceInterval;
            return this;
        }

        public Builder guidanceBeforeStart(boolean guidanceBeforeStart) {
            this.guidanceBeforeStart = guidanceBeforeStart;
            return this;
        }

        public Builder requireApproval(boolean requireApproval) {
            this.requireApproval = requireApproval;
            return this;
        }

        public Builder validateResults(boolean validateResults) {
            this.validateResults = validateResults;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder inputTimeout(Duration inputTimeout) {
            this.inputTimeout = inputTimeout;
            return this;
        }

        public Builder maxInputAttempts(int maxInputAttempts) {
            this.maxInputAttempts = maxInputAttempts;
            return this;
        }

        public OrchestrationConfig build() {
            return new OrchestrationConfig(
                maxIterations, thinkingDepth, interactive, autoApproveSimple,
                guidanceInterval, guidanceBeforeStart, requireApproval, validateResults,
                defaultTimeout, inputTimeout, maxInputAttempts
            );
        }
    }
}
