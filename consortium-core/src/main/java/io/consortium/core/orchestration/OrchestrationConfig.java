package io.consortium.core.orchestration;

import io.consortium.core.convergence.RetentionPolicy;
import io.consortium.core.exception.ConsortiumConfigurationException;
import io.consortium.core.roster.Roster;
import io.consortium.core.synthesis.JudgingMethod;
import java.time.Duration;
import java.util.logging.Logger;

/// Immutable parameters of one orchestration call.
///
/// ### Default Values
/// - `confidenceThreshold`: `0.8`
/// - `minIterations`: `1`
/// - `maxIterations`: `3`
/// - `agentTimeout`: 5 minutes per invocation
/// - `retentionPolicy`: {@link RetentionPolicy#LAST_ROUND}
/// - `judgingMethod`: {@link JudgingMethod#DEFAULT}
///
/// ### Contracts
/// - **Invariant**: `0 <= confidenceThreshold <= 1`
/// - **Invariant**: `1 <= minIterations <= maxIterations`
/// - **Invariant**: roster is non-empty; the arbiter need not be a roster member
/// - **Invariant**: pick-one and rank judging run exactly one round
///
/// @implNote Thread-safe. All fields are immutable after construction.
public final class OrchestrationConfig {

    private static final Logger logger = Logger.getLogger(OrchestrationConfig.class.getName());

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.8;
    public static final int DEFAULT_MIN_ITERATIONS = 1;
    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final Duration DEFAULT_AGENT_TIMEOUT = Duration.ofMinutes(5);

    private final Roster roster;
    private final String arbiterIdentifier;
    private final double confidenceThreshold;
    private final int minIterations;
    private final int maxIterations;
    private final String systemPrompt;
    private final Duration agentTimeout;
    private final RetentionPolicy retentionPolicy;
    private final JudgingMethod judgingMethod;

    private OrchestrationConfig(Builder builder, int minIterations, int maxIterations) {
        this.roster = builder.roster;
        this.arbiterIdentifier = builder.arbiterIdentifier.strip();
        this.confidenceThreshold = builder.confidenceThreshold;
        this.minIterations = minIterations;
        this.maxIterations = maxIterations;
        this.systemPrompt = builder.systemPrompt;
        this.agentTimeout = builder.agentTimeout;
        this.retentionPolicy = builder.retentionPolicy;
        this.judgingMethod = builder.judgingMethod;
    }

    public Roster getRoster() {
        return roster;
    }

    public String getArbiterIdentifier() {
        return arbiterIdentifier;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getMinIterations() {
        return minIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /// Returns the user instructions given to every agent and shown to the arbiter.
    ///
    /// @return the system prompt, may be null
    public String getSystemPrompt() {
        return systemPrompt;
    }

    /// Returns the time budget of one agent invocation, measured from the dispatch of
    /// its round. The arbiter invocation uses the same budget.
    ///
    /// @return the timeout, never null
    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public RetentionPolicy getRetentionPolicy() {
        return retentionPolicy;
    }

    public JudgingMethod getJudgingMethod() {
        return judgingMethod;
    }

    /// Creates a builder pre-filled with this configuration's values.
    public Builder toBuilder() {
        return builder()
                .roster(roster)
                .arbiter(arbiterIdentifier)
                .confidenceThreshold(confidenceThreshold)
                .minIterations(minIterations)
                .maxIterations(maxIterations)
                .systemPrompt(systemPrompt)
                .agentTimeout(agentTimeout)
                .retentionPolicy(retentionPolicy)
                .judgingMethod(judgingMethod);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link OrchestrationConfig}; all validation happens in {@link #build()}.
    ///
    /// @implNote Not thread-safe.
    public static final class Builder {
        private Roster roster;
        private String arbiterIdentifier;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private int minIterations = DEFAULT_MIN_ITERATIONS;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private String systemPrompt;
        private Duration agentTimeout = DEFAULT_AGENT_TIMEOUT;
        private RetentionPolicy retentionPolicy = RetentionPolicy.LAST_ROUND;
        private JudgingMethod judgingMethod = JudgingMethod.DEFAULT;

        private Builder() {}

        public Builder roster(Roster roster) {
            this.roster = roster;
            return this;
        }

        /// Parses and sets the roster, e.g. `"a:1,b:2"`.
        ///
        /// @throws ConsortiumConfigurationException if the roster text is invalid
        public Builder roster(String roster) {
            this.roster = Roster.parse(roster);
            return this;
        }

        public Builder arbiter(String arbiterIdentifier) {
            this.arbiterIdentifier = arbiterIdentifier;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder minIterations(int minIterations) {
            this.minIterations = minIterations;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder agentTimeout(Duration agentTimeout) {
            this.agentTimeout = agentTimeout;
            return this;
        }

        public Builder retentionPolicy(RetentionPolicy retentionPolicy) {
            this.retentionPolicy = retentionPolicy;
            return this;
        }

        public Builder judgingMethod(JudgingMethod judgingMethod) {
            this.judgingMethod = judgingMethod;
            return this;
        }

        /// Validates and builds the configuration.
        ///
        /// @return the immutable configuration, never null
        /// @throws ConsortiumConfigurationException if any invariant is violated
        public OrchestrationConfig build() {
            if (roster == null) {
                throw new ConsortiumConfigurationException(
                        "Roster must contain at least one agent");
            }
            if (arbiterIdentifier == null || arbiterIdentifier.isBlank()) {
                throw new ConsortiumConfigurationException("Arbiter identifier must not be blank");
            }
            if (Double.isNaN(confidenceThreshold)
                    || confidenceThreshold < 0.0
                    || confidenceThreshold > 1.0) {
                throw new ConsortiumConfigurationException(
                        "Confidence threshold must be between 0.0 and 1.0, got "
                                + confidenceThreshold);
            }
            if (minIterations < 1) {
                throw new ConsortiumConfigurationException(
                        "Minimum iterations must be at least 1, got " + minIterations);
            }
            if (maxIterations < minIterations) {
                throw new ConsortiumConfigurationException(
                        "Maximum iterations ("
                                + maxIterations
                                + ") must not be less than minimum iterations ("
                                + minIterations
                                + ")");
            }
            if (agentTimeout == null || agentTimeout.isZero() || agentTimeout.isNegative()) {
                throw new ConsortiumConfigurationException("Agent timeout must be positive");
            }
            if (retentionPolicy == null || judgingMethod == null) {
                throw new ConsortiumConfigurationException(
                        "Retention policy and judging method must not be null");
            }

            if (judgingMethod.isSinglePass() && maxIterations != 1) {
                logger.info(
                        "Judging method "
                                + judgingMethod
                                + " runs a single round; ignoring iteration bounds "
                                + minIterations
                                + ".."
                                + maxIterations);
                return new OrchestrationConfig(this, 1, 1);
            }
            return new OrchestrationConfig(this, minIterations, maxIterations);
        }
    }

    @Override
    public String toString() {
        return "OrchestrationConfig{roster="
                + roster
                + ", arbiter='"
                + arbiterIdentifier
                + "', threshold="
                + confidenceThreshold
                + ", iterations="
                + minIterations
                + ".."
                + maxIterations
                + ", judging="
                + judgingMethod
                + ", retention="
                + retentionPolicy
                + "}";
    }
}
