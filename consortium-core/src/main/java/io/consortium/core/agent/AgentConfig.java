package io.consortium.core.agent;

import java.time.Duration;
import java.util.Objects;

/// Immutable configuration for one consortium agent.
///
/// Specifies the model and its sampling parameters. Roster identifiers that have no
/// explicit configuration are registered with {@link #forModel(String)}, i.e. the
/// identifier doubles as the model name.
///
/// ### Required Fields
/// - `id` - Unique identifier for registry lookup (the roster identifier)
/// - `model` - Model identifier (e.g., "claude-sonnet-4", "gpt-4o", "gemini-2.0-flash")
///
/// ### Optional Parameters
/// - `temperature` - Sampling temperature (provider default when null)
/// - `maxTokens` - Maximum response tokens
/// - `instructions` - Agent-level system instructions, prepended to the per-call system prompt
/// - `topP` - Nucleus sampling cutoff
/// - `timeout` - Transport-level request timeout
/// - `maxRetries` - Provider-level retries (rate limits, transient errors)
///
/// @implNote Thread-safe. All fields are immutable after construction.
///
/// @see Agent for the runtime agent interface
/// @see AgentFactory for creating agents from configurations
public final class AgentConfig {

    private final String id;
    private final String model;
    private final Double temperature;
    private final Integer maxTokens;
    private final String instructions;
    private final Double topP;
    private final Duration timeout;
    private final Integer maxRetries;

    private AgentConfig(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.model = Objects.requireNonNull(builder.model, "model must not be null");
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.instructions = builder.instructions;
        this.topP = builder.topP;
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
    }

    /// Creates a default configuration whose ID and model are both `model`.
    ///
    /// @param model the model identifier, not null
    /// @return configuration with provider defaults, never null
    public static AgentConfig forModel(String model) {
        return builder().id(model).model(model).build();
    }

    /// @return the roster identifier this configuration is registered under, never null
    public String getId() {
        return id;
    }

    /// @return the model name handed to the provider, never null
    public String getModel() {
        return model;
    }

    /// @return sampling temperature, may be null (provider default used)
    public Double getTemperature() {
        return temperature;
    }

    /// @return max tokens limit, may be null (provider default used)
    public Integer getMaxTokens() {
        return maxTokens;
    }

    /// Instructions placed ahead of the per-call system prompt on every invocation.
    ///
    /// @return instruction text, may be null
    public String getInstructions() {
        return instructions;
    }

    /// @return top-p value, may be null (provider default used)
    public Double getTopP() {
        return topP;
    }

    /// Returns the transport-level request timeout.
    ///
    /// This is independent of the orchestrator's per-task timeout, which bounds the
    /// whole invocation from the dispatcher's point of view.
    ///
    /// @return timeout, may be null (provider default used)
    public Duration getTimeout() {
        return timeout;
    }

    /// @return provider-level retry count, may be null (provider default used)
    public Integer getMaxRetries() {
        return maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link AgentConfig}. `id` and `model` are required.
    public static final class Builder {
        private String id;
        private String model;
        private Double temperature;
        private Integer maxTokens;
        private String instructions;
        private Double topP;
        private Duration timeout;
        private Integer maxRetries;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder instructions(String instructions) {
            this.instructions = instructions;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /// @throws NullPointerException if id or model is missing
        public AgentConfig build() {
            return new AgentConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentConfig that)) return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AgentConfig[" + id + " -> " + model + "]";
    }
}
