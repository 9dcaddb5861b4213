package io.consortium.core.agent.spi;

import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentConfig;
import java.util.Map;

/// Provider interface for pluggable agent implementations.
///
/// Implement this interface to add support for a model family (e.g., Claude, GPT,
/// Gemini). Implementations are wired explicitly through
/// {@link io.consortium.core.ConsortiumFactory.Builder#agentProvider(AgentProvider)};
/// no classpath scanning is involved.
///
/// ### Priority System
/// When multiple providers support the same model, the one with the highest
/// {@link #getPriority()} value is selected. Use this to:
/// - Override default implementations with custom ones
/// - Provide testing stubs that intercept all models
///
/// @implNote Implementations should be stateless and thread-safe.
///
/// @see io.consortium.core.agent.AgentFactory for provider selection
/// @see io.consortium.core.agent.stub.StubAgentProvider for a testing implementation
public interface AgentProvider {

    /// Returns the provider's display name for logging and diagnostics.
    ///
    /// @return provider name (e.g., "langchain4j", "stub"), never null
    String getName();

    /// Checks if this provider can handle the specified model.
    ///
    /// @param modelName model identifier (e.g., "claude-sonnet-4", "gpt-4o"), not null
    /// @return `true` if this provider can create agents for this model
    boolean supportsModel(String modelName);

    /// Creates an agent instance for the specified configuration.
    ///
    /// Called after {@link #supportsModel(String)} returns `true`.
    ///
    /// @param agentId unique identifier for the agent, not null
    /// @param config agent configuration, not null
    /// @param credentials map of API keys and other credentials, not null
    /// @return configured agent ready for execution, never null
    /// @throws IllegalStateException if required credentials are missing
    /// @throws IllegalArgumentException if configuration is invalid for this provider
    Agent createAgent(String agentId, AgentConfig config, Map<String, String> credentials);

    /// Returns this provider's priority for model selection.
    ///
    /// @return priority value; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}
