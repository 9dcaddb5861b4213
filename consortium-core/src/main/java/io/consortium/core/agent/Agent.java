package io.consortium.core.agent;

/// Core interface for the remote language-model endpoints that make up a consortium.
///
/// An agent is the Agent Invocation Interface of the orchestrator: given a prompt
/// and an optional system prompt it returns the model's raw text, or a typed error.
/// Each agent wraps an underlying model (e.g., Claude, GPT, Gemini) behind this
/// uniform contract.
///
/// ### Contracts
/// - **Postcondition**: `execute()` always returns a non-null {@link AgentResponse}
/// - **Invariant**: Agent ID and config remain constant after construction
/// - **No retries**: the orchestrator never retries an invocation. Retry policy, if any,
///   belongs to the implementation (see the LangChain4j adapter's `maxRetries`)
///
/// @implNote Implementations must be thread-safe. The dispatcher invokes the same
/// agent concurrently when a roster entry asks for several instances.
///
/// @see AgentRegistry for agent lifecycle management
/// @see AgentFactory for agent instantiation
/// @see io.consortium.core.agent.spi.AgentProvider for implementing custom agent backends
public interface Agent {

    /// Sends a prompt to the underlying model.
    ///
    /// @param prompt the fully rendered prompt, not null
    /// @param systemPrompt system-level instructions for this call, may be null
    /// @return text output or a typed error, never null
    /// @throws NullPointerException if prompt is null
    AgentResponse execute(String prompt, String systemPrompt);

    /// Returns the unique identifier used for agent registry lookup.
    ///
    /// @return non-null identifier, stable for the agent's lifetime
    String getId();

    /// Returns the configuration used to create this agent.
    ///
    /// @return immutable agent configuration, never null
    AgentConfig getConfig();
}
