package io.consortium.core.agent;

import io.consortium.core.exception.AgentNotFoundException;
import java.util.Map;
import java.util.Optional;

/// Registry mapping roster identifiers to {@link Agent} instances.
///
/// Agents are either registered explicitly with an {@link AgentConfig} or resolved
/// lazily from a bare identifier, in which case the identifier is taken as the model
/// name (see {@link #resolveAgent(String)}).
///
/// ### Contracts
/// - **Precondition**: Agent IDs must be non-null and non-blank
/// - **Postcondition**: Registered agents are immediately available for retrieval
/// - **Invariant**: Registry state is always consistent (no partial registrations)
///
/// @implNote Implementations must be thread-safe. Concurrent orchestrations may
/// register and retrieve agents simultaneously.
///
/// @see DefaultAgentRegistry for the standard implementation
/// @see AgentFactory for agent creation mechanics
public interface AgentRegistry {

    /// Retrieves an agent by its unique identifier.
    ///
    /// @param id the agent identifier to look up, not null
    /// @return an {@link Optional} containing the agent if found, empty otherwise
    Optional<Agent> getAgent(String id);

    /// Retrieves an agent by ID or throws an exception if not found.
    ///
    /// @param id the agent identifier to look up, not null
    /// @return the agent instance, never null
    /// @throws AgentNotFoundException if no agent exists with the given ID
    Agent getAgentOrThrow(String id) throws AgentNotFoundException;

    /// Returns the registered agent, or creates and registers one whose model is the
    /// identifier itself.
    ///
    /// @param id the roster or arbiter identifier, not null
    /// @return the resolved agent, never null
    /// @throws AgentNotFoundException if no agent is registered and no provider supports
    ///     a model of that name
    Agent resolveAgent(String id) throws AgentNotFoundException;

    /// Creates and registers an agent with the given configuration.
    ///
    /// If an agent with the same ID already exists, it will be replaced.
    ///
    /// @apiNote **Side effects**:
    /// - Modifies internal agent registry
    /// - Overwrites existing agent if ID already registered
    /// - Logs registration at INFO level
    ///
    /// @param agentId unique identifier for the agent, not null or blank
    /// @param config agent configuration specifying model and parameters, not null
    /// @return the created and registered agent, never null
    /// @throws IllegalArgumentException if agentId is blank
    /// @throws IllegalStateException if no provider supports the configured model
    Agent registerAgent(String agentId, AgentConfig config);

    /// Registers a ready-made agent instance under its own ID.
    ///
    /// @param agent the agent to register, not null
    /// @return the registered agent, never null
    Agent registerAgent(Agent agent);

    /// Registers multiple agents from a configuration map.
    ///
    /// @param configs map of agent ID to configuration, not null (may be empty)
    /// @throws IllegalStateException if any configured model is unsupported
    void registerAgents(Map<String, AgentConfig> configs);

    /// Checks whether an agent with the given ID is registered.
    ///
    /// @param agentId the agent identifier to check, not null
    /// @return `true` if an agent with this ID exists, `false` otherwise
    boolean hasAgent(String agentId);
}
