package io.consortium.core.agent;

import io.consortium.core.exception.AgentNotFoundException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link AgentRegistry}.
///
/// Stores agents in a {@link ConcurrentHashMap} and delegates creation to
/// {@link AgentFactory}.
///
/// @implNote Thread-safe. Lazy resolution uses `computeIfAbsent`, so concurrent
/// orchestrations resolving the same identifier share one agent instance.
///
/// @see AgentFactory for agent creation
public class DefaultAgentRegistry implements AgentRegistry {

    private static final Logger logger = Logger.getLogger(DefaultAgentRegistry.class.getName());

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final AgentFactory agentFactory;

    /// Creates a new registry backed by the given agent factory.
    ///
    /// @param agentFactory factory for creating agents from configurations, not null
    /// @throws NullPointerException if agentFactory is null
    public DefaultAgentRegistry(AgentFactory agentFactory) {
        this.agentFactory = Objects.requireNonNull(agentFactory, "agentFactory must not be null");
    }

    @Override
    public Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public Agent getAgentOrThrow(String id) throws AgentNotFoundException {
        return getAgent(id).orElseThrow(() -> new AgentNotFoundException("Agent not found: " + id));
    }

    @Override
    public Agent resolveAgent(String id) throws AgentNotFoundException {
        Agent existing = agents.get(id);
        if (existing != null) {
            return existing;
        }
        if (!agentFactory.isModelSupported(id)) {
            throw new AgentNotFoundException(
                    "Agent not found and no provider supports model: " + id);
        }
        return agents.computeIfAbsent(
                id,
                key -> {
                    logger.info("Resolving agent '" + key + "' as model of the same name");
                    return agentFactory.createAgent(key, AgentConfig.forModel(key));
                });
    }

    /// Creates and registers an agent with the given configuration.
    ///
    /// If an agent with the same ID already exists, it will be replaced and a
    /// warning logged.
    ///
    /// @apiNote **Side effects**:
    /// - Modifies internal agent registry
    /// - Logs registration at INFO level
    ///
    /// @param agentId unique identifier for the agent, not null
    /// @param config agent configuration specifying model and parameters, not null
    /// @return the created and registered agent, never null
    /// @throws IllegalArgumentException if agentId is blank
    /// @throws IllegalStateException if no provider supports the configured model
    @Override
    public Agent registerAgent(String agentId, AgentConfig config) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Agent ID must not be blank");
        }
        if (agents.containsKey(agentId)) {
            logger.warning("Agent already exists: " + agentId + ". Replacing...");
        }

        Agent agent = agentFactory.createAgent(agentId, config);
        agents.put(agentId, agent);

        logger.info("Registered agent: " + agentId + " with model: " + config.getModel());
        return agent;
    }

    @Override
    public Agent registerAgent(Agent agent) {
        Objects.requireNonNull(agent, "agent must not be null");
        if (agents.put(agent.getId(), agent) != null) {
            logger.warning("Agent already exists: " + agent.getId() + ". Replaced.");
        }
        logger.info("Registered agent instance: " + agent.getId());
        return agent;
    }

    @Override
    public void registerAgents(Map<String, AgentConfig> configs) {
        configs.forEach(this::registerAgent);
    }

    /// Removes an agent from the registry.
    ///
    /// @param agentId the agent identifier to remove, not null
    /// @return `true` if an agent was removed, `false` if no agent with this ID existed
    public boolean unregisterAgent(String agentId) {
        Agent removed = agents.remove(agentId);
        if (removed != null) {
            logger.info("Unregistered agent: " + agentId);
            return true;
        }
        return false;
    }

    @Override
    public boolean hasAgent(String agentId) {
        return agents.containsKey(agentId);
    }

    /// Returns the IDs of all registered agents.
    ///
    /// @return unmodifiable set of agent IDs, never null (may be empty)
    public Set<String> getAgentIds() {
        return Collections.unmodifiableSet(agents.keySet());
    }
}
