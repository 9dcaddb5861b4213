package io.consortium.core.agent;

import io.consortium.core.agent.spi.AgentProvider;
import java.util.*;
import java.util.logging.Logger;

/// Factory for creating agents from explicitly wired providers.
///
/// When creating an agent, selects the highest-priority provider that supports the
/// requested model. Providers are passed in by {@link io.consortium.core.ConsortiumFactory};
/// the stub provider is always among them and only wins when stub mode is enabled.
///
/// @implNote Thread-safe after construction. Provider list and credentials are
/// immutable once the factory is created. Individual provider thread-safety
/// depends on the provider implementation.
///
/// @see AgentProvider for implementing custom agent backends
/// @see AgentRegistry for agent lifecycle management
public class AgentFactory {

    private static final Logger logger = Logger.getLogger(AgentFactory.class.getName());

    private final List<AgentProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a new agent factory with the given credentials and providers.
    ///
    /// @param credentials map of credential keys to values (e.g., `ANTHROPIC_API_KEY`), not null
    /// @param providers the providers to choose from, not null (may be empty)
    /// @throws NullPointerException if any argument is null
    public AgentFactory(Map<String, String> credentials, List<AgentProvider> providers) {
        this.credentials = Map.copyOf(credentials);
        this.providers = List.copyOf(providers);

        logger.info(
                "Loaded "
                        + this.providers.size()
                        + " agent providers: "
                        + this.providers.stream().map(AgentProvider::getName).toList());
    }

    /// Creates an agent using the appropriate provider for the configured model.
    ///
    /// @param agentId unique identifier for the agent, not null
    /// @param config agent configuration specifying model and parameters, not null
    /// @return the created agent, never null
    /// @throws IllegalStateException if no provider supports the configured model
    public Agent createAgent(String agentId, AgentConfig config) {
        String modelName = config.getModel();

        AgentProvider provider =
                selectProvider(modelName)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for model: "
                                                        + modelName
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(AgentProvider::getName)
                                                                .toList()));

        logger.info("Creating agent '" + agentId + "' with provider: " + provider.getName());
        return provider.createAgent(agentId, config, credentials);
    }

    /// Checks if any loaded provider supports the given model.
    ///
    /// @param modelName the model identifier to check (e.g., `claude-sonnet-4`), not null
    /// @return `true` if at least one provider supports this model, `false` otherwise
    public boolean isModelSupported(String modelName) {
        return selectProvider(modelName).isPresent();
    }

    private Optional<AgentProvider> selectProvider(String modelName) {
        return providers.stream()
                .filter(p -> p.supportsModel(modelName))
                .max(Comparator.comparingInt(AgentProvider::getPriority));
    }
}
