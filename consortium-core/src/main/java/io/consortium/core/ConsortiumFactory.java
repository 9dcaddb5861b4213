package io.consortium.core;

import io.consortium.core.agent.AgentFactory;
import io.consortium.core.agent.AgentRegistry;
import io.consortium.core.agent.DefaultAgentRegistry;
import io.consortium.core.agent.spi.AgentProvider;
import io.consortium.core.agent.stub.StubAgentProvider;
import io.consortium.core.log.AsyncInteractionLog;
import io.consortium.core.log.InteractionLog;
import io.consortium.core.orchestration.ConsortiumOrchestrator;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Factory for creating and wiring consortium environments.
///
/// Provides static factory methods and a fluent {@link Builder} for constructing
/// fully-configured {@link ConsortiumEnvironment} instances. Handles credential
/// loading, provider wiring, and thread pool creation with zero external dependencies.
///
/// ### Usage Patterns
///
/// **Builder with explicit providers**:
/// {@snippet :
/// var env = ConsortiumFactory.builder()
///     .config(ConsortiumConfig.builder().threadPoolSize(8).build())
///     .loadCredentials(properties)
///     .agentProvider(new LangChain4jProvider())
///     .interactionLog(new JsonLinesInteractionLog(path))
///     .build();
/// }
///
/// **Offline with stub agents**:
/// {@snippet :
/// var env = ConsortiumFactory.builder().stubMode(true).build();
/// }
///
/// @see ConsortiumEnvironment
/// @see ConsortiumConfig
public final class ConsortiumFactory {

    static final String CREDENTIALS_PREFIX = "consortium.credentials.";

    private ConsortiumFactory() {}

    /// Creates an environment with default configuration and credentials discovered
    /// from environment variables. Only the stub provider is available.
    ///
    /// @return a fully-configured environment, never null
    public static ConsortiumEnvironment createEnvironment() {
        return builder().build();
    }

    /// Creates an environment with custom configuration and credentials discovered
    /// from environment variables. Only the stub provider is available.
    ///
    /// @param config thread pool configuration, not null
    /// @return a fully-configured environment, never null
    public static ConsortiumEnvironment createEnvironment(ConsortiumConfig config) {
        return builder().config(config).build();
    }

    /// Discovers and loads API credentials from environment variables.
    ///
    /// Picks up variables matching `*_API_KEY`, `*_KEY`, `*_SECRET` and `*_TOKEN`,
    /// plus `CONSORTIUM_STUB_ENABLED`.
    ///
    /// @return map of discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        return credentialsFrom(System.getenv());
    }

    static Map<String, String> credentialsFrom(Map<String, String> environment) {
        Map<String, String> credentials = new HashMap<>();
        environment.forEach(
                (key, value) -> {
                    if (value != null
                            && !value.isEmpty()
                            && (isApiKeyPattern(key)
                                    || key.equals(StubAgentProvider.ENABLED_KEY))) {
                        credentials.put(key, value);
                    }
                });
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase(Locale.ROOT);
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    /// Loads credentials from a Properties object.
    ///
    /// Supports multiple patterns:
    /// - Prefixed keys (e.g., `consortium.credentials.ANTHROPIC_API_KEY=sk-...`), prefix stripped
    /// - Direct API key names (e.g., `ANTHROPIC_API_KEY=sk-...`)
    /// - Stub mode setting: `consortium.stub.enabled=true`
    ///
    /// @param properties the properties to extract credentials from, not null
    /// @return map of credential keys to their values, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();

        for (String key : properties.stringPropertyNames()) {
            String value = properties.getProperty(key);
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (key.startsWith(CREDENTIALS_PREFIX)) {
                credentials.put(key.substring(CREDENTIALS_PREFIX.length()), value);
            } else if (key.equals(StubAgentProvider.ENABLED_PROPERTY)) {
                credentials.put(StubAgentProvider.ENABLED_KEY, value);
            } else if (isApiKeyPattern(key)) {
                credentials.put(key, value);
            }
        }
        return credentials;
    }

    /// Loads credentials from both environment variables and properties.
    ///
    /// Properties take precedence over environment variables when the same
    /// key exists in both sources.
    ///
    /// @param properties the properties to merge with environment credentials, not null
    /// @return merged map of credentials, never null
    public static Map<String, String> loadCredentials(Properties properties) {
        Map<String, String> credentials = loadCredentialsFromEnvironment();
        credentials.putAll(loadCredentialsFromProperties(properties));
        return credentials;
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ConsortiumEnvironment}.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration
    /// before calling {@link #build()}.
    public static class Builder {
        private ConsortiumConfig config = new ConsortiumConfig();
        private Map<String, String> credentials = new HashMap<>();
        private final List<AgentProvider> agentProviders = new ArrayList<>();
        private AgentRegistry agentRegistry;
        private ExecutorService executorService;
        private InteractionLog interactionLog = InteractionLog.NOOP;

        private Builder() {}

        public Builder config(ConsortiumConfig config) {
            this.config = config;
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Adds an agent provider.
        ///
        /// The built-in {@link StubAgentProvider} is always included; do not add it.
        ///
        /// @param provider the agent provider, not null
        /// @return this builder for chaining, never null
        public Builder agentProvider(AgentProvider provider) {
            this.agentProviders.add(provider);
            return this;
        }

        public Builder agentProviders(List<AgentProvider> providers) {
            this.agentProviders.addAll(providers);
            return this;
        }

        /// Enables or disables stub mode for running without API calls.
        ///
        /// @param enabled `true` to answer every model with a stub agent
        /// @return this builder for chaining, never null
        public Builder stubMode(boolean enabled) {
            this.credentials.put(StubAgentProvider.ENABLED_KEY, String.valueOf(enabled));
            return this;
        }

        /// Sets a custom agent registry; providers and credentials are then unused.
        ///
        /// @param agentRegistry the registry, may be null for default
        /// @return this builder for chaining, never null
        public Builder agentRegistry(AgentRegistry agentRegistry) {
            this.agentRegistry = agentRegistry;
            return this;
        }

        /// Sets a custom executor service for agent invocations.
        ///
        /// @param executorService the thread pool, may be null for auto-created pool
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Sets the sink receiving every completed round.
        ///
        /// @param interactionLog the sink, not null
        /// @return this builder for chaining, never null
        public Builder interactionLog(InteractionLog interactionLog) {
            this.interactionLog = Objects.requireNonNull(interactionLog, "interactionLog");
            return this;
        }

        public Builder loadCredentialsFromEnvironment() {
            this.credentials.putAll(ConsortiumFactory.loadCredentialsFromEnvironment());
            return this;
        }

        public Builder loadCredentialsFromProperties(Properties properties) {
            this.credentials.putAll(ConsortiumFactory.loadCredentialsFromProperties(properties));
            return this;
        }

        public Builder loadCredentials(Properties properties) {
            this.credentials.putAll(ConsortiumFactory.loadCredentials(properties));
            return this;
        }

        /// Builds and returns the configured {@link ConsortiumEnvironment}.
        ///
        /// @apiNote **Side effects**:
        /// - Auto-loads environment credentials if none were explicitly provided
        /// - Creates a thread pool if none was provided
        /// - Starts the interaction log's background writer when async logging is enabled
        ///
        /// @return the configured environment, never null
        public ConsortiumEnvironment build() {
            if (credentials.isEmpty()) {
                credentials = ConsortiumFactory.loadCredentialsFromEnvironment();
            }
            if (executorService == null) {
                executorService =
                        Executors.newFixedThreadPool(
                                config.getThreadPoolSize(), namedThreads("consortium-agent-"));
            }
            if (agentRegistry == null) {
                List<AgentProvider> allProviders = new ArrayList<>(agentProviders);
                allProviders.add(new StubAgentProvider(credentials));
                AgentFactory agentFactory = new AgentFactory(credentials, allProviders);
                agentRegistry = new DefaultAgentRegistry(agentFactory);
            }
            InteractionLog log =
                    config.isAsyncInteractionLog()
                            ? new AsyncInteractionLog(interactionLog)
                            : interactionLog;

            ConsortiumOrchestrator orchestrator =
                    new ConsortiumOrchestrator(agentRegistry, executorService, log);
            return new ConsortiumEnvironment(orchestrator, agentRegistry, log, executorService);
        }

        private static ThreadFactory namedThreads(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
