package io.consortium.core.agent.stub;

import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentConfig;
import io.consortium.core.agent.spi.AgentProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Agent provider that answers every model with a {@link StubAgent}.
///
/// When enabled, intercepts ALL model requests with the highest priority (1000).
///
/// ### Enabling Stub Mode
/// Enable via any of these methods (checked in order):
/// - Credentials map: `credentials.put("CONSORTIUM_STUB_ENABLED", "true")`
/// - System property: `-Dconsortium.stub.enabled=true`
/// - Environment variable: `CONSORTIUM_STUB_ENABLED=true`
///
/// ### Priority Behavior
/// - When enabled: priority 1000 (intercepts all models)
/// - When disabled: priority -1 (never selected)
///
/// @implNote Thread-safe. Creates new {@link StubAgent} instances for each request.
///
/// @see StubResponseRegistry for configuring stub responses
public class StubAgentProvider implements AgentProvider {

    private static final Logger logger = Logger.getLogger(StubAgentProvider.class.getName());

    public static final String ENABLED_KEY = "CONSORTIUM_STUB_ENABLED";
    public static final String ENABLED_PROPERTY = "consortium.stub.enabled";

    private final Map<String, String> credentials;

    /// Creates a provider that only consults the system property and environment.
    public StubAgentProvider() {
        this(Map.of());
    }

    /// Creates a provider whose enablement may be overridden by the credentials map.
    ///
    /// @param credentials map that may contain `CONSORTIUM_STUB_ENABLED`, not null
    public StubAgentProvider(Map<String, String> credentials) {
        this.credentials = Map.copyOf(credentials);
    }

    @Override
    public String getName() {
        return "stub";
    }

    /// @param modelName model identifier (ignored), not null
    /// @return `true` for every model while stub mode is enabled
    @Override
    public boolean supportsModel(String modelName) {
        return isEnabled(credentials);
    }

    /// Creates a stub agent for the given configuration.
    ///
    /// @throws IllegalStateException if called while stub mode is disabled
    @Override
    public Agent createAgent(String agentId, AgentConfig config, Map<String, String> credentials) {
        if (!isEnabled(credentials)) {
            throw new IllegalStateException(
                    "Stub provider called but not enabled. This should not happen.");
        }

        logger.info(
                "[STUB] Creating stub agent: " + agentId + " (model: " + config.getModel() + ")");
        return new StubAgent(agentId, config);
    }

    /// @return 1000 when enabled (highest priority), -1 when disabled
    @Override
    public int getPriority() {
        return isEnabled(credentials) ? 1000 : -1;
    }

    /// Credentials map values take precedence over global settings.
    private boolean isEnabled(Map<String, String> credentials) {
        if (credentials != null) {
            String credValue = credentials.get(ENABLED_KEY);
            if (credValue == null) {
                credValue = credentials.get(ENABLED_PROPERTY);
            }
            if ("true".equalsIgnoreCase(credValue)) {
                return true;
            }
            if ("false".equalsIgnoreCase(credValue)) {
                return false;
            }
        }
        return isEnabledGlobally();
    }

    private boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }
}
