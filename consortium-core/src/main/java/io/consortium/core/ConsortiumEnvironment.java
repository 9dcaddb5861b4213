package io.consortium.core;

import io.consortium.core.agent.AgentRegistry;
import io.consortium.core.log.InteractionLog;
import io.consortium.core.orchestration.ConsortiumOrchestrator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Container holding the wired consortium components.
///
/// Implements {@link AutoCloseable} to release the thread pool and drain the
/// interaction log.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link ConsortiumFactory#createEnvironment()} or
/// {@link ConsortiumFactory.Builder} rather than direct construction.
public final class ConsortiumEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ConsortiumEnvironment.class.getName());

    private final ConsortiumOrchestrator orchestrator;
    private final AgentRegistry agentRegistry;
    private final InteractionLog interactionLog;
    private final ExecutorService executorService;

    public ConsortiumEnvironment(
            ConsortiumOrchestrator orchestrator,
            AgentRegistry agentRegistry,
            InteractionLog interactionLog,
            ExecutorService executorService) {
        this.orchestrator = orchestrator;
        this.agentRegistry = agentRegistry;
        this.interactionLog = interactionLog;
        this.executorService = executorService;
    }

    /// @return the orchestrator bound to this environment's registry, pool and log
    public ConsortiumOrchestrator getOrchestrator() {
        return orchestrator;
    }

    /// Returns the registry resolving roster and arbiter identifiers.
    ///
    /// Register agents with explicit {@link io.consortium.core.agent.AgentConfig}s here
    /// before running; unknown identifiers are created on first use with the identifier
    /// as model name.
    ///
    /// @return the agent registry, never null
    public AgentRegistry getAgentRegistry() {
        return agentRegistry;
    }

    public InteractionLog getInteractionLog() {
        return interactionLog;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Shuts down the thread pool and closes the interaction log.
    ///
    /// @apiNote **Side effects**:
    /// - In-flight invocations are interrupted
    /// - Pending log appends are drained before the log closes
    @Override
    public void close() {
        executorService.shutdownNow();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Agent thread pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        interactionLog.close();
    }
}
