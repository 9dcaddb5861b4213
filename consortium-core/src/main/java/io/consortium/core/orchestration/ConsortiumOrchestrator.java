package io.consortium.core.orchestration;

import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentRegistry;
import io.consortium.core.convergence.ConvergenceDecision;
import io.consortium.core.convergence.ConvergenceEvaluator;
import io.consortium.core.dispatch.AgentTask;
import io.consortium.core.dispatch.DispatchContext;
import io.consortium.core.dispatch.DispatchResult;
import io.consortium.core.dispatch.Dispatcher;
import io.consortium.core.exception.AgentNotFoundException;
import io.consortium.core.exception.AllAgentsFailedException;
import io.consortium.core.exception.ArbiterException;
import io.consortium.core.exception.ConsortiumConfigurationException;
import io.consortium.core.log.InteractionLog;
import io.consortium.core.parse.ResponseParser;
import io.consortium.core.parse.RoundResponse;
import io.consortium.core.synthesis.ArbiterSynthesizer;
import io.consortium.core.synthesis.SynthesisResult;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Runs the consortium loop: dispatch, synthesize, evaluate, and refine until the
/// convergence rule stops it.
///
/// ### Execution Flow
/// 1. Resolve every roster identifier and the arbiter; fail fast with
///    {@link ConsortiumConfigurationException} before anything is dispatched
/// 2. Dispatch the round's prompt to every task in parallel and wait for all of them
/// 3. Ask the arbiter to judge the successful responses
/// 4. Evaluate confidence and round number; append the round to history and log
/// 5. Stop, or build the refinement prompt and go to step 2
///
/// ### Outcomes
/// Exactly one {@link OrchestrationResult} per call. Failed runs carry the rounds
/// completed before the failure. Interrupting the calling thread cancels in-flight
/// invocations and returns {@link FailureKind#CANCELLED} with the interrupt flag restored.
///
/// @implNote Thread-safe. All per-run state lives on the calling thread's stack, so
/// one orchestrator may serve concurrent runs.
///
/// @see ConvergenceEvaluator for the stopping rule
/// @see io.consortium.core.ConsortiumEnvironment for a fully wired instance
public class ConsortiumOrchestrator {

    private static final Logger logger = Logger.getLogger(ConsortiumOrchestrator.class.getName());

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AgentRegistry agentRegistry;
    private final Dispatcher dispatcher;
    private final ArbiterSynthesizer synthesizer;
    private final ConvergenceEvaluator convergenceEvaluator;
    private final IterationPromptBuilder promptBuilder;
    private final InteractionLog interactionLog;

    /// Creates an orchestrator with the standard collaborators.
    ///
    /// @param agentRegistry resolves roster and arbiter identifiers, not null
    /// @param executorService runs agent invocations, not null, not shut down by this class
    /// @param interactionLog receives every completed round, not null
    public ConsortiumOrchestrator(
            AgentRegistry agentRegistry,
            ExecutorService executorService,
            InteractionLog interactionLog) {
        this(
                agentRegistry,
                new Dispatcher(executorService, new ResponseParser()),
                new ArbiterSynthesizer(executorService),
                new ConvergenceEvaluator(),
                new IterationPromptBuilder(),
                interactionLog);
    }

    public ConsortiumOrchestrator(
            AgentRegistry agentRegistry,
            Dispatcher dispatcher,
            ArbiterSynthesizer synthesizer,
            ConvergenceEvaluator convergenceEvaluator,
            IterationPromptBuilder promptBuilder,
            InteractionLog interactionLog) {
        this.agentRegistry = Objects.requireNonNull(agentRegistry, "agentRegistry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.convergenceEvaluator =
                Objects.requireNonNull(convergenceEvaluator, "convergenceEvaluator");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
        this.interactionLog = Objects.requireNonNull(interactionLog, "interactionLog");
    }

    public OrchestrationResult orchestrate(String query, OrchestrationConfig config) {
        return orchestrate(query, config, List.of(), OrchestrationListener.NOOP);
    }

    public OrchestrationResult orchestrate(
            String query, OrchestrationConfig config, List<ConversationTurn> conversation) {
        return orchestrate(query, config, conversation, OrchestrationListener.NOOP);
    }

    /// Runs one orchestration.
    ///
    /// @param query the user's query, not blank
    /// @param config validated run parameters, not null
    /// @param conversation earlier exchanges replayed before the query, not null
    /// @param listener lifecycle callbacks, not null
    /// @return the terminal outcome, never null
    /// @throws ConsortiumConfigurationException if the query is blank or an identifier
    ///     cannot be resolved
    public OrchestrationResult orchestrate(
            String query,
            OrchestrationConfig config,
            List<ConversationTurn> conversation,
            OrchestrationListener listener) {
        if (query == null || query.isBlank()) {
            throw new ConsortiumConfigurationException("Query must not be blank");
        }
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(conversation, "conversation must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        List<AgentTask> tasks = AgentTask.expand(config.getRoster(), resolveRoster(config));
        Agent arbiter = resolve(config.getArbiterIdentifier(), "arbiter");

        String runId = newRunId();
        logger.info(
                "Starting consortium run "
                        + runId
                        + " with "
                        + tasks.size()
                        + " tasks per round: "
                        + config);

        List<IterationRecord> history = new ArrayList<>();
        List<IterationRecord> historyView = Collections.unmodifiableList(history);
        String prompt = promptBuilder.initialPrompt(query, conversation);

        for (int round = 1; ; round++) {
            Instant startedAt = Instant.now();

            transition(listener, round, OrchestrationState.DISPATCHING);
            listener.onRoundStart(runId, round, prompt);
            DispatchContext context =
                    new DispatchContext(
                            round, config.getSystemPrompt(), config.getAgentTimeout(), listener);

            DispatchResult dispatched;
            try {
                dispatched = dispatcher.dispatch(prompt, tasks, context);
            } catch (AllAgentsFailedException e) {
                return fail(
                        runId,
                        new OrchestrationFailure(
                                FailureKind.ALL_AGENTS_FAILED,
                                round,
                                e.getMessage(),
                                e.getFailures(),
                                e),
                        history,
                        listener);
            } catch (InterruptedException e) {
                return cancel(runId, round, history, listener, e);
            }

            transition(listener, round, OrchestrationState.SYNTHESIZING);
            SynthesisResult synthesis;
            try {
                synthesis =
                        synthesizer.synthesize(
                                query, historyView, dispatched.successes(), config, arbiter);
            } catch (ArbiterException e) {
                RoundResponse arbiterFailure =
                        RoundResponse.failure(config.getArbiterIdentifier(), 1, e.getFailure());
                return fail(
                        runId,
                        new OrchestrationFailure(
                                FailureKind.ARBITER_FAILED,
                                round,
                                e.getMessage(),
                                List.of(arbiterFailure),
                                e),
                        history,
                        listener);
            } catch (InterruptedException e) {
                return cancel(runId, round, history, listener, e);
            }
            listener.onSynthesisComplete(round, synthesis);

            transition(listener, round, OrchestrationState.EVALUATING);
            ConvergenceDecision decision =
                    convergenceEvaluator.evaluate(synthesis.confidence(), round, config);
            logger.info(
                    "Round "
                            + round
                            + " of run "
                            + runId
                            + ": confidence "
                            + synthesis.confidence()
                            + " -> "
                            + decision);

            IterationRecord record =
                    new IterationRecord(
                            runId,
                            round,
                            prompt,
                            dispatched.responses(),
                            synthesis,
                            decision,
                            startedAt,
                            Instant.now());
            history.add(record);
            appendToLog(record);
            listener.onRoundComplete(record);

            if (decision.isStop()) {
                transition(listener, round, OrchestrationState.DONE);
                return complete(runId, config, history, decision);
            }

            transition(listener, round, OrchestrationState.CONTINUING);
            if (Thread.currentThread().isInterrupted()) {
                return cancel(runId, round + 1, history, listener, null);
            }
            prompt = promptBuilder.refinementPrompt(query, synthesis);
        }
    }

    private Map<String, Agent> resolveRoster(OrchestrationConfig config) {
        Map<String, Agent> agents = new LinkedHashMap<>();
        for (String identifier : config.getRoster().identifiers()) {
            agents.put(identifier, resolve(identifier, "roster agent"));
        }
        return agents;
    }

    private Agent resolve(String identifier, String role) {
        try {
            return agentRegistry.resolveAgent(identifier);
        } catch (AgentNotFoundException e) {
            throw new ConsortiumConfigurationException(
                    "Cannot resolve " + role + " '" + identifier + "': " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ConsortiumConfigurationException(
                    "Cannot create " + role + " '" + identifier + "': " + e.getMessage(), e);
        }
    }

    private OrchestrationResult complete(
            String runId,
            OrchestrationConfig config,
            List<IterationRecord> history,
            ConvergenceDecision decision) {
        IterationRecord retained = config.getRetentionPolicy().select(history);
        RunMetadata metadata =
                new RunMetadata(
                        config.getRoster().instanceCounts(),
                        config.getArbiterIdentifier(),
                        Instant.now(),
                        history.size(),
                        decision,
                        config.getJudgingMethod(),
                        retained.roundNumber());

        logger.info(
                "Consortium run "
                        + runId
                        + " completed after "
                        + history.size()
                        + " round(s) ("
                        + decision
                        + "), final confidence "
                        + retained.synthesis().confidence());
        return new OrchestrationResult.Completed(runId, retained.synthesis(), history, metadata);
    }

    private OrchestrationResult fail(
            String runId,
            OrchestrationFailure failure,
            List<IterationRecord> history,
            OrchestrationListener listener) {
        transition(listener, failure.round(), OrchestrationState.FAILED);
        logger.warning(
                "Consortium run "
                        + runId
                        + " failed in round "
                        + failure.round()
                        + " ("
                        + failure.kind()
                        + "): "
                        + failure.message());
        return new OrchestrationResult.Failed(runId, failure, history);
    }

    private OrchestrationResult cancel(
            String runId,
            int round,
            List<IterationRecord> history,
            OrchestrationListener listener,
            InterruptedException cause) {
        Thread.currentThread().interrupt();
        return fail(
                runId,
                new OrchestrationFailure(
                        FailureKind.CANCELLED,
                        round,
                        "Orchestration cancelled in round " + round,
                        List.of(),
                        cause),
                history,
                listener);
    }

    private void appendToLog(IterationRecord record) {
        try {
            interactionLog.append(record);
        } catch (RuntimeException e) {
            logger.warning(
                    "Interaction log rejected round "
                            + record.roundNumber()
                            + " of run "
                            + record.runId()
                            + ": "
                            + e.getMessage());
        }
    }

    private void transition(OrchestrationListener listener, int round, OrchestrationState state) {
        logger.fine("Round " + round + ": " + state);
        listener.onStateChange(round, state);
    }

    /// @return a random 16-hex-character run identifier
    static String newRunId() {
        byte[] bytes = new byte[8];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
