package io.consortium.core.synthesis;

import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentResponse;
import io.consortium.core.agent.AgentResponse.TextResponse;
import io.consortium.core.exception.ArbiterException;
import io.consortium.core.orchestration.IterationRecord;
import io.consortium.core.orchestration.OrchestrationConfig;
import io.consortium.core.parse.AgentFailure;
import io.consortium.core.parse.RoundResponse;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Asks the arbiter agent to judge one round and parses its verdict.
///
/// The arbiter runs on the shared executor under the same per-invocation timeout as
/// the roster, so a hung arbiter or an interrupt of the orchestrating thread does not
/// block the run.
///
/// ### Contracts
/// - **Precondition**: `responses` holds only successful responses, at least one
/// - **Postcondition**: a returned result always has a confidence in [0, 1]
///
/// Any failure of the arbiter invocation is fatal for the run; there is no fallback
/// synthesis from the roster's responses.
///
/// @see ArbiterPromptBuilder
/// @see ArbiterResponseParser
public class ArbiterSynthesizer {

    private static final Logger logger = Logger.getLogger(ArbiterSynthesizer.class.getName());

    private final ExecutorService executorService;
    private final ArbiterPromptBuilder promptBuilder;
    private final ArbiterResponseParser responseParser;

    public ArbiterSynthesizer(ExecutorService executorService) {
        this(executorService, new ArbiterPromptBuilder(), new ArbiterResponseParser());
    }

    public ArbiterSynthesizer(
            ExecutorService executorService,
            ArbiterPromptBuilder promptBuilder,
            ArbiterResponseParser responseParser) {
        this.executorService = executorService;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
    }

    /// Synthesizes one round.
    ///
    /// @param originalQuery the user's query, not null
    /// @param history completed rounds, oldest first, not null
    /// @param responses successful responses of the current round, not empty
    /// @param config the orchestration configuration, not null
    /// @param arbiter the resolved arbiter agent, not null
    /// @return the parsed synthesis, never null
    /// @throws ArbiterException if the arbiter errors, throws or times out
    /// @throws InterruptedException if the calling thread is interrupted while waiting
    public SynthesisResult synthesize(
            String originalQuery,
            List<IterationRecord> history,
            List<RoundResponse> responses,
            OrchestrationConfig config,
            Agent arbiter)
            throws ArbiterException, InterruptedException {
        String prompt =
                promptBuilder.build(
                        originalQuery,
                        history,
                        responses,
                        config.getSystemPrompt(),
                        config.getJudgingMethod());

        logger.info(
                "Synthesizing "
                        + responses.size()
                        + " responses with arbiter '"
                        + config.getArbiterIdentifier()
                        + "' ("
                        + config.getJudgingMethod()
                        + ")");
        logger.fine("Arbiter prompt:\n" + prompt);

        AgentResponse response = invoke(arbiter, prompt, config);

        if (response instanceof TextResponse text) {
            SynthesisResult result =
                    responseParser.parse(text.content(), config.getJudgingMethod(), responses);
            logger.info("Arbiter confidence: " + result.confidence());
            return result;
        }

        AgentResponse.Error error = (AgentResponse.Error) response;
        throw new ArbiterException(
                "Arbiter '"
                        + config.getArbiterIdentifier()
                        + "' failed ("
                        + error.errorType()
                        + "): "
                        + error.message(),
                AgentFailure.from(error));
    }

    private AgentResponse invoke(Agent arbiter, String prompt, OrchestrationConfig config)
            throws ArbiterException, InterruptedException {
        Future<AgentResponse> future = executorService.submit(() -> arbiter.execute(prompt, null));
        try {
            return future.get(config.getAgentTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            String message =
                    "Arbiter '"
                            + config.getArbiterIdentifier()
                            + "' timed out after "
                            + config.getAgentTimeout();
            throw new ArbiterException(message, AgentFailure.timeout(message));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ArbiterException(
                    "Arbiter '" + config.getArbiterIdentifier() + "' threw: " + cause.getMessage(),
                    AgentFailure.from(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
