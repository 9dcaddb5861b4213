package io.consortium.core.orchestration;

import static io.consortium.core.agent.ScriptedAgent.agentReply;
import static io.consortium.core.agent.ScriptedAgent.synthesisReply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.consortium.core.agent.AgentFactory;
import io.consortium.core.agent.AgentResponse.Error.ErrorType;
import io.consortium.core.agent.DefaultAgentRegistry;
import io.consortium.core.agent.ScriptedAgent;
import io.consortium.core.convergence.ConvergenceDecision;
import io.consortium.core.convergence.RetentionPolicy;
import io.consortium.core.exception.ConsortiumConfigurationException;
import io.consortium.core.exception.OrchestrationFailedException;
import io.consortium.core.log.InMemoryInteractionLog;
import io.consortium.core.log.InteractionLog;
import io.consortium.core.parse.RoundResponse;
import io.consortium.core.synthesis.JudgingMethod;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConsortiumOrchestratorTest {

    private ExecutorService executor;
    private DefaultAgentRegistry registry;
    private InMemoryInteractionLog interactionLog;
    private ConsortiumOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new DefaultAgentRegistry(new AgentFactory(Map.of(), List.of()));
        interactionLog = new InMemoryInteractionLog();
        orchestrator = new ConsortiumOrchestrator(registry, executor, interactionLog);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    class ConvergenceTest {

        @Test
        @DisplayName("three agents, arbiter confident in round 2: two rounds, no third")
        void shouldStopOnceArbiterIsConfidentEnough() {
            // Given
            ScriptedAgent x = register(ScriptedAgent.replying("x", agentReply("4", 0.9)));
            ScriptedAgent y = register(ScriptedAgent.replying("y", agentReply("4", 0.8)));
            ScriptedAgent z = register(ScriptedAgent.replying("z", agentReply("five", 0.3)));
            ScriptedAgent judge =
                    register(
                            ScriptedAgent.replying(
                                    "judge",
                                    synthesisReply(0.6, "settle the disagreement"),
                                    synthesisReply(0.85)));
            OrchestrationConfig config =
                    baseConfig("x,y,z").confidenceThreshold(0.8).maxIterations(3).build();

            // When
            OrchestrationResult result = orchestrator.orchestrate("What is 2+2?", config);

            // Then
            OrchestrationResult.Completed completed = result.getOrThrow();
            assertThat(completed.iterationCount()).isEqualTo(2);
            assertThat(completed.confidence()).isEqualTo(0.85);
            assertThat(completed.synthesisText()).isEqualTo("synthesis at 0.85");
            assertThat(completed.metadata().stopReason()).isEqualTo(ConvergenceDecision.CONVERGED);
            assertThat(completed.metadata().modelsUsed())
                    .containsOnly(Map.entry("x", 1), Map.entry("y", 1), Map.entry("z", 1));
            assertThat(completed.metadata().arbiter()).isEqualTo("judge");
            assertThat(completed.runId()).matches("[0-9a-f]{16}");

            assertThat(completed.history())
                    .extracting(IterationRecord::decision)
                    .containsExactly(ConvergenceDecision.CONTINUE, ConvergenceDecision.CONVERGED);
            assertThat(completed.history().get(0).responses()).hasSize(3);
            assertThat(x.invocations()).isEqualTo(2);
            assertThat(y.invocations()).isEqualTo(2);
            assertThat(z.invocations()).isEqualTo(2);
            assertThat(judge.invocations()).isEqualTo(2);

            assertThat(x.getPrompts().get(0)).contains("Human: What is 2+2?");
            assertThat(x.getPrompts().get(1))
                    .contains("Refining response for original prompt:")
                    .contains("- settle the disagreement");
            assertThat(judge.getPrompts().get(1))
                    .contains("<iteration_number>1</iteration_number>");
        }

        @Test
        void shouldRunExactlyMinRoundsWhenMinEqualsMax() {
            register(ScriptedAgent.replying("x", agentReply("a", 0.9)));
            register(ScriptedAgent.replying("judge", synthesisReply(0.99)));
            OrchestrationConfig config = baseConfig("x").minIterations(3).maxIterations(3).build();

            OrchestrationResult.Completed completed =
                    orchestrator.orchestrate("q", config).getOrThrow();

            assertThat(completed.iterationCount()).isEqualTo(3);
            assertThat(completed.metadata().stopReason()).isEqualTo(ConvergenceDecision.CONVERGED);
        }

        @Test
        void shouldStopAtCeilingWithLastSynthesis() {
            register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(
                    ScriptedAgent.replying(
                            "judge",
                            synthesisReply(0.3, "more"),
                            synthesisReply(0.5, "more"),
                            synthesisReply(0.4, "more")));
            OrchestrationConfig config = baseConfig("x").maxIterations(3).build();

            OrchestrationResult.Completed completed =
                    orchestrator.orchestrate("q", config).getOrThrow();

            assertThat(completed.iterationCount()).isEqualTo(3);
            assertThat(completed.confidence()).isEqualTo(0.4);
            assertThat(completed.metadata().stopReason())
                    .isEqualTo(ConvergenceDecision.ITERATION_LIMIT);
            assertThat(completed.metadata().retainedRound()).isEqualTo(3);
        }

        @Test
        void shouldRetainBestRoundWhenConfigured() {
            register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(
                    ScriptedAgent.replying(
                            "judge",
                            synthesisReply(0.3, "more"),
                            synthesisReply(0.7, "more"),
                            synthesisReply(0.4, "more")));
            OrchestrationConfig config =
                    baseConfig("x")
                            .maxIterations(3)
                            .retentionPolicy(RetentionPolicy.BEST_CONFIDENCE)
                            .build();

            OrchestrationResult.Completed completed =
                    orchestrator.orchestrate("q", config).getOrThrow();

            assertThat(completed.confidence()).isEqualTo(0.7);
            assertThat(completed.metadata().retainedRound()).isEqualTo(2);
            assertThat(completed.history()).hasSize(3);
        }

        @Test
        void shouldRunSingleRoundForPickOne() {
            register(ScriptedAgent.replying("x", agentReply("from x", 0.5)));
            register(ScriptedAgent.replying("y", agentReply("from y", 0.5)));
            register(ScriptedAgent.replying("judge", "<response_id>2</response_id>"));
            OrchestrationConfig config =
                    baseConfig("x,y")
                            .maxIterations(5)
                            .judgingMethod(JudgingMethod.PICK_ONE)
                            .build();

            OrchestrationResult.Completed completed =
                    orchestrator.orchestrate("q", config).getOrThrow();

            assertThat(completed.iterationCount()).isEqualTo(1);
            assertThat(completed.synthesisText()).isEqualTo("from y");
            assertThat(completed.synthesis().chosenId()).isEqualTo(2);
            assertThat(completed.metadata().judgingMethod()).isEqualTo(JudgingMethod.PICK_ONE);
        }

        @Test
        void shouldSendEveryInstanceTheSamePromptAndNumberAllResponses() {
            ScriptedAgent x = register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            ScriptedAgent judge = register(ScriptedAgent.replying("judge", synthesisReply(0.9)));

            orchestrator.orchestrate("q", baseConfig("x:3").build()).getOrThrow();

            assertThat(x.invocations()).isEqualTo(3);
            assertThat(x.getPrompts()).containsOnly(x.getPrompts().get(0));
            assertThat(judge.getPrompts().get(0))
                    .contains("<id>3</id>\n<model>x</model>\n<instance>3</instance>");
        }

        @Test
        void shouldIncludeConversationHistoryInFirstPrompt() {
            ScriptedAgent x = register(ScriptedAgent.replying("x", agentReply("6", 0.9)));
            register(ScriptedAgent.replying("judge", synthesisReply(0.9)));

            orchestrator.orchestrate(
                    "And 3+3?",
                    baseConfig("x").build(),
                    List.of(new ConversationTurn("What is 2+2?", "4")));

            assertThat(x.getPrompts().get(0))
                    .contains("Human: What is 2+2?\nAssistant: 4\n\nHuman: And 3+3?");
        }
    }

    @Nested
    class FailureTest {

        @Test
        void shouldFailWithoutInvokingArbiterWhenAllAgentsFail() {
            // Given
            register(ScriptedAgent.failing("x", ErrorType.TRANSPORT));
            register(ScriptedAgent.throwing("y", new IllegalStateException("boom")));
            ScriptedAgent judge = register(ScriptedAgent.replying("judge", synthesisReply(0.9)));

            // When
            OrchestrationResult result = orchestrator.orchestrate("q", baseConfig("x,y").build());

            // Then
            assertThat(result).isInstanceOf(OrchestrationResult.Failed.class);
            OrchestrationFailure failure = ((OrchestrationResult.Failed) result).failure();
            assertThat(failure.kind()).isEqualTo(FailureKind.ALL_AGENTS_FAILED);
            assertThat(failure.round()).isEqualTo(1);
            assertThat(failure.failedAgents())
                    .extracting(RoundResponse::taskLabel)
                    .containsExactly("x#1", "y#1");
            assertThat(judge.invocations()).isZero();
            assertThat(result.history()).isEmpty();
            assertThatThrownBy(result::getOrThrow)
                    .isInstanceOf(OrchestrationFailedException.class);
        }

        @Test
        void shouldContinueWithSurvivorsOnPartialFailure() {
            register(ScriptedAgent.failing("x", ErrorType.PROVIDER));
            register(ScriptedAgent.replying("y", agentReply("ok", 0.9)));
            ScriptedAgent judge = register(ScriptedAgent.replying("judge", synthesisReply(0.9)));

            OrchestrationResult.Completed completed =
                    orchestrator.orchestrate("q", baseConfig("x,y").build()).getOrThrow();

            IterationRecord round = completed.history().get(0);
            assertThat(round.responses()).hasSize(2);
            assertThat(round.successfulResponses())
                    .extracting(RoundResponse::agentIdentifier)
                    .containsExactly("y");
            assertThat(judge.getPrompts().get(0))
                    .contains("<model>y</model>")
                    .doesNotContain("<model>x</model>");
        }

        @Test
        void shouldFailWhenArbiterFails() {
            register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(ScriptedAgent.failing("judge", ErrorType.TIMEOUT));

            OrchestrationResult result = orchestrator.orchestrate("q", baseConfig("x").build());

            assertThat(result).isInstanceOf(OrchestrationResult.Failed.class);
            OrchestrationFailure failure = ((OrchestrationResult.Failed) result).failure();
            assertThat(failure.kind()).isEqualTo(FailureKind.ARBITER_FAILED);
            assertThat(failure.message()).contains("judge");
            assertThat(failure.failedAgents())
                    .singleElement()
                    .satisfies(
                            arbiter -> {
                                assertThat(arbiter.agentIdentifier()).isEqualTo("judge");
                                assertThat(arbiter.isSuccess()).isFalse();
                                assertThat(arbiter.error().errorType())
                                        .isEqualTo(ErrorType.TIMEOUT);
                            });
            assertThat(interactionLog.getRecords()).isEmpty();
        }

        @Test
        void shouldReportArbiterTransportFailureWithItsErrorType() {
            // Given
            register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(ScriptedAgent.failing("judge", ErrorType.TRANSPORT));

            // When
            OrchestrationResult result = orchestrator.orchestrate("q", baseConfig("x").build());

            // Then
            OrchestrationFailure failure = ((OrchestrationResult.Failed) result).failure();
            assertThat(failure.kind()).isEqualTo(FailureKind.ARBITER_FAILED);
            assertThat(failure.failedAgents().get(0).error().errorType())
                    .isEqualTo(ErrorType.TRANSPORT);
            assertThat(failure.failedAgents().get(0).error().message())
                    .isEqualTo("judge failed");
        }

        @Test
        void shouldRejectUnresolvableIdentifierBeforeDispatch() {
            ScriptedAgent x = register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(ScriptedAgent.replying("judge", synthesisReply(0.9)));

            assertThatThrownBy(() -> orchestrator.orchestrate("q", baseConfig("x,ghost").build()))
                    .isInstanceOf(ConsortiumConfigurationException.class)
                    .hasMessageContaining("ghost");
            assertThat(x.invocations()).isZero();
        }

        @Test
        void shouldRejectUnresolvableArbiterBeforeDispatch() {
            ScriptedAgent x = register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            OrchestrationConfig config =
                    OrchestrationConfig.builder().roster("x").arbiter("nobody").build();

            assertThatThrownBy(() -> orchestrator.orchestrate("q", config))
                    .isInstanceOf(ConsortiumConfigurationException.class)
                    .hasMessageContaining("arbiter 'nobody'");
            assertThat(x.invocations()).isZero();
        }

        @Test
        void shouldRejectBlankQuery() {
            assertThatThrownBy(() -> orchestrator.orchestrate(" ", baseConfig("x").build()))
                    .isInstanceOf(ConsortiumConfigurationException.class);
        }
    }

    @Nested
    class CancellationTest {

        @Test
        void shouldReturnCancelledAndRestoreInterruptFlag() throws Exception {
            // Given
            ScriptedAgent slow = register(ScriptedAgent.hanging("x"));
            register(ScriptedAgent.replying("judge", synthesisReply(0.9)));
            OrchestrationConfig config =
                    baseConfig("x").agentTimeout(Duration.ofMinutes(1)).build();
            AtomicReference<OrchestrationResult> outcome = new AtomicReference<>();
            AtomicBoolean interruptedAfter = new AtomicBoolean();

            Thread caller =
                    new Thread(
                            () -> {
                                outcome.set(orchestrator.orchestrate("q", config));
                                interruptedAfter.set(Thread.currentThread().isInterrupted());
                            });

            // When
            caller.start();
            assertThat(slow.started().await(5, TimeUnit.SECONDS)).isTrue();
            caller.interrupt();
            caller.join(5_000);

            // Then
            assertThat(caller.isAlive()).isFalse();
            assertThat(outcome.get()).isInstanceOf(OrchestrationResult.Failed.class);
            OrchestrationFailure failure = ((OrchestrationResult.Failed) outcome.get()).failure();
            assertThat(failure.kind()).isEqualTo(FailureKind.CANCELLED);
            assertThat(failure.round()).isEqualTo(1);
            assertThat(interruptedAfter).isTrue();
        }
    }

    @Nested
    class ObservationTest {

        @Test
        void shouldAppendEveryRoundToInteractionLog() {
            register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(
                    ScriptedAgent.replying(
                            "judge", synthesisReply(0.5, "more"), synthesisReply(0.9)));

            OrchestrationResult result =
                    orchestrator.orchestrate("q", baseConfig("x").maxIterations(3).build());

            assertThat(interactionLog.getRecords(result.runId()))
                    .extracting(IterationRecord::roundNumber)
                    .containsExactly(1, 2);
        }

        @Test
        void shouldCompleteEvenWhenInteractionLogFails() {
            InteractionLog broken =
                    record -> {
                        throw new IllegalStateException("disk full");
                    };
            ConsortiumOrchestrator withBrokenLog =
                    new ConsortiumOrchestrator(registry, executor, broken);
            register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(ScriptedAgent.replying("judge", synthesisReply(0.9)));

            OrchestrationResult result = withBrokenLog.orchestrate("q", baseConfig("x").build());

            assertThat(result.isCompleted()).isTrue();
        }

        @Test
        void shouldReportStateTransitionsInOrder() {
            register(ScriptedAgent.replying("x", agentReply("a", 0.5)));
            register(
                    ScriptedAgent.replying(
                            "judge", synthesisReply(0.5, "more"), synthesisReply(0.9)));
            List<String> events = new CopyOnWriteArrayList<>();
            OrchestrationListener listener =
                    new OrchestrationListener() {
                        @Override
                        public void onStateChange(int round, OrchestrationState state) {
                            events.add(round + ":" + state);
                        }
                    };

            orchestrator.orchestrate(
                    "q", baseConfig("x").maxIterations(3).build(), List.of(), listener);

            assertThat(events)
                    .containsExactly(
                            "1:DISPATCHING",
                            "1:SYNTHESIZING",
                            "1:EVALUATING",
                            "1:CONTINUING",
                            "2:DISPATCHING",
                            "2:SYNTHESIZING",
                            "2:EVALUATING",
                            "2:DONE");
        }
    }

    // -- Helpers --

    private ScriptedAgent register(ScriptedAgent agent) {
        registry.registerAgent(agent);
        return agent;
    }

    private static OrchestrationConfig.Builder baseConfig(String roster) {
        return OrchestrationConfig.builder()
                .roster(roster)
                .arbiter("judge")
                .agentTimeout(Duration.ofSeconds(10));
    }
}
