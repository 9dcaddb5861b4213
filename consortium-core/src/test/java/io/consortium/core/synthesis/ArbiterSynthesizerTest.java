package io.consortium.core.synthesis;

import static io.consortium.core.agent.ScriptedAgent.synthesisReply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.consortium.core.agent.Agent;
import io.consortium.core.agent.AgentResponse;
import io.consortium.core.agent.AgentResponse.Error.ErrorType;
import io.consortium.core.agent.ScriptedAgent;
import io.consortium.core.exception.ArbiterException;
import io.consortium.core.orchestration.OrchestrationConfig;
import io.consortium.core.parse.ParsedResponse;
import io.consortium.core.parse.RoundResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArbiterSynthesizerTest {

    @Mock private Agent arbiter;

    private ExecutorService executor;
    private ArbiterSynthesizer synthesizer;
    private OrchestrationConfig config;
    private List<RoundResponse> responses;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        synthesizer = new ArbiterSynthesizer(executor);
        config =
                OrchestrationConfig.builder()
                        .roster("x,y")
                        .arbiter("judge")
                        .systemPrompt("Answer in French.")
                        .agentTimeout(Duration.ofSeconds(5))
                        .build();
        responses =
                List.of(
                        RoundResponse.success("x", 1, new ParsedResponse(null, "a", 0.8), "a"),
                        RoundResponse.success("y", 1, new ParsedResponse(null, "b", 0.6), "b"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldParseArbiterReply() throws Exception {
        // Given
        when(arbiter.execute(anyString(), isNull()))
                .thenReturn(AgentResponse.TextResponse.of(synthesisReply(0.85)));

        // When
        SynthesisResult result = synthesizer.synthesize("q", List.of(), responses, config, arbiter);

        // Then
        assertThat(result.confidence()).isEqualTo(0.85);
        assertThat(result.synthesisText()).isEqualTo("synthesis at 0.85");
    }

    @Test
    void shouldShowSystemPromptToArbiterAsUserInstructions() throws Exception {
        ScriptedAgent judge = ScriptedAgent.replying("judge", synthesisReply(0.9));

        synthesizer.synthesize("q", List.of(), responses, config, judge);

        assertThat(judge.getPrompts().get(0))
                .contains("<user_instructions>\nAnswer in French.\n</user_instructions>");
        assertThat(judge.getSystemPrompts()).containsExactly("null");
    }

    @Test
    void shouldRaiseArbiterExceptionOnErrorResponse() {
        when(arbiter.execute(anyString(), any()))
                .thenReturn(AgentResponse.Error.of("quota exceeded", ErrorType.PROVIDER));

        assertThatThrownBy(() -> synthesizer.synthesize("q", List.of(), responses, config, arbiter))
                .isInstanceOf(ArbiterException.class)
                .hasMessageContaining("judge")
                .hasMessageContaining("quota exceeded");
    }

    @Test
    void shouldKeepErrorTypeReportedByArbiter() {
        when(arbiter.execute(anyString(), any()))
                .thenReturn(AgentResponse.Error.of("connection reset", ErrorType.TRANSPORT));

        assertThatThrownBy(() -> synthesizer.synthesize("q", List.of(), responses, config, arbiter))
                .isInstanceOfSatisfying(
                        ArbiterException.class,
                        e -> {
                            assertThat(e.getFailure().errorType())
                                    .isEqualTo(ErrorType.TRANSPORT);
                            assertThat(e.getFailure().message()).isEqualTo("connection reset");
                        });
    }

    @Test
    void shouldRaiseArbiterExceptionWhenArbiterThrows() {
        when(arbiter.execute(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> synthesizer.synthesize("q", List.of(), responses, config, arbiter))
                .isInstanceOfSatisfying(
                        ArbiterException.class,
                        e ->
                                assertThat(e.getFailure().errorType())
                                        .isEqualTo(ErrorType.PROVIDER))
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRaiseArbiterExceptionOnTimeout() {
        ScriptedAgent slow = ScriptedAgent.hanging("judge");
        OrchestrationConfig quick =
                config.toBuilder().agentTimeout(Duration.ofMillis(100)).build();

        assertThatThrownBy(() -> synthesizer.synthesize("q", List.of(), responses, quick, slow))
                .isInstanceOfSatisfying(
                        ArbiterException.class,
                        e ->
                                assertThat(e.getFailure().errorType())
                                        .isEqualTo(ErrorType.TIMEOUT))
                .hasMessageContaining("timed out");
    }

    @Test
    void shouldNotFailOnMalformedPickOneReply() throws Exception {
        // Given
        OrchestrationConfig pickOne =
                config.toBuilder().judgingMethod(JudgingMethod.PICK_ONE).build();
        when(arbiter.execute(anyString(), any()))
                .thenReturn(AgentResponse.TextResponse.of("no id here"));

        // When
        SynthesisResult result =
                synthesizer.synthesize("q", List.of(), responses, pickOne, arbiter);

        // Then
        assertThat(result.analysis()).startsWith("Parsing failed");
        verify(arbiter).execute(anyString(), any());
    }
}
