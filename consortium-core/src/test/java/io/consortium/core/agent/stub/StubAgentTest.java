package io.consortium.core.agent.stub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.consortium.core.agent.AgentConfig;
import io.consortium.core.agent.AgentResponse;
import io.consortium.core.agent.AgentResponse.TextResponse;
import io.consortium.core.parse.ParsedResponse;
import io.consortium.core.parse.ResponseParser;
import io.consortium.core.synthesis.ArbiterResponseParser;
import io.consortium.core.synthesis.SynthesisResult;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StubAgentTest {

    private StubAgent agent;

    @BeforeEach
    void setUp() {
        StubResponseRegistry.getInstance().clearResponses();
        agent = new StubAgent("gpt-4o", AgentConfig.forModel("gpt-4o"));
    }

    @AfterEach
    void tearDown() {
        StubResponseRegistry.getInstance().clearResponses();
    }

    @Nested
    class GeneratedResponseTest {

        @Test
        void shouldAnswerConsortiumPromptInTaggedFormat() {
            // When
            AgentResponse response = agent.execute("What is 2+2?", null);

            // Then
            TextResponse text = (TextResponse) response;
            ParsedResponse parsed = new ResponseParser().parse(text.content());
            assertThat(parsed.answer()).startsWith("Stub answer to:");
            assertThat(parsed.confidence()).isEqualTo(StubAgent.GENERATED_CONFIDENCE);
            assertThat(text.metadata())
                    .containsEntry("stub", true)
                    .containsEntry("model", "gpt-4o");
        }

        @Test
        void shouldAnswerSynthesisPromptWithSynthesis() {
            AgentResponse response = agent.execute("Reply with <synthesis>...</synthesis>", null);

            SynthesisResult result =
                    new ArbiterResponseParser().parseSynthesis(((TextResponse) response).content());
            assertThat(result.synthesisText()).contains("STUB SYNTHESIS from gpt-4o");
            assertThat(result.confidence()).isEqualTo(StubAgent.GENERATED_CONFIDENCE);
        }

        @Test
        void shouldPickFirstResponseWhenAskedForResponseId() {
            TextResponse response = (TextResponse) agent.execute("give <response_id>", null);

            assertThat(response.content()).contains("<response_id>1</response_id>");
        }
    }

    @Test
    void shouldReturnRegisteredResponse() {
        StubResponseRegistry.getInstance().registerResponse("gpt-4o", "<answer>canned</answer>");

        TextResponse response = (TextResponse) agent.execute("anything", "system");

        assertThat(response.content()).isEqualTo("<answer>canned</answer>");
    }

    @Nested
    class ProviderTest {

        @Test
        void shouldClaimEveryModelWithTopPriorityWhenEnabled() {
            StubAgentProvider provider =
                    new StubAgentProvider(Map.of(StubAgentProvider.ENABLED_KEY, "true"));

            assertThat(provider.supportsModel("anything")).isTrue();
            assertThat(provider.getPriority()).isEqualTo(1000);
            assertThat(
                            provider.createAgent(
                                    "a",
                                    AgentConfig.forModel("a"),
                                    Map.of(StubAgentProvider.ENABLED_KEY, "true")))
                    .isInstanceOf(StubAgent.class);
        }

        @Test
        void shouldStayOutOfTheWayWhenDisabled() {
            StubAgentProvider provider =
                    new StubAgentProvider(Map.of(StubAgentProvider.ENABLED_KEY, "false"));

            assertThat(provider.supportsModel("anything")).isFalse();
            assertThat(provider.getPriority()).isEqualTo(-1);
            assertThatThrownBy(
                            () ->
                                    provider.createAgent(
                                            "a",
                                            AgentConfig.forModel("a"),
                                            Map.of(StubAgentProvider.ENABLED_KEY, "false")))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
