package io.consortium.core.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import io.consortium.core.convergence.ConvergenceDecision;
import io.consortium.core.orchestration.IterationRecord;
import io.consortium.core.parse.ParsedResponse;
import io.consortium.core.parse.RoundResponse;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ArbiterPromptBuilderTest {

    private ArbiterPromptBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ArbiterPromptBuilder();
    }

    @Test
    void shouldEmbedQueryInstructionsAndNumberedResponses() {
        // Given
        List<RoundResponse> responses =
                List.of(
                        RoundResponse.success(
                                "x", 1, new ParsedResponse("because", "42", 0.9), "raw"),
                        RoundResponse.success("y", 2, new ParsedResponse(null, "41", null), "raw"));

        // When
        String prompt =
                builder.build(
                        "What is 6 x 7?", List.of(), responses, "Be terse.", JudgingMethod.DEFAULT);

        // Then
        assertThat(prompt)
                .contains("<original_prompt>\nWhat is 6 x 7?\n</original_prompt>")
                .contains("<user_instructions>\nBe terse.\n</user_instructions>")
                .contains("None. This is the first round.")
                .contains("<id>1</id>\n<model>x</model>\n<instance>1</instance>")
                .contains("<confidence>0.9</confidence>\n<reasoning>because</reasoning>")
                .contains("<id>2</id>\n<model>y</model>\n<instance>2</instance>")
                .contains("<confidence>N/A</confidence>\n<answer>41</answer>")
                .contains("<synthesis>the synthesized answer</synthesis>");
    }

    @Test
    void shouldOmitUserInstructionsWhenAbsent() {
        String prompt = builder.build("q", List.of(), List.of(), null, JudgingMethod.DEFAULT);

        assertThat(prompt).doesNotContain("<user_instructions>");
    }

    @Test
    void shouldSummarisePriorRoundsWithoutTheirResponses() {
        // Given
        SynthesisResult previous =
                SynthesisResult.of(
                        "draft answer", 0.6, "a", true, List.of("add detail"), "", "raw");
        RoundResponse oldResponse =
                RoundResponse.success(
                        "x", 1, new ParsedResponse(null, "old answer text", null), "raw");
        IterationRecord record =
                new IterationRecord(
                        "run",
                        1,
                        "p",
                        List.of(oldResponse),
                        previous,
                        ConvergenceDecision.CONTINUE,
                        Instant.now(),
                        Instant.now());

        // When
        String history = builder.formatHistory(List.of(record));

        // Then
        assertThat(history)
                .contains("<iteration_number>1</iteration_number>")
                .contains("<confidence>0.6</confidence>")
                .contains("<synthesis>draft answer</synthesis>")
                .contains("<area>add detail</area>")
                .doesNotContain("old answer text");
    }

    @Nested
    class JudgingFormatTest {

        @Test
        void shouldAskForResponseIdWhenPickingOne() {
            String prompt = builder.build("q", List.of(), List.of(), null, JudgingMethod.PICK_ONE);

            assertThat(prompt).contains("<response_id>").doesNotContain("<ranking>");
        }

        @Test
        void shouldAskForRankingWhenRanking() {
            String prompt = builder.build("q", List.of(), List.of(), null, JudgingMethod.RANK);

            assertThat(prompt).contains("<ranking>").doesNotContain("<response_id>");
        }
    }
}
