package io.consortium.core.synthesis;

import io.consortium.core.orchestration.IterationRecord;
import io.consortium.core.parse.RoundResponse;
import java.util.List;

/// Builds the single prompt sent to the arbiter each round.
///
/// Responses are numbered from 1 in the order given; {@link ArbiterResponseParser}
/// resolves pick-one and rank ids against the same list.
///
/// Prior rounds are summarised by their synthesis, confidence and refinement areas
/// only. Their individual responses are left out so settled points are not argued again.
public class ArbiterPromptBuilder {

    private static final String SYNTHESIS_FORMAT =
            """
            Synthesize the responses into one answer that is better than any single response.
            Compare them, resolve contradictions, and note any dissent worth keeping.

            Reply using exactly these tags:
            <synthesis>the synthesized answer</synthesis>
            <confidence>a number between 0.0 and 1.0</confidence>
            <analysis>how the responses agree and differ</analysis>
            <dissent>notable dissenting views, or empty</dissent>
            <needs_iteration>true or false</needs_iteration>
            <refinement_areas>
            <area>one point another round should address</area>
            </refinement_areas>""";

    private static final String PICK_ONE_FORMAT =
            """
            Select the single best response. Do not write a new answer.

            Reply using exactly these tags:
            <analysis>why the chosen response is the best</analysis>
            <response_id>the id of the chosen response</response_id>""";

    private static final String RANK_FORMAT =
            """
            Rank every response from best to worst. Do not write a new answer.

            Reply using exactly these tags:
            <analysis>the reasoning behind the ranking</analysis>
            <ranking>
            <rank position="1">id of the best response</rank>
            <rank position="2">id of the next best response</rank>
            </ranking>""";

    /// Builds the arbiter prompt.
    ///
    /// @param originalQuery the user's query, not null
    /// @param history completed rounds, oldest first, not null (may be empty)
    /// @param responses successful responses of the current round, not empty
    /// @param userInstructions the configured system prompt, may be null
    /// @param method the judging method, not null
    /// @return the prompt, never null
    public String build(
            String originalQuery,
            List<IterationRecord> history,
            List<RoundResponse> responses,
            String userInstructions,
            JudgingMethod method) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are the arbiter of a consortium of independent models.\n\n");
        prompt.append("<original_prompt>\n")
                .append(originalQuery)
                .append("\n</original_prompt>\n\n");

        if (userInstructions != null && !userInstructions.isBlank()) {
            prompt.append("<user_instructions>\n")
                    .append(userInstructions.strip())
                    .append("\n</user_instructions>\n\n");
        }

        prompt.append(formatHistory(history)).append("\n\n");
        prompt.append("<model_responses>\n")
                .append(formatResponses(responses))
                .append("</model_responses>\n\n");
        prompt.append(formatFor(method));
        return prompt.toString();
    }

    String formatResponses(List<RoundResponse> responses) {
        StringBuilder formatted = new StringBuilder();
        for (int i = 0; i < responses.size(); i++) {
            RoundResponse r = responses.get(i);
            formatted.append("<model_response>\n");
            formatted.append("<id>").append(i + 1).append("</id>\n");
            formatted.append("<model>").append(r.agentIdentifier()).append("</model>\n");
            formatted.append("<instance>").append(r.instanceIndex()).append("</instance>\n");
            formatted
                    .append("<confidence>")
                    .append(r.selfConfidence() != null ? r.selfConfidence() : "N/A")
                    .append("</confidence>\n");
            if (r.reasoning() != null) {
                formatted.append("<reasoning>").append(r.reasoning()).append("</reasoning>\n");
            }
            formatted.append("<answer>").append(r.answer()).append("</answer>\n");
            formatted.append("</model_response>\n");
        }
        return formatted.toString();
    }

    String formatHistory(List<IterationRecord> history) {
        if (history.isEmpty()) {
            return "<previous_iterations>None. This is the first round.</previous_iterations>";
        }
        StringBuilder formatted = new StringBuilder("<previous_iterations>\n");
        for (IterationRecord record : history) {
            SynthesisResult synthesis = record.synthesis();
            formatted.append("<iteration>\n");
            formatted
                    .append("<iteration_number>")
                    .append(record.roundNumber())
                    .append("</iteration_number>\n");
            formatted
                    .append("<confidence>")
                    .append(synthesis.confidence())
                    .append("</confidence>\n");
            formatted
                    .append("<synthesis>")
                    .append(synthesis.synthesisText())
                    .append("</synthesis>\n");
            formatted.append("<refinement_areas>\n");
            synthesis.refinementAreas()
                    .forEach(area -> formatted.append("<area>").append(area).append("</area>\n"));
            formatted.append("</refinement_areas>\n");
            formatted.append("</iteration>\n");
        }
        return formatted.append("</previous_iterations>").toString();
    }

    private String formatFor(JudgingMethod method) {
        switch (method) {
            case PICK_ONE:
                return PICK_ONE_FORMAT;
            case RANK:
                return RANK_FORMAT;
            default:
                return SYNTHESIS_FORMAT;
        }
    }
}
