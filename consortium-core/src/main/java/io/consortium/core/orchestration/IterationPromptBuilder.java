package io.consortium.core.orchestration;

import io.consortium.core.synthesis.SynthesisResult;
import java.util.ArrayList;
import java.util.List;

/// Builds the prompts dispatched to the roster.
///
/// The first round carries any earlier conversation followed by the query. Later
/// rounds restate the query, the previous synthesis with its confidence and the
/// arbiter's refinement areas, and ask for an improved answer. Every prompt ends with
/// the reply format the {@link io.consortium.core.parse.ResponseParser} understands.
public class IterationPromptBuilder {

    static final String RESPONSE_FORMAT =
            """
            Structure your reply as:
            <reasoning>how you arrived at the answer</reasoning>
            <answer>your answer</answer>
            <confidence>your confidence in the answer, between 0.0 and 1.0</confidence>""";

    /// Builds the first-round prompt.
    ///
    /// @param query the user's query, not null
    /// @param conversation earlier exchanges, oldest first, not null (may be empty)
    /// @return the prompt, never null
    public String initialPrompt(String query, List<ConversationTurn> conversation) {
        List<String> parts = new ArrayList<>();
        if (!conversation.isEmpty()) {
            parts.add(formatConversation(conversation));
        }
        parts.add("Human: " + query);

        return "<prompt>\n<instruction>"
                + String.join("\n\n", parts)
                + "</instruction>\n</prompt>\n\n"
                + RESPONSE_FORMAT;
    }

    /// Builds the prompt of the round following `previous`.
    ///
    /// @param query the user's original query, not null
    /// @param previous the synthesis of the round just completed, not null
    /// @return the prompt, never null
    public String refinementPrompt(String query, SynthesisResult previous) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Refining response for original prompt:\n").append(query).append("\n\n");

        prompt.append("Arbiter feedback from previous attempt:\n");
        prompt.append("Previous synthesis: ").append(previous.synthesisText()).append('\n');
        prompt.append("Confidence: ").append(previous.confidence()).append('\n');
        if (!previous.analysis().isBlank()) {
            prompt.append("Analysis: ").append(previous.analysis()).append('\n');
        }
        if (!previous.dissent().isBlank()) {
            prompt.append("Dissent: ").append(previous.dissent()).append('\n');
        }

        if (previous.refinementAreas().isEmpty()) {
            prompt.append("\nThe arbiter named no specific refinement areas.\n");
        } else {
            prompt.append("\nRefinement areas:\n");
            previous.refinementAreas()
                    .forEach(area -> prompt.append("- ").append(area).append('\n'));
        }

        prompt.append(
                "\nPlease improve your response based on this feedback,"
                        + " addressing each refinement area explicitly.\n\n");
        prompt.append(RESPONSE_FORMAT);
        return prompt.toString();
    }

    private static String formatConversation(List<ConversationTurn> conversation) {
        List<String> exchanges = new ArrayList<>(conversation.size());
        for (ConversationTurn turn : conversation) {
            exchanges.add("Human: " + turn.human() + "\nAssistant: " + turn.assistant());
        }
        return String.join("\n\n", exchanges);
    }
}
