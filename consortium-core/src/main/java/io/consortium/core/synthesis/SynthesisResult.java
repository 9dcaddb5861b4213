package io.consortium.core.synthesis;

import java.util.List;
import java.util.Objects;

/// The arbiter's verdict on one round.
///
/// `confidence` is the only value the convergence rule reads; `needsIteration` is
/// the arbiter's advice and is recorded but never acted upon.
///
/// @param synthesisText the synthesized (or chosen) answer, not null
/// @param confidence arbiter confidence in [0, 1]
/// @param analysis the arbiter's comparison of the responses, not null (may be empty)
/// @param needsIteration whether the arbiter recommends another round
/// @param refinementAreas points the next round should address, in order, not null
/// @param dissent dissenting views worth preserving, not null (may be empty)
/// @param rawArbiterResponse the arbiter's unparsed reply, not null
/// @param chosenId id of the selected response for pick-one judging, null otherwise
/// @param ranking response ids best-first for rank judging, empty otherwise
public record SynthesisResult(
        String synthesisText,
        double confidence,
        String analysis,
        boolean needsIteration,
        List<String> refinementAreas,
        String dissent,
        String rawArbiterResponse,
        Integer chosenId,
        List<Integer> ranking) {

    public SynthesisResult {
        Objects.requireNonNull(synthesisText, "synthesisText must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        analysis = analysis != null ? analysis : "";
        refinementAreas = refinementAreas != null ? List.copyOf(refinementAreas) : List.of();
        dissent = dissent != null ? dissent : "";
        rawArbiterResponse = rawArbiterResponse != null ? rawArbiterResponse : "";
        ranking = ranking != null ? List.copyOf(ranking) : List.of();
    }

    /// Creates a synthesis-style result without pick-one or rank fields.
    public static SynthesisResult of(
            String synthesisText,
            double confidence,
            String analysis,
            boolean needsIteration,
            List<String> refinementAreas,
            String dissent,
            String rawArbiterResponse) {
        return new SynthesisResult(
                synthesisText,
                confidence,
                analysis,
                needsIteration,
                refinementAreas,
                dissent,
                rawArbiterResponse,
                null,
                List.of());
    }
}
