package io.consortium.core.orchestration;

import io.consortium.core.convergence.ConvergenceDecision;
import io.consortium.core.synthesis.JudgingMethod;
import java.time.Instant;
import java.util.Map;

/// Summary of a completed run.
///
/// @param modelsUsed roster identifiers with their instance counts, in roster order
/// @param arbiter arbiter identifier
/// @param timestamp when the run completed
/// @param iterationCount number of rounds executed
/// @param stopReason the decision that ended the run
/// @param judgingMethod how the arbiter judged
/// @param retainedRound round whose synthesis is the final result
public record RunMetadata(
        Map<String, Integer> modelsUsed,
        String arbiter,
        Instant timestamp,
        int iterationCount,
        ConvergenceDecision stopReason,
        JudgingMethod judgingMethod,
        int retainedRound) {

    public RunMetadata {
        modelsUsed = Map.copyOf(modelsUsed);
    }
}
