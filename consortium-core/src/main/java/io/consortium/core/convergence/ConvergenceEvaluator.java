package io.consortium.core.convergence;

import io.consortium.core.orchestration.OrchestrationConfig;

/// Decides after each round whether the run stops.
///
/// Stop when `round >= minIterations && confidence >= confidenceThreshold`, or when
/// `round >= maxIterations`. The decision depends on its arguments only: no memory of
/// earlier rounds and no reading of the arbiter's `needsIteration` advice.
///
/// @implNote Stateless and thread-safe.
public class ConvergenceEvaluator {

    /// Classifies a round.
    ///
    /// @param confidence the arbiter's confidence for the round, in [0, 1]
    /// @param round the 1-based round number just completed
    /// @param config thresholds and bounds, not null
    /// @return `CONVERGED` when the confidence rule holds, else `ITERATION_LIMIT` at the
    ///     ceiling, else `CONTINUE`
    public ConvergenceDecision evaluate(double confidence, int round, OrchestrationConfig config) {
        if (round >= config.getMinIterations() && confidence >= config.getConfidenceThreshold()) {
            return ConvergenceDecision.CONVERGED;
        }
        if (round >= config.getMaxIterations()) {
            return ConvergenceDecision.ITERATION_LIMIT;
        }
        return ConvergenceDecision.CONTINUE;
    }

    public boolean shouldStop(double confidence, int round, OrchestrationConfig config) {
        return evaluate(confidence, round, config).isStop();
    }
}
