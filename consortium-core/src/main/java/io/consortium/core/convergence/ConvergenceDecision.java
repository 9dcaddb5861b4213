package io.consortium.core.convergence;

/// Outcome of the convergence rule for one round.
public enum ConvergenceDecision {
    /// Run another round.
    CONTINUE,
    /// The minimum round count was reached and the arbiter confidence met the threshold.
    CONVERGED,
    /// The maximum round count was reached without convergence.
    ITERATION_LIMIT;

    public boolean isStop() {
        return this != CONTINUE;
    }
}
