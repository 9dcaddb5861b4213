package io.consortium.core.orchestration;

/// Why an orchestration run ended without a result.
public enum FailureKind {
    /// Every task of a round failed; the arbiter was not invoked.
    ALL_AGENTS_FAILED,
    /// The arbiter invocation failed or timed out.
    ARBITER_FAILED,
    /// The orchestrating thread was interrupted.
    CANCELLED
}
