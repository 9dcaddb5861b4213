package io.consortium.core.orchestration;

/// States of one orchestration run.
///
/// ```
/// DISPATCHING -> SYNTHESIZING -> EVALUATING -> CONTINUING -> DISPATCHING ...
///                                           -> DONE
/// any state   -> FAILED
/// ```
public enum OrchestrationState {
    DISPATCHING,
    SYNTHESIZING,
    EVALUATING,
    CONTINUING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
