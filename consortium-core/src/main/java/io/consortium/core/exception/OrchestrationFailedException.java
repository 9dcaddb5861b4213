package io.consortium.core.exception;

import io.consortium.core.orchestration.OrchestrationFailure;
import java.io.Serial;

/// Unchecked view of a failed orchestration, for callers that prefer exceptions over
/// inspecting {@link io.consortium.core.orchestration.OrchestrationResult.Failed}.
public class OrchestrationFailedException extends RuntimeException {
    @Serial private static final long serialVersionUID = 7720149982043519734L;

    private final transient OrchestrationFailure failure;

    public OrchestrationFailedException(OrchestrationFailure failure) {
        super(
                "Orchestration failed in round "
                        + failure.round()
                        + " ("
                        + failure.kind()
                        + "): "
                        + failure.message(),
                failure.cause());
        this.failure = failure;
    }

    public OrchestrationFailure getFailure() {
        return failure;
    }
}
