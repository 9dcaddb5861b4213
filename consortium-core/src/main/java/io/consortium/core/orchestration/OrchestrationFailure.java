package io.consortium.core.orchestration;

import io.consortium.core.parse.RoundResponse;
import java.util.List;
import java.util.Objects;

/// Description of a failed run.
///
/// @param kind failure class, not null
/// @param round the round in which the run failed
/// @param message human-readable description, not null
/// @param failedAgents failed task outcomes of that round, not null (may be empty)
/// @param cause underlying exception, may be null
public record OrchestrationFailure(
        FailureKind kind,
        int round,
        String message,
        List<RoundResponse> failedAgents,
        Throwable cause) {

    public OrchestrationFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        failedAgents = failedAgents != null ? List.copyOf(failedAgents) : List.of();
    }
}
