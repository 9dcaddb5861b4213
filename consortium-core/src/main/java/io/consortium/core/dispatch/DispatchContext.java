package io.consortium.core.dispatch;

import io.consortium.core.orchestration.OrchestrationListener;
import java.time.Duration;
import java.util.Objects;

/// Per-round parameters shared by every task of a dispatch.
///
/// @param round 1-based round number, used for logging and listener callbacks
/// @param systemPrompt system instructions passed with each invocation, may be null
/// @param timeout budget for every task, measured from the dispatch of the round, not null
/// @param listener lifecycle listener, not null
public record DispatchContext(
        int round, String systemPrompt, Duration timeout, OrchestrationListener listener) {

    public DispatchContext {
        Objects.requireNonNull(timeout, "timeout must not be null");
        listener = listener != null ? listener : OrchestrationListener.NOOP;
    }
}
