package io.consortium.core.exception;

import io.consortium.core.parse.AgentFailure;
import java.io.Serial;

/// Raised when the arbiter invocation fails. There is no fallback synthesis.
///
/// Carries the arbiter's {@link AgentFailure} so the error type reported by the agent
/// (or assigned for a timeout) reaches the caller unchanged.
public class ArbiterException extends Exception {
    @Serial private static final long serialVersionUID = -1675024390713488226L;

    private final transient AgentFailure failure;

    public ArbiterException(String message, AgentFailure failure) {
        super(message, failure.cause());
        this.failure = failure;
    }

    /// @return the arbiter's failure, never null
    public AgentFailure getFailure() {
        return failure;
    }
}
