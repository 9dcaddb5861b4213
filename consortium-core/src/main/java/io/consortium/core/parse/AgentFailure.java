package io.consortium.core.parse;

import io.consortium.core.agent.AgentResponse;
import io.consortium.core.agent.AgentResponse.Error.ErrorType;

/// Why a single task produced no usable response.
///
/// @param errorType failure class, not null
/// @param message human-readable description, not null
/// @param cause underlying exception, may be null
public record AgentFailure(ErrorType errorType, String message, Throwable cause) {

    public static AgentFailure from(AgentResponse.Error error) {
        return new AgentFailure(error.errorType(), error.message(), error.cause());
    }

    public static AgentFailure from(Throwable cause) {
        return from(AgentResponse.Error.from(cause));
    }

    public static AgentFailure timeout(String message) {
        return new AgentFailure(ErrorType.TIMEOUT, message, null);
    }
}
