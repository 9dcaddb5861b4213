package io.consortium.core.exception;

import java.io.Serial;

/// Thrown synchronously, before any agent is invoked, when an orchestration request
/// is invalid: bad thresholds or iteration bounds, an empty or malformed roster, a
/// blank arbiter, or identifiers that no provider can resolve.
public class ConsortiumConfigurationException extends IllegalArgumentException {
    @Serial private static final long serialVersionUID = 4187266091552019820L;

    public ConsortiumConfigurationException(String message) {
        super(message);
    }

    public ConsortiumConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
