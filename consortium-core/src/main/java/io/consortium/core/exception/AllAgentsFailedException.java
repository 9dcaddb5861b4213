package io.consortium.core.exception;

import io.consortium.core.parse.RoundResponse;
import java.io.Serial;
import java.util.List;

/// Raised by the dispatcher when no task of a round produced a usable response.
public class AllAgentsFailedException extends Exception {
    @Serial private static final long serialVersionUID = 2973410288017254613L;

    private final transient List<RoundResponse> failures;

    public AllAgentsFailedException(String message, List<RoundResponse> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    /// @return every failed task of the round, in roster order
    public List<RoundResponse> getFailures() {
        return failures;
    }
}
