package io.consortium.core.dispatch;

import io.consortium.core.parse.RoundResponse;
import java.util.List;

/// Every task outcome of one round, in task order.
///
/// @param responses successful and failed task outcomes, not null
public record DispatchResult(List<RoundResponse> responses) {

    public DispatchResult {
        responses = List.copyOf(responses);
    }

    /// @return the responses eligible for synthesis
    public List<RoundResponse> successes() {
        return responses.stream().filter(RoundResponse::isSuccess).toList();
    }

    public List<RoundResponse> failures() {
        return responses.stream().filter(r -> !r.isSuccess()).toList();
    }
}
