package io.consortium.core.orchestration;

import io.consortium.core.convergence.ConvergenceDecision;
import io.consortium.core.parse.RoundResponse;
import io.consortium.core.synthesis.SynthesisResult;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Immutable record of one completed round.
///
/// @param runId identifier of the orchestration run, not null
/// @param roundNumber 1-based round number
/// @param prompt the prompt dispatched to every task, not null
/// @param responses every task outcome in task order, failures included, not null
/// @param synthesis the arbiter's verdict, not null
/// @param decision the convergence decision taken after this round, not null
/// @param startedAt when the round was dispatched, not null
/// @param completedAt when the decision was taken, not null
public record IterationRecord(
        String runId,
        int roundNumber,
        String prompt,
        List<RoundResponse> responses,
        SynthesisResult synthesis,
        ConvergenceDecision decision,
        Instant startedAt,
        Instant completedAt) {

    public IterationRecord {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(synthesis, "synthesis must not be null");
        Objects.requireNonNull(decision, "decision must not be null");
        responses = List.copyOf(responses);
    }

    /// @return the responses that were shown to the arbiter
    public List<RoundResponse> successfulResponses() {
        return responses.stream().filter(RoundResponse::isSuccess).toList();
    }
}
