package io.consortium.core.orchestration;

import io.consortium.core.exception.OrchestrationFailedException;
import io.consortium.core.synthesis.SynthesisResult;
import java.util.List;

/// Terminal outcome of one orchestration call.
///
/// ### Permitted Subtypes
/// - {@link Completed} - the run stopped on convergence or the iteration ceiling
/// - {@link Failed} - every agent of a round failed, the arbiter failed, or the run was
///   cancelled
///
/// Both carry the history of the rounds completed so far.
public sealed interface OrchestrationResult {

    /// @return identifier of the run, never null
    String runId();

    /// @return completed rounds, oldest first, never null
    List<IterationRecord> history();

    /// Returns the completed result or throws the failure.
    ///
    /// @return this result as {@link Completed}, never null
    /// @throws OrchestrationFailedException if the run failed
    default Completed getOrThrow() {
        if (this instanceof Failed failed) {
            throw new OrchestrationFailedException(failed.failure());
        }
        return (Completed) this;
    }

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /// Run finished with a final synthesis.
    ///
    /// @param runId identifier of the run, not null
    /// @param synthesis the retained synthesis, not null
    /// @param history every completed round, not empty
    /// @param metadata run summary, not null
    record Completed(
            String runId,
            SynthesisResult synthesis,
            List<IterationRecord> history,
            RunMetadata metadata)
            implements OrchestrationResult {

        public Completed {
            history = List.copyOf(history);
        }

        public String synthesisText() {
            return synthesis.synthesisText();
        }

        public double confidence() {
            return synthesis.confidence();
        }

        public String analysis() {
            return synthesis.analysis();
        }

        public int iterationCount() {
            return history.size();
        }
    }

    /// Run ended without a final synthesis.
    ///
    /// @param runId identifier of the run, not null
    /// @param failure what went wrong, not null
    /// @param history rounds completed before the failure, not null
    record Failed(String runId, OrchestrationFailure failure, List<IterationRecord> history)
            implements OrchestrationResult {

        public Failed {
            history = List.copyOf(history);
        }
    }
}
