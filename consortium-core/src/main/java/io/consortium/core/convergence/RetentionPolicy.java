package io.consortium.core.convergence;

import io.consortium.core.orchestration.IterationRecord;
import java.util.List;

/// Which round's synthesis becomes the final answer once the run stops.
///
/// The policy never changes when the run stops, only what it returns.
public enum RetentionPolicy {
    /// The synthesis of the final round, even if an earlier round scored higher.
    LAST_ROUND {
        @Override
        public IterationRecord select(List<IterationRecord> history) {
            return history.get(history.size() - 1);
        }
    },
    /// The highest-confidence synthesis; the earliest such round on ties.
    BEST_CONFIDENCE {
        @Override
        public IterationRecord select(List<IterationRecord> history) {
            IterationRecord best = history.get(0);
            for (IterationRecord record : history) {
                if (record.synthesis().confidence() > best.synthesis().confidence()) {
                    best = record;
                }
            }
            return best;
        }
    };

    /// @param history completed rounds, oldest first, not empty
    /// @return the retained round, never null
    public abstract IterationRecord select(List<IterationRecord> history);
}
