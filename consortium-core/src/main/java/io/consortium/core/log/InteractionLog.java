package io.consortium.core.log;

import io.consortium.core.orchestration.IterationRecord;

/// Append-only sink for completed rounds.
///
/// Appends are fire-and-forget from the orchestrator's point of view: a sink failure
/// never affects the run. Storage is up to the implementation.
///
/// @see AsyncInteractionLog for the wrapper every environment installs
public interface InteractionLog extends AutoCloseable {

    /// Appends one completed round.
    ///
    /// @param record the round to append, not null
    void append(IterationRecord record);

    /// Releases resources held by the sink.
    @Override
    default void close() {}

    /// Sink that discards every record.
    InteractionLog NOOP = record -> {};
}
