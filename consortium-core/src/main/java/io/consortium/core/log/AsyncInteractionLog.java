package io.consortium.core.log;

import io.consortium.core.orchestration.IterationRecord;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Moves appends of a delegate log onto one background thread.
///
/// Records reach the delegate in the order they were appended. A failing delegate is
/// logged at WARNING and otherwise ignored; the orchestrator never waits on it.
///
/// @implNote Thread-safe. {@link #close()} drains pending appends before closing the
/// delegate.
public class AsyncInteractionLog implements InteractionLog {

    private static final Logger logger = Logger.getLogger(AsyncInteractionLog.class.getName());

    private static final long DRAIN_TIMEOUT_SECONDS = 30;

    private final InteractionLog delegate;
    private final ExecutorService writer;

    public AsyncInteractionLog(InteractionLog delegate) {
        this.delegate = delegate;
        this.writer =
                Executors.newSingleThreadExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "consortium-interaction-log");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    @Override
    public void append(IterationRecord record) {
        try {
            writer.execute(() -> write(record));
        } catch (RejectedExecutionException e) {
            logger.warning(
                    "Interaction log closed; dropped round "
                            + record.roundNumber()
                            + " of run "
                            + record.runId());
        }
    }

    private void write(IterationRecord record) {
        try {
            delegate.append(record);
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Failed to append round "
                            + record.roundNumber()
                            + " of run "
                            + record.runId()
                            + " to interaction log",
                    e);
        }
    }

    /// Waits for pending appends, then closes the delegate.
    ///
    /// @apiNote **Side effects**:
    /// - Rejects appends made after this call
    /// - Restores the interrupt flag if interrupted while draining
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warning(
                        "Interaction log did not drain within " + DRAIN_TIMEOUT_SECONDS + "s");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            delegate.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to close interaction log", e);
        }
    }

    public InteractionLog getDelegate() {
        return delegate;
    }
}
