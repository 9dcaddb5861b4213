package io.consortium.serialization;

import io.consortium.core.log.InteractionLog;
import io.consortium.core.orchestration.IterationRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Logger;

/// {@link InteractionLog} that appends one JSON object per round to a file.
///
/// Each line is a complete {@link IterationRecord} as rendered by
/// {@link ResultSerializer#toJsonLine}: run id, round number, prompt, every task's
/// response or failure, and the arbiter's synthesis. Existing content is kept, so one
/// file can collect many runs; filter on `run_id` to separate them.
///
/// @implNote Thread-safe. Lines are written and flushed under a lock, so records from
/// concurrent runs never interleave. Wrap in
/// {@link io.consortium.core.log.AsyncInteractionLog} to keep file I/O off the
/// orchestration thread.
public class JsonLinesInteractionLog implements InteractionLog {

    private static final Logger logger = Logger.getLogger(JsonLinesInteractionLog.class.getName());

    private final Path file;
    private final BufferedWriter writer;

    /// Opens the file for appending, creating it and its parent directories if needed.
    ///
    /// @param file destination file, not null
    /// @throws IOException if the file cannot be created or opened
    public JsonLinesInteractionLog(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer =
                Files.newBufferedWriter(
                        file,
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
        logger.info("Interaction log writing to " + file);
    }

    /// @throws UncheckedIOException if the line cannot be written
    @Override
    public synchronized void append(IterationRecord record) {
        String line = ResultSerializer.toJsonLine(record);
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write interaction log " + file, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close interaction log " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
