package io.consortium.core.log;

import io.consortium.core.orchestration.IterationRecord;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// Keeps appended records in memory, in append order.
///
/// @implNote Thread-safe.
public class InMemoryInteractionLog implements InteractionLog {

    private final List<IterationRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(IterationRecord record) {
        records.add(record);
    }

    /// @return a snapshot of all appended records, never null
    public List<IterationRecord> getRecords() {
        return List.copyOf(records);
    }

    /// @return the records of one run, in round order
    public List<IterationRecord> getRecords(String runId) {
        return records.stream().filter(r -> r.runId().equals(runId)).toList();
    }

    public void clear() {
        records.clear();
    }
}
