package com.libragraph.emlstore.core.history;

import com.libragraph.emlstore.core.dao.HistoryRecord;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of the history after one committed mutation.
 *
 * @param version increases by one with every published snapshot
 * @param records every record, most recently accessed first
 * @param stats   cache statistics at the same point in time
 */
public record HistorySnapshot(long version, List<HistoryRecord> records, CacheStats stats) {

    public HistorySnapshot {
        records = List.copyOf(records);
    }

    public Optional<HistoryRecord> findById(long id) {
        for (HistoryRecord record : records) {
            if (record.id() == id) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
