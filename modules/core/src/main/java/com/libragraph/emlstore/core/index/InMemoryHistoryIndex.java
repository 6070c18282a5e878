package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.EmailMetadata;
import com.libragraph.emlstore.core.dao.HistoryRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * HistoryIndex held in memory, for tests and embedded use. Ids start at 1 and are
 * never reused, even after {@link #deleteAll()}. Not thread-safe; the owning
 * {@link com.libragraph.emlstore.core.db.InMemoryMetadataStore} copies it per transaction.
 */
public class InMemoryHistoryIndex implements HistoryIndex {

    private final TreeMap<Long, HistoryRecord> records;
    private long lastId;

    public InMemoryHistoryIndex() {
        this(new TreeMap<>(), 0);
    }

    private InMemoryHistoryIndex(TreeMap<Long, HistoryRecord> records, long lastId) {
        this.records = records;
        this.lastId = lastId;
    }

    public InMemoryHistoryIndex copy() {
        return new InMemoryHistoryIndex(new TreeMap<>(records), lastId);
    }

    @Override
    public HistoryRecord insert(NewHistoryItem item) {
        EmailMetadata meta = item.metadata();
        HistoryRecord record = new HistoryRecord(++lastId, item.blobHash(), item.displayName(),
                item.originalSourceRef(), item.lastAccessed(),
                meta.subject(), meta.senderEmail(), meta.senderName(),
                meta.recipientEmails(), meta.recipientNames(),
                meta.emailDate(), meta.hasAttachments(), meta.bodyPreview());
        records.put(record.id(), record);
        return record;
    }

    @Override
    public Optional<HistoryRecord> getById(long id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<HistoryRecord> findByBlobHash(String blobHash) {
        List<HistoryRecord> matches = new ArrayList<>();
        for (HistoryRecord record : records.values()) {
            if (record.blobHash().equals(blobHash)) {
                matches.add(record);
            }
        }
        return matches;
    }

    @Override
    public boolean updateLastAccessed(long id, long timestamp) {
        HistoryRecord current = records.get(id);
        if (current == null) {
            return false;
        }
        records.put(id, current.withLastAccessed(timestamp));
        return true;
    }

    @Override
    public boolean deleteById(long id) {
        return records.remove(id) != null;
    }

    @Override
    public int deleteAll() {
        int removed = records.size();
        records.clear();
        return removed;
    }

    @Override
    public int countByBlobHash(String blobHash) {
        return findByBlobHash(blobHash).size();
    }

    @Override
    public int count() {
        return records.size();
    }

    @Override
    public List<HistoryRecord> oldest(int n) {
        return records.values().stream()
                .sorted(HistoryOrdering.LEAST_RECENTLY_ACCESSED)
                .limit(Math.max(n, 0))
                .toList();
    }

    @Override
    public List<HistoryRecord> all() {
        return records.values().stream()
                .sorted(HistoryOrdering.RECENTLY_ACCESSED)
                .toList();
    }

    @Override
    public List<HistoryRecord> query(HistoryQuery query) {
        return query.apply(records.values());
    }
}
