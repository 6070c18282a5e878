package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.HistoryRecord;

import java.util.List;
import java.util.Optional;

/**
 * Metadata index over history records: CRUD plus the search, sort and filter
 * query surface. Reads observe earlier writes of the same transaction.
 */
public interface HistoryIndex {

    /** Inserts a record and returns it with its newly assigned id. */
    HistoryRecord insert(NewHistoryItem item);

    Optional<HistoryRecord> getById(long id);

    /** Records pointing at {@code blobHash}, oldest id first. */
    List<HistoryRecord> findByBlobHash(String blobHash);

    /** @return false if no record has this id */
    boolean updateLastAccessed(long id, long timestamp);

    /** @return false if no record has this id */
    boolean deleteById(long id);

    int deleteAll();

    int countByBlobHash(String blobHash);

    int count();

    /** Up to {@code n} least recently accessed records, in eviction order. */
    List<HistoryRecord> oldest(int n);

    /** Every record, most recently accessed first. */
    List<HistoryRecord> all();

    /**
     * Case-insensitive substring search over subject, sender, recipients and body
     * preview. A blank query returns everything. Newest effective date first.
     */
    default List<HistoryRecord> search(String query) {
        return query(HistoryQuery.forSearch(query));
    }

    default List<HistoryRecord> sortBy(SortField field, SortDirection direction) {
        return query(HistoryQuery.all().sortedBy(field, direction));
    }

    default List<HistoryRecord> filter(HistoryFilter filter) {
        return query(HistoryQuery.all().withFilter(filter));
    }

    List<HistoryRecord> query(HistoryQuery query);
}
