package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.HistoryRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Search text, filter and sort order evaluated together. Search and filter combine
 * with AND. Without an explicit sort field, results come in search order
 * (newest effective date first).
 */
public record HistoryQuery(
        String search,
        HistoryFilter filter,
        SortField sortField,
        SortDirection direction
) {

    public HistoryQuery {
        search = search == null ? "" : search;
        filter = filter != null ? filter : HistoryFilter.NONE;
        if (sortField != null && direction == null) {
            direction = sortField == SortField.DATE ? SortDirection.DESCENDING : SortDirection.ASCENDING;
        }
    }

    public static HistoryQuery all() {
        return new HistoryQuery("", HistoryFilter.NONE, null, null);
    }

    public static HistoryQuery forSearch(String text) {
        return all().withSearch(text);
    }

    public HistoryQuery withSearch(String text) {
        return new HistoryQuery(text, filter, sortField, direction);
    }

    public HistoryQuery withFilter(HistoryFilter newFilter) {
        return new HistoryQuery(search, Objects.requireNonNull(newFilter, "filter"), sortField, direction);
    }

    public HistoryQuery sortedBy(SortField field, SortDirection newDirection) {
        return new HistoryQuery(search, filter,
                Objects.requireNonNull(field, "field"),
                Objects.requireNonNull(newDirection, "direction"));
    }

    /** Blank search text matches everything; otherwise it is matched as given, spaces included. */
    public boolean hasSearch() {
        return !search.isBlank();
    }

    public Comparator<HistoryRecord> comparator() {
        return sortField == null
                ? HistoryOrdering.SEARCH_RESULTS
                : HistoryOrdering.sort(sortField, direction);
    }

    public boolean matches(HistoryRecord record) {
        return HistoryOrdering.matchesSearch(record, search) && filter.test(record);
    }

    /**
     * Evaluates this query over an in-memory collection.
     */
    public List<HistoryRecord> apply(Collection<HistoryRecord> records) {
        return records.stream()
                .filter(this::matches)
                .sorted(comparator())
                .toList();
    }
}
