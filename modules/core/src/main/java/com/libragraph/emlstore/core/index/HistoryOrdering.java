package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.HistoryRecord;

import java.util.Comparator;
import java.util.Locale;

/**
 * Matching and ordering rules shared by every in-memory evaluation of a history query.
 * {@link JdbiHistoryIndex} expresses the same rules in SQL.
 */
public final class HistoryOrdering {

    /** Most recently accessed first; newest id first on ties. */
    public static final Comparator<HistoryRecord> RECENTLY_ACCESSED =
            Comparator.comparingLong(HistoryRecord::lastAccessed)
                    .thenComparingLong(HistoryRecord::id)
                    .reversed();

    /** Eviction order: least recently accessed first, oldest id first on ties. */
    public static final Comparator<HistoryRecord> LEAST_RECENTLY_ACCESSED =
            Comparator.comparingLong(HistoryRecord::lastAccessed)
                    .thenComparingLong(HistoryRecord::id);

    /** Search results: newest effective date first, newest id first on ties. */
    public static final Comparator<HistoryRecord> SEARCH_RESULTS =
            Comparator.comparingLong(HistoryRecord::effectiveDate)
                    .thenComparingLong(HistoryRecord::id)
                    .reversed();

    private HistoryOrdering() {
    }

    /**
     * Comparator for an explicit sort. Ties always fall back to ascending id so
     * repeated calls over the same data give the same order.
     */
    public static Comparator<HistoryRecord> sort(SortField field, SortDirection direction) {
        Comparator<HistoryRecord> primary = switch (field) {
            case DATE -> Comparator.comparingLong(HistoryRecord::effectiveDate);
            case SUBJECT -> Comparator.comparing((HistoryRecord r) -> fold(r.subject()));
            case SENDER -> Comparator.comparing((HistoryRecord r) -> fold(r.displaySender()));
        };
        if (direction == SortDirection.DESCENDING) {
            primary = primary.reversed();
        }
        return primary.thenComparingLong(HistoryRecord::id);
    }

    /**
     * True if {@code query} is blank or occurs, ignoring case, in any searchable field.
     */
    public static boolean matchesSearch(HistoryRecord record, String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String needle = fold(query);
        return fold(record.subject()).contains(needle)
                || fold(record.senderEmail()).contains(needle)
                || fold(record.senderName()).contains(needle)
                || fold(record.recipientEmails()).contains(needle)
                || fold(record.recipientNames()).contains(needle)
                || fold(record.bodyPreview()).contains(needle);
    }

    static String fold(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
