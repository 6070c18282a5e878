package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.HistoryRecord;

import java.util.function.Predicate;

/**
 * Filter criteria for history listings. A {@code null} criterion is inactive;
 * active criteria combine with AND.
 *
 * @param hasAttachments only records whose attachment flag equals this value
 * @param dateFrom       inclusive lower bound on {@link HistoryRecord#effectiveDate()}
 * @param dateTo         inclusive upper bound on {@link HistoryRecord#effectiveDate()}
 * @param senderContains case-insensitive substring of sender address or sender name
 */
public record HistoryFilter(
        Boolean hasAttachments,
        Long dateFrom,
        Long dateTo,
        String senderContains
) implements Predicate<HistoryRecord> {

    public static final HistoryFilter NONE = new HistoryFilter(null, null, null, null);

    public HistoryFilter {
        if (senderContains != null && senderContains.isBlank()) {
            senderContains = null;
        }
        if (dateFrom != null && dateTo != null && dateFrom > dateTo) {
            throw new IllegalArgumentException(
                    "dateFrom must not be after dateTo: " + dateFrom + " > " + dateTo);
        }
    }

    public static HistoryFilter withAttachments() {
        return new HistoryFilter(true, null, null, null);
    }

    public static HistoryFilter dateBetween(Long from, Long to) {
        return new HistoryFilter(null, from, to, null);
    }

    public static HistoryFilter sender(String substring) {
        return new HistoryFilter(null, null, null, substring);
    }

    /**
     * This filter with every criterion set on {@code other} replaced by other's value.
     * Criteria {@code other} leaves unset are kept. Useful for refining a saved filter,
     * e.g. narrowing the date range of an attachments-only view.
     */
    public HistoryFilter overriddenBy(HistoryFilter other) {
        if (other == null) {
            return this;
        }
        return new HistoryFilter(
                other.hasAttachments != null ? other.hasAttachments : hasAttachments,
                other.dateFrom != null ? other.dateFrom : dateFrom,
                other.dateTo != null ? other.dateTo : dateTo,
                other.senderContains != null ? other.senderContains : senderContains);
    }

    public boolean isEmpty() {
        return hasAttachments == null && dateFrom == null && dateTo == null && senderContains == null;
    }

    @Override
    public boolean test(HistoryRecord record) {
        if (hasAttachments != null && record.hasAttachments() != hasAttachments) {
            return false;
        }
        long date = record.effectiveDate();
        if (dateFrom != null && date < dateFrom) {
            return false;
        }
        if (dateTo != null && date > dateTo) {
            return false;
        }
        if (senderContains != null) {
            String needle = HistoryOrdering.fold(senderContains);
            return HistoryOrdering.fold(record.senderEmail()).contains(needle)
                    || HistoryOrdering.fold(record.senderName()).contains(needle);
        }
        return true;
    }
}
