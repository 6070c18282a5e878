package com.libragraph.emlstore.core.db;

import com.libragraph.emlstore.core.index.HistoryIndex;
import com.libragraph.emlstore.core.ledger.BlobLedger;

/**
 * Persistence behind the blob ledger and the history index. Both are only reachable
 * inside a unit of work, so a mutation touching refcounts and records commits or
 * rolls back as a whole.
 */
public interface MetadataStore {

    @FunctionalInterface
    interface Work<T> {
        T apply(BlobLedger ledger, HistoryIndex index);
    }

    /**
     * Runs {@code work} in one transaction. Any exception rolls back every change
     * made through the supplied ledger and index, then propagates.
     */
    <T> T inTransaction(Work<T> work);
}
