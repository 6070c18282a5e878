package com.libragraph.emlstore.core.db;

import com.libragraph.emlstore.core.index.InMemoryHistoryIndex;
import com.libragraph.emlstore.core.ledger.InMemoryBlobLedger;

/**
 * MetadataStore without a database. Each transaction works on copies of the ledger
 * and index and swaps them in on success, so a failed unit of work leaves no trace.
 */
public class InMemoryMetadataStore implements MetadataStore {

    private InMemoryBlobLedger ledger = new InMemoryBlobLedger();
    private InMemoryHistoryIndex index = new InMemoryHistoryIndex();

    @Override
    public synchronized <T> T inTransaction(Work<T> work) {
        InMemoryBlobLedger workingLedger = ledger.copy();
        InMemoryHistoryIndex workingIndex = index.copy();
        T result = work.apply(workingLedger, workingIndex);
        ledger = workingLedger;
        index = workingIndex;
        return result;
    }
}
