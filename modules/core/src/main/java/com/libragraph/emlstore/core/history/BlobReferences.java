package com.libragraph.emlstore.core.history;

import com.libragraph.emlstore.core.dao.HistoryRecord;
import com.libragraph.emlstore.core.index.HistoryIndex;
import com.libragraph.emlstore.core.ledger.BlobLedger;
import com.libragraph.emlstore.core.ledger.LedgerInvariantException;

/**
 * Removes a history record together with its blob reference.
 */
final class BlobReferences {

    private BlobReferences() {
    }

    /**
     * Deletes {@code record} and drops its reference.
     *
     * @return true if that was the last reference and the blob file must go
     */
    static boolean release(HistoryRecord record, BlobLedger ledger, HistoryIndex index) {
        if (!index.deleteById(record.id())) {
            return false;
        }
        String hash = record.blobHash();
        int remaining = ledger.decrementRef(hash);
        int referencing = index.countByBlobHash(hash);
        if (remaining != referencing) {
            throw new LedgerInvariantException("Blob " + hash + " has refCount " + remaining
                    + " but " + referencing + " referencing records");
        }
        return remaining == 0;
    }
}
