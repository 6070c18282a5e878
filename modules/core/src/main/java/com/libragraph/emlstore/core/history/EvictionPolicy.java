package com.libragraph.emlstore.core.history;

import com.libragraph.emlstore.core.dao.HistoryRecord;
import com.libragraph.emlstore.core.index.HistoryIndex;
import com.libragraph.emlstore.core.ledger.BlobLedger;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded retention. When the index holds more than {@code limit} records, the least
 * recently accessed ones are removed, one at a time, until exactly {@code limit} remain.
 * A limit of 0 or less disables eviction.
 */
public final class EvictionPolicy {

    private static final Logger log = Logger.getLogger(EvictionPolicy.class);

    private static final EvictionPolicy UNBOUNDED = new EvictionPolicy(0);

    private final int limit;

    private EvictionPolicy(int limit) {
        this.limit = Math.max(limit, 0);
    }

    public static EvictionPolicy unbounded() {
        return UNBOUNDED;
    }

    public static EvictionPolicy limitedTo(int limit) {
        return limit <= 0 ? UNBOUNDED : new EvictionPolicy(limit);
    }

    public boolean isEnabled() {
        return limit > 0;
    }

    public int limit() {
        return limit;
    }

    /**
     * Evicts records over the limit inside the caller's transaction.
     *
     * @return hashes of blobs whose last reference was evicted; their files must be deleted
     *         once the transaction commits
     */
    public List<String> enforce(BlobLedger ledger, HistoryIndex index) {
        if (!isEnabled()) {
            return List.of();
        }
        List<String> released = new ArrayList<>();
        int count = index.count();
        while (count > limit) {
            List<HistoryRecord> oldest = index.oldest(1);
            if (oldest.isEmpty()) {
                break;
            }
            HistoryRecord victim = oldest.get(0);
            if (BlobReferences.release(victim, ledger, index)) {
                released.add(victim.blobHash());
            }
            log.debugf("Evicted history record %d (%s), last accessed %d",
                    Long.valueOf(victim.id()), victim.displayName(), Long.valueOf(victim.lastAccessed()));
            count--;
        }
        return released;
    }

    @Override
    public String toString() {
        return isEnabled() ? "EvictionPolicy[limit=" + limit + "]" : "EvictionPolicy[unbounded]";
    }
}
