package com.libragraph.emlstore.core.ledger;

import com.libragraph.emlstore.core.dao.BlobRecord;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * BlobLedger kept in a sorted map. Not thread-safe; the owning
 * {@link com.libragraph.emlstore.core.db.InMemoryMetadataStore} copies it per transaction.
 */
public class InMemoryBlobLedger implements BlobLedger {

    private static final Logger log = Logger.getLogger(InMemoryBlobLedger.class);

    private final TreeMap<String, BlobRecord> blobs;

    public InMemoryBlobLedger() {
        this.blobs = new TreeMap<>();
    }

    private InMemoryBlobLedger(TreeMap<String, BlobRecord> blobs) {
        this.blobs = blobs;
    }

    /** Working copy for a transaction. Records are immutable, so a shallow copy suffices. */
    public InMemoryBlobLedger copy() {
        return new InMemoryBlobLedger(new TreeMap<>(blobs));
    }

    @Override
    public Optional<BlobRecord> lookup(String hash) {
        return Optional.ofNullable(blobs.get(hash));
    }

    @Override
    public BlobRecord create(String hash, long sizeBytes) {
        if (blobs.containsKey(hash)) {
            throw violation("Blob already registered: " + hash);
        }
        BlobRecord record = new BlobRecord(hash, sizeBytes, 1);
        blobs.put(hash, record);
        return record;
    }

    @Override
    public BlobRecord incrementRef(String hash) {
        BlobRecord current = blobs.get(hash);
        if (current == null) {
            throw violation("Cannot add reference to unknown blob: " + hash);
        }
        BlobRecord updated = current.withRefCount(current.refCount() + 1);
        blobs.put(hash, updated);
        return updated;
    }

    @Override
    public int decrementRef(String hash) {
        BlobRecord current = blobs.get(hash);
        if (current == null) {
            throw violation("Cannot release reference to unknown blob: " + hash);
        }
        if (current.refCount() <= 0) {
            throw violation("Blob " + hash + " has non-positive refCount " + current.refCount());
        }
        int remaining = current.refCount() - 1;
        if (remaining == 0) {
            blobs.remove(hash);
        } else {
            blobs.put(hash, current.withRefCount(remaining));
        }
        return remaining;
    }

    @Override
    public boolean remove(String hash) {
        return blobs.remove(hash) != null;
    }

    @Override
    public List<BlobRecord> all() {
        return new ArrayList<>(blobs.values());
    }

    @Override
    public int count() {
        return blobs.size();
    }

    @Override
    public long totalSizeBytes() {
        long total = 0;
        for (BlobRecord blob : blobs.values()) {
            total += blob.sizeBytes();
        }
        return total;
    }

    @Override
    public int deleteAll() {
        int removed = blobs.size();
        blobs.clear();
        return removed;
    }

    private static LedgerInvariantException violation(String message) {
        log.error(message);
        return new LedgerInvariantException(message);
    }
}
