package com.libragraph.emlstore.core.ledger;

import com.libragraph.emlstore.core.dao.BlobRecord;

import java.util.List;
import java.util.Optional;

/**
 * Tracks {@code {hash, sizeBytes, refCount}} for every payload in the content store.
 *
 * <p>The ledger only mutates metadata. Deleting the backing file when a count reaches
 * zero is the caller's job, after the surrounding transaction has committed.
 */
public interface BlobLedger {

    Optional<BlobRecord> lookup(String hash);

    /**
     * Registers a freshly written blob with {@code refCount = 1}.
     *
     * @throws LedgerInvariantException if the hash is already registered
     */
    BlobRecord create(String hash, long sizeBytes);

    /**
     * Adds one reference.
     *
     * @return the updated record
     * @throws LedgerInvariantException if the hash is not registered
     */
    BlobRecord incrementRef(String hash);

    /**
     * Drops one reference. At zero the record is removed.
     *
     * @return references remaining; 0 means the blob file must now be deleted
     * @throws LedgerInvariantException if the hash is not registered
     */
    int decrementRef(String hash);

    /** Removes a record regardless of its count. Used when its file is known to be gone. */
    boolean remove(String hash);

    List<BlobRecord> all();

    int count();

    /** Sum of sizes of all registered (distinct) blobs. */
    long totalSizeBytes();

    int deleteAll();
}
