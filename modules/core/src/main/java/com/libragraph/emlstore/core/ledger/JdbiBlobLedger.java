package com.libragraph.emlstore.core.ledger;

import com.libragraph.emlstore.core.dao.BlobDao;
import com.libragraph.emlstore.core.dao.BlobRecord;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * BlobLedger over the {@code cas_blob} table. Bound to the handle of the current
 * transaction through its attached {@link BlobDao}.
 */
public class JdbiBlobLedger implements BlobLedger {

    private static final Logger log = Logger.getLogger(JdbiBlobLedger.class);

    private final BlobDao dao;

    public JdbiBlobLedger(BlobDao dao) {
        this.dao = dao;
    }

    @Override
    public Optional<BlobRecord> lookup(String hash) {
        return dao.findByHash(hash);
    }

    @Override
    public BlobRecord create(String hash, long sizeBytes) {
        if (dao.findByHash(hash).isPresent()) {
            throw violation("Blob already registered: " + hash);
        }
        dao.insert(hash, sizeBytes);
        return new BlobRecord(hash, sizeBytes, 1);
    }

    @Override
    public BlobRecord incrementRef(String hash) {
        if (dao.incrementRefCount(hash) == 0) {
            throw violation("Cannot add reference to unknown blob: " + hash);
        }
        return dao.findByHash(hash).orElseThrow();
    }

    @Override
    public int decrementRef(String hash) {
        BlobRecord current = dao.findByHash(hash)
                .orElseThrow(() -> violation("Cannot release reference to unknown blob: " + hash));
        if (current.refCount() <= 0) {
            throw violation("Blob " + hash + " has non-positive refCount " + current.refCount());
        }
        if (current.refCount() == 1) {
            dao.deleteByHash(hash);
            return 0;
        }
        dao.decrementRefCount(hash);
        return current.refCount() - 1;
    }

    @Override
    public boolean remove(String hash) {
        return dao.deleteByHash(hash) > 0;
    }

    @Override
    public List<BlobRecord> all() {
        return dao.findAll();
    }

    @Override
    public int count() {
        return dao.count();
    }

    @Override
    public long totalSizeBytes() {
        return dao.totalSizeBytes();
    }

    @Override
    public int deleteAll() {
        return dao.deleteAll();
    }

    private static LedgerInvariantException violation(String message) {
        log.error(message);
        return new LedgerInvariantException(message);
    }
}
