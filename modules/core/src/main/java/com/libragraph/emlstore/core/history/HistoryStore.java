package com.libragraph.emlstore.core.history;

import com.libragraph.emlstore.core.dao.BlobRecord;
import com.libragraph.emlstore.core.dao.EmailMetadata;
import com.libragraph.emlstore.core.dao.HistoryRecord;
import com.libragraph.emlstore.core.db.MetadataStore;
import com.libragraph.emlstore.core.index.HistoryFilter;
import com.libragraph.emlstore.core.index.HistoryQuery;
import com.libragraph.emlstore.core.index.NewHistoryItem;
import com.libragraph.emlstore.core.index.SortDirection;
import com.libragraph.emlstore.core.index.SortField;
import com.libragraph.emlstore.core.ledger.LedgerInvariantException;
import com.libragraph.emlstore.core.storage.ContentStore;
import com.libragraph.emlstore.core.storage.FilesystemContentStore;
import com.libragraph.emlstore.core.storage.StorageException;
import com.libragraph.emlstore.util.ContentHash;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Content-addressed email history: stores each distinct payload once under
 * {@code cas/<sha256>} and keeps a searchable record per history entry.
 *
 * <p>Mutations ({@link #ingest}, {@link #access}, {@link #delete}, {@link #clearAll},
 * {@link #reconcile}, and eviction) are serialized by one lock. A blob file is fully
 * written before the transaction that registers it; released blob files are deleted
 * after the transaction that released them has committed. After each mutation an
 * immutable {@link HistorySnapshot} is published; queries read that snapshot and never
 * wait for writers.
 *
 * <p>Calls are synchronous and touch the disk. Run them on a background executor.
 * One instance owns its base directory and database schema exclusively.
 */
public class HistoryStore {

    private static final Logger log = Logger.getLogger(HistoryStore.class);

    /** Display name used when the caller supplies a blank one. */
    public static final String UNTITLED = "Untitled";

    /** Handle returned by {@link #subscribe}; closing it stops delivery. */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private record Outcome<T>(T value, List<String> releasedBlobs) {
        static <T> Outcome<T> of(T value) {
            return new Outcome<>(value, List.of());
        }
    }

    private final HistoryStoreConfig config;
    private final ContentStore contentStore;
    private final MetadataStore metadata;
    private final Clock clock;
    private final EvictionPolicy eviction;

    private final ReentrantLock mutationLock = new ReentrantLock();
    private final List<HistoryListener> listeners = new CopyOnWriteArrayList<>();
    private volatile HistorySnapshot snapshot;

    public HistoryStore(HistoryStoreConfig config, ContentStore contentStore,
                        MetadataStore metadata, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore cannot be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.eviction = EvictionPolicy.limitedTo(config.historyLimit());
        this.snapshot = loadSnapshot(0);
        log.infof("History store opened at %s: %d records, %s, %s",
                config.baseDir(), snapshot.size(), config.dedupPolicy(), eviction);
    }

    /** Opens a store on the filesystem layout under {@code config.baseDir()}. */
    public static HistoryStore open(HistoryStoreConfig config, MetadataStore metadata) {
        return new HistoryStore(config, new FilesystemContentStore(config.baseDir()),
                metadata, Clock.systemUTC());
    }

    public HistoryStoreConfig config() {
        return config;
    }

    // -- mutations --

    public HistoryRecord ingest(byte[] bytes, String displayName, String sourceRef) {
        return ingest(bytes, displayName, sourceRef, EmailMetadata.empty());
    }

    /**
     * Stores {@code bytes} (once per distinct payload) and returns the history record
     * for it. Under {@link DedupPolicy#UNIQUE_CONTENT} a known payload returns its
     * existing record with a fresh access time; under {@link DedupPolicy#SHARED_BLOB}
     * a new record sharing the blob is added. Eviction runs afterwards.
     *
     * @param displayName shown to users; blank becomes {@value #UNTITLED}
     * @param sourceRef   where the payload came from, may be null
     * @param metadata    parsed email fields, may be null
     * @throws StorageException if the payload could not be written; nothing is registered
     */
    public HistoryRecord ingest(byte[] bytes, String displayName, String sourceRef,
                                EmailMetadata metadata) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ContentHash hash = ContentHash.of(bytes);
        String key = hash.toHex();
        String name = displayName == null || displayName.isBlank() ? UNTITLED : displayName;
        EmailMetadata meta = metadata != null ? metadata : EmailMetadata.empty();

        mutationLock.lock();
        try {
            long now = clock.millis();
            Optional<BlobRecord> known = this.metadata.inTransaction((ledger, index) -> ledger.lookup(key));

            Outcome<HistoryRecord> outcome;
            if (known.isEmpty()) {
                outcome = ingestNewBlob(hash, bytes, name, sourceRef, meta, now);
            } else {
                if (!contentStore.exists(hash)) {
                    log.warnf("Blob %s is registered but its file is missing; rewriting it", key);
                    contentStore.storeIfAbsent(hash, bytes);
                }
                outcome = config.dedupPolicy() == DedupPolicy.UNIQUE_CONTENT
                        ? touchExisting(key, now)
                        : addReference(key, name, sourceRef, meta, now);
            }

            List<StorageException> failures = deleteBlobs(outcome.releasedBlobs());
            publish();
            throwIfAny(failures);
            return outcome.value();
        } finally {
            mutationLock.unlock();
        }
    }

    private Outcome<HistoryRecord> ingestNewBlob(ContentHash hash, byte[] bytes, String name,
                                                 String sourceRef, EmailMetadata meta, long now) {
        ContentStore.StoreResult stored = contentStore.storeIfAbsent(hash, bytes);
        String key = hash.toHex();
        try {
            Outcome<HistoryRecord> outcome = metadata.inTransaction((ledger, index) -> {
                ledger.create(key, bytes.length);
                HistoryRecord record = index.insert(new NewHistoryItem(key, name, sourceRef, now, meta));
                return new Outcome<>(record, eviction.enforce(ledger, index));
            });
            log.debugf("Ingested new blob %s (%d bytes) as record %d",
                    key, bytes.length, outcome.value().id());
            return outcome;
        } catch (RuntimeException e) {
            if (stored.written()) {
                try {
                    contentStore.delete(hash);
                } catch (StorageException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw e;
        }
    }

    private Outcome<HistoryRecord> touchExisting(String key, long now) {
        return metadata.inTransaction((ledger, index) -> {
            List<HistoryRecord> records = index.findByBlobHash(key);
            if (records.isEmpty()) {
                throw new LedgerInvariantException("Blob " + key + " is registered but no record references it");
            }
            HistoryRecord record = records.get(0);
            index.updateLastAccessed(record.id(), now);
            log.debugf("Dedup hit: blob %s already held by record %d", key, record.id());
            return new Outcome<>(record.withLastAccessed(now), eviction.enforce(ledger, index));
        });
    }

    private Outcome<HistoryRecord> addReference(String key, String name, String sourceRef,
                                                EmailMetadata meta, long now) {
        return metadata.inTransaction((ledger, index) -> {
            BlobRecord blob = ledger.incrementRef(key);
            HistoryRecord record = index.insert(new NewHistoryItem(key, name, sourceRef, now, meta));
            log.debugf("Dedup hit: blob %s now referenced by %d records", key, blob.refCount());
            return new Outcome<>(record, eviction.enforce(ledger, index));
        });
    }

    /**
     * Marks a record as just accessed.
     *
     * @return the updated record, or empty if {@code id} is unknown
     */
    public Optional<HistoryRecord> access(long id) {
        mutationLock.lock();
        try {
            long now = clock.millis();
            Optional<HistoryRecord> updated = metadata.inTransaction((ledger, index) ->
                    index.updateLastAccessed(id, now) ? index.getById(id) : Optional.<HistoryRecord>empty());
            if (updated.isPresent()) {
                publish();
            }
            return updated;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Removes a record and releases its blob. Unknown ids are ignored.
     *
     * @return true if a record was removed
     * @throws StorageException if the released blob file could not be deleted; the record
     *                          and ledger entry are gone regardless, and the file is left
     *                          for {@link #reconcile()}
     */
    public boolean delete(long id) {
        mutationLock.lock();
        try {
            Outcome<Boolean> outcome = metadata.inTransaction((ledger, index) -> {
                Optional<HistoryRecord> record = index.getById(id);
                if (record.isEmpty()) {
                    return Outcome.of(false);
                }
                boolean lastReference = BlobReferences.release(record.get(), ledger, index);
                return new Outcome<>(true,
                        lastReference ? List.of(record.get().blobHash()) : List.<String>of());
            });
            if (!outcome.value()) {
                return false;
            }
            List<StorageException> failures = deleteBlobs(outcome.releasedBlobs());
            publish();
            throwIfAny(failures);
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Removes every record and every blob file.
     *
     * @throws StorageException if blob files could not be removed; the records and ledger
     *                          are gone regardless, and leftover files are left for
     *                          {@link #reconcile()}
     */
    public void clearAll() {
        mutationLock.lock();
        try {
            int removed = metadata.inTransaction((ledger, index) -> {
                int records = index.deleteAll();
                ledger.deleteAll();
                return records;
            });
            try {
                int files = contentStore.deleteAll();
                contentStore.sweepTemporaryFiles();
                log.infof("Cleared history: %d records, %d blob files", removed, files);
            } catch (StorageException e) {
                log.warnf("Cleared %d records but blob files remain, leaving them for reconcile: %s",
                        removed, e.getMessage());
                throw e;
            } finally {
                publish();
            }
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Brings disk and metadata back in line after a crash or a failed file deletion:
     * removes interrupted writes and unregistered blob files, and drops ledger entries
     * (with their records) whose file has disappeared.
     */
    public ReconcileReport reconcile() {
        mutationLock.lock();
        try {
            int temporary = contentStore.sweepTemporaryFiles();
            Set<String> onDisk = new HashSet<>();
            for (ContentHash hash : contentStore.list()) {
                onDisk.add(hash.toHex());
            }

            int[] missing = new int[2];
            Set<String> registered = metadata.inTransaction((ledger, index) -> {
                Set<String> hashes = new HashSet<>();
                for (BlobRecord blob : ledger.all()) {
                    if (onDisk.contains(blob.hash())) {
                        hashes.add(blob.hash());
                        continue;
                    }
                    log.warnf("Blob %s is missing from disk; dropping its records", blob.hash());
                    for (HistoryRecord record : index.findByBlobHash(blob.hash())) {
                        index.deleteById(record.id());
                        missing[1]++;
                    }
                    ledger.remove(blob.hash());
                    missing[0]++;
                }
                return hashes;
            });

            int orphans = 0;
            for (String hash : onDisk) {
                if (!registered.contains(hash) && contentStore.delete(ContentHash.fromHex(hash))) {
                    orphans++;
                }
            }

            ReconcileReport report = new ReconcileReport(temporary, orphans, missing[0], missing[1]);
            if (report.isClean()) {
                log.debug("Reconcile found nothing to repair");
            } else {
                log.infof("Reconciled history store: %s", report);
            }
            if (missing[0] > 0) {
                publish();
            }
            return report;
        } finally {
            mutationLock.unlock();
        }
    }

    // -- reads --

    /** The most recently published snapshot. */
    public HistorySnapshot snapshot() {
        return snapshot;
    }

    public CacheStats getCacheStats() {
        return snapshot.stats();
    }

    public Optional<HistoryRecord> getById(long id) {
        return snapshot.findById(id);
    }

    /** Every record, most recently accessed first. */
    public List<HistoryRecord> items() {
        return snapshot.records();
    }

    public List<HistoryRecord> search(String query) {
        return query(HistoryQuery.forSearch(query));
    }

    public List<HistoryRecord> sortBy(SortField field, SortDirection direction) {
        return query(HistoryQuery.all().sortedBy(field, direction));
    }

    public List<HistoryRecord> filter(HistoryFilter filter) {
        return query(HistoryQuery.all().withFilter(filter));
    }

    /** Search, filter and sort combined, evaluated against the current snapshot. */
    public List<HistoryRecord> query(HistoryQuery query) {
        return query.apply(snapshot.records());
    }

    /** Ledger entry for a blob, if registered. */
    public Optional<BlobRecord> blobMeta(String hash) {
        return metadata.inTransaction((ledger, index) -> ledger.lookup(hash));
    }

    /** Opens a stored payload. Caller closes the stream. */
    public Optional<InputStream> openBlob(String hash) {
        return contentStore.open(ContentHash.fromHex(hash));
    }

    /**
     * Reads a stored payload.
     *
     * @throws com.libragraph.emlstore.core.storage.BlobNotFoundException if it is not stored
     */
    public byte[] readBlob(String hash) {
        return contentStore.read(ContentHash.fromHex(hash));
    }

    // -- observers --

    /**
     * Registers a listener and hands it the current snapshot right away.
     */
    public Subscription subscribe(HistoryListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        mutationLock.lock();
        try {
            listeners.add(listener);
            deliver(listener, snapshot);
        } finally {
            mutationLock.unlock();
        }
        return () -> listeners.remove(listener);
    }

    // -- internals --

    private List<StorageException> deleteBlobs(List<String> hashes) {
        List<StorageException> failures = new ArrayList<>();
        for (String hash : hashes) {
            try {
                contentStore.delete(ContentHash.fromHex(hash));
            } catch (StorageException e) {
                log.warnf("Released blob %s could not be deleted, leaving it for reconcile: %s",
                        hash, e.getMessage());
                failures.add(e);
            }
        }
        return failures;
    }

    private static void throwIfAny(List<StorageException> failures) {
        if (failures.isEmpty()) {
            return;
        }
        StorageException first = failures.get(0);
        for (int i = 1; i < failures.size(); i++) {
            first.addSuppressed(failures.get(i));
        }
        throw first;
    }

    private void publish() {
        HistorySnapshot next = loadSnapshot(snapshot.version() + 1);
        snapshot = next;
        for (HistoryListener listener : listeners) {
            deliver(listener, next);
        }
    }

    private HistorySnapshot loadSnapshot(long version) {
        return metadata.inTransaction((ledger, index) -> {
            List<HistoryRecord> records = index.all();
            return new HistorySnapshot(version, records,
                    new CacheStats(records.size(), ledger.totalSizeBytes()));
        });
    }

    private void deliver(HistoryListener listener, HistorySnapshot current) {
        try {
            listener.onSnapshot(current);
        } catch (RuntimeException e) {
            log.warnf(e, "History listener %s failed on snapshot %d", listener, current.version());
        }
    }
}
