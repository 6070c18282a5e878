package com.libragraph.emlstore.core.storage;

import com.libragraph.emlstore.util.ContentHash;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable byte store keyed by content hash: one object per distinct payload.
 *
 * <p>Writes are all-or-nothing. Once {@link #store} returns, the blob is complete
 * and durable; a reader never sees a partial object under its final key.
 */
public interface ContentStore {

    /** Outcome of a {@link #storeIfAbsent} call. */
    record StoreResult(ContentHash hash, long size, boolean written) {}

    /**
     * Hashes {@code bytes} and writes them under their hash unless already present.
     *
     * @throws StorageException on I/O errors; nothing is left under the final key
     */
    default ContentHash store(byte[] bytes) {
        return storeIfAbsent(ContentHash.of(bytes), bytes).hash();
    }

    /**
     * Writes {@code bytes} under a precomputed hash unless the key already exists.
     * {@code written} is false when the blob was already on disk.
     *
     * @throws StorageException on I/O errors
     */
    StoreResult storeIfAbsent(ContentHash hash, byte[] bytes);

    boolean exists(ContentHash hash);

    /**
     * Size in bytes of a stored blob, or empty if absent.
     */
    OptionalLong size(ContentHash hash);

    /**
     * Opens a stream over a stored blob, or empty if absent. Caller closes the stream.
     */
    Optional<InputStream> open(ContentHash hash);

    /**
     * Reads a whole blob.
     *
     * @throws BlobNotFoundException if the blob does not exist
     * @throws StorageException on I/O errors
     */
    byte[] read(ContentHash hash);

    /**
     * Deletes a blob. Deleting an absent blob is a no-op.
     *
     * @return true if a blob was removed
     * @throws StorageException on I/O errors
     */
    boolean delete(ContentHash hash);

    /**
     * Deletes every stored blob.
     *
     * @return number of blobs removed
     */
    int deleteAll();

    /**
     * Lists the hashes of all stored blobs.
     */
    List<ContentHash> list();

    /**
     * Removes leftovers of interrupted writes.
     *
     * @return number of files removed
     */
    int sweepTemporaryFiles();
}
