package com.libragraph.emlstore.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * Ledger row for one stored payload. {@code refCount} is always positive:
 * a blob whose last reference goes away is deleted, not kept at zero.
 */
public record BlobRecord(
        @ColumnName("hash") String hash,
        @ColumnName("size_bytes") long sizeBytes,
        @ColumnName("ref_count") int refCount
) {

    public BlobRecord withRefCount(int newRefCount) {
        return new BlobRecord(hash, sizeBytes, newRefCount);
    }
}
