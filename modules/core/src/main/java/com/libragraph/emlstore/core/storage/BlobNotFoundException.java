package com.libragraph.emlstore.core.storage;

import com.libragraph.emlstore.util.ContentHash;

/**
 * Thrown when a read targets a blob that does not exist.
 */
public class BlobNotFoundException extends RuntimeException {

    private final ContentHash hash;

    public BlobNotFoundException(ContentHash hash) {
        super("Blob not found: " + hash);
        this.hash = hash;
    }

    public ContentHash hash() {
        return hash;
    }
}
