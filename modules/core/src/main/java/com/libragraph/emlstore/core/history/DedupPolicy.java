package com.libragraph.emlstore.core.history;

/**
 * How re-ingesting an already stored payload maps onto history records.
 */
public enum DedupPolicy {

    /**
     * One history record per distinct payload. Ingesting known bytes again marks
     * the existing record as accessed and returns it; no record is added.
     */
    UNIQUE_CONTENT,

    /**
     * Every ingest adds a record. Records with identical payloads share one blob,
     * whose reference count tracks all of them.
     */
    SHARED_BLOB
}
