package com.libragraph.emlstore.core.history;

/**
 * Size of the history cache.
 *
 * @param entryCount     number of history records
 * @param totalSizeBytes bytes held by distinct blobs; a payload shared by several
 *                       records counts once
 */
public record CacheStats(int entryCount, long totalSizeBytes) {

    public static final CacheStats EMPTY = new CacheStats(0, 0L);
}
