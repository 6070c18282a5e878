package com.libragraph.emlstore.core.history;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for one {@link HistoryStore}.
 *
 * @param baseDir      directory owning the {@code cas/} blob tree
 * @param historyLimit maximum number of records kept; 0 or less keeps everything
 * @param dedupPolicy  record identity policy for repeated payloads
 */
public record HistoryStoreConfig(Path baseDir, int historyLimit, DedupPolicy dedupPolicy) {

    public HistoryStoreConfig {
        Objects.requireNonNull(baseDir, "baseDir cannot be null");
        dedupPolicy = dedupPolicy != null ? dedupPolicy : DedupPolicy.UNIQUE_CONTENT;
    }

    /** Unbounded retention, one record per distinct payload. */
    public static HistoryStoreConfig of(Path baseDir) {
        return new HistoryStoreConfig(baseDir, 0, DedupPolicy.UNIQUE_CONTENT);
    }

    public HistoryStoreConfig withHistoryLimit(int limit) {
        return new HistoryStoreConfig(baseDir, limit, dedupPolicy);
    }

    public HistoryStoreConfig withDedupPolicy(DedupPolicy policy) {
        return new HistoryStoreConfig(baseDir, historyLimit, policy);
    }
}
