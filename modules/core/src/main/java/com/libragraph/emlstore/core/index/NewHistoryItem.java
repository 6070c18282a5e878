package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.EmailMetadata;

import java.util.Objects;

/**
 * Insert request for {@link HistoryIndex#insert}; the index assigns the id.
 */
public record NewHistoryItem(
        String blobHash,
        String displayName,
        String originalSourceRef,
        long lastAccessed,
        EmailMetadata metadata
) {
    public NewHistoryItem {
        Objects.requireNonNull(blobHash, "blobHash cannot be null");
        Objects.requireNonNull(displayName, "displayName cannot be null");
        metadata = metadata != null ? metadata : EmailMetadata.empty();
    }
}
