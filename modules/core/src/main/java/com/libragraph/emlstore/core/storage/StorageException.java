package com.libragraph.emlstore.core.storage;

/**
 * Unchecked failure reading or writing blob files under {@code cas/}, usually
 * wrapping the {@link java.io.IOException} from the file system. History
 * mutations that already committed their metadata rethrow it after publishing,
 * leaving the stray files for {@code HistoryStore.reconcile()}.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
