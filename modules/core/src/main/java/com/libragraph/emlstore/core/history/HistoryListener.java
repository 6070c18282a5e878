package com.libragraph.emlstore.core.history;

/**
 * Receives the current snapshot on subscription and after every committed mutation.
 * Called on the mutating thread while the store's mutation lock is held, so calls
 * arrive in commit order. Implementations should return quickly.
 */
@FunctionalInterface
public interface HistoryListener {

    void onSnapshot(HistorySnapshot snapshot);
}
