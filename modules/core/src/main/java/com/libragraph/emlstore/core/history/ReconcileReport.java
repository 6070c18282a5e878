package com.libragraph.emlstore.core.history;

/**
 * What {@link HistoryStore#reconcile()} had to repair.
 *
 * @param temporaryFiles  leftovers of interrupted blob writes removed
 * @param orphanBlobs     blob files without a ledger entry removed
 * @param missingBlobs    ledger entries whose file was gone, removed
 * @param droppedRecords  history records removed because their blob was gone
 */
public record ReconcileReport(int temporaryFiles, int orphanBlobs, int missingBlobs, int droppedRecords) {

    public boolean isClean() {
        return temporaryFiles == 0 && orphanBlobs == 0 && missingBlobs == 0 && droppedRecords == 0;
    }
}
