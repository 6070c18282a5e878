package com.libragraph.emlstore.core.ledger;

/**
 * Thrown when the blob ledger disagrees with the history it is supposed to count:
 * releasing a reference that does not exist, registering a blob twice, or a history
 * record pointing at an unknown blob. Always a bug, never clamped or retried.
 */
public class LedgerInvariantException extends IllegalStateException {

    public LedgerInvariantException(String message) {
        super(message);
    }
}
