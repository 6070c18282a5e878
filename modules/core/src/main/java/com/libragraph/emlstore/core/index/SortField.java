package com.libragraph.emlstore.core.index;

/**
 * Sort keys for history listings.
 */
public enum SortField {
    /** Email date, falling back to last access when the date is unknown. */
    DATE,
    /** Subject, case-insensitive. */
    SUBJECT,
    /** Sender name, or sender address when there is no name; case-insensitive. */
    SENDER
}
