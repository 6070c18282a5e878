package com.libragraph.emlstore.core.index;

public enum SortDirection {
    /** A-Z, oldest first. */
    ASCENDING,
    /** Z-A, newest first. */
    DESCENDING
}
