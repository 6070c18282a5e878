package com.libragraph.emlstore.core.history;

/**
 * Fired via CDI after every committed history mutation, carrying the snapshot
 * that mutation produced.
 */
public record HistoryChangedEvent(HistorySnapshot snapshot) {}
