package com.libragraph.emlstore.util;

/**
 * Thrown when a content hash cannot be computed at all. Never expected for
 * well-formed input; indicates a broken runtime (missing digest provider).
 */
public class HashComputationException extends IllegalStateException {

    public HashComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
