package com.libragraph.emlstore.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a SHA-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>The lowercase hex form doubles as the blob's storage key ({@code cas/<hex>})
 * and as its primary key in the blob ledger.
 */
public record ContentHash(byte[] bytes) {
    private static final int HASH_LENGTH = 32; // 256 bits
    private static final int HEX_LENGTH = HASH_LENGTH * 2;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (SHA-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes a byte payload.
     *
     * @throws HashComputationException if the platform has no SHA-256 provider
     */
    public static ContentHash of(byte[] payload) {
        Objects.requireNonNull(payload, "payload cannot be null");
        try {
            return new ContentHash(DigestUtils.sha256(payload));
        } catch (IllegalArgumentException e) {
            throw new HashComputationException("SHA-256 digest unavailable", e);
        }
    }

    /**
     * Hashes everything remaining in the stream. The stream is not closed.
     */
    public static ContentHash of(InputStream in) {
        Objects.requireNonNull(in, "stream cannot be null");
        try {
            return new ContentHash(DigestUtils.sha256(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stream for hashing", e);
        } catch (IllegalArgumentException e) {
            throw new HashComputationException("SHA-256 digest unavailable", e);
        }
    }

    /**
     * Creates ContentHash from hex string (64 characters).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HEX_LENGTH) {
            throw new IllegalArgumentException(
                "SHA-256 hex string must be 64 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Returns true if {@code candidate} has the shape of a hex-encoded hash.
     * Used to tell blob files apart from anything else in a storage directory.
     */
    public static boolean isHex(String candidate) {
        if (candidate == null || candidate.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
