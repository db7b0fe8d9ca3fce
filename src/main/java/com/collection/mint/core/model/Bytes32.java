package com.collection.mint.core.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Immutable 32-byte value: a hash, a merkle node, or a published commitment.
 * Ordering is unsigned lexicographic over the bytes, which is the order used
 * when hashing sorted pairs.
 */
public final class Bytes32 implements Comparable<Bytes32> {

    public static final int LENGTH = 32;

    /** The all-zero value; used as "not configured" for merkle roots. */
    public static final Bytes32 ZERO = new Bytes32(new byte[LENGTH]);

    private final byte[] bytes;

    private Bytes32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Bytes32 wrap(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes are required");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Expected " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Bytes32(bytes.clone());
    }

    /**
     * Parses 64 hex digits, with or without a {@code 0x} prefix.
     */
    public static Bytes32 fromHex(String hex) {
        Objects.requireNonNull(hex, "hex is required");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Expected 64 hex digits, got " + digits.length());
        }
        return new Bytes32(HexFormat.of().parseHex(digits));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return "0x" + HexFormat.of().formatHex(bytes);
    }

    public boolean isZero() {
        return Arrays.equals(bytes, ZERO.bytes);
    }

    @Override
    public int compareTo(Bytes32 other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Bytes32) o).bytes);
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
