package com.collection.mint.core.model;

import java.util.HexFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A 20-byte participant identity, held as {@code 0x}-prefixed lowercase hex.
 * Two addresses are equal when their bytes are equal, regardless of the case
 * they were parsed from.
 */
public record Address(String value) implements Comparable<Address> {

    private static final Pattern HEX_40 = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address value is required");
        value = value.trim().toLowerCase();
        if (!value.startsWith("0x")) {
            value = "0x" + value;
        }
        if (!HEX_40.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a 20-byte hex address: " + value);
        }
    }

    public static Address of(String hex) {
        return new Address(hex);
    }

    public static Address of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes are required");
        if (bytes.length != 20) {
            throw new IllegalArgumentException("Address must be 20 bytes, got " + bytes.length);
        }
        return new Address("0x" + HexFormat.of().formatHex(bytes));
    }

    /**
     * Returns the raw 20 bytes of this address.
     */
    public byte[] toBytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
