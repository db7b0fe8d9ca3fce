package com.collection.mint.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Address Tests")
class AddressTest {

    @Test
    @DisplayName("Should normalize case and add the 0x prefix")
    void normalizes() {
        Address upper = Address.of("0xABCDEF0123456789ABCDEF0123456789ABCDEF01");
        Address bare = Address.of("abcdef0123456789abcdef0123456789abcdef01");

        assertEquals("0xabcdef0123456789abcdef0123456789abcdef01", upper.value());
        assertEquals(upper, bare);
        assertEquals(upper.hashCode(), bare.hashCode());
    }

    @Test
    @DisplayName("Should reject malformed addresses")
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> Address.of("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> Address.of("0xzz00000000000000000000000000000000000000"));
        assertThrows(NullPointerException.class, () -> Address.of((String) null));
    }

    @Test
    @DisplayName("Should convert to and from raw bytes")
    void bytesConversion() {
        byte[] raw = new byte[20];
        raw[0] = (byte) 0xff;
        raw[19] = 0x01;

        Address address = Address.of(raw);

        assertEquals("0xff00000000000000000000000000000000000001", address.value());
        assertArrayEquals(raw, address.toBytes());
        assertThrows(IllegalArgumentException.class, () -> Address.of(new byte[19]));
    }

    @Test
    @DisplayName("ZERO should be recognized as zero")
    void zero() {
        assertTrue(Address.ZERO.isZero());
        assertFalse(Address.of("0x0000000000000000000000000000000000000001").isZero());
    }
}
