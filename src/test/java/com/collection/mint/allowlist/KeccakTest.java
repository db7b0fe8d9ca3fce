package com.collection.mint.allowlist;

import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Keccak Tests")
class KeccakTest {

    @Test
    @DisplayName("Should match the Keccak-256 digest of the empty input")
    void emptyInput() {
        assertEquals(Bytes32.fromHex("c5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470"),
                Keccak.hash(new byte[0]));
    }

    @Test
    @DisplayName("Should match the Keccak-256 digest of 'abc'")
    void abcInput() {
        assertEquals(Bytes32.fromHex("4e03657aea45a94fc7d47ba826c8d667c0d1e6e33a64a036ec44f58fa12d6c45"),
                Keccak.hash("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    @DisplayName("Sorted pair hash should not depend on argument order")
    void sortedPairIsSymmetric() {
        Bytes32 a = Keccak.hash(new byte[]{1});
        Bytes32 b = Keccak.hash(new byte[]{2});

        assertEquals(Keccak.hashSortedPair(a, b), Keccak.hashSortedPair(b, a));
        assertNotEquals(a, Keccak.hashSortedPair(a, b));
    }

    @Test
    @DisplayName("Leaf should hash the 20 raw address bytes")
    void leafHashesRawBytes() {
        Address address = Address.of("0x00000000000000000000000000000000000000ad");
        assertEquals(Keccak.hash(address.toBytes()), Keccak.leaf(address));
    }
}
