package com.collection.mint.allowlist;

import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * Keccak-256 (the original Keccak padding, not NIST SHA3-256), backed by BouncyCastle.
 */
public final class Keccak {

    private Keccak() {
    }

    public static Bytes32 hash(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Bytes32.wrap(out);
    }

    /**
     * Leaf of an allowlist tree: the hash of the address's 20 raw bytes.
     */
    public static Bytes32 leaf(Address address) {
        return hash(address.toBytes());
    }

    /**
     * Hashes two nodes in ascending unsigned order, so the result does not
     * depend on which side of the tree each node came from.
     */
    public static Bytes32 hashSortedPair(Bytes32 a, Bytes32 b) {
        Bytes32 first = a.compareTo(b) <= 0 ? a : b;
        Bytes32 second = first == a ? b : a;
        byte[] buffer = new byte[Bytes32.LENGTH * 2];
        System.arraycopy(first.toBytes(), 0, buffer, 0, Bytes32.LENGTH);
        System.arraycopy(second.toBytes(), 0, buffer, Bytes32.LENGTH, Bytes32.LENGTH);
        return hash(buffer);
    }
}
