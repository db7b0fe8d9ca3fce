package com.collection.mint.allowlist;

import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Binary merkle tree over an allowlist, built the way allowlist tooling builds
 * them for on-chain verification:
 * <ul>
 *   <li>leaves are {@code keccak256(address)} kept in insertion order,</li>
 *   <li>each parent is the hash of its two children sorted ascending,</li>
 *   <li>a trailing node without a sibling moves up a layer unchanged.</li>
 * </ul>
 * Proofs produced here verify with {@link AllowlistVerifier}.
 */
public class SortedPairMerkleTree {

    private final List<List<Bytes32>> layers;

    private SortedPairMerkleTree(List<Bytes32> leaves) {
        if (leaves.isEmpty()) {
            throw new IllegalArgumentException("A merkle tree needs at least one leaf");
        }
        List<List<Bytes32>> built = new ArrayList<>();
        List<Bytes32> layer = List.copyOf(leaves);
        built.add(layer);
        while (layer.size() > 1) {
            List<Bytes32> parent = new ArrayList<>((layer.size() + 1) / 2);
            for (int i = 0; i < layer.size(); i += 2) {
                if (i + 1 < layer.size()) {
                    parent.add(Keccak.hashSortedPair(layer.get(i), layer.get(i + 1)));
                } else {
                    parent.add(layer.get(i));
                }
            }
            layer = Collections.unmodifiableList(parent);
            built.add(layer);
        }
        this.layers = Collections.unmodifiableList(built);
    }

    public static SortedPairMerkleTree ofAddresses(List<Address> addresses) {
        Objects.requireNonNull(addresses, "addresses are required");
        return new SortedPairMerkleTree(addresses.stream().map(Keccak::leaf).toList());
    }

    public static SortedPairMerkleTree ofLeaves(List<Bytes32> leaves) {
        Objects.requireNonNull(leaves, "leaves are required");
        return new SortedPairMerkleTree(leaves);
    }

    public Bytes32 root() {
        return layers.get(layers.size() - 1).get(0);
    }

    public int leafCount() {
        return layers.get(0).size();
    }

    /**
     * Proof for the given address, or an empty list when the address is not a leaf.
     * An empty list is also the valid proof for a single-leaf tree; use
     * {@link #contains(Address)} to tell the two apart.
     */
    public List<Bytes32> proof(Address address) {
        int index = layers.get(0).indexOf(Keccak.leaf(address));
        return index < 0 ? List.of() : proof(index);
    }

    public boolean contains(Address address) {
        return layers.get(0).contains(Keccak.leaf(address));
    }

    public List<Bytes32> proof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leafCount()) {
            throw new IndexOutOfBoundsException("leafIndex " + leafIndex + " not in [0, " + leafCount() + ")");
        }
        List<Bytes32> proof = new ArrayList<>();
        int index = leafIndex;
        for (int depth = 0; depth < layers.size() - 1; depth++) {
            List<Bytes32> layer = layers.get(depth);
            int sibling = (index % 2 == 1) ? index - 1 : index + 1;
            if (sibling < layer.size()) {
                proof.add(layer.get(sibling));
            }
            index /= 2;
        }
        return Collections.unmodifiableList(proof);
    }
}
