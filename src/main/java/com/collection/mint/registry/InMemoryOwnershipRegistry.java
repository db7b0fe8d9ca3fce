package com.collection.mint.registry;

import com.collection.mint.core.model.Address;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory implementation of {@link OwnershipRegistry}.
 * Token ids are assigned sequentially from 0. Suitable for testing and
 * single-JVM deployments.
 */
public class InMemoryOwnershipRegistry implements OwnershipRegistry {
    private static final Logger log = LoggerFactory.getLogger(InMemoryOwnershipRegistry.class);

    private final int hardCap;
    private final List<Address> owners = new ArrayList<>();
    private final Map<Address, Integer> balances = new HashMap<>();

    public InMemoryOwnershipRegistry(int hardCap) {
        if (hardCap <= 0) {
            throw new IllegalArgumentException("hardCap must be > 0");
        }
        this.hardCap = hardCap;
    }

    @Override
    public synchronized List<Long> mint(Address owner, int count) {
        Objects.requireNonNull(owner, "owner is required");
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        if (count > hardCap - owners.size()) {
            throw new CollectionException(ErrorCode.SUPPLY_EXHAUSTED,
                    "Minting " + count + " would exceed the registry cap of " + hardCap);
        }
        List<Long> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add((long) owners.size());
            owners.add(owner);
        }
        balances.merge(owner, count, Integer::sum);
        log.debug("Registry minted {} tokens [{}..{}] to {}", count, ids.get(0), ids.get(count - 1), owner);
        return Collections.unmodifiableList(ids);
    }

    @Override
    public synchronized int balanceOf(Address owner) {
        return balances.getOrDefault(owner, 0);
    }

    @Override
    public synchronized int totalSupply() {
        return owners.size();
    }

    @Override
    public synchronized Address ownerOf(long tokenId) {
        if (tokenId < 0 || tokenId >= owners.size()) {
            throw new CollectionException(ErrorCode.NON_EXISTENT_TOKEN, "Token does not exist: " + tokenId);
        }
        return owners.get((int) tokenId);
    }

    public int getHardCap() {
        return hardCap;
    }
}
