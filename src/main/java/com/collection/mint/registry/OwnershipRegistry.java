package com.collection.mint.registry;

import com.collection.mint.core.model.Address;

import java.util.List;

/**
 * Token ownership ledger the mint engine writes to.
 * Implementations track token id to owner, per-owner balance and the total
 * minted count. Transfer and approval mechanics are outside this interface.
 */
public interface OwnershipRegistry {

    /**
     * Mints {@code count} new tokens to {@code owner}.
     *
     * @return the ids of the new tokens, ascending
     * @throws com.collection.mint.error.CollectionException with
     *         {@code SUPPLY_EXHAUSTED} if the registry's hard cap would be exceeded
     */
    List<Long> mint(Address owner, int count);

    /**
     * Number of tokens held by {@code owner}; 0 for unknown owners.
     */
    int balanceOf(Address owner);

    /**
     * Total number of tokens minted so far.
     */
    int totalSupply();

    /**
     * Owner of a token.
     *
     * @throws com.collection.mint.error.CollectionException with
     *         {@code NON_EXISTENT_TOKEN} if the token was never minted
     */
    Address ownerOf(long tokenId);
}
