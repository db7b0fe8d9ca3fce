package com.collection.mint.compliance;

import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.MintKind;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Result of an accepted mint.
 *
 * @param kind      the path the tokens were minted through
 * @param recipient new owner of the tokens
 * @param tokenIds  ids of the minted tokens, ascending
 * @param payment   amount paid with the call, in wei
 */
public record MintReceipt(MintKind kind, Address recipient, List<Long> tokenIds, BigInteger payment) {

    public MintReceipt {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(recipient, "recipient is required");
        tokenIds = List.copyOf(tokenIds);
        payment = payment != null ? payment : BigInteger.ZERO;
    }

    public int amount() {
        return tokenIds.size();
    }

    public long firstTokenId() {
        return tokenIds.get(0);
    }
}
