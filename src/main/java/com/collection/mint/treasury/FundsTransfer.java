package com.collection.mint.treasury;

import com.collection.mint.core.model.Address;

import java.math.BigInteger;

/**
 * Pays out an executed withdrawal. Any exception thrown here aborts the
 * withdrawal and restores the treasury to its prior state.
 */
@FunctionalInterface
public interface FundsTransfer {

    void transfer(Address to, BigInteger value, byte[] data);

    /**
     * Transfer that accepts every payout without side effects.
     */
    static FundsTransfer accepting() {
        return (to, value, data) -> { };
    }
}
