package com.collection.mint.error;

/**
 * Reasons a contract call is rejected. Every rejection leaves state untouched.
 */
public enum ErrorCode {
    ZERO_AMOUNT,
    AMOUNT_EXCEEDS_CAP,
    SUPPLY_EXHAUSTED,
    INSUFFICIENT_PAYMENT,
    INVALID_PROOF,
    STAGE_NOT_READY,
    ALREADY_CLAIMED,
    NON_EXISTENT_TOKEN,
    INDEX_OUT_OF_RANGE,
    ALREADY_CONFIRMED,
    NOT_CONFIRMED,
    QUORUM_NOT_MET,
    ALREADY_EXECUTED,
    UNAUTHORIZED,
    REENTRANT_CALL,
    /** Withdrawal value exceeds the funds held by the contract. */
    INSUFFICIENT_BALANCE,
    /** The payout collaborator failed; the withdrawal was rolled back. */
    TRANSFER_FAILED,
    /** Deployment-readiness gate: no metadata base URI configured yet. */
    METADATA_NOT_CONFIGURED
}
