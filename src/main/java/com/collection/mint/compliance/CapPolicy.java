package com.collection.mint.compliance;

/**
 * How a purchase cap is applied to a participant.
 */
public enum CapPolicy {

    /** Running balance plus the new amount must stay within the cap. */
    CUMULATIVE_PER_WALLET,

    /** Only each individual call is bounded by the cap. */
    PER_TRANSACTION,

    /** One call per participant, bounded by the cap; presale lists only. */
    CLAIM_ONCE
}
