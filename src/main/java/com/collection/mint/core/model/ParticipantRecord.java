package com.collection.mint.core.model;

/**
 * Per-address purchase state. Never stored until the first successful mint;
 * absent participants read as {@link #EMPTY}.
 *
 * @param ogClaimed         OG allocation used (claim-once policy)
 * @param wlClaimed         WL allocation used (claim-once policy)
 * @param ogBalance         tokens minted through the OG list
 * @param wlBalance         tokens minted through the WL list
 * @param publicSaleBalance tokens minted in the public sale
 */
public record ParticipantRecord(
        boolean ogClaimed,
        boolean wlClaimed,
        int ogBalance,
        int wlBalance,
        int publicSaleBalance
) {
    public static final ParticipantRecord EMPTY = new ParticipantRecord(false, false, 0, 0, 0);

    public ParticipantRecord {
        if (ogBalance < 0 || wlBalance < 0 || publicSaleBalance < 0) {
            throw new IllegalArgumentException("balances must be >= 0");
        }
    }

    public ParticipantRecord withOgMint(int amount) {
        return new ParticipantRecord(true, wlClaimed, ogBalance + amount, wlBalance, publicSaleBalance);
    }

    public ParticipantRecord withWlMint(int amount) {
        return new ParticipantRecord(ogClaimed, true, ogBalance, wlBalance + amount, publicSaleBalance);
    }

    public ParticipantRecord withPublicMint(int amount) {
        return new ParticipantRecord(ogClaimed, wlClaimed, ogBalance, wlBalance, publicSaleBalance + amount);
    }
}
