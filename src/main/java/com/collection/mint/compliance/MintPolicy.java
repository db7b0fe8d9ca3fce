package com.collection.mint.compliance;

import java.util.Objects;

/**
 * Behavioural choices of a deployment that the sale configuration does not
 * cover. OG minting is always restricted to the OG window; this is not a
 * policy switch.
 */
public class MintPolicy {

    private final CapPolicy presaleCapPolicy;
    private final CapPolicy publicCapPolicy;
    private final boolean stageGatedWithdrawals;

    private MintPolicy(Builder builder) {
        this.presaleCapPolicy = builder.presaleCapPolicy;
        this.publicCapPolicy = builder.publicCapPolicy;
        this.stageGatedWithdrawals = builder.stageGatedWithdrawals;
    }

    public CapPolicy getPresaleCapPolicy() {
        return presaleCapPolicy;
    }

    public CapPolicy getPublicCapPolicy() {
        return publicCapPolicy;
    }

    /**
     * Whether executing a withdrawal additionally requires the public sale to have started.
     */
    public boolean isStageGatedWithdrawals() {
        return stageGatedWithdrawals;
    }

    /**
     * Default policy: cumulative wallet caps everywhere, withdrawals only once the public sale is open.
     */
    public static MintPolicy defaults() {
        return builder().build();
    }

    /**
     * Presale lists may be used once per participant.
     */
    public static MintPolicy claimOnce() {
        return builder().presaleCapPolicy(CapPolicy.CLAIM_ONCE).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "MintPolicy{" +
                "presaleCapPolicy=" + presaleCapPolicy +
                ", publicCapPolicy=" + publicCapPolicy +
                ", stageGatedWithdrawals=" + stageGatedWithdrawals +
                '}';
    }

    public static class Builder {
        private CapPolicy presaleCapPolicy = CapPolicy.CUMULATIVE_PER_WALLET;
        private CapPolicy publicCapPolicy = CapPolicy.CUMULATIVE_PER_WALLET;
        private boolean stageGatedWithdrawals = true;

        public Builder presaleCapPolicy(CapPolicy presaleCapPolicy) {
            this.presaleCapPolicy = Objects.requireNonNull(presaleCapPolicy, "presaleCapPolicy is required");
            return this;
        }

        public Builder publicCapPolicy(CapPolicy publicCapPolicy) {
            Objects.requireNonNull(publicCapPolicy, "publicCapPolicy is required");
            if (publicCapPolicy == CapPolicy.CLAIM_ONCE) {
                throw new IllegalArgumentException("CLAIM_ONCE applies to presale lists only");
            }
            this.publicCapPolicy = publicCapPolicy;
            return this;
        }

        public Builder stageGatedWithdrawals(boolean stageGatedWithdrawals) {
            this.stageGatedWithdrawals = stageGatedWithdrawals;
            return this;
        }

        public MintPolicy build() {
            return new MintPolicy(this);
        }
    }
}
