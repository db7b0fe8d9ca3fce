package com.collection.mint.compliance;

import com.collection.mint.allowlist.AllowlistVerifier;
import com.collection.mint.clock.SaleStageClock;
import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import com.collection.mint.core.model.CollectionConfig;
import com.collection.mint.core.model.MintKind;
import com.collection.mint.core.model.ParticipantRecord;
import com.collection.mint.core.model.SaleStage;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import com.collection.mint.registry.OwnershipRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Gatekeeper for every mint.
 *
 * <p>Each operation runs the same fixed pipeline and stops at the first failed
 * check:</p>
 * <ol>
 *   <li>sale stage</li>
 *   <li>non-zero amount</li>
 *   <li>per-transaction bound</li>
 *   <li>claim flag or cumulative wallet cap</li>
 *   <li>remaining supply</li>
 *   <li>payment</li>
 *   <li>allowlist proof (presale lists only)</li>
 * </ol>
 * Step 3 must come before any sum involving {@code amount}: once the amount is
 * known to be at most a small cap, later additions cannot overflow.
 *
 * <p>Nothing is written until every check has passed; then exactly one
 * {@link OwnershipRegistry#mint} call is made and the participant record is
 * updated. The engine is not thread-safe on its own; the owning contract
 * serializes calls.</p>
 */
public class MintComplianceEngine {
    private static final Logger log = LoggerFactory.getLogger(MintComplianceEngine.class);

    private final Supplier<CollectionConfig> config;
    private final SaleStageClock stageClock;
    private final OwnershipRegistry registry;
    private final AllowlistVerifier allowlistVerifier;
    private final ParticipantStore participants;
    private final MintPolicy policy;

    public MintComplianceEngine(Supplier<CollectionConfig> config,
                                SaleStageClock stageClock,
                                OwnershipRegistry registry,
                                AllowlistVerifier allowlistVerifier,
                                ParticipantStore participants,
                                MintPolicy policy) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.stageClock = Objects.requireNonNull(stageClock, "stageClock is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.allowlistVerifier = Objects.requireNonNull(allowlistVerifier, "allowlistVerifier is required");
        this.participants = Objects.requireNonNull(participants, "participants is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    /**
     * Presale mint for OG list members, open only during {@link SaleStage#PRESALE_OG}.
     */
    public MintReceipt ogMint(Address caller, int amount, List<Bytes32> proof, BigInteger payment) {
        CollectionConfig cfg = config.get();
        PresaleList list = new PresaleList(MintKind.OG, SaleStage.PRESALE_OG, cfg.getPresaleMaxTokenPerOg(),
                cfg.getPresalePriceOg(), cfg.getOgMerkleRoot());
        return presaleMint(cfg, list, caller, amount, proof, payment);
    }

    /**
     * Presale mint for WL list members, open only during {@link SaleStage#PRESALE_WL}.
     */
    public MintReceipt wlMint(Address caller, int amount, List<Bytes32> proof, BigInteger payment) {
        CollectionConfig cfg = config.get();
        PresaleList list = new PresaleList(MintKind.WL, SaleStage.PRESALE_WL, cfg.getPresaleMaxTokenPerWl(),
                cfg.getPresalePriceWl(), cfg.getWlMerkleRoot());
        return presaleMint(cfg, list, caller, amount, proof, payment);
    }

    /**
     * Public sale mint.
     */
    public MintReceipt publicMint(Address caller, int amount, BigInteger payment) {
        Objects.requireNonNull(caller, "caller is required");
        requireNonNegative(amount, payment);
        CollectionConfig cfg = config.get();

        requireStage(cfg, SaleStage.PUBLIC_SALE);
        requireNonZero(amount);

        int walletCap = cfg.getMaxTokenPerWallet();
        if (cfg.getMaxMintPerTx() > 0 && amount > cfg.getMaxMintPerTx()) {
            throw reject(ErrorCode.AMOUNT_EXCEEDS_CAP,
                    "Amount " + amount + " exceeds the per-transaction cap of " + cfg.getMaxMintPerTx());
        }
        if (amount > walletCap) {
            throw reject(ErrorCode.AMOUNT_EXCEEDS_CAP,
                    "Amount " + amount + " exceeds the wallet cap of " + walletCap);
        }

        ParticipantRecord record = participants.get(caller);
        if (policy.getPublicCapPolicy() == CapPolicy.CUMULATIVE_PER_WALLET
                && record.publicSaleBalance() > walletCap - amount) {
            throw reject(ErrorCode.AMOUNT_EXCEEDS_CAP,
                    "Wallet " + caller + " holds " + record.publicSaleBalance()
                            + " public sale tokens; " + amount + " more exceeds the cap of " + walletCap);
        }

        requireSupply(cfg, amount);
        requirePayment(cfg.getPrice(), amount, payment);

        List<Long> tokenIds = registry.mint(caller, amount);
        participants.put(caller, record.withPublicMint(amount));
        log.debug("Public mint of {} for {} accepted, tokens {}", amount, caller, tokenIds);
        return new MintReceipt(MintKind.PUBLIC, caller, tokenIds, payment);
    }

    /**
     * Privileged mint: no stage, price or proof checks, but the supply cap still applies.
     * The caller's role is checked by the contract before this is reached.
     */
    public MintReceipt operatorMint(Address recipient, int amount, BigInteger payment) {
        return privilegedMint(MintKind.OPERATOR, recipient, amount, payment);
    }

    /**
     * Mints the reserved allocation at construction time.
     */
    public MintReceipt mintReserved(Address recipient, int amount) {
        return privilegedMint(MintKind.RESERVED, recipient, amount, BigInteger.ZERO);
    }

    public SaleStage currentStage() {
        return stageClock.currentStage(config.get());
    }

    public int totalMinted() {
        return registry.totalSupply();
    }

    public ParticipantRecord participant(Address participant) {
        return participants.get(participant);
    }

    private MintReceipt privilegedMint(MintKind kind, Address recipient, int amount, BigInteger payment) {
        Objects.requireNonNull(recipient, "recipient is required");
        requireNonNegative(amount, payment);
        requireNonZero(amount);
        requireSupply(config.get(), amount);

        List<Long> tokenIds = registry.mint(recipient, amount);
        log.debug("{} mint of {} for {} accepted, tokens {}", kind, amount, recipient, tokenIds);
        return new MintReceipt(kind, recipient, tokenIds, payment);
    }

    private MintReceipt presaleMint(CollectionConfig cfg, PresaleList list, Address caller,
                                    int amount, List<Bytes32> proof, BigInteger payment) {
        Objects.requireNonNull(caller, "caller is required");
        requireNonNegative(amount, payment);

        requireStage(cfg, list.stage());
        requireNonZero(amount);

        if (amount > list.cap()) {
            throw reject(ErrorCode.AMOUNT_EXCEEDS_CAP,
                    list.kind() + " amount " + amount + " exceeds the cap of " + list.cap());
        }

        ParticipantRecord record = participants.get(caller);
        boolean claimed = list.kind() == MintKind.OG ? record.ogClaimed() : record.wlClaimed();
        int balance = list.kind() == MintKind.OG ? record.ogBalance() : record.wlBalance();
        switch (policy.getPresaleCapPolicy()) {
            case CLAIM_ONCE -> {
                if (claimed) {
                    throw reject(ErrorCode.ALREADY_CLAIMED,
                            caller + " already claimed the " + list.kind() + " allocation");
                }
            }
            case CUMULATIVE_PER_WALLET -> {
                if (balance > list.cap() - amount) {
                    throw reject(ErrorCode.AMOUNT_EXCEEDS_CAP,
                            caller + " holds " + balance + " " + list.kind() + " tokens; "
                                    + amount + " more exceeds the cap of " + list.cap());
                }
            }
            case PER_TRANSACTION -> {
                // amount already bounded above
            }
        }

        requireSupply(cfg, amount);
        requirePayment(list.price(), amount, payment);

        if (!allowlistVerifier.verify(caller, proof, list.root())) {
            throw reject(ErrorCode.INVALID_PROOF, caller + " is not on the " + list.kind() + " list");
        }

        List<Long> tokenIds = registry.mint(caller, amount);
        participants.put(caller, list.kind() == MintKind.OG ? record.withOgMint(amount) : record.withWlMint(amount));
        log.debug("{} mint of {} for {} accepted, tokens {}", list.kind(), amount, caller, tokenIds);
        return new MintReceipt(list.kind(), caller, tokenIds, payment);
    }

    private void requireStage(CollectionConfig cfg, SaleStage required) {
        SaleStage current = stageClock.currentStage(cfg);
        if (current != required) {
            throw reject(ErrorCode.STAGE_NOT_READY, "Requires stage " + required + " but stage is " + current);
        }
    }

    private void requireSupply(CollectionConfig cfg, int amount) {
        int remaining = cfg.getTotalSupply() - registry.totalSupply();
        if (amount > remaining) {
            throw reject(ErrorCode.SUPPLY_EXHAUSTED,
                    "Amount " + amount + " exceeds the remaining supply of " + Math.max(remaining, 0));
        }
    }

    private static void requirePayment(BigInteger unitPrice, int amount, BigInteger payment) {
        BigInteger due = unitPrice.multiply(BigInteger.valueOf(amount));
        if (payment.compareTo(due) < 0) {
            throw reject(ErrorCode.INSUFFICIENT_PAYMENT, "Payment " + payment + " is below the due " + due);
        }
    }

    private static void requireNonZero(int amount) {
        if (amount == 0) {
            throw reject(ErrorCode.ZERO_AMOUNT, "Mint amount must be greater than zero");
        }
    }

    private static void requireNonNegative(int amount, BigInteger payment) {
        Objects.requireNonNull(payment, "payment is required");
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        if (payment.signum() < 0) {
            throw new IllegalArgumentException("payment must be >= 0");
        }
    }

    private static CollectionException reject(ErrorCode code, String message) {
        return new CollectionException(code, message);
    }

    private record PresaleList(MintKind kind, SaleStage stage, int cap, BigInteger price, Bytes32 root) {
    }
}
