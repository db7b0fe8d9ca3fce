package com.collection.mint.relay;

import com.collection.mint.allowlist.AllowlistVerifier;
import com.collection.mint.api.CollectionContract;
import com.collection.mint.audit.AuditAction;
import com.collection.mint.audit.AuditService;
import com.collection.mint.compliance.MintReceipt;
import com.collection.mint.config.DeploymentSettings;
import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import com.collection.mint.lock.ExecutionLock;
import com.collection.mint.lock.NonReentrantExecutionLock;
import com.collection.mint.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Separate allowlist sale that mints through a collection's operator path.
 *
 * <p>The relay keeps its own allowlist root, unit price and window. A buyer on
 * the relay list pays the relay price and the whole payment is forwarded to
 * {@link CollectionContract#operatorMint}, so the relay's own address must hold
 * the OPERATOR role on the collection. The relay applies no per-wallet cap.</p>
 *
 * <p>The window is open from {@code presaleStartDate} (0 means not scheduled)
 * until {@code presaleEndDate}, exclusive (0 means open-ended).</p>
 */
public class MintRelay {
    private static final Logger log = LoggerFactory.getLogger(MintRelay.class);

    private final Address address;
    private final Address owner;
    private final CollectionContract collection;
    private final AllowlistVerifier allowlistVerifier = new AllowlistVerifier();
    private final ExecutionLock executionLock;
    private final AuditService auditService;
    private final Clock clock;

    private volatile Bytes32 wlMerkleRoot;
    private volatile BigInteger price;
    private volatile long presaleStartDate;
    private volatile long presaleEndDate;

    private MintRelay(Builder builder) {
        this.address = Objects.requireNonNull(builder.address, "address is required");
        this.owner = Objects.requireNonNull(builder.owner, "owner is required");
        this.collection = Objects.requireNonNull(builder.collection, "collection is required");
        this.wlMerkleRoot = Objects.requireNonNull(builder.wlMerkleRoot, "wlMerkleRoot is required");
        this.price = requirePrice(builder.price);
        this.presaleStartDate = requireTimestamp(builder.presaleStartDate, "presaleStartDate");
        this.presaleEndDate = requireTimestamp(builder.presaleEndDate, "presaleEndDate");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.executionLock = builder.executionLock != null ? builder.executionLock : new NonReentrantExecutionLock();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mints {@code amount} tokens to {@code caller} through the collection.
     *
     * @throws CollectionException {@code STAGE_NOT_READY} outside the window,
     *         {@code ZERO_AMOUNT}, {@code INSUFFICIENT_PAYMENT}, {@code INVALID_PROOF},
     *         or whatever the collection rejects the forwarded mint with
     */
    public MintReceipt mintRelay(Address caller, int amount, List<Bytes32> proof, BigInteger payment) {
        Objects.requireNonNull(caller, "caller is required");
        Objects.requireNonNull(payment, "payment is required");
        if (amount < 0 || payment.signum() < 0) {
            throw new IllegalArgumentException("amount and payment must be >= 0");
        }
        try (LogContext logCtx = LogContext.forCall("mintRelay", caller.value());
             ExecutionLock.Permit permit = executionLock.acquire("mintRelay")) {
            try {
                requireOpen();
                if (amount == 0) {
                    throw new CollectionException(ErrorCode.ZERO_AMOUNT, "Mint amount must be greater than zero");
                }
                BigInteger due = price.multiply(BigInteger.valueOf(amount));
                if (payment.compareTo(due) < 0) {
                    throw new CollectionException(ErrorCode.INSUFFICIENT_PAYMENT,
                            "Payment " + payment + " is below the due " + due);
                }
                if (!allowlistVerifier.verify(caller, proof, wlMerkleRoot)) {
                    throw new CollectionException(ErrorCode.INVALID_PROOF, caller + " is not on the relay list");
                }

                MintReceipt receipt = collection.operatorMint(address, caller, amount, payment);
                auditService.record(AuditAction.RELAY_MINTED, caller.value(), address.value(), Map.of(
                        "amount", amount,
                        "firstTokenId", receipt.firstTokenId(),
                        "payment", payment.toString()));
                log.info("relay.minted buyer={} amount={} payment={}", caller, amount, payment);
                return receipt;
            } catch (CollectionException e) {
                log.warn("relay.rejected buyer={} error={} reason={}", caller, e.getErrorCode(), e.getMessage());
                throw e;
            }
        }
    }

    public boolean isOpen() {
        long now = clock.instant().getEpochSecond();
        if (presaleStartDate == 0 || now < presaleStartDate) {
            return false;
        }
        return presaleEndDate == 0 || now < presaleEndDate;
    }

    public void setWlMerkleRoot(Address caller, Bytes32 root) {
        Objects.requireNonNull(root, "root is required");
        ownerUpdate(caller, "wlMerkleRoot", root.toHex(), () -> this.wlMerkleRoot = root);
    }

    public void setPrice(Address caller, BigInteger price) {
        BigInteger checked = requirePrice(price);
        ownerUpdate(caller, "price", checked.toString(), () -> this.price = checked);
    }

    public void setPresaleStartDate(Address caller, long presaleStartDate) {
        long checked = requireTimestamp(presaleStartDate, "presaleStartDate");
        ownerUpdate(caller, "presaleStartDate", checked, () -> this.presaleStartDate = checked);
    }

    public void setPresaleEndDate(Address caller, long presaleEndDate) {
        long checked = requireTimestamp(presaleEndDate, "presaleEndDate");
        ownerUpdate(caller, "presaleEndDate", checked, () -> this.presaleEndDate = checked);
    }

    public Address getAddress() {
        return address;
    }

    public Address getOwner() {
        return owner;
    }

    public Bytes32 getWlMerkleRoot() {
        return wlMerkleRoot;
    }

    public BigInteger getPrice() {
        return price;
    }

    public long getPresaleStartDate() {
        return presaleStartDate;
    }

    public long getPresaleEndDate() {
        return presaleEndDate;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    private void requireOpen() {
        if (!isOpen()) {
            throw new CollectionException(ErrorCode.STAGE_NOT_READY,
                    "Relay window is closed (start=" + presaleStartDate + ", end=" + presaleEndDate + ")");
        }
    }

    private void ownerUpdate(Address caller, String parameter, Object value, Runnable change) {
        Objects.requireNonNull(caller, "caller is required");
        try (ExecutionLock.Permit permit = executionLock.acquire("set " + parameter)) {
            if (!owner.equals(caller)) {
                throw new CollectionException(ErrorCode.UNAUTHORIZED, caller + " is not the relay owner");
            }
            change.run();
            auditService.record(AuditAction.PARAMETER_UPDATED, address.value(), caller.value(), Map.of(
                    "parameter", parameter,
                    "value", value));
            log.info("relay.updated parameter={} value={}", parameter, value);
        }
    }

    private static BigInteger requirePrice(BigInteger price) {
        Objects.requireNonNull(price, "price is required");
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price must be >= 0");
        }
        return price;
    }

    private static long requireTimestamp(long timestamp, String name) {
        if (timestamp < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return timestamp;
    }

    public static class Builder {
        private Address address;
        private Address owner;
        private CollectionContract collection;
        private Bytes32 wlMerkleRoot = Bytes32.ZERO;
        private BigInteger price;
        private long presaleStartDate;
        private long presaleEndDate;
        private Clock clock;
        private ExecutionLock executionLock;
        private AuditService auditService;

        /**
         * Takes the relay price and, when no owner was set, the collection admin as owner.
         *
         * @throws IllegalArgumentException when the settings carry no relay price
         */
        public Builder settings(DeploymentSettings settings) {
            this.price = settings.relayPriceIfSet().orElseThrow(() ->
                    new IllegalArgumentException("Deployment settings carry no relay price"));
            if (this.owner == null) {
                this.owner = settings.admin();
            }
            return this;
        }

        /**
         * The relay's own identity, used as the caller of {@code operatorMint}.
         */
        public Builder address(Address address) {
            this.address = address;
            return this;
        }

        public Builder owner(Address owner) {
            this.owner = owner;
            return this;
        }

        public Builder collection(CollectionContract collection) {
            this.collection = collection;
            return this;
        }

        public Builder wlMerkleRoot(Bytes32 wlMerkleRoot) {
            this.wlMerkleRoot = wlMerkleRoot;
            return this;
        }

        public Builder price(BigInteger price) {
            this.price = price;
            return this;
        }

        public Builder presaleStartDate(long presaleStartDate) {
            this.presaleStartDate = presaleStartDate;
            return this;
        }

        public Builder presaleEndDate(long presaleEndDate) {
            this.presaleEndDate = presaleEndDate;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder executionLock(ExecutionLock executionLock) {
            this.executionLock = executionLock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public MintRelay build() {
            return new MintRelay(this);
        }
    }
}
