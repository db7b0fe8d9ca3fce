package com.collection.mint.treasury;

import com.collection.mint.access.AccessControl;
import com.collection.mint.access.Role;
import com.collection.mint.clock.SaleStageClock;
import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.CollectionConfig;
import com.collection.mint.core.model.SaleStage;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Holds the proceeds of the sale and pays them out through N-of-M approval.
 *
 * <p>Each withdrawal moves PROPOSED → EXECUTABLE → EXECUTED. Approvers confirm
 * or revoke their confirmation while the transaction is not executed; the
 * admin executes once {@code requiredConfirmations} approvers have confirmed.</p>
 *
 * <p>Execution is gated twice:</p>
 * <ul>
 *   <li>funds safety: quorum, not already executed, value covered by the
 *       balance, and a successful payout;</li>
 *   <li>deployment readiness: the public sale has started (when stage gating is
 *       on) and a metadata base URI has been configured.</li>
 * </ul>
 *
 * <p>Methods are synchronized so views are consistent from any thread; the
 * owning contract's execution lock still orders the state-changing calls.</p>
 */
public class MultiApprovalTreasury {
    private static final Logger log = LoggerFactory.getLogger(MultiApprovalTreasury.class);

    private final Set<Address> approvers;
    private final int requiredConfirmations;
    private final AccessControl accessControl;
    private final FundsTransfer fundsTransfer;
    private final Supplier<CollectionConfig> config;
    private final SaleStageClock stageClock;
    private final boolean stageGated;

    private final List<WithdrawalTransaction> transactions = new ArrayList<>();
    private BigInteger balance = BigInteger.ZERO;

    private MultiApprovalTreasury(Builder builder) {
        if (builder.approvers.isEmpty()) {
            throw new IllegalArgumentException("At least one approver is required");
        }
        this.approvers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.approvers));
        int quorum = builder.requiredConfirmations != null ? builder.requiredConfirmations : approvers.size();
        if (quorum < 1 || quorum > approvers.size()) {
            throw new IllegalArgumentException("requiredConfirmations must be between 1 and "
                    + approvers.size() + ", got " + quorum);
        }
        this.requiredConfirmations = quorum;
        this.accessControl = Objects.requireNonNull(builder.accessControl, "accessControl is required");
        this.fundsTransfer = builder.fundsTransfer != null ? builder.fundsTransfer : FundsTransfer.accepting();
        this.config = Objects.requireNonNull(builder.config, "config is required");
        this.stageClock = builder.stageClock != null ? builder.stageClock : new SaleStageClock();
        this.stageGated = builder.stageGated;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Credits sale proceeds.
     */
    public synchronized void deposit(BigInteger amount) {
        Objects.requireNonNull(amount, "amount is required");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("deposit must be >= 0");
        }
        balance = balance.add(amount);
    }

    /**
     * Proposes a withdrawal with zero confirmations.
     *
     * @return the index of the new transaction
     */
    public synchronized long submit(Address caller, Address to, BigInteger value, byte[] data) {
        requireApprover(caller);
        Objects.requireNonNull(to, "to is required");
        Objects.requireNonNull(value, "value is required");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be >= 0");
        }
        long index = transactions.size();
        transactions.add(new WithdrawalTransaction(index, to, value, data, caller));
        log.info("treasury.submitted txIndex={} to={} value={} submitter={}", index, to, value, caller);
        return index;
    }

    public synchronized void confirm(Address caller, long index) {
        requireApprover(caller);
        WithdrawalTransaction tx = pending(index);
        if (tx.isConfirmedBy(caller)) {
            throw new CollectionException(ErrorCode.ALREADY_CONFIRMED,
                    caller + " already confirmed transaction " + index);
        }
        tx.addConfirmation(caller);
        log.info("treasury.confirmed txIndex={} approver={} confirmations={}/{}",
                index, caller, tx.getNumConfirmations(), requiredConfirmations);
    }

    /**
     * Withdraws the caller's confirmation. Allowed after quorum is reached as long
     * as the transaction has not been executed.
     */
    public synchronized void revokeConfirmation(Address caller, long index) {
        requireApprover(caller);
        WithdrawalTransaction tx = pending(index);
        if (!tx.isConfirmedBy(caller)) {
            throw new CollectionException(ErrorCode.NOT_CONFIRMED,
                    caller + " has not confirmed transaction " + index);
        }
        tx.removeConfirmation(caller);
        log.info("treasury.revoked txIndex={} approver={} confirmations={}/{}",
                index, caller, tx.getNumConfirmations(), requiredConfirmations);
    }

    /**
     * Pays out a confirmed withdrawal. The transaction is marked executed and the
     * balance debited before {@link FundsTransfer#transfer} is called; both are
     * restored if the transfer throws.
     *
     * @return a snapshot of the executed transaction
     */
    public synchronized WithdrawalTransaction execute(Address caller, long index) {
        accessControl.requireRole(Role.ADMIN, caller);
        WithdrawalTransaction tx = pending(index);
        if (tx.getNumConfirmations() < requiredConfirmations) {
            throw new CollectionException(ErrorCode.QUORUM_NOT_MET,
                    "Transaction " + index + " has " + tx.getNumConfirmations() + " of "
                            + requiredConfirmations + " required confirmations");
        }
        if (tx.getValue().compareTo(balance) > 0) {
            throw new CollectionException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Transaction " + index + " value " + tx.getValue() + " exceeds the balance " + balance);
        }
        requireDeploymentReady();

        BigInteger previousBalance = balance;
        tx.markExecuted();
        balance = balance.subtract(tx.getValue());
        try {
            fundsTransfer.transfer(tx.getTo(), tx.getValue(), tx.getData());
        } catch (CollectionException e) {
            tx.clearExecuted();
            balance = previousBalance;
            throw e;
        } catch (RuntimeException e) {
            tx.clearExecuted();
            balance = previousBalance;
            throw new CollectionException(ErrorCode.TRANSFER_FAILED,
                    "Payout of transaction " + index + " failed: " + e.getMessage(), e);
        }
        log.info("treasury.executed txIndex={} to={} value={} balance={}", index, tx.getTo(), tx.getValue(), balance);
        return tx.snapshot();
    }

    public synchronized WithdrawalTransaction getTransaction(long index) {
        return find(index).snapshot();
    }

    public synchronized int getTransactionCount() {
        return transactions.size();
    }

    public synchronized boolean isConfirmed(long index, Address approver) {
        return find(index).isConfirmedBy(approver);
    }

    public synchronized BigInteger getBalance() {
        return balance;
    }

    public Set<Address> getApprovers() {
        return approvers;
    }

    public boolean isApprover(Address account) {
        return approvers.contains(account);
    }

    public int getRequiredConfirmations() {
        return requiredConfirmations;
    }

    public boolean isStageGated() {
        return stageGated;
    }

    private void requireDeploymentReady() {
        CollectionConfig cfg = config.get();
        if (stageGated) {
            SaleStage stage = stageClock.currentStage(cfg);
            if (stage != SaleStage.PUBLIC_SALE) {
                throw new CollectionException(ErrorCode.STAGE_NOT_READY,
                        "Withdrawals open with the public sale; stage is " + stage);
            }
        }
        if (!cfg.hasMetadataBaseURI()) {
            throw new CollectionException(ErrorCode.METADATA_NOT_CONFIGURED,
                    "Metadata base URI must be set before withdrawals");
        }
    }

    private void requireApprover(Address caller) {
        Objects.requireNonNull(caller, "caller is required");
        if (!approvers.contains(caller) || !accessControl.hasRole(Role.OPERATOR, caller)) {
            throw new CollectionException(ErrorCode.UNAUTHORIZED, caller + " is not an active approver");
        }
    }

    private WithdrawalTransaction pending(long index) {
        WithdrawalTransaction tx = find(index);
        if (tx.isExecuted()) {
            throw new CollectionException(ErrorCode.ALREADY_EXECUTED, "Transaction " + index + " was already executed");
        }
        return tx;
    }

    private WithdrawalTransaction find(long index) {
        if (index < 0 || index >= transactions.size()) {
            throw new CollectionException(ErrorCode.INDEX_OUT_OF_RANGE,
                    "No transaction at index " + index + " (count " + transactions.size() + ")");
        }
        return transactions.get((int) index);
    }

    public static class Builder {
        private final Set<Address> approvers = new LinkedHashSet<>();
        private Integer requiredConfirmations;
        private AccessControl accessControl;
        private FundsTransfer fundsTransfer;
        private Supplier<CollectionConfig> config;
        private SaleStageClock stageClock;
        private boolean stageGated = true;

        public Builder approver(Address approver) {
            this.approvers.add(Objects.requireNonNull(approver, "approver is required"));
            return this;
        }

        public Builder approvers(Iterable<Address> approvers) {
            approvers.forEach(this::approver);
            return this;
        }

        /**
         * Defaults to the size of the approver set.
         */
        public Builder requiredConfirmations(int requiredConfirmations) {
            this.requiredConfirmations = requiredConfirmations;
            return this;
        }

        public Builder accessControl(AccessControl accessControl) {
            this.accessControl = accessControl;
            return this;
        }

        public Builder fundsTransfer(FundsTransfer fundsTransfer) {
            this.fundsTransfer = fundsTransfer;
            return this;
        }

        public Builder config(Supplier<CollectionConfig> config) {
            this.config = config;
            return this;
        }

        public Builder stageClock(SaleStageClock stageClock) {
            this.stageClock = stageClock;
            return this;
        }

        public Builder stageGated(boolean stageGated) {
            this.stageGated = stageGated;
            return this;
        }

        public MultiApprovalTreasury build() {
            return new MultiApprovalTreasury(this);
        }
    }
}
