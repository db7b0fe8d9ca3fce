package com.collection.mint.treasury;

import com.collection.mint.core.model.Address;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A proposed payout from the treasury. The index is assigned on submission and
 * never reused. Once an execution completes, {@code executed} is never cleared.
 *
 * <p>Instances handed out by {@link MultiApprovalTreasury} are snapshots; the
 * mutators are package-private.</p>
 */
public class WithdrawalTransaction {

    private final long index;
    private final Address to;
    private final BigInteger value;
    private final byte[] data;
    private final Address submitter;
    private final Set<Address> confirmations;
    private boolean executed;

    WithdrawalTransaction(long index, Address to, BigInteger value, byte[] data, Address submitter) {
        this(index, to, value, data, submitter, new LinkedHashSet<>(), false);
    }

    private WithdrawalTransaction(long index, Address to, BigInteger value, byte[] data, Address submitter,
                                  Set<Address> confirmations, boolean executed) {
        this.index = index;
        this.to = Objects.requireNonNull(to, "to is required");
        this.value = Objects.requireNonNull(value, "value is required");
        this.data = data != null ? data.clone() : new byte[0];
        this.submitter = submitter;
        this.confirmations = confirmations;
        this.executed = executed;
    }

    public long getIndex() {
        return index;
    }

    public Address getTo() {
        return to;
    }

    public BigInteger getValue() {
        return value;
    }

    public byte[] getData() {
        return data.clone();
    }

    public Address getSubmitter() {
        return submitter;
    }

    public Set<Address> getConfirmations() {
        return Collections.unmodifiableSet(confirmations);
    }

    public int getNumConfirmations() {
        return confirmations.size();
    }

    public boolean isConfirmedBy(Address approver) {
        return confirmations.contains(approver);
    }

    public boolean isExecuted() {
        return executed;
    }

    boolean addConfirmation(Address approver) {
        return confirmations.add(approver);
    }

    boolean removeConfirmation(Address approver) {
        return confirmations.remove(approver);
    }

    void markExecuted() {
        this.executed = true;
    }

    void clearExecuted() {
        this.executed = false;
    }

    WithdrawalTransaction snapshot() {
        return new WithdrawalTransaction(index, to, value, data, submitter,
                new LinkedHashSet<>(confirmations), executed);
    }

    @Override
    public String toString() {
        return "WithdrawalTransaction{" +
                "index=" + index +
                ", to=" + to +
                ", value=" + value +
                ", data=" + Arrays.toString(data) +
                ", confirmations=" + confirmations.size() +
                ", executed=" + executed +
                '}';
    }
}
