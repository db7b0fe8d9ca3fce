package com.collection.mint.api;

import com.collection.mint.access.AccessControl;
import com.collection.mint.access.Role;
import com.collection.mint.allowlist.AllowlistVerifier;
import com.collection.mint.audit.AuditAction;
import com.collection.mint.audit.AuditRepository;
import com.collection.mint.audit.AuditService;
import com.collection.mint.audit.InMemoryAuditRepository;
import com.collection.mint.clock.SaleStageClock;
import com.collection.mint.compliance.InMemoryParticipantStore;
import com.collection.mint.compliance.MintComplianceEngine;
import com.collection.mint.compliance.MintPolicy;
import com.collection.mint.compliance.MintReceipt;
import com.collection.mint.compliance.ParticipantStore;
import com.collection.mint.config.DeploymentSettings;
import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import com.collection.mint.core.model.CollectionConfig;
import com.collection.mint.core.model.ParticipantRecord;
import com.collection.mint.core.model.SaleStage;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import com.collection.mint.lock.ExecutionLock;
import com.collection.mint.lock.NonReentrantExecutionLock;
import com.collection.mint.logging.LogContext;
import com.collection.mint.metrics.MetricsService;
import com.collection.mint.metrics.NoOpMetricsService;
import com.collection.mint.registry.InMemoryOwnershipRegistry;
import com.collection.mint.registry.OwnershipRegistry;
import com.collection.mint.tracing.NoOpTracingService;
import com.collection.mint.tracing.Span;
import com.collection.mint.tracing.TracingService;
import com.collection.mint.treasury.FundsTransfer;
import com.collection.mint.treasury.MultiApprovalTreasury;
import com.collection.mint.treasury.WithdrawalTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Main entry point for a token collection sale.
 * One call per state transition; every call names its caller explicitly.
 *
 * <h2>Call discipline</h2>
 * <ul>
 *   <li>State-changing calls are serialized by an {@link ExecutionLock}; a nested
 *       call on the same instance, e.g. from a {@link FundsTransfer}, fails with
 *       {@link ErrorCode#REENTRANT_CALL}.</li>
 *   <li>A rejected call throws {@link CollectionException} and changes nothing.</li>
 *   <li>A successful call appends one entry to the audit log.</li>
 * </ul>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * CollectionContract collection = CollectionContract.builder()
 *     .admin(admin)
 *     .operators(List.of(operator1, operator2))
 *     .config(CollectionConfig.builder()
 *         .presaleDate(presaleStart)
 *         .publicSaleDate(publicStart)
 *         .ogMerkleRoot(ogTree.root())
 *         .build())
 *     .requiredConfirmations(2)
 *     .build();
 *
 * MintReceipt receipt = collection.ogMint(buyer, 2, ogTree.proof(buyer), EtherUnits.parseEther("0.05"));
 * </pre>
 */
public class CollectionContract {
    private static final Logger log = LoggerFactory.getLogger(CollectionContract.class);

    private final String name;
    private final SaleStageClock stageClock;
    private final OwnershipRegistry registry;
    private final AccessControl accessControl;
    private final MintComplianceEngine complianceEngine;
    private final MultiApprovalTreasury treasury;
    private final ExecutionLock executionLock;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private volatile CollectionConfig config;

    private CollectionContract(Builder builder) {
        Objects.requireNonNull(builder.admin, "admin is required");
        this.name = builder.name;
        this.config = builder.config;
        this.stageClock = new SaleStageClock(builder.clock);
        this.registry = builder.registry != null
                ? builder.registry : new InMemoryOwnershipRegistry(config.getTotalSupply());
        this.executionLock = builder.executionLock != null
                ? builder.executionLock : new NonReentrantExecutionLock();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else {
            AuditRepository repository = builder.auditRepository != null
                    ? builder.auditRepository : new InMemoryAuditRepository();
            this.auditService = new AuditService(repository, builder.clock);
        }

        this.accessControl = new AccessControl(builder.admin);
        for (Address operator : builder.operators) {
            accessControl.grant(Role.OPERATOR, operator);
        }

        ParticipantStore participants = builder.participantStore != null
                ? builder.participantStore : new InMemoryParticipantStore();
        this.complianceEngine = new MintComplianceEngine(this::getConfig, stageClock, registry,
                new AllowlistVerifier(), participants, builder.policy);

        Set<Address> approvers = new LinkedHashSet<>(builder.approvers);
        if (approvers.isEmpty()) {
            approvers.addAll(builder.operators);
            approvers.add(builder.admin);
        }
        MultiApprovalTreasury.Builder treasuryBuilder = MultiApprovalTreasury.builder()
                .approvers(approvers)
                .accessControl(accessControl)
                .fundsTransfer(builder.fundsTransfer)
                .config(this::getConfig)
                .stageClock(stageClock)
                .stageGated(builder.policy.isStageGatedWithdrawals());
        if (builder.requiredConfirmations != null) {
            treasuryBuilder.requiredConfirmations(builder.requiredConfirmations);
        }
        this.treasury = treasuryBuilder.build();

        if (config.getReservedTokens() > 0) {
            MintReceipt reserved = complianceEngine.mintReserved(builder.admin, config.getReservedTokens());
            auditMint(builder.admin, reserved);
        }

        log.info("collection.deployed name={} admin={} totalSupply={} reserved={} approvers={} quorum={} policy={}",
                name, builder.admin, config.getTotalSupply(), config.getReservedTokens(),
                treasury.getApprovers().size(), treasury.getRequiredConfirmations(), builder.policy);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Minting ==========

    /**
     * Presale mint for OG list members. Open only during {@link SaleStage#PRESALE_OG}.
     */
    public MintReceipt ogMint(Address caller, int amount, List<Bytes32> proof, BigInteger payment) {
        return mintCall("ogMint", caller, amount,
                () -> complianceEngine.ogMint(caller, amount, proof, payment));
    }

    /**
     * Presale mint for WL list members. Open only during {@link SaleStage#PRESALE_WL}.
     */
    public MintReceipt wlMint(Address caller, int amount, List<Bytes32> proof, BigInteger payment) {
        return mintCall("wlMint", caller, amount,
                () -> complianceEngine.wlMint(caller, amount, proof, payment));
    }

    /**
     * Public sale mint.
     */
    public MintReceipt mint(Address caller, int amount, BigInteger payment) {
        return mintCall("mint", caller, amount,
                () -> complianceEngine.publicMint(caller, amount, payment));
    }

    /**
     * Privileged mint to any recipient at any stage. Only the supply cap applies.
     */
    public MintReceipt operatorMint(Address caller, Address recipient, int amount, BigInteger payment) {
        return mintCall("operatorMint", caller, amount, () -> {
            accessControl.requireRole(Role.OPERATOR, caller);
            return complianceEngine.operatorMint(recipient, amount, payment);
        });
    }

    // ========== Treasury ==========

    /**
     * Proposes a withdrawal.
     *
     * @return index of the new transaction
     */
    public long submitWithdrawal(Address caller, Address to, BigInteger value, byte[] data) {
        return call("submitWithdrawal", caller, span -> {
            long index = treasury.submit(caller, to, value, data);
            span.setAttribute("collection.tx.index", index);
            auditService.record(AuditAction.WITHDRAWAL_SUBMITTED, txSubject(index), caller.value(), Map.of(
                    "txIndex", index,
                    "to", to.value(),
                    "value", value.toString()));
            return index;
        });
    }

    public void confirmWithdrawal(Address caller, long index) {
        withdrawalCall("confirmWithdrawal", caller, index, span -> {
            treasury.confirm(caller, index);
            auditService.record(AuditAction.WITHDRAWAL_CONFIRMED, txSubject(index), caller.value(),
                    Map.of("txIndex", index));
            return null;
        });
    }

    public void revokeConfirmation(Address caller, long index) {
        withdrawalCall("revokeConfirmation", caller, index, span -> {
            treasury.revokeConfirmation(caller, index);
            auditService.record(AuditAction.WITHDRAWAL_REVOKED, txSubject(index), caller.value(),
                    Map.of("txIndex", index));
            return null;
        });
    }

    /**
     * Pays out a withdrawal that reached quorum. Admin only.
     *
     * @return the executed transaction
     */
    public WithdrawalTransaction executeWithdrawal(Address caller, long index) {
        return withdrawalCall("executeWithdrawal", caller, index, span -> {
            WithdrawalTransaction executed = treasury.execute(caller, index);
            auditService.record(AuditAction.WITHDRAWAL_EXECUTED, txSubject(index), caller.value(), Map.of(
                    "txIndex", index,
                    "to", executed.getTo().value(),
                    "value", executed.getValue().toString()));
            metricsService.recordWithdrawalExecuted(executed.getValue());
            return executed;
        });
    }

    // ========== Admin setters ==========

    public void setPrice(Address caller, BigInteger price) {
        updateConfig("setPrice", caller, "price", price.toString(), false, b -> b.price(price));
    }

    public void setMaxTokenPerWallet(Address caller, int maxTokenPerWallet) {
        updateConfig("setMaxTokenPerWallet", caller, "maxTokenPerWallet", maxTokenPerWallet, false,
                b -> b.maxTokenPerWallet(maxTokenPerWallet));
    }

    public void setMetadataBaseURI(Address caller, String metadataBaseURI) {
        Objects.requireNonNull(metadataBaseURI, "metadataBaseURI is required");
        updateConfig("setMetadataBaseURI", caller, "metadataBaseURI", metadataBaseURI, false,
                b -> b.metadataBaseURI(metadataBaseURI));
    }

    /**
     * Replaces the OG allowlist root. Only while the sale is {@link SaleStage#IDLE}.
     */
    public void setOgMerkleRoot(Address caller, Bytes32 root) {
        Objects.requireNonNull(root, "root is required");
        updateConfig("setOgMerkleRoot", caller, "ogMerkleRoot", root.toHex(), true, b -> b.ogMerkleRoot(root));
    }

    /**
     * Replaces the WL allowlist root. Only while the sale is {@link SaleStage#IDLE}.
     */
    public void setWlMerkleRoot(Address caller, Bytes32 root) {
        Objects.requireNonNull(root, "root is required");
        updateConfig("setWlMerkleRoot", caller, "wlMerkleRoot", root.toHex(), true, b -> b.wlMerkleRoot(root));
    }

    /**
     * Moves the presale start. Only while the sale is {@link SaleStage#IDLE}.
     */
    public void setPresaleDate(Address caller, long presaleDate) {
        updateConfig("setPresaleDate", caller, "presaleDate", presaleDate, true, b -> b.presaleDate(presaleDate));
    }

    /**
     * Moves the public sale start. Only while the sale is {@link SaleStage#IDLE}.
     */
    public void setPublicSaleDate(Address caller, long publicSaleDate) {
        updateConfig("setPublicSaleDate", caller, "publicSaleDate", publicSaleDate, true,
                b -> b.publicSaleDate(publicSaleDate));
    }

    public void setRevealDate(Address caller, long revealDate) {
        updateConfig("setRevealDate", caller, "revealDate", revealDate, false, b -> b.revealDate(revealDate));
    }

    // ========== Roles ==========

    /**
     * Grants a role. Admin only.
     *
     * @return true if the account did not already hold the role
     */
    public boolean grantRole(Address caller, Role role, Address account) {
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(account, "account is required");
        return call("grantRole", caller, span -> {
            accessControl.requireRole(Role.ADMIN, caller);
            boolean granted = accessControl.grant(role, account);
            if (granted) {
                auditService.record(AuditAction.ROLE_GRANTED, account.value(), caller.value(),
                        Map.of("role", role.name()));
                log.info("role.granted role={} account={}", role, account);
            }
            return granted;
        });
    }

    /**
     * Revokes a role. Admin only.
     *
     * @return true if the account held the role
     */
    public boolean revokeRole(Address caller, Role role, Address account) {
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(account, "account is required");
        return call("revokeRole", caller, span -> {
            accessControl.requireRole(Role.ADMIN, caller);
            boolean revoked = accessControl.revoke(role, account);
            if (revoked) {
                auditService.record(AuditAction.ROLE_REVOKED, account.value(), caller.value(),
                        Map.of("role", role.name()));
                log.info("role.revoked role={} account={}", role, account);
            }
            return revoked;
        });
    }

    // ========== Views ==========

    public SaleStage getSaleStage() {
        return stageClock.currentStage(config);
    }

    /**
     * Stage the current configuration yields at the given unix time.
     */
    public SaleStage getSaleStageAt(long timestamp) {
        return SaleStageClock.stageAt(config, timestamp);
    }

    public CollectionConfig getConfig() {
        return config;
    }

    public ParticipantRecord getParticipant(Address participant) {
        return complianceEngine.participant(participant);
    }

    public int totalSupply() {
        return registry.totalSupply();
    }

    public int balanceOf(Address owner) {
        return registry.balanceOf(owner);
    }

    public Address ownerOf(long tokenId) {
        return registry.ownerOf(tokenId);
    }

    public WithdrawalTransaction getTransaction(long index) {
        return treasury.getTransaction(index);
    }

    public int getTransactionCount() {
        return treasury.getTransactionCount();
    }

    public boolean isConfirmed(long index, Address approver) {
        return treasury.isConfirmed(index, approver);
    }

    /**
     * Funds held by the contract, in wei.
     */
    public BigInteger getBalance() {
        return treasury.getBalance();
    }

    public boolean hasRole(Role role, Address account) {
        return accessControl.hasRole(role, account);
    }

    public Set<Address> getApprovers() {
        return treasury.getApprovers();
    }

    public int getRequiredConfirmations() {
        return treasury.getRequiredConfirmations();
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public String getName() {
        return name;
    }

    // ========== Internals ==========

    private MintReceipt mintCall(String operation, Address caller, int amount, MintAction action) {
        return call(operation, caller, span -> {
            span.setAttribute("collection.amount", amount);
            long start = System.nanoTime();
            MintReceipt receipt = action.mint();
            treasury.deposit(receipt.payment());
            auditMint(caller, receipt);
            metricsService.recordMint(receipt.kind(), receipt.amount(), Duration.ofNanos(System.nanoTime() - start));
            log.info("mint.accepted kind={} recipient={} amount={} firstTokenId={} payment={} totalSupply={}",
                    receipt.kind(), receipt.recipient(), receipt.amount(), receipt.firstTokenId(),
                    receipt.payment(), registry.totalSupply());
            return receipt;
        });
    }

    private void updateConfig(String operation, Address caller, String parameter, Object value,
                              boolean idleOnly, UnaryOperator<CollectionConfig.Builder> change) {
        call(operation, caller, span -> {
            accessControl.requireRole(Role.ADMIN, caller);
            CollectionConfig current = config;
            if (idleOnly) {
                SaleStage stage = stageClock.currentStage(current);
                if (stage != SaleStage.IDLE) {
                    throw new CollectionException(ErrorCode.STAGE_NOT_READY,
                            parameter + " can only change before the sale starts; stage is " + stage);
                }
            }
            config = change.apply(current.toBuilder()).build();
            auditService.record(AuditAction.PARAMETER_UPDATED, name, caller.value(), Map.of(
                    "parameter", parameter,
                    "value", value));
            log.info("config.updated parameter={} value={}", parameter, value);
            return null;
        });
    }

    private <T> T withdrawalCall(String operation, Address caller, long index, Function<Span, T> body) {
        Objects.requireNonNull(caller, "caller is required");
        try (LogContext logCtx = LogContext.forWithdrawal(operation, caller.value(), index)) {
            return traced(operation, caller, body);
        }
    }

    private <T> T call(String operation, Address caller, Function<Span, T> body) {
        Objects.requireNonNull(caller, "caller is required");
        try (LogContext logCtx = LogContext.forCall(operation, caller.value())) {
            return traced(operation, caller, body);
        }
    }

    private <T> T traced(String operation, Address caller, Function<Span, T> body) {
        try (Span span = tracingService.startCallSpan(operation, caller)) {
            try (ExecutionLock.Permit permit = executionLock.acquire(operation)) {
                T result = body.apply(span);
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (CollectionException e) {
                span.recordRejection(e);
                metricsService.incrementRejected(operation, e.getErrorCode());
                log.warn("call.rejected operation={} caller={} error={} reason={}",
                        operation, caller, e.getErrorCode(), e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                span.recordFailure(e);
                log.error("call.failed operation={} caller={} error={}",
                        operation, caller, e.getClass().getSimpleName(), e);
                throw e;
            }
        }
    }

    private void auditMint(Address caller, MintReceipt receipt) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", receipt.kind().name());
        details.put("recipient", receipt.recipient().value());
        details.put("amount", receipt.amount());
        details.put("firstTokenId", receipt.firstTokenId());
        details.put("payment", receipt.payment().toString());
        auditService.record(AuditAction.TOKENS_MINTED, receipt.recipient().value(), caller.value(), details);
    }

    private static String txSubject(long index) {
        return "tx-" + index;
    }

    @FunctionalInterface
    private interface MintAction {
        MintReceipt mint();
    }

    public static class Builder {
        private String name = "Collection";
        private Address admin;
        private final List<Address> operators = new ArrayList<>();
        private final List<Address> approvers = new ArrayList<>();
        private Integer requiredConfirmations;
        private CollectionConfig config = CollectionConfig.defaults();
        private MintPolicy policy = MintPolicy.defaults();
        private Clock clock = Clock.systemUTC();
        private OwnershipRegistry registry;
        private ParticipantStore participantStore;
        private FundsTransfer fundsTransfer;
        private ExecutionLock executionLock;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MetricsService metricsService;
        private TracingService tracingService;

        /**
         * Applies everything a {@link DeploymentSettings} carries.
         */
        public Builder settings(DeploymentSettings settings) {
            this.name = settings.contractName();
            this.config = settings.config();
            this.admin = settings.admin();
            this.operators.clear();
            this.operators.addAll(settings.operators());
            this.approvers.clear();
            this.approvers.addAll(settings.approvers());
            this.requiredConfirmations = settings.requiredConfirmations();
            this.policy = settings.policy();
            return this;
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
            return this;
        }

        /**
         * Sets the admin. Required; the admin receives the reserved tokens.
         */
        public Builder admin(Address admin) {
            this.admin = admin;
            return this;
        }

        /**
         * Adds OPERATOR holders. Unless approvers are set, they also form the
         * treasury approver set together with the admin.
         */
        public Builder operators(List<Address> operators) {
            this.operators.addAll(operators);
            return this;
        }

        /**
         * Sets an explicit approver set. Each approver also needs the OPERATOR role to act.
         */
        public Builder approvers(List<Address> approvers) {
            this.approvers.addAll(approvers);
            return this;
        }

        /**
         * Treasury quorum. Defaults to the size of the approver set.
         */
        public Builder requiredConfirmations(int requiredConfirmations) {
            this.requiredConfirmations = requiredConfirmations;
            return this;
        }

        public Builder config(CollectionConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        public Builder policy(MintPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy is required");
            return this;
        }

        /**
         * Time source for stage computation and audit timestamps.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        /**
         * Sets a custom ownership registry.
         * Defaults to an {@link InMemoryOwnershipRegistry} capped at the total supply.
         */
        public Builder registry(OwnershipRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder participantStore(ParticipantStore participantStore) {
            this.participantStore = participantStore;
            return this;
        }

        /**
         * Sets the payout collaborator used by executed withdrawals.
         */
        public Builder fundsTransfer(FundsTransfer fundsTransfer) {
            this.fundsTransfer = fundsTransfer;
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

        /**
         * Sets a custom audit repository.
         * Ignored when an audit service is set.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public CollectionContract build() {
            return new CollectionContract(this);
        }
    }
}
