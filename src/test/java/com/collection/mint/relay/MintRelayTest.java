package com.collection.mint.relay;

import com.collection.mint.MutableClock;
import com.collection.mint.access.Role;
import com.collection.mint.allowlist.SortedPairMerkleTree;
import com.collection.mint.api.CollectionContract;
import com.collection.mint.audit.AuditAction;
import com.collection.mint.audit.AuditEntry;
import com.collection.mint.audit.AuditService;
import com.collection.mint.audit.InMemoryAuditRepository;
import com.collection.mint.compliance.MintReceipt;
import com.collection.mint.config.CollectionConfigLoader;
import com.collection.mint.config.DeploymentSettings;
import com.collection.mint.core.model.Address;
import com.collection.mint.core.model.Bytes32;
import com.collection.mint.core.model.CollectionConfig;
import com.collection.mint.core.model.EtherUnits;
import com.collection.mint.core.model.MintKind;
import com.collection.mint.core.model.SaleStage;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MintRelay Tests")
class MintRelayTest {

    private static final long START = 1_000;
    private static final long END = 2_000;

    private static final Address ADMIN = Address.of("0x00000000000000000000000000000000000000ad");
    private static final Address RELAY = Address.of("0x0000000000000000000000000000000000000e1a");
    private static final Address RELAY_OWNER = Address.of("0x00000000000000000000000000000000000000e0");
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000a11ce");
    private static final Address BOB = Address.of("0x0000000000000000000000000000000000000b0b");
    private static final Address CAROL = Address.of("0x00000000000000000000000000000000000ca201");
    private static final Address MALLORY = Address.of("0x00000000000000000000000000000000000bad00");

    private static final SortedPairMerkleTree RELAY_TREE = SortedPairMerkleTree.ofAddresses(List.of(ALICE, BOB, CAROL));
    private static final BigInteger PRICE = EtherUnits.parseEther("0.025");

    private MutableClock clock;
    private CollectionContract collection;
    private MintRelay relay;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START - 10);
        collection = CollectionContract.builder()
                .admin(ADMIN)
                .config(CollectionConfig.builder()
                        .totalSupply(50)
                        .reservedTokens(0)
                        .presaleDate(10_000)
                        .publicSaleDate(20_000)
                        .build())
                .clock(clock)
                .build();
        collection.grantRole(ADMIN, Role.OPERATOR, RELAY);
        relay = MintRelay.builder()
                .address(RELAY)
                .owner(RELAY_OWNER)
                .collection(collection)
                .wlMerkleRoot(RELAY_TREE.root())
                .price(PRICE)
                .clock(clock)
                .build();
    }

    private static ErrorCode rejection(Executable call) {
        return assertThrows(CollectionException.class, call).getErrorCode();
    }

    private static BigInteger cost(int amount) {
        return PRICE.multiply(BigInteger.valueOf(amount));
    }

    private void openAt(long now) {
        relay.setPresaleStartDate(RELAY_OWNER, START);
        clock.setEpochSecond(now);
    }

    @Nested
    @DisplayName("Window")
    class Window {

        @Test
        @DisplayName("Unscheduled relay should be closed")
        void unscheduled() {
            clock.setEpochSecond(START + 1);
            assertFalse(relay.isOpen());
            assertEquals(ErrorCode.STAGE_NOT_READY,
                    rejection(() -> relay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), PRICE)));
        }

        @Test
        @DisplayName("Relay should open exactly at the start date")
        void startBoundary() {
            openAt(START - 1);
            assertFalse(relay.isOpen());
            assertEquals(ErrorCode.STAGE_NOT_READY,
                    rejection(() -> relay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), PRICE)));

            clock.setEpochSecond(START);
            assertTrue(relay.isOpen());
        }

        @Test
        @DisplayName("Relay should close at the end date")
        void endBoundary() {
            openAt(END - 1);
            relay.setPresaleEndDate(RELAY_OWNER, END);
            assertDoesNotThrow(() -> relay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), PRICE));

            clock.setEpochSecond(END);
            assertEquals(ErrorCode.STAGE_NOT_READY,
                    rejection(() -> relay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), PRICE)));
        }

        @Test
        @DisplayName("Relay window should not depend on the collection stage")
        void independentOfCollectionStage() {
            openAt(START);
            assertEquals(SaleStage.IDLE, collection.getSaleStage());
            assertDoesNotThrow(() -> relay.mintRelay(BOB, 2, RELAY_TREE.proof(BOB), cost(2)));
        }
    }

    @Nested
    @DisplayName("Minting")
    class Minting {

        @BeforeEach
        void open() {
            openAt(START);
        }

        @Test
        @DisplayName("Relay mints should forward the whole payment to the collection")
        void forwardsPayment() {
            relay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), cost(1));
            relay.mintRelay(BOB, 3, RELAY_TREE.proof(BOB), cost(3));
            MintReceipt receipt = relay.mintRelay(CAROL, 5, RELAY_TREE.proof(CAROL), cost(5));

            assertEquals(MintKind.OPERATOR, receipt.kind());
            assertEquals(CAROL, receipt.recipient());
            assertEquals(9, collection.totalSupply());
            assertEquals(5, collection.balanceOf(CAROL));
            assertEquals(cost(9), collection.getBalance());
        }

        @Test
        @DisplayName("Relay should not cap wallets")
        void noWalletCap() {
            relay.mintRelay(ALICE, 5, RELAY_TREE.proof(ALICE), cost(5));
            relay.mintRelay(ALICE, 5, RELAY_TREE.proof(ALICE), cost(5));

            assertEquals(10, collection.balanceOf(ALICE));
        }

        @Test
        @DisplayName("Checks should run window, amount, payment, then proof")
        void validationOrder() {
            assertEquals(ErrorCode.ZERO_AMOUNT, rejection(() -> relay.mintRelay(MALLORY, 0, List.of(), BigInteger.ZERO)));
            assertEquals(ErrorCode.INSUFFICIENT_PAYMENT,
                    rejection(() -> relay.mintRelay(MALLORY, 1, List.of(), BigInteger.ZERO)));
            assertEquals(ErrorCode.INVALID_PROOF,
                    rejection(() -> relay.mintRelay(MALLORY, 1, RELAY_TREE.proof(ALICE), PRICE)));
            assertEquals(0, collection.totalSupply());
        }

        @Test
        @DisplayName("Collection rejections should surface unchanged")
        void collectionRejection() {
            collection.revokeRole(ADMIN, Role.OPERATOR, RELAY);

            assertEquals(ErrorCode.UNAUTHORIZED,
                    rejection(() -> relay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), PRICE)));
            assertEquals(BigInteger.ZERO, collection.getBalance());
            assertTrue(relay.getAuditService().getEntriesByAction(AuditAction.RELAY_MINTED).isEmpty());
        }

        @Test
        @DisplayName("Supply cap of the collection should still apply")
        void supplyCap() {
            for (int i = 0; i < 10; i++) {
                relay.mintRelay(ALICE, 5, RELAY_TREE.proof(ALICE), cost(5));
            }
            assertEquals(ErrorCode.SUPPLY_EXHAUSTED,
                    rejection(() -> relay.mintRelay(BOB, 1, RELAY_TREE.proof(BOB), PRICE)));
        }

        @Test
        @DisplayName("Accepted relay mints should be audited on both sides")
        void audited() {
            relay.mintRelay(BOB, 2, RELAY_TREE.proof(BOB), cost(2));

            AuditEntry relayEntry = relay.getAuditService().getEntriesByAction(AuditAction.RELAY_MINTED).get(0);
            assertEquals(BOB.value(), relayEntry.subject());
            assertEquals(RELAY.value(), relayEntry.actorId());
            assertEquals(2, relayEntry.details().get("amount"));

            AuditEntry collectionEntry = collection.getAuditService().getEntriesForSubject(BOB.value()).get(0);
            assertEquals(AuditAction.TOKENS_MINTED, collectionEntry.action());
            assertEquals(RELAY.value(), collectionEntry.actorId());
        }

        @Test
        @DisplayName("Relay and collection should be able to share one audit log")
        void sharedAuditLog() {
            InMemoryAuditRepository shared = new InMemoryAuditRepository();
            CollectionContract sharedCollection = CollectionContract.builder()
                    .admin(ADMIN)
                    .config(CollectionConfig.builder().totalSupply(50).reservedTokens(0)
                            .presaleDate(10_000).publicSaleDate(20_000).build())
                    .clock(clock)
                    .auditRepository(shared)
                    .build();
            sharedCollection.grantRole(ADMIN, Role.OPERATOR, RELAY);
            MintRelay sharedRelay = MintRelay.builder()
                    .address(RELAY)
                    .owner(RELAY_OWNER)
                    .collection(sharedCollection)
                    .wlMerkleRoot(RELAY_TREE.root())
                    .price(PRICE)
                    .presaleStartDate(START)
                    .clock(clock)
                    .auditService(new AuditService(shared))
                    .build();
            clock.setEpochSecond(START);

            sharedRelay.mintRelay(BOB, 2, RELAY_TREE.proof(BOB), cost(2));
            sharedRelay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), cost(1));

            assertEquals(3, sharedCollection.totalSupply());
            assertEquals(cost(3), sharedCollection.getBalance());
            assertEquals(List.of(AuditAction.ROLE_GRANTED, AuditAction.TOKENS_MINTED, AuditAction.RELAY_MINTED,
                            AuditAction.TOKENS_MINTED, AuditAction.RELAY_MINTED),
                    shared.findAll().stream().map(AuditEntry::action).toList());
            assertEquals(List.of(1L, 2L, 3L, 4L, 5L), shared.findAll().stream().map(AuditEntry::sequence).toList());
        }
    }

    @Nested
    @DisplayName("Deployment settings")
    class Settings {

        private DeploymentSettings load() throws IOException {
            try (InputStream in = getClass().getResourceAsStream("/test-deployment.json")) {
                return new CollectionConfigLoader().load(in);
            }
        }

        @Test
        @DisplayName("Relay price and owner should come from the settings")
        void appliesRelayPrice() throws IOException {
            DeploymentSettings settings = load();

            MintRelay configured = MintRelay.builder()
                    .settings(settings)
                    .address(RELAY)
                    .collection(collection)
                    .build();

            assertEquals(EtherUnits.parseEther("0.025"), configured.getPrice());
            assertEquals(settings.admin(), configured.getOwner());
        }

        @Test
        @DisplayName("An explicit owner should be kept")
        void keepsOwner() throws IOException {
            MintRelay configured = MintRelay.builder()
                    .owner(RELAY_OWNER)
                    .settings(load())
                    .address(RELAY)
                    .collection(collection)
                    .build();

            assertEquals(RELAY_OWNER, configured.getOwner());
        }

        @Test
        @DisplayName("Settings without a relay section should be refused")
        void noRelayPrice() {
            DeploymentSettings settings = new DeploymentSettings(null, null, null,
                    CollectionConfig.defaults(), ADMIN, null, null, null, null, null);

            assertThrows(IllegalArgumentException.class, () -> MintRelay.builder().settings(settings));
        }
    }

    @Nested
    @DisplayName("Owner setters")
    class OwnerSetters {

        @Test
        @DisplayName("Non-owners should be UNAUTHORIZED")
        void ownerOnly() {
            assertEquals(ErrorCode.UNAUTHORIZED, rejection(() -> relay.setPresaleStartDate(ADMIN, START)));
            assertEquals(ErrorCode.UNAUTHORIZED, rejection(() -> relay.setPrice(ALICE, BigInteger.ONE)));
            assertEquals(ErrorCode.UNAUTHORIZED, rejection(() -> relay.setWlMerkleRoot(ALICE, Bytes32.ZERO)));
            assertEquals(ErrorCode.UNAUTHORIZED, rejection(() -> relay.setPresaleEndDate(ALICE, END)));

            assertEquals(0, relay.getPresaleStartDate());
            assertEquals(PRICE, relay.getPrice());
            assertEquals(RELAY_TREE.root(), relay.getWlMerkleRoot());
        }

        @Test
        @DisplayName("Price and root changes should apply to later mints")
        void updates() {
            openAt(START);
            relay.setPrice(RELAY_OWNER, BigInteger.ONE);
            relay.setWlMerkleRoot(RELAY_OWNER, SortedPairMerkleTree.ofAddresses(List.of(MALLORY)).root());

            assertEquals(ErrorCode.INVALID_PROOF,
                    rejection(() -> relay.mintRelay(ALICE, 1, RELAY_TREE.proof(ALICE), PRICE)));
            SortedPairMerkleTree single = SortedPairMerkleTree.ofAddresses(List.of(MALLORY));
            relay.mintRelay(MALLORY, 3, single.proof(MALLORY), BigInteger.valueOf(3));

            assertEquals(3, collection.balanceOf(MALLORY));
            assertEquals(3, relay.getAuditService().getEntriesByAction(AuditAction.PARAMETER_UPDATED).size());
        }

        @Test
        @DisplayName("Negative values should be programming errors")
        void negatives() {
            assertThrows(IllegalArgumentException.class, () -> relay.setPrice(RELAY_OWNER, BigInteger.valueOf(-1)));
            assertThrows(IllegalArgumentException.class, () -> relay.setPresaleEndDate(RELAY_OWNER, -5));
            assertThrows(NullPointerException.class, () -> MintRelay.builder()
                    .address(RELAY).owner(RELAY_OWNER).collection(collection).build());
        }
    }
}
