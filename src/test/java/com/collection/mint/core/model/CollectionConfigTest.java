package com.collection.mint.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CollectionConfig Tests")
class CollectionConfigTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should carry the reference sale values")
        void referenceValues() {
            CollectionConfig config = CollectionConfig.defaults();

            assertEquals(5000, config.getTotalSupply());
            assertEquals(900, config.getPresaleInterval());
            assertEquals(EtherUnits.parseEther("0.025"), config.getPresalePriceOg());
            assertEquals(EtherUnits.parseEther("0.025"), config.getPresalePriceWl());
            assertEquals(3, config.getPresaleMaxTokenPerOg());
            assertEquals(2, config.getPresaleMaxTokenPerWl());
            assertEquals(50, config.getReservedTokens());
            assertEquals(0, config.getMaxMintPerTx());
            assertEquals(EtherUnits.parseEther("0.03"), config.getPrice());
            assertEquals(5, config.getMaxTokenPerWallet());
            assertEquals(Bytes32.ZERO, config.getOgMerkleRoot());
            assertEquals(Bytes32.ZERO, config.getWlMerkleRoot());
            assertFalse(config.hasMetadataBaseURI());
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("toBuilder should copy every field and leave the original untouched")
        void toBuilderCopies() {
            CollectionConfig original = CollectionConfig.builder()
                    .totalSupply(100)
                    .reservedTokens(5)
                    .presaleDate(1_000)
                    .publicSaleDate(5_000)
                    .metadataBaseURI("ipfs://base/")
                    .build();

            CollectionConfig changed = original.toBuilder().price(BigInteger.TEN).build();

            assertEquals(100, changed.getTotalSupply());
            assertEquals(5, changed.getReservedTokens());
            assertEquals(1_000, changed.getPresaleDate());
            assertEquals(5_000, changed.getPublicSaleDate());
            assertEquals("ipfs://base/", changed.getMetadataBaseURI());
            assertEquals(BigInteger.TEN, changed.getPrice());
            assertEquals(EtherUnits.parseEther("0.03"), original.getPrice());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class, () -> CollectionConfig.builder().totalSupply(0));
            assertThrows(IllegalArgumentException.class, () -> CollectionConfig.builder().presaleDate(-1));
            assertThrows(IllegalArgumentException.class, () -> CollectionConfig.builder().price(BigInteger.valueOf(-1)));
            assertThrows(IllegalArgumentException.class, () -> CollectionConfig.builder().maxTokenPerWallet(0));
            assertThrows(IllegalArgumentException.class,
                    () -> CollectionConfig.builder().totalSupply(10).reservedTokens(11).build());
        }

        @Test
        @DisplayName("Should accept a presale date after the public sale date")
        void outOfOrderDatesAccepted() {
            assertDoesNotThrow(() -> CollectionConfig.builder().presaleDate(10_000).publicSaleDate(5_000).build());
        }
    }
}
