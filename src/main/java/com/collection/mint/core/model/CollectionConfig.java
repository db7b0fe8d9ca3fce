package com.collection.mint.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Sale configuration of a collection.
 *
 * <p>Instances are immutable. The deploy-time constants (supply, presale
 * interval, presale prices and caps, reserved tokens, per-transaction cap) are
 * fixed for the life of a contract; the admin-mutable fields are changed by
 * building a replacement with {@link #toBuilder()}.</p>
 *
 * <p>{@code presaleDate <= publicSaleDate} is deliberately not validated.</p>
 */
public final class CollectionConfig {

    private static final int DEFAULT_TOTAL_SUPPLY = 5000;
    private static final long DEFAULT_PRESALE_INTERVAL = 900;
    private static final BigInteger DEFAULT_PRESALE_PRICE_OG = EtherUnits.parseEther("0.025");
    private static final BigInteger DEFAULT_PRESALE_PRICE_WL = EtherUnits.parseEther("0.025");
    private static final int DEFAULT_PRESALE_MAX_TOKEN_PER_OG = 3;
    private static final int DEFAULT_PRESALE_MAX_TOKEN_PER_WL = 2;
    private static final int DEFAULT_RESERVED_TOKENS = 50;
    private static final BigInteger DEFAULT_PRICE = EtherUnits.parseEther("0.03");
    private static final int DEFAULT_MAX_TOKEN_PER_WALLET = 5;

    // deploy-time constants
    private final int totalSupply;
    private final long presaleInterval;
    private final BigInteger presalePriceOg;
    private final BigInteger presalePriceWl;
    private final int presaleMaxTokenPerOg;
    private final int presaleMaxTokenPerWl;
    private final int reservedTokens;
    private final int maxMintPerTx;

    // admin-mutable
    private final BigInteger price;
    private final int maxTokenPerWallet;
    private final long presaleDate;
    private final long publicSaleDate;
    private final long revealDate;
    private final Bytes32 ogMerkleRoot;
    private final Bytes32 wlMerkleRoot;
    private final String metadataBaseURI;

    private CollectionConfig(Builder builder) {
        this.totalSupply = builder.totalSupply;
        this.presaleInterval = builder.presaleInterval;
        this.presalePriceOg = builder.presalePriceOg;
        this.presalePriceWl = builder.presalePriceWl;
        this.presaleMaxTokenPerOg = builder.presaleMaxTokenPerOg;
        this.presaleMaxTokenPerWl = builder.presaleMaxTokenPerWl;
        this.reservedTokens = builder.reservedTokens;
        this.maxMintPerTx = builder.maxMintPerTx;
        this.price = builder.price;
        this.maxTokenPerWallet = builder.maxTokenPerWallet;
        this.presaleDate = builder.presaleDate;
        this.publicSaleDate = builder.publicSaleDate;
        this.revealDate = builder.revealDate;
        this.ogMerkleRoot = builder.ogMerkleRoot;
        this.wlMerkleRoot = builder.wlMerkleRoot;
        this.metadataBaseURI = builder.metadataBaseURI;
    }

    public int getTotalSupply() {
        return totalSupply;
    }

    public long getPresaleInterval() {
        return presaleInterval;
    }

    public BigInteger getPresalePriceOg() {
        return presalePriceOg;
    }

    public BigInteger getPresalePriceWl() {
        return presalePriceWl;
    }

    public int getPresaleMaxTokenPerOg() {
        return presaleMaxTokenPerOg;
    }

    public int getPresaleMaxTokenPerWl() {
        return presaleMaxTokenPerWl;
    }

    public int getReservedTokens() {
        return reservedTokens;
    }

    /**
     * Per-transaction cap for the public sale, or 0 when only the wallet cap applies.
     */
    public int getMaxMintPerTx() {
        return maxMintPerTx;
    }

    public BigInteger getPrice() {
        return price;
    }

    public int getMaxTokenPerWallet() {
        return maxTokenPerWallet;
    }

    public long getPresaleDate() {
        return presaleDate;
    }

    public long getPublicSaleDate() {
        return publicSaleDate;
    }

    public long getRevealDate() {
        return revealDate;
    }

    public Bytes32 getOgMerkleRoot() {
        return ogMerkleRoot;
    }

    public Bytes32 getWlMerkleRoot() {
        return wlMerkleRoot;
    }

    public String getMetadataBaseURI() {
        return metadataBaseURI;
    }

    public boolean hasMetadataBaseURI() {
        return !metadataBaseURI.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static CollectionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CollectionConfig{" +
                "totalSupply=" + totalSupply +
                ", price=" + price +
                ", maxTokenPerWallet=" + maxTokenPerWallet +
                ", presaleDate=" + presaleDate +
                ", publicSaleDate=" + publicSaleDate +
                ", revealDate=" + revealDate +
                '}';
    }

    public static class Builder {
        private int totalSupply = DEFAULT_TOTAL_SUPPLY;
        private long presaleInterval = DEFAULT_PRESALE_INTERVAL;
        private BigInteger presalePriceOg = DEFAULT_PRESALE_PRICE_OG;
        private BigInteger presalePriceWl = DEFAULT_PRESALE_PRICE_WL;
        private int presaleMaxTokenPerOg = DEFAULT_PRESALE_MAX_TOKEN_PER_OG;
        private int presaleMaxTokenPerWl = DEFAULT_PRESALE_MAX_TOKEN_PER_WL;
        private int reservedTokens = DEFAULT_RESERVED_TOKENS;
        private int maxMintPerTx = 0;
        private BigInteger price = DEFAULT_PRICE;
        private int maxTokenPerWallet = DEFAULT_MAX_TOKEN_PER_WALLET;
        private long presaleDate = 0;
        private long publicSaleDate = 0;
        private long revealDate = 0;
        private Bytes32 ogMerkleRoot = Bytes32.ZERO;
        private Bytes32 wlMerkleRoot = Bytes32.ZERO;
        private String metadataBaseURI = "";

        private Builder() {
        }

        private Builder(CollectionConfig config) {
            this.totalSupply = config.totalSupply;
            this.presaleInterval = config.presaleInterval;
            this.presalePriceOg = config.presalePriceOg;
            this.presalePriceWl = config.presalePriceWl;
            this.presaleMaxTokenPerOg = config.presaleMaxTokenPerOg;
            this.presaleMaxTokenPerWl = config.presaleMaxTokenPerWl;
            this.reservedTokens = config.reservedTokens;
            this.maxMintPerTx = config.maxMintPerTx;
            this.price = config.price;
            this.maxTokenPerWallet = config.maxTokenPerWallet;
            this.presaleDate = config.presaleDate;
            this.publicSaleDate = config.publicSaleDate;
            this.revealDate = config.revealDate;
            this.ogMerkleRoot = config.ogMerkleRoot;
            this.wlMerkleRoot = config.wlMerkleRoot;
            this.metadataBaseURI = config.metadataBaseURI;
        }

        public Builder totalSupply(int totalSupply) {
            requirePositive(totalSupply, "totalSupply");
            this.totalSupply = totalSupply;
            return this;
        }

        public Builder presaleInterval(long presaleInterval) {
            requireTimestamp(presaleInterval, "presaleInterval");
            this.presaleInterval = presaleInterval;
            return this;
        }

        public Builder presalePriceOg(BigInteger presalePriceOg) {
            this.presalePriceOg = requireAmount(presalePriceOg, "presalePriceOg");
            return this;
        }

        public Builder presalePriceWl(BigInteger presalePriceWl) {
            this.presalePriceWl = requireAmount(presalePriceWl, "presalePriceWl");
            return this;
        }

        public Builder presaleMaxTokenPerOg(int presaleMaxTokenPerOg) {
            requirePositive(presaleMaxTokenPerOg, "presaleMaxTokenPerOg");
            this.presaleMaxTokenPerOg = presaleMaxTokenPerOg;
            return this;
        }

        public Builder presaleMaxTokenPerWl(int presaleMaxTokenPerWl) {
            requirePositive(presaleMaxTokenPerWl, "presaleMaxTokenPerWl");
            this.presaleMaxTokenPerWl = presaleMaxTokenPerWl;
            return this;
        }

        public Builder reservedTokens(int reservedTokens) {
            if (reservedTokens < 0) {
                throw new IllegalArgumentException("reservedTokens must be >= 0");
            }
            this.reservedTokens = reservedTokens;
            return this;
        }

        public Builder maxMintPerTx(int maxMintPerTx) {
            if (maxMintPerTx < 0) {
                throw new IllegalArgumentException("maxMintPerTx must be >= 0");
            }
            this.maxMintPerTx = maxMintPerTx;
            return this;
        }

        public Builder price(BigInteger price) {
            this.price = requireAmount(price, "price");
            return this;
        }

        public Builder maxTokenPerWallet(int maxTokenPerWallet) {
            requirePositive(maxTokenPerWallet, "maxTokenPerWallet");
            this.maxTokenPerWallet = maxTokenPerWallet;
            return this;
        }

        public Builder presaleDate(long presaleDate) {
            requireTimestamp(presaleDate, "presaleDate");
            this.presaleDate = presaleDate;
            return this;
        }

        public Builder publicSaleDate(long publicSaleDate) {
            requireTimestamp(publicSaleDate, "publicSaleDate");
            this.publicSaleDate = publicSaleDate;
            return this;
        }

        public Builder revealDate(long revealDate) {
            requireTimestamp(revealDate, "revealDate");
            this.revealDate = revealDate;
            return this;
        }

        public Builder ogMerkleRoot(Bytes32 ogMerkleRoot) {
            this.ogMerkleRoot = Objects.requireNonNull(ogMerkleRoot, "ogMerkleRoot is required");
            return this;
        }

        public Builder wlMerkleRoot(Bytes32 wlMerkleRoot) {
            this.wlMerkleRoot = Objects.requireNonNull(wlMerkleRoot, "wlMerkleRoot is required");
            return this;
        }

        public Builder metadataBaseURI(String metadataBaseURI) {
            this.metadataBaseURI = metadataBaseURI != null ? metadataBaseURI : "";
            return this;
        }

        public CollectionConfig build() {
            if (reservedTokens > totalSupply) {
                throw new IllegalArgumentException(
                        "reservedTokens (" + reservedTokens + ") exceeds totalSupply (" + totalSupply + ")");
            }
            return new CollectionConfig(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
        }

        private static void requireTimestamp(long value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
        }

        private static BigInteger requireAmount(BigInteger value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.signum() < 0) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
            return value;
        }
    }
}
