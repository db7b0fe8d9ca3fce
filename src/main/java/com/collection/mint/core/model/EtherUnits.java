package com.collection.mint.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Conversions between decimal ether amounts and wei, the smallest currency unit.
 */
public final class EtherUnits {

    public static final BigInteger WEI_PER_ETHER = BigInteger.TEN.pow(18);

    private EtherUnits() {
    }

    /**
     * Converts a decimal ether string such as {@code "0.025"} to wei.
     *
     * @throws IllegalArgumentException if the value is negative or has more than 18 decimals
     */
    public static BigInteger parseEther(String ether) {
        Objects.requireNonNull(ether, "ether amount is required");
        BigDecimal wei = new BigDecimal(ether.trim()).movePointRight(18);
        if (wei.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + ether);
        }
        try {
            return wei.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount has more than 18 decimals: " + ether, e);
        }
    }

    public static String formatEther(BigInteger wei) {
        return new BigDecimal(wei).movePointLeft(18).stripTrailingZeros().toPlainString();
    }
}
