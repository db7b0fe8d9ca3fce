package com.collection.mint.clock;

import com.collection.mint.core.model.CollectionConfig;
import com.collection.mint.core.model.SaleStage;

import java.time.Clock;
import java.util.Objects;

/**
 * Maps the current time and a {@link CollectionConfig} to the {@link SaleStage}.
 *
 * <p>The stage is never cached. Callers ask again after every config change
 * and get an answer computed from the dates in force at that moment.</p>
 *
 * <p>Precedence, highest first:</p>
 * <ol>
 *   <li>{@code t >= publicSaleDate} → {@link SaleStage#PUBLIC_SALE}</li>
 *   <li>{@code t >= presaleDate + presaleInterval} → {@link SaleStage#PRESALE_WL}</li>
 *   <li>{@code t >= presaleDate} → {@link SaleStage#PRESALE_OG}</li>
 *   <li>otherwise {@link SaleStage#IDLE}</li>
 * </ol>
 * The WL boundary saturates at {@link Long#MAX_VALUE} instead of overflowing,
 * so the mapping stays deterministic even when the dates are out of order.
 */
public class SaleStageClock {

    private final Clock clock;

    public SaleStageClock() {
        this(Clock.systemUTC());
    }

    public SaleStageClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Current unix time in seconds.
     */
    public long now() {
        return clock.instant().getEpochSecond();
    }

    public SaleStage currentStage(CollectionConfig config) {
        return stageAt(config, now());
    }

    public static SaleStage stageAt(CollectionConfig config, long timestamp) {
        Objects.requireNonNull(config, "config is required");
        if (timestamp >= config.getPublicSaleDate()) {
            return SaleStage.PUBLIC_SALE;
        }
        if (timestamp >= saturatingAdd(config.getPresaleDate(), config.getPresaleInterval())) {
            return SaleStage.PRESALE_WL;
        }
        if (timestamp >= config.getPresaleDate()) {
            return SaleStage.PRESALE_OG;
        }
        return SaleStage.IDLE;
    }

    static long saturatingAdd(long a, long b) {
        long sum = a + b;
        // both operands are non-negative, so overflow shows up as a negative sum
        return sum < 0 ? Long.MAX_VALUE : sum;
    }
}
