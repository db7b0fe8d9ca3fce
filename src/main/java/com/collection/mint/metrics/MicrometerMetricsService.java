package com.collection.mint.metrics;

import com.collection.mint.core.model.EtherUnits;
import com.collection.mint.core.model.MintKind;
import com.collection.mint.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code collection.mint.tokens}: Counter of tokens minted (tag: kind)</li>
 *   <li>{@code collection.mint.duration}: Timer of accepted mint calls (tag: kind)</li>
 *   <li>{@code collection.call.rejected}: Counter (tags: operation, error)</li>
 *   <li>{@code collection.treasury.executed}: Counter of executed withdrawals</li>
 *   <li>{@code collection.treasury.value}: DistributionSummary of withdrawn ether</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter withdrawalCounter;
    private final DistributionSummary withdrawalValueSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.withdrawalCounter = Counter.builder("collection.treasury.executed")
                .description("Number of executed withdrawals")
                .register(registry);
        this.withdrawalValueSummary = DistributionSummary.builder("collection.treasury.value")
                .description("Ether paid out per executed withdrawal")
                .baseUnit("ether")
                .register(registry);
    }

    @Override
    public void recordMint(MintKind kind, int amount, Duration duration) {
        Counter tokens = counterCache.computeIfAbsent("tokens:" + kind.name(), k ->
                Counter.builder("collection.mint.tokens")
                        .description("Number of tokens minted")
                        .tag("kind", kind.name())
                        .register(registry));
        tokens.increment(amount);

        Timer timer = timerCache.computeIfAbsent(kind.name(), k ->
                Timer.builder("collection.mint.duration")
                        .description("Duration of accepted mint calls")
                        .tag("kind", kind.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRejected(String operation, ErrorCode errorCode) {
        String key = "rejected:" + operation + ":" + errorCode.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("collection.call.rejected")
                        .description("Number of rejected contract calls")
                        .tag("operation", operation)
                        .tag("error", errorCode.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordWithdrawalExecuted(BigInteger valueWei) {
        withdrawalCounter.increment();
        withdrawalValueSummary.record(new BigDecimal(EtherUnits.formatEther(valueWei)).doubleValue());
    }
}
