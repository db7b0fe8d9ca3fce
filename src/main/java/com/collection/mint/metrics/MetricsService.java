package com.collection.mint.metrics;

import com.collection.mint.core.model.MintKind;
import com.collection.mint.error.ErrorCode;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Interface for recording collection metrics.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void recordMint(MintKind kind, int amount, Duration duration);

    void incrementRejected(String operation, ErrorCode errorCode);

    void recordWithdrawalExecuted(BigInteger valueWei);
}
