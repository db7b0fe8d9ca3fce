package com.collection.mint.metrics;

import com.collection.mint.core.model.MintKind;
import com.collection.mint.error.ErrorCode;

import java.math.BigInteger;
import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMint(MintKind kind, int amount, Duration duration) {
    }

    @Override
    public void incrementRejected(String operation, ErrorCode errorCode) {
    }

    @Override
    public void recordWithdrawalExecuted(BigInteger valueWei) {
    }
}
