package com.collection.mint.lock;

/**
 * Configuration for {@link ExecutionLock} implementations.
 *
 * @param timeoutMs maximum time a call waits for the instance to become free
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
