package com.collection.mint.lock;

/**
 * One-call-at-a-time guard for a contract instance.
 *
 * <p>Every state-changing call enters through {@link #acquire(String)} and
 * holds the returned {@link Permit} until it finishes:</p>
 * <pre>
 * try (ExecutionLock.Permit permit = lock.acquire("mint")) {
 *     // validate, then mutate
 * }
 * </pre>
 * Calls from other threads wait their turn. A nested call on the same
 * instance while an outer call is still running is rejected.
 */
public interface ExecutionLock {

    /**
     * Enters the guarded section.
     *
     * @param operation name of the call, used in diagnostics
     * @return a permit that must be closed to leave the section
     * @throws com.collection.mint.error.CollectionException with
     *         {@code REENTRANT_CALL} if the calling thread is already inside
     * @throws LockAcquisitionException if another call holds the lock past the timeout
     */
    Permit acquire(String operation);

    /**
     * Returns true if some call is currently inside the guarded section.
     */
    boolean isHeld();

    /**
     * Scoped hold on an {@link ExecutionLock}. Closing releases it; closing twice is a no-op.
     */
    interface Permit extends AutoCloseable {
        @Override
        void close();
    }
}
