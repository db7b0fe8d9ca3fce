package com.collection.mint.lock;

import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link ExecutionLock} built on a single {@link ReentrantLock}.
 * The lock's own re-entrancy is used only to detect a nested call, which is
 * then refused instead of being let through.
 */
public class NonReentrantExecutionLock implements ExecutionLock {
    private static final Logger log = LoggerFactory.getLogger(NonReentrantExecutionLock.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final LockConfig config;
    private volatile String activeOperation;

    public NonReentrantExecutionLock() {
        this(LockConfig.defaults());
    }

    public NonReentrantExecutionLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public Permit acquire(String operation) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Re-entrant call rejected: {} while {} is in progress", operation, activeOperation);
            throw new CollectionException(ErrorCode.REENTRANT_CALL,
                    "Re-entrant call to " + operation + " while " + activeOperation + " is in progress");
        }
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(
                        "Failed to enter " + operation + " within " + config.timeoutMs() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while entering " + operation, e);
        }
        activeOperation = operation;
        log.debug("Execution lock acquired: {}", operation);
        return new HeldPermit(operation);
    }

    @Override
    public boolean isHeld() {
        return lock.isLocked();
    }

    private final class HeldPermit implements Permit {
        private final String operation;
        private boolean released;

        private HeldPermit(String operation) {
            this.operation = operation;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            activeOperation = null;
            lock.unlock();
            log.debug("Execution lock released: {}", operation);
        }
    }
}
