package com.collection.mint.lock;

/**
 * Runtime exception thrown when a call cannot enter a contract instance
 * within the configured timeout.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
