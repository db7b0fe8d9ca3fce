package com.collection.mint.error;

import java.util.Objects;

/**
 * Runtime exception thrown when a contract call is rejected.
 * The {@link ErrorCode} identifies the failed check; the call had no effect.
 */
public class CollectionException extends RuntimeException {

    private final ErrorCode errorCode;

    public CollectionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    public CollectionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "CollectionException{" + errorCode + ": " + getMessage() + '}';
    }
}
