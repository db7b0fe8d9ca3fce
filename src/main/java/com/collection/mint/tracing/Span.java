package com.collection.mint.tracing;

import com.collection.mint.error.CollectionException;

/**
 * A traced contract call. Closing the span ends it, so spans are used in
 * try-with-resources blocks:
 * <pre>
 * try (Span span = tracingService.startCallSpan("ogMint", caller)) {
 *     span.setAttribute("collection.amount", amount);
 *     // ... do work ...
 *     span.setStatus(Span.SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Marks the span as failed by a rejected call, tagging the error code.
     */
    default void recordRejection(CollectionException rejection) {
        setAttribute("collection.error", rejection.getErrorCode().name());
        recordException(rejection);
        setStatus(SpanStatus.ERROR);
    }

    /**
     * Marks the span as failed by an unexpected runtime error.
     */
    default void recordFailure(Throwable failure) {
        setAttribute("collection.error", failure.getClass().getSimpleName());
        recordException(failure);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
