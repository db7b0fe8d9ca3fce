package com.collection.mint.tracing;

import com.collection.mint.core.model.Address;

import java.util.Map;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the library works
 * without a tracing backend.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts the span for one contract call, tagged with the operation and the caller.
     */
    default Span startCallSpan(String operation, Address caller) {
        return startSpan("collection." + operation, Map.of(
                "collection.operation", operation,
                "collection.caller", caller != null ? caller.value() : "unknown"));
    }
}
