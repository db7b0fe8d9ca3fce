package com.collection.mint.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper that tags every log line of a contract call.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCall("ogMint", caller.value())) {
 *     log.info("mint.accepted kind={} amount={}", kind, amount);
 * } // MDC entries are restored here
 * </pre>
 * Values that were already in the MDC when a key was put are put back on close,
 * so a nested call does not wipe the context of the call around it.
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one contract call with a fresh correlation id.
     */
    public static LogContext forCall(String operation, String caller) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("operation", operation);
        ctx.put("caller", caller);
        return ctx;
    }

    /**
     * Creates a log context for a treasury call on one withdrawal transaction.
     */
    public static LogContext forWithdrawal(String operation, String caller, long index) {
        return forCall(operation, caller).with("txIndex", Long.toString(index));
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
