package com.collection.mint.tracing;

import com.collection.mint.error.CollectionException;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Reports contract calls to OpenTelemetry as {@link SpanKind#SERVER} spans.
 * A rejected call ends with ERROR status whose description is the error code,
 * so rejections can be grouped without parsing exception messages.
 */
public class OpenTelemetryTracingService implements TracingService {

    /** Instrumentation scope used when the tracer is obtained from an {@link OpenTelemetry} instance. */
    public static final String INSTRUMENTATION_SCOPE = "com.collection.mint";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.SERVER);
        if (attributes != null) {
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                builder.setAttribute(attribute.getKey(), attribute.getValue());
            }
        }
        return new CallSpan(builder.startSpan());
    }

    private static final class CallSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        private CallSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void recordRejection(CollectionException rejection) {
            String code = rejection.getErrorCode().name();
            delegate.setAttribute("collection.error", code);
            delegate.recordException(rejection);
            delegate.setStatus(StatusCode.ERROR, code);
        }

        @Override
        public void recordFailure(Throwable failure) {
            String type = failure.getClass().getSimpleName();
            delegate.setAttribute("collection.error", type);
            delegate.recordException(failure);
            delegate.setStatus(StatusCode.ERROR, type);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
