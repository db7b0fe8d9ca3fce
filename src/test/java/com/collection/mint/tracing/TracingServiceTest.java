package com.collection.mint.tracing;

import com.collection.mint.core.model.Address;
import com.collection.mint.error.CollectionException;
import com.collection.mint.error.ErrorCode;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    private static final Address CALLER = Address.of("0x0000000000000000000000000000000000000001");

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startCallSpan("mint", CALLER)) {
                    span.setAttribute("collection.amount", 3L);
                    span.recordRejection(new CollectionException(ErrorCode.ZERO_AMOUNT, "zero"));
                }
            });
        }

        @Test
        @DisplayName("Should return the same singleton span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("a", Map.of()), noOp.startSpan("b", null));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);

            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.setSpanKind(any(SpanKind.class))).thenReturn(builder);
            when(builder.setAttribute(anyString(), anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
        }

        @Test
        @DisplayName("Call spans should be SERVER spans named after the operation and tagged with the caller")
        void callSpan() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(tracer);

            try (Span span = service.startCallSpan("ogMint", CALLER)) {
                span.setStatus(Span.SpanStatus.OK);
            }

            verify(tracer).spanBuilder("collection.ogMint");
            verify(builder).setSpanKind(SpanKind.SERVER);
            verify(builder).setAttribute("collection.operation", "ogMint");
            verify(builder).setAttribute("collection.caller", CALLER.value());
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Rejections should tag the error code, record the exception and set ERROR status")
        void recordRejection() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(tracer);
            CollectionException rejection = new CollectionException(ErrorCode.QUORUM_NOT_MET, "1 of 2");

            try (Span span = service.startCallSpan("executeWithdrawal", CALLER)) {
                span.recordRejection(rejection);
            }

            verify(otelSpan).setAttribute("collection.error", "QUORUM_NOT_MET");
            verify(otelSpan).recordException(rejection);
            verify(otelSpan).setStatus(StatusCode.ERROR, "QUORUM_NOT_MET");
        }

        @Test
        @DisplayName("Unexpected failures should tag the exception type and set ERROR status")
        void recordFailure() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(tracer);
            IllegalStateException failure = new IllegalStateException("store offline");

            try (Span span = service.startCallSpan("mint", CALLER)) {
                span.recordFailure(failure);
            }

            verify(otelSpan).setAttribute("collection.error", "IllegalStateException");
            verify(otelSpan).recordException(failure);
            verify(otelSpan).setStatus(StatusCode.ERROR, "IllegalStateException");
        }

        @Test
        @DisplayName("Tracer should be taken from OpenTelemetry under the library scope")
        void fromOpenTelemetry() {
            OpenTelemetry openTelemetry = mock(OpenTelemetry.class);
            when(openTelemetry.getTracer(OpenTelemetryTracingService.INSTRUMENTATION_SCOPE)).thenReturn(tracer);

            try (Span span = new OpenTelemetryTracingService(openTelemetry).startCallSpan("mint", CALLER)) {
                span.setStatus(Span.SpanStatus.OK);
            }

            verify(tracer).spanBuilder("collection.mint");
        }

        @Test
        @DisplayName("Long attributes should be forwarded")
        void longAttribute() {
            OpenTelemetryTracingService service = new OpenTelemetryTracingService(tracer);

            try (Span span = service.startSpan("collection.mint", null)) {
                span.setAttribute("collection.amount", 3L);
            }

            verify(otelSpan).setAttribute("collection.amount", 3L);
        }
    }
}
