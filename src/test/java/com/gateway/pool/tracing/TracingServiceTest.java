package com.gateway.pool.tracing;

import com.gateway.pool.connection.ConnectConfig;
import com.gateway.pool.connection.ConnectionEstablishmentException;
import com.gateway.pool.connection.GatewayConnection;
import com.gateway.pool.connection.KeyedGatewayConnectionPool;
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
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    private static final ConnectConfig CONFIG = ConnectConfig.builder().url("wss://test.gateway.com").build();

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            assertDoesNotThrow(() -> {
                try (Span span = NoOpTracingService.INSTANCE.startClientSpan("gateway.connect", Map.of())) {
                    span.setAttribute("gateway.id", "gateway_123");
                    span.setAttribute("insecure", false);
                    span.setStatus(Span.SpanStatus.ERROR);
                    span.recordException(new RuntimeException("test"));
                }
            });
        }

        @Test
        @DisplayName("Should return the same inert span")
        void sameSpanReturned() {
            Span span1 = NoOpTracingService.INSTANCE.startClientSpan("op1", Map.of());
            Span span2 = new NoOpTracingService().startClientSpan("op2", null);
            assertSame(span1, span2);
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
            when(builder.setSpanKind(any())).thenReturn(builder);
            when(builder.setAttribute(anyString(), anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
        }

        @Test
        @DisplayName("Should start a client span with initial attributes")
        void startClientSpan() {
            Span span = new OpenTelemetryTracingService(tracer)
                    .startClientSpan("gateway.connect", Map.of("gateway.id", "gateway_123"));

            assertNotNull(span);
            verify(tracer).spanBuilder("gateway.connect");
            verify(builder).setSpanKind(SpanKind.CLIENT);
            verify(builder).setAttribute("gateway.id", "gateway_123");
        }

        @Test
        @DisplayName("Should map status, attributes, exceptions and close")
        void delegatesToOtelSpan() {
            Span span = new OpenTelemetryTracingService(tracer).startClientSpan("gateway.connect", Map.of());
            RuntimeException error = new RuntimeException("handshake failed");

            span.setAttribute("url", "wss://test.gateway.com");
            span.setAttribute("insecure", true);
            span.setStatus(Span.SpanStatus.OK);
            span.setStatus(Span.SpanStatus.ERROR);
            span.recordException(error);
            span.close();

            verify(otelSpan).setAttribute("url", "wss://test.gateway.com");
            verify(otelSpan).setAttribute("insecure", true);
            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan).recordException(error);
            verify(otelSpan).end();
        }
    }

    @Nested
    @DisplayName("Pool integration")
    class PoolTracing {

        @Test
        @DisplayName("Should trace slow-path connects only")
        void tracesSlowPath() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startClientSpan(eq("gateway.connect"), anyMap())).thenReturn(span);
            GatewayConnection connection = mock(GatewayConnection.class);
            when(connection.isOpen()).thenReturn(true);
            when(connection.getId()).thenReturn("conn-1");

            try (KeyedGatewayConnectionPool pool = KeyedGatewayConnectionPool.builder(cfg -> connection)
                    .tracing(tracing)
                    .build()) {
                GatewayConnection acquired = pool.acquire("gateway_123", CONFIG);
                pool.release(acquired, pool.buildKey("gateway_123", CONFIG));
                pool.acquire("gateway_123", CONFIG);
            }

            verify(tracing, times(1)).startClientSpan("gateway.connect",
                    Map.of("gateway.id", "gateway_123", "gateway.url", "wss://test.gateway.com"));
            verify(span).setAttribute("gateway.tls.insecure", false);
            verify(span).setAttribute("gateway.device_pairing.disabled", false);
            verify(span).setAttribute("gateway.connection.id", "conn-1");
            verify(span).setStatus(Span.SpanStatus.OK);
            verify(span).close();
        }

        @Test
        @DisplayName("Should record connect failures on the span")
        void recordsFailure() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startClientSpan(anyString(), anyMap())).thenReturn(span);
            ConnectionEstablishmentException failure = new ConnectionEstablishmentException("refused");

            try (KeyedGatewayConnectionPool pool = KeyedGatewayConnectionPool.builder(cfg -> {
                        throw failure;
                    })
                    .tracing(tracing)
                    .build()) {
                assertThrows(ConnectionEstablishmentException.class, () -> pool.acquire("gateway_123", CONFIG));
            }

            verify(span).recordException(failure);
            verify(span).setStatus(Span.SpanStatus.ERROR);
            verify(span).close();
        }
    }
}
