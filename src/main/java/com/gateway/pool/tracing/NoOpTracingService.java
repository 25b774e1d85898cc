package com.gateway.pool.tracing;

import java.util.Map;

/**
 * {@link TracingService} that records nothing. Every call returns the same inert span.
 */
public class NoOpTracingService implements TracingService {

    public static final NoOpTracingService INSTANCE = new NoOpTracingService();

    private static final Span NO_OP_SPAN = new Span() {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startClientSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }
}
