package com.gateway.pool.tracing;

/**
 * A traced unit of pool work, such as opening a gateway connection.
 * Ending the span happens in {@link #close()}, so spans fit try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startClientSpan("gateway.connect", Map.of("gateway.id", gatewayId))) {
 *     GatewayConnection connection = connector.connect(config);
 *     span.setStatus(Span.SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, boolean value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Ends the span. Does not throw.
     */
    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
