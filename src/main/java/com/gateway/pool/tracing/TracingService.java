package com.gateway.pool.tracing;

import java.util.Map;

/**
 * Starts spans around pool operations that leave the process.
 * {@link NoOpTracingService} is used when no tracer is configured.
 */
public interface TracingService {

    /**
     * Starts a span of kind CLIENT.
     *
     * @param operationName span name
     * @param attributes    initial attributes, may be empty
     */
    Span startClientSpan(String operationName, Map<String, String> attributes);
}
