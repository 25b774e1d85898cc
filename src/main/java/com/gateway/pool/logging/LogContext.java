package com.gateway.pool.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC scope for pool operations.
 * Entries added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAcquire(gatewayId)) {
 *     ctx.with(LogContext.PATH, "fast");
 *     log.debug("pool.acquire reused");
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String GATEWAY_ID = "gatewayId";
    public static final String OPERATION = "operation";
    public static final String PATH = "path";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forAcquire(String gatewayId) {
        return forOperation("acquire", gatewayId);
    }

    public static LogContext forRelease(String gatewayId) {
        return forOperation("release", gatewayId);
    }

    public static LogContext forEviction() {
        LogContext ctx = new LogContext();
        ctx.put(OPERATION, "evict");
        return ctx;
    }

    private static LogContext forOperation(String operation, String gatewayId) {
        LogContext ctx = new LogContext();
        ctx.put(GATEWAY_ID, gatewayId);
        ctx.put(OPERATION, operation);
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
