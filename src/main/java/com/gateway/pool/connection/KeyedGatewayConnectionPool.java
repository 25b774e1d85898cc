package com.gateway.pool.connection;

import com.gateway.pool.logging.LogContext;
import com.gateway.pool.metrics.EvictionReason;
import com.gateway.pool.metrics.NoOpPoolMetrics;
import com.gateway.pool.metrics.PoolMetrics;
import com.gateway.pool.tracing.NoOpTracingService;
import com.gateway.pool.tracing.Span;
import com.gateway.pool.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe {@link GatewayConnectionPool} keyed by gateway id and handshake parameters.
 *
 * <p>All bookkeeping (key lookup, the scan-and-mark of an idle entry, admission and
 * eviction) happens under a single {@link ReentrantLock}. Opening a new connection and
 * closing evicted ones happen outside the lock, so a slow handshake for one gateway
 * never blocks callers of another.</p>
 *
 * <p>{@link PoolConfig#getMaxIdlePerKey()} bounds idle entries only: when every entry of a
 * key is in use, a new connection is admitted beyond the bound rather than making the
 * caller wait. Such admissions are counted as overflow.</p>
 */
public class KeyedGatewayConnectionPool implements GatewayConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(KeyedGatewayConnectionPool.class);

    static final String CONNECT_SPAN = "gateway.connect";
    static final String EVICTOR_THREAD_NAME = "gateway-pool-evictor";

    private final GatewayConnector connector;
    private final PoolConfig config;
    private final Clock clock;
    private final PoolMetrics metrics;
    private final TracingService tracing;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<PoolKey, List<PoolEntry>> entries = new HashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ScheduledExecutorService evictor;

    private final AtomicLong totalAcquired = new AtomicLong(0);
    private final AtomicLong totalReleased = new AtomicLong(0);
    private final AtomicLong totalCreated = new AtomicLong(0);
    private final AtomicLong totalReused = new AtomicLong(0);
    private final AtomicLong totalEvicted = new AtomicLong(0);

    public KeyedGatewayConnectionPool(GatewayConnector connector) {
        this(builder(connector));
    }

    public KeyedGatewayConnectionPool(GatewayConnector connector, PoolConfig config) {
        this(builder(connector).config(config));
    }

    private KeyedGatewayConnectionPool(Builder builder) {
        this.connector = Objects.requireNonNull(builder.connector, "connector");
        this.config = builder.config;
        this.clock = builder.clock;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;

        if (config.isBackgroundEvictionEnabled()) {
            this.evictor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, EVICTOR_THREAD_NAME);
                thread.setDaemon(true);
                return thread;
            });
            long interval = config.getEvictionIntervalMillis();
            evictor.scheduleWithFixedDelay(this::runScheduledEviction, interval, interval, TimeUnit.MILLISECONDS);
        } else {
            this.evictor = null;
        }

        log.info("Gateway connection pool initialized: {}", config);
    }

    public static Builder builder(GatewayConnector connector) {
        return new Builder(connector);
    }

    @Override
    public GatewayConnection acquire(String gatewayId, ConnectConfig connectConfig) {
        PoolKey key = buildKey(gatewayId, connectConfig);
        ensureOpen();

        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forAcquire(gatewayId)) {
            List<GatewayConnection> evicted = new ArrayList<>();
            GatewayConnection reused;

            lock.lock();
            try {
                long now = clock.millis();
                sweepExpired(now, evicted);
                reused = checkoutIdle(key, now, evicted);
            } finally {
                lock.unlock();
            }
            closeAll(evicted);

            if (reused != null) {
                ctx.with(LogContext.PATH, "fast");
                totalAcquired.incrementAndGet();
                totalReused.incrementAndGet();
                metrics.recordAcquire(true, Duration.ofNanos(System.nanoTime() - start));
                log.debug("pool.acquire reused key={} connection={}", key, reused.getId());
                return reused;
            }

            ctx.with(LogContext.PATH, "slow");
            GatewayConnection connection = connect(gatewayId, connectConfig);
            admit(key, connection);

            totalAcquired.incrementAndGet();
            totalCreated.incrementAndGet();
            metrics.recordAcquire(false, Duration.ofNanos(System.nanoTime() - start));
            log.debug("pool.acquire created key={} connection={}", key, connection.getId());
            return connection;
        }
    }

    @Override
    public void release(GatewayConnection connection, PoolKey key) {
        if (connection == null || key == null) {
            return;
        }

        try (LogContext ctx = LogContext.forRelease(key.gatewayId())) {
            boolean discard = false;
            boolean returned = false;

            lock.lock();
            try {
                List<PoolEntry> list = entries.get(key);
                PoolEntry entry = list != null ? findByConnection(list, connection) : null;
                if (entry == null) {
                    log.debug("pool.release unknown connection={} key={}", connection.getId(), key);
                } else if (!connection.isOpen()) {
                    removeEntry(key, list, entry);
                    discard = true;
                } else {
                    entry.checkin(clock.millis(), config.getTtlMillis());
                    returned = true;
                }
            } finally {
                lock.unlock();
            }

            if (discard) {
                recordEvicted(EvictionReason.UNHEALTHY, 1);
                closeQuietly(connection);
                log.debug("pool.release discarded unhealthy connection={}", connection.getId());
            }
            if (discard || returned) {
                totalReleased.incrementAndGet();
                metrics.recordRelease();
            }
        }
    }

    @Override
    public int poolSize() {
        lock.lock();
        try {
            long now = clock.millis();
            int count = 0;
            for (List<PoolEntry> list : entries.values()) {
                for (PoolEntry entry : list) {
                    if (!entry.isExpired(now)) {
                        count++;
                    }
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int evictExpired() {
        List<GatewayConnection> evicted = new ArrayList<>();
        lock.lock();
        try {
            sweepExpired(clock.millis(), evicted);
        } finally {
            lock.unlock();
        }
        closeAll(evicted);
        return evicted.size();
    }

    @Override
    public void clear() {
        List<GatewayConnection> all = new ArrayList<>();
        lock.lock();
        try {
            for (List<PoolEntry> list : entries.values()) {
                for (PoolEntry entry : list) {
                    all.add(entry.connection());
                }
            }
            entries.clear();
        } finally {
            lock.unlock();
        }

        recordEvicted(EvictionReason.CLEARED, all.size());
        closeAll(all);
        log.info("Gateway connection pool cleared: closed={}", all.size());
    }

    @Override
    public PoolStats getStats() {
        int total = 0;
        int inUse = 0;
        int largest = 0;
        int keyCount;

        lock.lock();
        try {
            keyCount = entries.size();
            for (List<PoolEntry> list : entries.values()) {
                total += list.size();
                largest = Math.max(largest, list.size());
                for (PoolEntry entry : list) {
                    if (entry.inUse()) {
                        inUse++;
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        return new PoolStats(
                total,
                inUse,
                total - inUse,
                keyCount,
                largest,
                config.getMaxIdlePerKey(),
                totalAcquired.get(),
                totalReleased.get(),
                totalCreated.get(),
                totalReused.get(),
                totalEvicted.get()
        );
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing gateway connection pool...");
            if (evictor != null) {
                evictor.shutdownNow();
            }
            clear();
            log.info("Gateway connection pool closed");
        }
    }

    public PoolConfig getConfig() {
        return config;
    }

    // ── Internal ─────────────────────────────────────────────

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Pool is closed");
        }
    }

    private GatewayConnection connect(String gatewayId, ConnectConfig connectConfig) {
        try (Span span = tracing.startClientSpan(CONNECT_SPAN,
                Map.of("gateway.id", gatewayId, "gateway.url", connectConfig.getUrl()))) {
            span.setAttribute("gateway.tls.insecure", connectConfig.isAllowInsecureTls());
            span.setAttribute("gateway.device_pairing.disabled", connectConfig.isDisableDevicePairing());
            try {
                GatewayConnection connection = connector.connect(connectConfig);
                if (connection == null) {
                    throw new ConnectionEstablishmentException(
                            "Connector returned no connection for gateway " + gatewayId);
                }
                span.setAttribute("gateway.connection.id", connection.getId());
                span.setStatus(Span.SpanStatus.OK);
                return connection;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                metrics.recordConnectFailure();
                log.warn("pool.connect failed gatewayId={} url={}: {}",
                        gatewayId, connectConfig.getUrl(), e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Adds a freshly opened connection to the pool, making room among idle entries if the
     * key is at capacity. Runs after the handshake, so the pool may have been closed meanwhile.
     */
    private void admit(PoolKey key, GatewayConnection connection) {
        List<GatewayConnection> evicted = new ArrayList<>();
        boolean rejected = false;
        boolean overflow = false;

        lock.lock();
        try {
            if (closed.get()) {
                rejected = true;
            } else {
                long now = clock.millis();
                List<PoolEntry> list = entries.computeIfAbsent(key, k -> new ArrayList<>());
                if (list.size() >= config.getMaxIdlePerKey()) {
                    PoolEntry oldestIdle = findOldestIdle(list);
                    if (oldestIdle != null) {
                        list.remove(oldestIdle);
                        evicted.add(oldestIdle.connection());
                    }
                }
                list.add(new PoolEntry(connection, now, config.getTtlMillis()));
                overflow = list.size() > config.getMaxIdlePerKey();
            }
        } finally {
            lock.unlock();
        }

        if (!evicted.isEmpty()) {
            recordEvicted(EvictionReason.CAPACITY, evicted.size());
            closeAll(evicted);
        }
        if (rejected) {
            closeQuietly(connection);
            throw new IllegalStateException("Pool was closed while connecting to gateway " + key.gatewayId());
        }
        if (overflow) {
            metrics.recordOverflow();
            log.debug("pool.admit beyond idle capacity key={} capacity={}", key, config.getMaxIdlePerKey());
        }
    }

    /**
     * Finds the first idle, open and unexpired entry for the key and marks it in use.
     * Idle entries that report closed are removed. Must be called with the lock held.
     */
    private GatewayConnection checkoutIdle(PoolKey key, long now, List<GatewayConnection> evicted) {
        List<PoolEntry> list = entries.get(key);
        if (list == null) {
            return null;
        }

        GatewayConnection found = null;
        int unhealthy = 0;
        Iterator<PoolEntry> it = list.iterator();
        while (it.hasNext()) {
            PoolEntry entry = it.next();
            if (entry.inUse()) {
                continue;
            }
            if (!entry.connection().isOpen()) {
                it.remove();
                evicted.add(entry.connection());
                unhealthy++;
                continue;
            }
            if (!entry.isExpired(now)) {
                entry.checkout(now, config.getTtlMillis());
                found = entry.connection();
                break;
            }
        }

        if (list.isEmpty()) {
            entries.remove(key);
        }
        recordEvicted(EvictionReason.UNHEALTHY, unhealthy);
        return found;
    }

    /**
     * Removes expired idle entries across all keys. In-use entries are never swept.
     * Must be called with the lock held.
     */
    private void sweepExpired(long now, List<GatewayConnection> evicted) {
        int count = 0;
        Iterator<Map.Entry<PoolKey, List<PoolEntry>>> keys = entries.entrySet().iterator();
        while (keys.hasNext()) {
            List<PoolEntry> list = keys.next().getValue();
            Iterator<PoolEntry> it = list.iterator();
            while (it.hasNext()) {
                PoolEntry entry = it.next();
                if (!entry.inUse() && entry.isExpired(now)) {
                    it.remove();
                    evicted.add(entry.connection());
                    count++;
                }
            }
            if (list.isEmpty()) {
                keys.remove();
            }
        }
        if (count > 0) {
            recordEvicted(EvictionReason.EXPIRED, count);
            log.debug("pool.evict expired={}", count);
        }
    }

    private void runScheduledEviction() {
        try (LogContext ctx = LogContext.forEviction()) {
            evictExpired();
        } catch (RuntimeException e) {
            log.warn("Background eviction failed: {}", e.getMessage(), e);
        }
    }

    private void removeEntry(PoolKey key, List<PoolEntry> list, PoolEntry entry) {
        list.remove(entry);
        if (list.isEmpty()) {
            entries.remove(key);
        }
    }

    private static PoolEntry findByConnection(List<PoolEntry> list, GatewayConnection connection) {
        for (PoolEntry entry : list) {
            if (entry.connection() == connection) {
                return entry;
            }
        }
        return null;
    }

    private static PoolEntry findOldestIdle(List<PoolEntry> list) {
        PoolEntry oldest = null;
        for (PoolEntry entry : list) {
            if (!entry.inUse() && (oldest == null || entry.expiresAt() < oldest.expiresAt())) {
                oldest = entry;
            }
        }
        return oldest;
    }

    private void recordEvicted(EvictionReason reason, int count) {
        if (count > 0) {
            totalEvicted.addAndGet(count);
            metrics.recordEviction(reason, count);
        }
    }

    private void closeAll(List<GatewayConnection> connections) {
        for (GatewayConnection connection : connections) {
            closeQuietly(connection);
        }
    }

    private void closeQuietly(GatewayConnection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.debug("Error closing gateway connection {}: {}", connection.getId(), e.getMessage());
        }
    }

    public static class Builder {
        private final GatewayConnector connector;
        private PoolConfig config = PoolConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private PoolMetrics metrics = new NoOpPoolMetrics();
        private TracingService tracing = NoOpTracingService.INSTANCE;

        private Builder(GatewayConnector connector) {
            this.connector = connector;
        }

        public Builder config(PoolConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Clock used for expiry timestamps. Tests pass a controllable clock.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder metrics(PoolMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = Objects.requireNonNull(tracing, "tracing");
            return this;
        }

        public KeyedGatewayConnectionPool build() {
            return new KeyedGatewayConnectionPool(this);
        }
    }
}
