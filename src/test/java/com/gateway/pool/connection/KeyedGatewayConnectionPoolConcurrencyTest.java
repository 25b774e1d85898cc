package com.gateway.pool.connection;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent acquire/release tests on fixed thread pools.
 * Validates exclusivity of checked-out connections and that handshakes run outside the pool lock.
 */
class KeyedGatewayConnectionPoolConcurrencyTest {

    private static final Logger log = LoggerFactory.getLogger(KeyedGatewayConnectionPoolConcurrencyTest.class);

    private static final String GATEWAY = "gateway_123";
    private static final int THREAD_COUNT = 16;
    private static final int OPS_PER_THREAD = 500;

    private final ConnectConfig config = ConnectConfig.builder()
            .url("wss://test.gateway.com")
            .token("tok_abc")
            .disableDevicePairing(true)
            .build();

    private StubGatewayConnector connector;
    private KeyedGatewayConnectionPool pool;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        connector = new StubGatewayConnector();
        pool = KeyedGatewayConnectionPool.builder(connector)
                .config(PoolConfig.builder().ttlMillis(60_000).maxIdlePerKey(3).build())
                .clock(new MutableClock(1_700_000_000_000L))
                .build();
        executor = Executors.newFixedThreadPool(THREAD_COUNT);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        pool.close();
    }

    @Test
    @DisplayName("No connection should ever be held by two callers at once")
    void noDoubleCheckout() throws Exception {
        Map<GatewayConnection, Thread> holders = new ConcurrentHashMap<>();
        AtomicInteger violations = new AtomicInteger(0);
        AtomicInteger completed = new AtomicInteger(0);
        CountDownLatch start = new CountDownLatch(1);
        PoolKey key = pool.buildKey(GATEWAY, config);

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < THREAD_COUNT; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < OPS_PER_THREAD; i++) {
                    GatewayConnection connection = pool.acquire(GATEWAY, config);
                    if (holders.putIfAbsent(connection, Thread.currentThread()) != null) {
                        violations.incrementAndGet();
                    }
                    Thread.yield();
                    holders.remove(connection, Thread.currentThread());
                    pool.release(connection, key);
                    completed.incrementAndGet();
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> f : futures) {
            f.get(60, TimeUnit.SECONDS);
        }

        PoolStats stats = pool.getStats();
        log.info("Stress run: created={} reused={} evicted={}",
                stats.totalCreated(), stats.totalReused(), stats.totalEvicted());

        assertEquals(0, violations.get(), "A connection was handed to two callers");
        assertEquals(THREAD_COUNT * OPS_PER_THREAD, completed.get());
        assertEquals(0, stats.inUseEntries());
        assertEquals(THREAD_COUNT * OPS_PER_THREAD, stats.totalCreated() + stats.totalReused());

        Set<GatewayConnection> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(connector.created());
        assertEquals(connector.connectCount(), distinct.size());
    }

    @Test
    @DisplayName("Four concurrent acquires should open four connections without eviction")
    void concurrentAcquiresBeyondCapacity() throws Exception {
        CountDownLatch gate = connector.holdConnects(config.getUrl());

        List<Future<GatewayConnection>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(executor.submit(() -> pool.acquire(GATEWAY, config)));
        }
        assertTrue(connector.awaitConnectsStarted(4), "All four acquires should reach the connector");
        gate.countDown();

        Set<GatewayConnection> acquired = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Future<GatewayConnection> f : futures) {
            acquired.add(f.get(10, TimeUnit.SECONDS));
        }

        assertEquals(4, acquired.size());
        assertEquals(4, connector.connectCount());
        assertEquals(4, pool.poolSize());
        assertEquals(4, pool.getStats().inUseEntries());
        assertEquals(0, pool.getStats().totalEvicted());
        for (FakeGatewayConnection connection : connector.created()) {
            assertFalse(connection.isClosed());
        }
    }

    @Test
    @DisplayName("A slow handshake should not block acquires for other gateways")
    void slowConnectDoesNotBlockOtherKeys() throws Exception {
        ConnectConfig slow = config.toBuilder().url("wss://slow.gateway.com").build();
        CountDownLatch gate = connector.holdConnects(slow.getUrl());

        Future<GatewayConnection> pending = executor.submit(() -> pool.acquire("gateway_slow", slow));
        assertTrue(connector.awaitConnectsStarted(1));

        Future<GatewayConnection> fast = executor.submit(() -> pool.acquire(GATEWAY, config));
        GatewayConnection fastConnection = fast.get(5, TimeUnit.SECONDS);

        assertNotNull(fastConnection);
        assertFalse(pending.isDone());

        pool.release(fastConnection, pool.buildKey(GATEWAY, config));
        assertEquals(1, pool.getStats().idleEntries());

        gate.countDown();
        assertNotNull(pending.get(10, TimeUnit.SECONDS));
        assertEquals(2, pool.poolSize());
    }

    @Test
    @DisplayName("A connect finishing after clear() should be pooled in the emptied pool")
    void connectCompletingAfterClear() throws Exception {
        GatewayConnection before = pool.acquire(GATEWAY, config);
        CountDownLatch gate = connector.holdConnects(config.getUrl());

        Future<GatewayConnection> pending = executor.submit(() -> pool.acquire(GATEWAY, config));
        assertTrue(connector.awaitConnectsStarted(1));

        pool.clear();
        gate.countDown();
        GatewayConnection after = pending.get(10, TimeUnit.SECONDS);

        assertTrue(((FakeGatewayConnection) before).isClosed());
        assertFalse(((FakeGatewayConnection) after).isClosed());
        assertEquals(1, pool.poolSize());
    }

    @Test
    @DisplayName("A connect finishing after close() should be closed and fail the acquire")
    void connectCompletingAfterClose() throws Exception {
        CountDownLatch gate = connector.holdConnects(config.getUrl());

        Future<GatewayConnection> pending = executor.submit(() -> pool.acquire(GATEWAY, config));
        assertTrue(connector.awaitConnectsStarted(1));

        pool.close();
        gate.countDown();

        Exception e = assertThrows(Exception.class, () -> pending.get(10, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(1, connector.created().size());
        assertTrue(connector.created().get(0).isClosed());
        assertEquals(0, pool.poolSize());
    }
}
