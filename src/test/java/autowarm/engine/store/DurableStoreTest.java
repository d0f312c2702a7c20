package autowarm.engine.store;

import autowarm.engine.MutableClock;
import autowarm.engine.config.PoolSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DurableStoreTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private MutableClock clock;
    private ToggleDataSource primaryDs;
    private ToggleDataSource replica1Ds;
    private ToggleDataSource replica2Ds;
    private Map<String, AtomicInteger> probes;
    private DurableStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        primaryDs = new ToggleDataSource(TestStores.h2("ds-primary"));
        replica1Ds = new ToggleDataSource(TestStores.h2("ds-replica1"));
        replica2Ds = new ToggleDataSource(TestStores.h2("ds-replica2"));
        probes = new ConcurrentHashMap<>();

        EndpointProbe counting = endpoint -> {
            probes.computeIfAbsent(endpoint.name(), k -> new AtomicInteger()).incrementAndGet();
            return EndpointProbe.selectOne().probe(endpoint);
        };

        store = new DurableStore(
                Endpoint.of("primary", EndpointRole.PRIMARY, "mem:ds-primary", primaryDs),
                List.of(Endpoint.of("replica-1", EndpointRole.REPLICA, "mem:ds-replica1", replica1Ds),
                        Endpoint.of("replica-2", EndpointRole.REPLICA, "mem:ds-replica2", replica2Ds)),
                INTERVAL, counting, clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    /** Work that reports which database it ran against. */
    private static String whereAmI(Connection conn) throws SQLException {
        String url = conn.getMetaData().getURL();
        if (url.contains("ds-primary")) {
            return "primary";
        }
        if (url.contains("ds-replica1")) {
            return "replica-1";
        }
        if (url.contains("ds-replica2")) {
            return "replica-2";
        }
        return url;
    }

    private int probeCount(String name) {
        AtomicInteger count = probes.get(name);
        return count != null ? count.get() : 0;
    }

    @Test
    void initialProbeMarksEndpointsHealthy() {
        assertTrue(store.health().stream().allMatch(EndpointHealth::healthy));
        assertEquals(EndpointRole.PRIMARY, store.health().get(0).role());
        assertEquals(1, probeCount("primary"));
        assertTrue(store.isWritable());
    }

    @Test
    void healthIsProbedAtMostOncePerInterval() {
        for (int i = 0; i < 20; i++) {
            store.write(DurableStoreTest::whereAmI);
            store.read(DurableStoreTest::whereAmI);
        }
        assertFalse(store.healthCheck());
        assertEquals(1, probeCount("primary"));
        assertEquals(1, probeCount("replica-1"));

        clock.advance(INTERVAL);
        assertTrue(store.healthCheck());
        assertEquals(2, probeCount("primary"));
        assertEquals(2, probeCount("replica-2"));
    }

    @Test
    void writesGoToPrimary() {
        assertEquals("primary", store.write(DurableStoreTest::whereAmI));
    }

    @Test
    void writesFailOverToReplicaAndReturnWhenPrimaryRecovers() {
        primaryDs.down();
        clock.advance(INTERVAL);

        assertEquals("replica-1", store.write(DurableStoreTest::whereAmI));
        assertEquals(EndpointState.UNHEALTHY, store.primary().state());

        primaryDs.up();
        // still cached as unhealthy until the next probe
        assertEquals("replica-1", store.write(DurableStoreTest::whereAmI));

        clock.advance(INTERVAL);
        assertEquals("primary", store.write(DurableStoreTest::whereAmI));
        assertEquals(EndpointState.HEALTHY, store.primary().state());
    }

    @Test
    void readsUseReplicasAndFallBackToPrimary() {
        for (int i = 0; i < 10; i++) {
            assertTrue(store.read(DurableStoreTest::whereAmI).startsWith("replica-"));
        }

        replica1Ds.down();
        replica2Ds.down();
        clock.advance(INTERVAL);

        assertEquals("primary", store.read(DurableStoreTest::whereAmI));
    }

    @Test
    void connectionErrorMarksEndpointAndRetriesOnce() {
        // cached verdict still says healthy
        primaryDs.down();

        assertEquals("replica-1", store.write(DurableStoreTest::whereAmI));
        assertEquals(EndpointState.UNHEALTHY, store.primary().state());
        assertEquals(1, probeCount("primary"));
    }

    @Test
    void noHealthyEndpointMeansUnavailable() {
        primaryDs.down();
        replica1Ds.down();
        replica2Ds.down();
        clock.advance(INTERVAL);

        assertFalse(store.isWritable());
        StorageUnavailableException write = assertThrows(StorageUnavailableException.class,
                () -> store.write(DurableStoreTest::whereAmI));
        assertEquals("write", write.operation());
        assertThrows(StorageUnavailableException.class, () -> store.read(DurableStoreTest::whereAmI));
    }

    @Test
    void bothCandidatesFailingIsUnavailable() {
        primaryDs.down();
        replica1Ds.down();
        replica2Ds.down();

        assertThrows(StorageUnavailableException.class, () -> store.write(DurableStoreTest::whereAmI));
        assertEquals(EndpointState.UNHEALTHY, store.primary().state());
        assertEquals(EndpointState.UNHEALTHY, store.replicas().get(0).state());
    }

    @Test
    void statementErrorsDoNotAffectHealth() {
        StoreException e = assertThrows(StoreException.class, () -> store.write(conn -> {
            throw new SQLException("syntax error", "42000");
        }));

        assertFalse(e instanceof StorageUnavailableException);
        assertTrue(store.primary().isHealthy());
    }

    @Test
    void workIsRolledBackOnFailure() {
        store.write(conn -> {
            conn.createStatement().execute("CREATE TABLE IF NOT EXISTS rb (v INT)");
            conn.createStatement().execute("DELETE FROM rb");
            return null;
        });

        assertThrows(IllegalStateException.class, () -> store.write(conn -> {
            conn.createStatement().execute("INSERT INTO rb VALUES (1)");
            throw new IllegalStateException("abort");
        }));

        int rows = store.write(conn -> {
            ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM rb");
            rs.next();
            return rs.getInt(1);
        });
        assertEquals(0, rows);
    }

    @Test
    void forceFailoverPromotesNamedReplica() {
        EndpointHealth promoted = store.forceFailover("replica-2");

        assertEquals("replica-2", promoted.name());
        assertEquals(EndpointRole.PRIMARY, promoted.role());
        assertEquals("replica-2", store.primary().name());
        assertEquals(List.of("replica-1"), store.replicas().stream().map(Endpoint::name).toList());
        assertEquals("replica-2", store.write(DurableStoreTest::whereAmI));
        assertEquals(2, store.health().size());
    }

    @Test
    void forceFailoverWithoutNamePicksFirstHealthyReplica() {
        replica1Ds.down();
        clock.advance(INTERVAL);
        store.healthCheck();

        assertEquals("replica-2", store.forceFailover(null).name());
    }

    @Test
    void forceFailoverRejectsUnknownReplica() {
        assertThrows(IllegalArgumentException.class, () -> store.forceFailover("replica-9"));
        assertEquals("primary", store.primary().name());
    }

    @Test
    void forceFailoverNeedsHealthyReplica() {
        replica1Ds.down();
        replica2Ds.down();
        clock.advance(INTERVAL);
        store.healthCheck();

        assertThrows(StorageUnavailableException.class, () -> store.forceFailover(null));
        assertEquals("primary", store.primary().name());
    }

    @Test
    void statsListEveryEndpoint() {
        List<PoolStats> stats = store.stats();

        assertEquals(3, stats.size());
        assertEquals("primary", stats.get(0).name());
        assertEquals(EndpointRole.REPLICA, stats.get(1).role());
        assertEquals(EndpointState.HEALTHY, stats.get(2).state());
    }

    @Test
    void pooledEndpointReportsPoolLimits() {
        PoolSettings pool = new PoolSettings(2, 3, Duration.ofSeconds(5), Duration.ofMinutes(30));
        try (Endpoint pooled = Endpoint.pooled("pooled", EndpointRole.PRIMARY,
                "jdbc:h2:mem:ds-pooled;DB_CLOSE_DELAY=-1", "sa", "", pool)) {
            DurableStore single = new DurableStore(pooled, List.of(), INTERVAL, EndpointProbe.selectOne(), clock);

            assertEquals(1, (int) single.write(conn -> 1));
            PoolStats stats = single.stats().get(0);
            assertEquals(5, stats.maxConnections());
            assertTrue(stats.total() >= 1);
            assertEquals(0, stats.active());
        }
    }

    @Test
    void busyPoolLeavesEndpointHealthy() throws SQLException {
        PoolSettings pool = new PoolSettings(1, 0, Duration.ofMillis(300), Duration.ofMinutes(30));
        try (Endpoint pooled = Endpoint.pooled("busy", EndpointRole.PRIMARY,
                "jdbc:h2:mem:ds-busy;DB_CLOSE_DELAY=-1", "sa", "", pool)) {
            DurableStore single = new DurableStore(pooled, List.of(), INTERVAL, EndpointProbe.selectOne(), clock);
            assertTrue(pooled.isHealthy());

            Connection held = pooled.connection();
            try {
                StorageUnavailableException e = assertThrows(StorageUnavailableException.class,
                        () -> single.write(conn -> 1));
                assertTrue(e.getMessage().contains("exhausted"), e.getMessage());
                assertTrue(pooled.isHealthy());

                // the probe does not borrow from the saturated pool
                clock.advance(INTERVAL);
                assertTrue(single.healthCheck());
                assertTrue(pooled.isHealthy());
            } finally {
                held.close();
            }

            assertEquals(1, (int) single.write(conn -> 1));
        }
    }

    @Test
    void onlyPoolTimeoutsCountAsExhaustion() {
        Endpoint plain = Endpoint.of("plain", EndpointRole.PRIMARY, "mem:plain", TestStores.h2("ds-plain"));
        SQLException timeout = new SQLTransientConnectionException(
                "autowarm-x - Connection is not available, request timed out after 300ms.");

        assertFalse(plain.isPoolExhausted(timeout));

        PoolSettings pool = new PoolSettings(1, 0, Duration.ofMillis(300), Duration.ofMinutes(30));
        try (Endpoint pooled = Endpoint.pooled("timeouts", EndpointRole.PRIMARY,
                "jdbc:h2:mem:ds-timeouts;DB_CLOSE_DELAY=-1", "sa", "", pool)) {
            assertTrue(pooled.isPoolExhausted(timeout));
            assertFalse(pooled.isPoolExhausted(new SQLTransientConnectionException(
                    "request timed out", "08001", new SQLException("Connection refused", "08001"))));
            assertFalse(pooled.isPoolExhausted(new SQLException("refused", "08006")));
        }
    }

    @Test
    void replicationStatusWithoutPostgresIsUnsupported() {
        ReplicationStatus status = store.replicationStatus();

        assertFalse(status.supported());
        assertTrue(status.primaryHealthy());
        assertEquals(2, status.replicaCount());
        assertEquals(2, status.healthyReplicas());
        assertTrue(status.replicas().isEmpty());
        assertNull(status.error());
    }

    @Test
    void replicationStatusReportsUnavailablePrimary() {
        primaryDs.down();
        replica2Ds.down();
        clock.advance(INTERVAL);

        ReplicationStatus status = store.replicationStatus();

        assertFalse(status.primaryHealthy());
        assertEquals(1, status.healthyReplicas());
        assertEquals("primary unavailable", status.error());
    }

    @Test
    void recognizesConnectionFailures() {
        assertTrue(DurableStore.isConnectionFailure(new SQLException("refused", "08006")));
        assertTrue(DurableStore.isConnectionFailure(
                new SQLException("outer", "HY000", new SQLTransientConnectionException("timeout"))));
        assertFalse(DurableStore.isConnectionFailure(new SQLException("duplicate key", "23505")));
        assertFalse(DurableStore.isConnectionFailure(new SQLException("no state")));
    }
}
