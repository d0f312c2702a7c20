package autowarm.engine.store;

import autowarm.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Storage client that routes work between one primary and N replica endpoints.
 *
 * Writes go to the primary, or to the first healthy replica while the primary
 * is unhealthy (degraded write). Reads go to a random healthy replica, falling
 * back to the primary. Health is probed at most once per interval; a connection
 * error during routed work marks that endpoint UNHEALTHY at once and the work
 * is retried once on the next candidate. A pool that is merely busy (acquire
 * timeout on a reachable endpoint) leaves health alone: the write fails, a read
 * moves on to the next candidate.
 *
 * Failover to a replica is a local routing decision of this process only.
 * Nothing is coordinated with other processes or with the database servers.
 */
public final class DurableStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DurableStore.class);

    private final Duration healthCheckInterval;
    private final EndpointProbe probe;
    private final Clock clock;

    // Guards probing, failover and health transitions; never the scheduler's admission lock.
    private final ReentrantLock healthLock = new ReentrantLock();
    private Instant lastHealthCheck;

    private volatile Topology topology;
    private final List<Endpoint> retired = new ArrayList<>();

    private record Topology(Endpoint primary, List<Endpoint> replicas) {
    }

    public DurableStore(Endpoint primary, List<Endpoint> replicas, Duration healthCheckInterval,
            EndpointProbe probe, Clock clock) {
        this.topology = new Topology(Objects.requireNonNull(primary, "primary"), List.copyOf(replicas));
        this.healthCheckInterval = Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.clock = Objects.requireNonNull(clock, "clock");

        log.info("Storage initialized: primary {}, {} replica(s), health check every {}s",
                primary.name(), replicas.size(), healthCheckInterval.toSeconds());

        // Initial verdicts, so routing never starts from UNKNOWN
        healthCheck();
    }

    /**
     * Build pooled endpoints from configuration.
     */
    public static DurableStore create(EngineConfig config) {
        Endpoint primary = Endpoint.pooled("primary", EndpointRole.PRIMARY, config.primaryUrl(),
                config.databaseUser(), config.databasePassword(), config.primaryPool());

        List<Endpoint> replicas = new ArrayList<>();
        int i = 1;
        for (String url : config.replicaUrls()) {
            replicas.add(Endpoint.pooled("replica-" + i++, EndpointRole.REPLICA, url,
                    config.databaseUser(), config.databasePassword(), config.replicaPool()));
        }

        return new DurableStore(primary, replicas, config.healthCheckInterval(), EndpointProbe.selectOne(),
                Clock.systemUTC());
    }

    /**
     * Create tables and indexes on the write route.
     */
    public void initSchema() {
        write(conn -> {
            Schema.apply(conn);
            return null;
        });
        log.info("Database schema initialized");
    }

    // ==================== Routing ====================

    /**
     * Run work against the primary, or a healthy replica while the primary is down.
     *
     * @throws StorageUnavailableException if no endpoint can take the write
     * @throws StoreException              if the work fails for another reason
     */
    public <T> T write(SqlWork<T> work) {
        healthCheck();
        return route("write", work);
    }

    /**
     * Run work against a random healthy replica, falling back to the primary.
     *
     * @throws StorageUnavailableException if no endpoint can serve the read
     * @throws StoreException              if the work fails for another reason
     */
    public <T> T read(SqlWork<T> work) {
        healthCheck();
        return route("read", work);
    }

    private <T> T route(String operation, SqlWork<T> work) {
        Endpoint first = select(operation, null);
        if (first == null) {
            throw new StorageUnavailableException(operation, "no healthy endpoint");
        }

        try {
            return execute(first, work);
        } catch (EndpointFailure e) {
            recordFailure(first, e);
            if (e.poolExhausted() && "write".equals(operation)) {
                throw new StorageUnavailableException(operation,
                        "connection pool of " + first.name() + " exhausted", e.getCause());
            }
        }

        Endpoint second = select(operation, first);
        if (second == null) {
            throw new StorageUnavailableException(operation,
                    "endpoint " + first.name() + " failed and no other candidate is healthy");
        }

        log.warn("Retrying {} on {} after {} failed", operation, second.name(), first.name());
        try {
            return execute(second, work);
        } catch (EndpointFailure e) {
            recordFailure(second, e);
            throw new StorageUnavailableException(operation, "all candidates failed", e.getCause());
        }
    }

    private void recordFailure(Endpoint endpoint, EndpointFailure failure) {
        if (failure.poolExhausted()) {
            log.warn("Connection pool of {} endpoint {} exhausted, health unchanged: {}",
                    endpoint.role(), endpoint.name(), failure.getCause().getMessage());
        } else {
            markUnhealthy(endpoint, failure.getCause());
        }
    }

    private Endpoint select(String operation, Endpoint exclude) {
        Topology t = topology;
        return "write".equals(operation) ? selectWriteTarget(t, exclude) : selectReadTarget(t, exclude);
    }

    private Endpoint selectWriteTarget(Topology t, Endpoint exclude) {
        if (t.primary().isHealthy() && t.primary() != exclude) {
            return t.primary();
        }
        for (Endpoint replica : t.replicas()) {
            if (replica.isHealthy() && replica != exclude) {
                log.warn("Primary {} unavailable, degraded write to replica {}", t.primary().name(), replica.name());
                return replica;
            }
        }
        return null;
    }

    private Endpoint selectReadTarget(Topology t, Endpoint exclude) {
        List<Endpoint> healthy = new ArrayList<>();
        for (Endpoint replica : t.replicas()) {
            if (replica.isHealthy() && replica != exclude) {
                healthy.add(replica);
            }
        }
        if (!healthy.isEmpty()) {
            return healthy.get(ThreadLocalRandom.current().nextInt(healthy.size()));
        }
        if (t.primary().isHealthy() && t.primary() != exclude) {
            if (!t.replicas().isEmpty()) {
                log.debug("No healthy replica, reading from primary {}", t.primary().name());
            }
            return t.primary();
        }
        return null;
    }

    private <T> T execute(Endpoint endpoint, SqlWork<T> work) throws EndpointFailure {
        Connection conn;
        try {
            conn = endpoint.connection();
        } catch (SQLException e) {
            throw new EndpointFailure(e, endpoint.isPoolExhausted(e));
        }

        try {
            T result = work.run(conn);
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(endpoint, conn);
            if (isConnectionFailure(e)) {
                throw new EndpointFailure(e, false);
            }
            throw new StoreException("Failed to run work on " + endpoint.name() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            rollback(endpoint, conn);
            throw e;
        } finally {
            close(endpoint, conn);
        }
    }

    /**
     * Whether an error means the endpoint itself is unreachable, as opposed to
     * a problem with the statement.
     */
    static boolean isConnectionFailure(SQLException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException) {
                return true;
            }
            if (current instanceof SQLException sql && sql.getSQLState() != null
                    && sql.getSQLState().startsWith("08")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private void rollback(Endpoint endpoint, Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.debug("Rollback on {} failed: {}", endpoint.name(), e.getMessage());
        }
    }

    private void close(Endpoint endpoint, Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("Closing connection to {} failed: {}", endpoint.name(), e.getMessage());
        }
    }

    // ==================== Health ====================

    /**
     * Probe all endpoints unless a probe ran within the health-check interval.
     * A caller that finds another thread probing uses the cached verdicts.
     *
     * @return true if this call probed
     */
    public boolean healthCheck() {
        if (!healthLock.tryLock()) {
            return false;
        }
        try {
            Instant now = clock.instant();
            if (lastHealthCheck != null && now.isBefore(lastHealthCheck.plus(healthCheckInterval))) {
                return false;
            }
            lastHealthCheck = now;

            Topology t = topology;
            probeEndpoint(t.primary(), now);
            for (Endpoint replica : t.replicas()) {
                probeEndpoint(replica, now);
            }
            return true;
        } finally {
            healthLock.unlock();
        }
    }

    private void probeEndpoint(Endpoint endpoint, Instant now) {
        boolean ok;
        String reason = null;
        try {
            ok = probe.probe(endpoint);
        } catch (Exception e) {
            ok = false;
            reason = e.getMessage();
        }

        EndpointState previous = endpoint.state();
        EndpointState next = ok ? EndpointState.HEALTHY : EndpointState.UNHEALTHY;
        endpoint.recordState(next, now);

        if (next == EndpointState.HEALTHY && previous == EndpointState.UNHEALTHY) {
            log.info("{} endpoint {} recovered", endpoint.role(), endpoint.name());
        } else if (next == EndpointState.UNHEALTHY && previous != EndpointState.UNHEALTHY) {
            log.error("{} endpoint {} unavailable: {}", endpoint.role(), endpoint.name(),
                    reason != null ? reason : "probe failed");
        }
    }

    /**
     * Mark an endpoint UNHEALTHY without waiting for the next probe.
     */
    public void markUnhealthy(Endpoint endpoint, Throwable cause) {
        healthLock.lock();
        try {
            boolean wasHealthy = endpoint.state() != EndpointState.UNHEALTHY;
            endpoint.recordState(EndpointState.UNHEALTHY, clock.instant());
            if (wasHealthy) {
                log.error("{} endpoint {} marked unhealthy: {}", endpoint.role(), endpoint.name(),
                        cause != null ? cause.getMessage() : "connection error");
            }
        } finally {
            healthLock.unlock();
        }
    }

    /**
     * Cached health of all routed endpoints, primary first.
     */
    public List<EndpointHealth> health() {
        Topology t = topology;
        List<EndpointHealth> result = new ArrayList<>();
        result.add(t.primary().health());
        for (Endpoint replica : t.replicas()) {
            result.add(replica.health());
        }
        return result;
    }

    /** Whether some endpoint can currently take writes. */
    public boolean isWritable() {
        Topology t = topology;
        return t.primary().isHealthy() || t.replicas().stream().anyMatch(Endpoint::isHealthy);
    }

    public Endpoint primary() {
        return topology.primary();
    }

    public List<Endpoint> replicas() {
        return topology.replicas();
    }

    // ==================== Failover ====================

    /**
     * Permanently promote a replica to primary for this process.
     * The replica leaves the replica set; the old primary is dropped from
     * routing until an operator reconfigures the store.
     *
     * @param replicaName replica to promote, or null for the first healthy one
     * @return health of the new primary
     * @throws StorageUnavailableException if no replica is healthy
     * @throws IllegalArgumentException    if the named replica is not in the replica set
     */
    public EndpointHealth forceFailover(String replicaName) {
        log.warn("Forced failover requested (target: {})", replicaName != null ? replicaName : "first healthy");

        healthLock.lock();
        try {
            Topology t = topology;

            List<Endpoint> healthy = t.replicas().stream().filter(Endpoint::isHealthy).toList();
            if (healthy.isEmpty()) {
                throw new StorageUnavailableException("failover", "no healthy replica to promote");
            }

            Endpoint target;
            if (replicaName == null) {
                target = healthy.get(0);
            } else {
                target = t.replicas().stream()
                        .filter(r -> r.name().equals(replicaName))
                        .findFirst()
                        .orElseThrow(() -> new IllegalArgumentException("Unknown replica: " + replicaName));
            }

            List<Endpoint> remaining = new ArrayList<>(t.replicas());
            remaining.remove(target);

            Endpoint oldPrimary = t.primary();
            target.promote();
            topology = new Topology(target, List.copyOf(remaining));
            retired.add(oldPrimary);

            log.warn("Failover complete: {} is now primary, {} dropped from routing",
                    target.name(), oldPrimary.name());
            return target.health();
        } finally {
            healthLock.unlock();
        }
    }

    // ==================== Replication ====================

    private static final String REPLICATION_SQL = """
            SELECT client_addr::text,
                   application_name,
                   state,
                   pg_wal_lsn_diff(pg_current_wal_lsn(), sent_lsn),
                   pg_wal_lsn_diff(sent_lsn, flush_lsn),
                   pg_wal_lsn_diff(flush_lsn, replay_lsn)
            FROM pg_stat_replication
            """;

    /**
     * Replication lag per streaming replica, read on the primary.
     * Databases other than PostgreSQL report {@code supported = false}.
     * Never throws: an unavailable primary or a failed query is reported in
     * {@link ReplicationStatus#error()}.
     */
    public ReplicationStatus replicationStatus() {
        healthCheck();
        Topology t = topology;
        Endpoint primary = t.primary();
        int healthyReplicas = (int) t.replicas().stream().filter(Endpoint::isHealthy).count();
        int replicaCount = t.replicas().size();

        if (!primary.isHealthy()) {
            return ReplicationStatus.failed(false, replicaCount, healthyReplicas, "primary unavailable");
        }

        try {
            return execute(primary, conn -> {
                String product = conn.getMetaData().getDatabaseProductName();
                if (!"PostgreSQL".equalsIgnoreCase(product)) {
                    return new ReplicationStatus(false, true, replicaCount, healthyReplicas, List.of(), null);
                }
                List<ReplicaLag> lags = new ArrayList<>();
                try (Statement st = conn.createStatement();
                        ResultSet rs = st.executeQuery(REPLICATION_SQL)) {
                    while (rs.next()) {
                        lags.add(new ReplicaLag(rs.getString(1), rs.getString(2), rs.getString(3),
                                rs.getLong(4), rs.getLong(5), rs.getLong(6)));
                    }
                }
                return new ReplicationStatus(true, true, replicaCount, healthyReplicas, List.copyOf(lags), null);
            });
        } catch (EndpointFailure e) {
            recordFailure(primary, e);
            return ReplicationStatus.failed(primary.isHealthy(), replicaCount, healthyReplicas,
                    e.getCause().getMessage());
        } catch (StoreException e) {
            log.error("Failed to read replication status: {}", e.getMessage());
            return ReplicationStatus.failed(true, replicaCount, healthyReplicas, e.getMessage());
        }
    }

    // ==================== Stats ====================

    /**
     * Pool utilization per routed endpoint, primary first.
     */
    public List<PoolStats> stats() {
        Topology t = topology;
        List<PoolStats> result = new ArrayList<>();
        result.add(t.primary().poolStats());
        for (Endpoint replica : t.replicas()) {
            result.add(replica.poolStats());
        }
        return result;
    }

    @Override
    public void close() {
        Topology t = topology;
        t.primary().close();
        t.replicas().forEach(Endpoint::close);
        healthLock.lock();
        try {
            retired.forEach(Endpoint::close);
        } finally {
            healthLock.unlock();
        }
        log.info("Storage closed");
    }

    /** Connection-level failure on a routed endpoint; triggers the single retry. */
    private static final class EndpointFailure extends Exception {
        private final boolean poolExhausted;

        EndpointFailure(SQLException cause, boolean poolExhausted) {
            super(cause);
            this.poolExhausted = poolExhausted;
        }

        boolean poolExhausted() {
            return poolExhausted;
        }
    }
}
