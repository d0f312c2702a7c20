package autowarm.engine.store;

import autowarm.engine.config.PoolSettings;
import autowarm.engine.util.JdbcUrls;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Instant;
import java.util.Objects;
import java.util.Properties;

/**
 * One storage endpoint (primary or replica) with its connection pool and
 * cached health verdict. Health fields are written only by {@link DurableStore}.
 */
public final class Endpoint implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Endpoint.class);

    private final String name;
    private final String address;
    private final DataSource dataSource;
    private final DirectConnector direct;
    private final int maxConnections;

    private volatile EndpointRole role;
    private volatile EndpointState state = EndpointState.UNKNOWN;
    private volatile Instant lastCheckedAt;

    /** Opens a connection outside the pool. */
    @FunctionalInterface
    private interface DirectConnector {
        Connection open() throws SQLException;
    }

    private Endpoint(String name, EndpointRole role, String address, DataSource dataSource, DirectConnector direct,
            int maxConnections) {
        this.name = Objects.requireNonNull(name, "name");
        this.role = Objects.requireNonNull(role, "role");
        this.address = address;
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.direct = Objects.requireNonNull(direct, "direct");
        this.maxConnections = maxConnections;
    }

    /**
     * Endpoint backed by a HikariCP pool.
     * The pool is created even if the database is down; health is decided by probes.
     */
    public static Endpoint pooled(String name, EndpointRole role, String jdbcUrl, String user, String password,
            PoolSettings pool) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        if (user != null) {
            hikariConfig.setUsername(user);
        }
        if (password != null) {
            hikariConfig.setPassword(password);
        }
        hikariConfig.setMaximumPoolSize(pool.maxConnections());
        hikariConfig.setMinimumIdle(pool.poolSize());
        hikariConfig.setConnectionTimeout(pool.acquireTimeout().toMillis());
        hikariConfig.setMaxLifetime(pool.recycle().toMillis());
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("autowarm-" + name);
        hikariConfig.setAutoCommit(false);
        hikariConfig.setInitializationFailTimeout(-1);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        HikariDataSource dataSource = new HikariDataSource(hikariConfig);
        log.info("Pool for {} endpoint {} initialized: {} (size {}, overflow {})",
                role, name, JdbcUrls.redact(jdbcUrl), pool.poolSize(), pool.maxOverflow());

        Properties credentials = new Properties();
        if (user != null) {
            credentials.setProperty("user", user);
        }
        if (password != null) {
            credentials.setProperty("password", password);
        }
        return new Endpoint(name, role, JdbcUrls.redact(jdbcUrl), dataSource,
                () -> DriverManager.getConnection(jdbcUrl, credentials), pool.maxConnections());
    }

    /** Endpoint over an externally managed DataSource (no pool statistics). */
    public static Endpoint of(String name, EndpointRole role, String address, DataSource dataSource) {
        return new Endpoint(name, role, address, dataSource, dataSource::getConnection, 0);
    }

    public String name() {
        return name;
    }

    public String address() {
        return address;
    }

    public EndpointRole role() {
        return role;
    }

    public EndpointState state() {
        return state;
    }

    public Instant lastCheckedAt() {
        return lastCheckedAt;
    }

    public boolean isHealthy() {
        return state == EndpointState.HEALTHY;
    }

    /**
     * Borrow a connection. Caller closes it.
     * Auto-commit is always off so the store controls the transaction.
     */
    public Connection connection() throws SQLException {
        Connection conn = dataSource.getConnection();
        if (conn.getAutoCommit()) {
            conn.setAutoCommit(false);
        }
        return conn;
    }

    /**
     * Open a connection that bypasses the pool, for health probes.
     * A saturated pool must not read as an unreachable database. Caller closes it.
     */
    public Connection probeConnection() throws SQLException {
        return direct.open();
    }

    /**
     * Whether a failure to borrow a connection means the pool was busy rather
     * than the database unreachable. HikariCP reports an acquire timeout without
     * a cause when no connection attempt has failed since the last success.
     */
    public boolean isPoolExhausted(SQLException e) {
        return dataSource instanceof HikariDataSource
                && e instanceof SQLTransientConnectionException
                && e.getCause() == null
                && e.getMessage() != null
                && e.getMessage().contains("request timed out");
    }

    public DataSource dataSource() {
        return dataSource;
    }

    void recordState(EndpointState newState, Instant checkedAt) {
        this.state = newState;
        this.lastCheckedAt = checkedAt;
    }

    void promote() {
        this.role = EndpointRole.PRIMARY;
    }

    public EndpointHealth health() {
        return new EndpointHealth(name, address, role, state, lastCheckedAt);
    }

    public PoolStats poolStats() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                return new PoolStats(name, role, state, pool.getActiveConnections(), pool.getIdleConnections(),
                        pool.getTotalConnections(), pool.getThreadsAwaitingConnection(), maxConnections);
            }
        }
        return new PoolStats(name, role, state, 0, 0, 0, 0, maxConnections);
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            hikari.close();
            log.info("Pool for endpoint {} closed", name);
        }
    }

    @Override
    public String toString() {
        return "Endpoint{" + name + ", " + role + ", " + state + '}';
    }
}
