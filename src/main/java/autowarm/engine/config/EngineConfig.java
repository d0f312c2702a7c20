package autowarm.engine.config;

import autowarm.engine.retry.BackoffWindow;
import autowarm.engine.util.JdbcUrls;
import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration holder for the engine.
 * All settings have sensible defaults; environment variables or an INI file
 * override them.
 */
public final class EngineConfig {

    // Storage
    private String primaryUrl = "jdbc:h2:file:./data/autowarm;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private List<String> replicaUrls = List.of();
    private String databaseUser = null;
    private String databasePassword = null;
    private PoolSettings primaryPool = PoolSettings.PRIMARY_DEFAULTS;
    private PoolSettings replicaPool = PoolSettings.REPLICA_DEFAULTS;
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    // Scheduler
    private int maxWorkers = 3;
    private int maxPerUser = 2;
    private int queueCapacity = 1000;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration loaderInterval = Duration.ofSeconds(10);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private BackoffWindow backoffWindow = BackoffWindow.DEFAULT;

    // Health gate
    private double riskThreshold = 60;
    private double healthThreshold = 40;

    // Ops HTTP (port 0 disables the server)
    private String httpHost = "0.0.0.0";
    private int httpPort = 8080;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String primary = System.getenv("AUTOWARM_DB_PRIMARY_URL");
        if (primary != null && !primary.isBlank()) {
            config.primaryUrl = primary;
        }

        String replicas = System.getenv("AUTOWARM_DB_REPLICA_URLS");
        if (replicas != null && !replicas.isBlank()) {
            config.replicaUrls = splitUrls(replicas);
        }

        String user = System.getenv("AUTOWARM_DB_USER");
        if (user != null && !user.isBlank()) {
            config.databaseUser = user;
        }

        String password = System.getenv("AUTOWARM_DB_PASSWORD");
        if (password != null && !password.isBlank()) {
            config.databasePassword = password;
        }

        String workers = System.getenv("AUTOWARM_MAX_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.maxWorkers = Integer.parseInt(workers.trim());
        }

        String perUser = System.getenv("AUTOWARM_MAX_PER_USER");
        if (perUser != null && !perUser.isBlank()) {
            config.maxPerUser = Integer.parseInt(perUser.trim());
        }

        String backoffMin = System.getenv("AUTOWARM_BACKOFF_MIN_MINUTES");
        String backoffMax = System.getenv("AUTOWARM_BACKOFF_MAX_MINUTES");
        if (backoffMin != null && !backoffMin.isBlank() || backoffMax != null && !backoffMax.isBlank()) {
            int min = backoffMin != null && !backoffMin.isBlank() ? Integer.parseInt(backoffMin.trim())
                    : config.backoffWindow.minMinutes();
            int max = backoffMax != null && !backoffMax.isBlank() ? Integer.parseInt(backoffMax.trim())
                    : config.backoffWindow.maxMinutes();
            config.backoffWindow = new BackoffWindow(min, max);
        }

        String healthInterval = System.getenv("AUTOWARM_HEALTH_CHECK_INTERVAL_SECONDS");
        if (healthInterval != null && !healthInterval.isBlank()) {
            config.healthCheckInterval = Duration.ofSeconds(Long.parseLong(healthInterval.trim()));
        }

        String capacity = System.getenv("AUTOWARM_QUEUE_CAPACITY");
        if (capacity != null && !capacity.isBlank()) {
            config.queueCapacity = Integer.parseInt(capacity.trim());
        }

        String port = System.getenv("AUTOWARM_HTTP_PORT");
        if (port != null && !port.isBlank()) {
            config.httpPort = Integer.parseInt(port.trim());
        }

        config.validate();
        return config;
    }

    /**
     * Load settings from an INI file on top of the defaults.
     * Sections: [database], [pool.primary], [pool.replica], [scheduler],
     * [health_gate], [server]. Missing sections and keys keep their defaults.
     */
    public static EngineConfig fromIni(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file: " + file, e);
        }

        EngineConfig config = new EngineConfig();

        Profile.Section db = ini.get("database");
        if (db != null) {
            config.primaryUrl = opt(db, "primary_url", config.primaryUrl);
            String replicas = opt(db, "replica_urls", null);
            if (replicas != null) {
                config.replicaUrls = splitUrls(replicas);
            }
            config.databaseUser = opt(db, "user", config.databaseUser);
            config.databasePassword = opt(db, "password", config.databasePassword);
            config.healthCheckInterval = seconds(db, "health_check_interval_seconds", config.healthCheckInterval);
        }

        config.primaryPool = pool(ini.get("pool.primary"), config.primaryPool);
        config.replicaPool = pool(ini.get("pool.replica"), config.replicaPool);

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            config.maxWorkers = intOpt(scheduler, "max_workers", config.maxWorkers);
            config.maxPerUser = intOpt(scheduler, "max_per_user", config.maxPerUser);
            config.queueCapacity = intOpt(scheduler, "queue_capacity", config.queueCapacity);
            config.pollInterval = millis(scheduler, "poll_interval_ms", config.pollInterval);
            config.loaderInterval = seconds(scheduler, "loader_interval_seconds", config.loaderInterval);
            config.shutdownTimeout = seconds(scheduler, "shutdown_timeout_seconds", config.shutdownTimeout);
            config.backoffWindow = new BackoffWindow(
                    intOpt(scheduler, "backoff_min_minutes", config.backoffWindow.minMinutes()),
                    intOpt(scheduler, "backoff_max_minutes", config.backoffWindow.maxMinutes()));
        }

        Profile.Section gate = ini.get("health_gate");
        if (gate != null) {
            config.riskThreshold = doubleOpt(gate, "risk_threshold", config.riskThreshold);
            config.healthThreshold = doubleOpt(gate, "health_threshold", config.healthThreshold);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.httpHost = opt(server, "host", config.httpHost);
            config.httpPort = intOpt(server, "port", config.httpPort);
        }

        config.validate();
        return config;
    }

    private void validate() {
        if (primaryUrl == null || primaryUrl.isBlank()) {
            throw new IllegalArgumentException("primary database URL is required");
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
        if (maxPerUser < 1) {
            throw new IllegalArgumentException("maxPerUser must be positive: " + maxPerUser);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
    }

    // Getters
    public String primaryUrl() {
        return primaryUrl;
    }

    public List<String> replicaUrls() {
        return replicaUrls;
    }

    public String databaseUser() {
        return databaseUser;
    }

    public String databasePassword() {
        return databasePassword;
    }

    public PoolSettings primaryPool() {
        return primaryPool;
    }

    public PoolSettings replicaPool() {
        return replicaPool;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public int maxPerUser() {
        return maxPerUser;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration loaderInterval() {
        return loaderInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public BackoffWindow backoffWindow() {
        return backoffWindow;
    }

    public double riskThreshold() {
        return riskThreshold;
    }

    public double healthThreshold() {
        return healthThreshold;
    }

    public String httpHost() {
        return httpHost;
    }

    public int httpPort() {
        return httpPort;
    }

    public boolean httpEnabled() {
        return httpPort > 0;
    }

    // Fluent setters for testing/customization
    public EngineConfig withPrimaryUrl(String url) {
        this.primaryUrl = url;
        return this;
    }

    public EngineConfig withReplicaUrls(List<String> urls) {
        this.replicaUrls = List.copyOf(urls);
        return this;
    }

    public EngineConfig withPrimaryPool(PoolSettings pool) {
        this.primaryPool = pool;
        return this;
    }

    public EngineConfig withReplicaPool(PoolSettings pool) {
        this.replicaPool = pool;
        return this;
    }

    public EngineConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public EngineConfig withMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    public EngineConfig withMaxPerUser(int maxPerUser) {
        this.maxPerUser = maxPerUser;
        return this;
    }

    public EngineConfig withQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
        return this;
    }

    public EngineConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public EngineConfig withLoaderInterval(Duration loaderInterval) {
        this.loaderInterval = loaderInterval;
        return this;
    }

    public EngineConfig withShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
        return this;
    }

    public EngineConfig withBackoffWindow(BackoffWindow window) {
        this.backoffWindow = window;
        return this;
    }

    public EngineConfig withRiskThreshold(double threshold) {
        this.riskThreshold = threshold;
        return this;
    }

    public EngineConfig withHealthThreshold(double threshold) {
        this.healthThreshold = threshold;
        return this;
    }

    public EngineConfig withHttpPort(int port) {
        this.httpPort = port;
        return this;
    }

    // ===== helpers =====
    private static List<String> splitUrls(String value) {
        List<String> urls = new ArrayList<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(urls::add);
        return List.copyOf(urls);
    }

    private static PoolSettings pool(Profile.Section s, PoolSettings def) {
        if (s == null) {
            return def;
        }
        return new PoolSettings(
                intOpt(s, "size", def.poolSize()),
                intOpt(s, "max_overflow", def.maxOverflow()),
                seconds(s, "acquire_timeout_seconds", def.acquireTimeout()),
                seconds(s, "recycle_seconds", def.recycle()));
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int intOpt(Profile.Section s, String key, int def) {
        String v = opt(s, key, null);
        return v == null ? def : Integer.parseInt(v);
    }

    private static double doubleOpt(Profile.Section s, String key, double def) {
        String v = opt(s, key, null);
        return v == null ? def : Double.parseDouble(v);
    }

    private static Duration seconds(Profile.Section s, String key, Duration def) {
        String v = opt(s, key, null);
        return v == null ? def : Duration.ofSeconds(Long.parseLong(v));
    }

    private static Duration millis(Profile.Section s, String key, Duration def) {
        String v = opt(s, key, null);
        return v == null ? def : Duration.ofMillis(Long.parseLong(v));
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "primaryUrl='" + JdbcUrls.redact(primaryUrl) + '\'' +
                ", replicas=" + replicaUrls.size() +
                ", maxWorkers=" + maxWorkers +
                ", maxPerUser=" + maxPerUser +
                ", backoff=" + backoffWindow +
                ", healthCheckInterval=" + healthCheckInterval +
                ", httpPort=" + httpPort +
                '}';
    }
}
