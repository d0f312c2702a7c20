package autowarm.engine.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection pool sizing for one class of storage endpoint (primary or replica).
 *
 * @param poolSize       connections kept open
 * @param maxOverflow    extra connections allowed above poolSize under load
 * @param acquireTimeout how long a caller waits for a free connection
 * @param recycle        maximum connection age before it is replaced
 */
public record PoolSettings(int poolSize, int maxOverflow, Duration acquireTimeout, Duration recycle) {

    public static final PoolSettings PRIMARY_DEFAULTS = new PoolSettings(50, 100, Duration.ofSeconds(60),
            Duration.ofHours(1));
    public static final PoolSettings REPLICA_DEFAULTS = new PoolSettings(20, 40, Duration.ofSeconds(30),
            Duration.ofHours(1));

    public PoolSettings {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        if (maxOverflow < 0) {
            throw new IllegalArgumentException("maxOverflow must not be negative");
        }
        Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        Objects.requireNonNull(recycle, "recycle");
    }

    /** Hard upper bound on open connections */
    public int maxConnections() {
        return poolSize + maxOverflow;
    }

    public PoolSettings withPoolSize(int poolSize) {
        return new PoolSettings(poolSize, maxOverflow, acquireTimeout, recycle);
    }

    public PoolSettings withMaxOverflow(int maxOverflow) {
        return new PoolSettings(poolSize, maxOverflow, acquireTimeout, recycle);
    }

    public PoolSettings withAcquireTimeout(Duration acquireTimeout) {
        return new PoolSettings(poolSize, maxOverflow, acquireTimeout, recycle);
    }

    public PoolSettings withRecycle(Duration recycle) {
        return new PoolSettings(poolSize, maxOverflow, acquireTimeout, recycle);
    }
}
