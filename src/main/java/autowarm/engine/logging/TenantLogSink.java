package autowarm.engine.logging;

/**
 * Append-only, per-tenant log channel.
 * Implementations must not block the caller or throw.
 */
public interface TenantLogSink {

    void info(long ownerId, String message);

    void warn(long ownerId, String message);

    void error(long ownerId, String message);
}
