package autowarm.engine.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Tenant log channel over SLF4J.
 *
 * Writes to the {@code autowarm.tenant} logger with the owner id in MDC under
 * {@link #MDC_OWNER_KEY}; logback routes those events to one file per tenant.
 */
public class Slf4jTenantLogSink implements TenantLogSink {

    public static final String LOGGER_NAME = "autowarm.tenant";
    public static final String MDC_OWNER_KEY = "ownerId";

    private static final Logger log = LoggerFactory.getLogger(Slf4jTenantLogSink.class);

    private final Logger tenantLog;

    public Slf4jTenantLogSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    Slf4jTenantLogSink(Logger tenantLog) {
        this.tenantLog = tenantLog;
    }

    @Override
    public void info(long ownerId, String message) {
        append(ownerId, Level.INFO, message);
    }

    @Override
    public void warn(long ownerId, String message) {
        append(ownerId, Level.WARN, message);
    }

    @Override
    public void error(long ownerId, String message) {
        append(ownerId, Level.ERROR, message);
    }

    private enum Level {
        INFO, WARN, ERROR
    }

    private void append(long ownerId, Level level, String message) {
        String previous = MDC.get(MDC_OWNER_KEY);
        MDC.put(MDC_OWNER_KEY, String.valueOf(ownerId));
        try {
            switch (level) {
                case INFO -> tenantLog.info(message);
                case WARN -> tenantLog.warn(message);
                case ERROR -> tenantLog.error(message);
            }
        } catch (RuntimeException e) {
            // appender failures must not reach the worker
            log.warn("Tenant log append failed for owner {}: {}", ownerId, e.toString());
        } finally {
            if (previous != null) {
                MDC.put(MDC_OWNER_KEY, previous);
            } else {
                MDC.remove(MDC_OWNER_KEY);
            }
        }
    }
}
