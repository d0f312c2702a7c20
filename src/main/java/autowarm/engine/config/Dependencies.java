package autowarm.engine.config;

import autowarm.engine.api.v1.HealthController;
import autowarm.engine.api.v1.SchedulerController;
import autowarm.engine.api.v1.StorageController;
import autowarm.engine.executor.ExecutorRegistry;
import autowarm.engine.health.HealthGate;
import autowarm.engine.health.HealthScorer;
import autowarm.engine.health.RiskScorer;
import autowarm.engine.logging.Slf4jTenantLogSink;
import autowarm.engine.logging.TenantLogSink;
import autowarm.engine.repository.ResourceRepository;
import autowarm.engine.repository.TaskRepository;
import autowarm.engine.retry.MidpointRetryPolicy;
import autowarm.engine.retry.RetryPolicy;
import autowarm.engine.scheduler.Scheduler;
import autowarm.engine.scheduler.TaskRunner;
import autowarm.engine.server.EngineHttpServer;
import autowarm.engine.server.RouterHandler;
import autowarm.engine.store.DurableStore;
import autowarm.engine.store.JdbcResourceRepository;
import autowarm.engine.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv(), riskScorer, healthScorer);
 * deps.executors().register(new MyExecutor());
 * deps.start();   // scheduler + ops HTTP
 * deps.scheduler().submit(task);
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Clock clock;
    private final DurableStore store;
    private final TaskRepository taskRepository;
    private final ResourceRepository resourceRepository;
    private final ExecutorRegistry executors;
    private final HealthGate healthGate;
    private final RetryPolicy retryPolicy;
    private final TenantLogSink tenantLog;
    private final TaskRunner taskRunner;
    private final Scheduler scheduler;

    // Ops HTTP (lazy-initialized)
    private RouterHandler routerHandler;
    private EngineHttpServer httpServer;

    private Dependencies(EngineConfig config, RiskScorer riskScorer, HealthScorer healthScorer, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.store = DurableStore.create(config);
        this.store.initSchema();

        // Repositories
        this.taskRepository = new JdbcTaskRepository(store);
        this.resourceRepository = new JdbcResourceRepository(store);

        // Collaborators
        this.executors = new ExecutorRegistry();
        this.healthGate = new HealthGate(riskScorer, healthScorer, config.riskThreshold(), config.healthThreshold());
        this.retryPolicy = new MidpointRetryPolicy();
        this.tenantLog = new Slf4jTenantLogSink();

        // Scheduling
        this.taskRunner = new TaskRunner(taskRepository, healthGate, executors, retryPolicy,
                config.backoffWindow(), tenantLog, clock);
        this.scheduler = new Scheduler(taskRepository, taskRunner, config, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and scorers.
     */
    public static Dependencies create(EngineConfig config, RiskScorer riskScorer, HealthScorer healthScorer) {
        return new Dependencies(config, riskScorer, healthScorer, Clock.systemUTC());
    }

    /**
     * Create dependencies without scoring services: every resource scores as
     * zero risk and full health, so the gate never forces passive mode.
     */
    public static Dependencies create(EngineConfig config) {
        log.warn("No risk/health scorers configured, health gate will not force passive mode");
        return create(config, resourceId -> 0.0, resourceId -> 100.0);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public DurableStore store() {
        return store;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public ResourceRepository resourceRepository() {
        return resourceRepository;
    }

    public ExecutorRegistry executors() {
        return executors;
    }

    public HealthGate healthGate() {
        return healthGate;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public TenantLogSink tenantLog() {
        return tenantLog;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * RouterHandler with all ops controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(new HealthController(store, scheduler))
                    .registerController(new StorageController(store))
                    .registerController(new SchedulerController(scheduler));
            log.info("RouterHandler created with {} controllers", 3);
        }
        return routerHandler;
    }

    public synchronized EngineHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new EngineHttpServer(routerHandler());
        }
        return httpServer;
    }

    /**
     * Start the scheduler and, when a port is configured, the ops HTTP server.
     */
    public void start() {
        if (executors.kinds().isEmpty()) {
            log.warn("No task executors registered, every task will fail and back off");
        }
        scheduler.start();
        if (config.httpEnabled()) {
            httpServer().start(config.httpHost(), config.httpPort());
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        synchronized (this) {
            if (httpServer != null) {
                try {
                    httpServer.stop();
                } catch (Exception e) {
                    log.warn("Error stopping HTTP server: {}", e.getMessage());
                }
            }
        }

        // Stop scheduler before the store so in-flight workers can persist
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            store.close();
        } catch (Exception e) {
            log.warn("Error closing store: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
