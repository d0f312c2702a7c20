package autowarm.engine.scheduler;

import autowarm.engine.config.EngineConfig;
import autowarm.engine.model.Task;
import autowarm.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Concurrent task scheduler.
 *
 * A single dispatch thread polls every {@code pollInterval}: it reaps finished
 * worker futures, then admits queued tasks while worker slots are free. It
 * never touches storage. The {@link TaskLoader} runs every
 * {@code loaderInterval} on its own thread, so a slow database delays loading
 * but not dispatch. Executions run on a fixed pool of {@code maxWorkers}
 * threads.
 *
 * Guarantees at most one in-flight task per resource and at most
 * {@code maxPerUser} per tenant. Deferred tasks go to the back of the queue;
 * nothing is dropped.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService dispatcher;
    private final ScheduledExecutorService loader;
    private final ExecutorService workers;
    private final AdmissionControl admission;
    private final TaskRunner runner;
    private final TaskLoader taskLoader;
    private final EngineConfig config;
    private final Clock clock;

    // pending and queuedIds are guarded by pending's monitor; inFlight is
    // written under it too so submit() sees a consistent picture
    private final Deque<Task> pending = new ArrayDeque<>();
    private final Set<String> queuedIds = new HashSet<>();
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong requeued = new AtomicLong();

    private volatile boolean running = false;
    private volatile boolean stopped = false;

    private record InFlight(Task task, Future<TaskOutcome> future) {
    }

    public Scheduler(TaskRepository taskRepository, TaskRunner runner, EngineConfig config, Clock clock) {
        this.dispatcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "autowarm-dispatch");
            t.setDaemon(true);
            return t;
        });
        this.loader = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "autowarm-loader");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerSeq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.maxWorkers(), r -> {
            Thread t = new Thread(r, "autowarm-worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.admission = new AdmissionControl(config.maxPerUser());
        this.runner = runner;
        this.taskLoader = new TaskLoader(taskRepository, this, clock, config.queueCapacity());
        this.config = config;
        this.clock = clock;
    }

    /**
     * Enqueue a task. Idempotent by task id.
     *
     * @return false if the task is completed, already queued or in flight,
     *         the queue is full, or the scheduler was stopped
     */
    public boolean submit(Task task) {
        if (task.isTerminal()) {
            log.debug("Task {} is completed, not queued", task.id());
            return false;
        }
        if (stopped) {
            log.warn("Scheduler stopped, task {} not queued", task.id());
            return false;
        }

        synchronized (pending) {
            if (queuedIds.contains(task.id()) || inFlight.containsKey(task.id())) {
                return false;
            }
            if (pending.size() >= config.queueCapacity()) {
                log.warn("Task queue full ({}), task {} rejected", config.queueCapacity(), task.id());
                return false;
            }
            pending.addLast(task);
            queuedIds.add(task.id());
        }
        log.debug("Task {} queued (owner {}, resource {})", task.id(), task.ownerId(), task.resourceId());
        return true;
    }

    /**
     * Start the dispatch loop and the task loader. Returns immediately.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        if (stopped) {
            throw new IllegalStateException("Scheduler cannot be restarted after stop");
        }

        running = true;

        long pollMs = config.pollInterval().toMillis();
        dispatcher.scheduleWithFixedDelay(wrapRunnable("dispatch", this::tick), 0, pollMs, TimeUnit.MILLISECONDS);
        log.info("Dispatch loop scheduled every {}ms ({} workers, {} per user)",
                pollMs, config.maxWorkers(), config.maxPerUser());

        long loaderMs = config.loaderInterval().toMillis();
        loader.scheduleWithFixedDelay(wrapRunnable("task-loader", taskLoader), 0, loaderMs,
                TimeUnit.MILLISECONDS);
        log.info("Task loader scheduled every {}ms", loaderMs);

        log.info("Scheduler started");
    }

    /**
     * Stop admitting tasks and wait up to {@code shutdownTimeout} for running
     * executions. Executions are never interrupted; any still running after the
     * timeout are left to finish on their own. A loader pass stuck on storage
     * is interrupted.
     */
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        running = false;

        dispatcher.shutdown();
        loader.shutdownNow();
        workers.shutdown();

        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dispatch loop did not stop in time");
            }
            if (!loader.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Task loader did not stop in time");
            }
            long timeoutMs = config.shutdownTimeout().toMillis();
            if (workers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.info("Scheduler stopped gracefully");
            } else {
                log.warn("Scheduler stopped with {} executions still running after {}ms",
                        inFlight.size(), timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping scheduler");
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /** True if the task is queued or in flight. */
    public boolean isTracked(String taskId) {
        synchronized (pending) {
            return queuedIds.contains(taskId) || inFlight.containsKey(taskId);
        }
    }

    public SchedulerStats stats() {
        AdmissionControl.Snapshot snapshot = admission.snapshot();
        int queued;
        synchronized (pending) {
            queued = pending.size();
        }
        return new SchedulerStats(running, queued, inFlight.size(), config.maxWorkers(),
                snapshot.activeResources().size(), snapshot.activeByOwner(),
                completed.get(), failed.get(), requeued.get());
    }

    public AdmissionControl admission() {
        return admission;
    }

    public TaskLoader taskLoader() {
        return taskLoader;
    }

    /**
     * One pass of the dispatch loop.
     */
    void tick() {
        reap();
        if (!stopped) {
            dispatch();
        }
    }

    private void reap() {
        Iterator<Map.Entry<String, InFlight>> it = inFlight.entrySet().iterator();
        while (it.hasNext()) {
            InFlight entry = it.next().getValue();
            if (!entry.future().isDone()) {
                continue;
            }
            it.remove();
            admission.release(entry.task());

            TaskOutcome outcome = outcomeOf(entry);
            switch (outcome.result()) {
                case COMPLETED -> completed.incrementAndGet();
                case FAILED -> failed.incrementAndGet();
                case SKIPPED -> {
                }
            }

            if (outcome.requeue()) {
                requeued.incrementAndGet();
                if (!submit(outcome.task())) {
                    log.warn("Task {} could not be requeued, left to the task loader", outcome.task().id());
                }
            }
        }
    }

    private TaskOutcome outcomeOf(InFlight entry) {
        try {
            return entry.future().get();
        } catch (ExecutionException e) {
            log.error("Worker crashed on task {}", entry.task().id(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Task held = runner.backOff(entry.task(), "Worker crashed", clock.instant());
        return new TaskOutcome(held, TaskOutcome.Result.FAILED, false);
    }

    private void dispatch() {
        int free = config.maxWorkers() - inFlight.size();
        if (free <= 0) {
            return;
        }

        int toScan;
        synchronized (pending) {
            toScan = pending.size();
        }

        Instant now = clock.instant();
        for (int i = 0; i < toScan && free > 0; i++) {
            Task task;
            synchronized (pending) {
                task = pending.pollFirst();
            }
            if (task == null) {
                break;
            }

            AdmissionControl.Decision decision = admission.tryAdmit(task, now);
            if (decision != AdmissionControl.Decision.ADMITTED) {
                synchronized (pending) {
                    pending.addLast(task);
                }
                continue;
            }

            Future<TaskOutcome> future;
            try {
                future = workers.submit(() -> runner.run(task));
            } catch (RejectedExecutionException e) {
                admission.release(task);
                synchronized (pending) {
                    pending.addFirst(task);
                }
                log.warn("Worker pool rejected task {}", task.id());
                break;
            }

            synchronized (pending) {
                inFlight.put(task.id(), new InFlight(task, future));
                queuedIds.remove(task.id());
            }
            free--;
            log.debug("Task {} dispatched (owner {}, resource {})", task.id(), task.ownerId(), task.resourceId());
        }
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
