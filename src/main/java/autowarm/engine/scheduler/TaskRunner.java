package autowarm.engine.scheduler;

import autowarm.engine.executor.ExecutorRegistry;
import autowarm.engine.executor.TaskExecutionException;
import autowarm.engine.executor.TaskExecutor;
import autowarm.engine.health.HealthGate;
import autowarm.engine.logging.TenantLogSink;
import autowarm.engine.model.ExecutionResult;
import autowarm.engine.model.Task;
import autowarm.engine.model.TaskProgress;
import autowarm.engine.model.TaskSettings;
import autowarm.engine.model.TaskStatus;
import autowarm.engine.repository.TaskRepository;
import autowarm.engine.retry.BackoffWindow;
import autowarm.engine.retry.RetryPolicy;
import autowarm.engine.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Body of one worker execution.
 *
 * Marks the task RUNNING, lets the health gate pick the mode, runs the
 * executor registered for the task kind and persists COMPLETED or FAILED.
 * Never throws: every failure ends up in the returned {@link TaskOutcome}.
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final TaskRepository taskRepository;
    private final HealthGate healthGate;
    private final ExecutorRegistry executors;
    private final RetryPolicy retryPolicy;
    private final BackoffWindow backoffWindow;
    private final TenantLogSink tenantLog;
    private final Clock clock;

    public TaskRunner(TaskRepository taskRepository, HealthGate healthGate, ExecutorRegistry executors,
            RetryPolicy retryPolicy, BackoffWindow backoffWindow, TenantLogSink tenantLog, Clock clock) {
        this.taskRepository = taskRepository;
        this.healthGate = healthGate;
        this.executors = executors;
        this.retryPolicy = retryPolicy;
        this.backoffWindow = backoffWindow;
        this.tenantLog = tenantLog;
        this.clock = clock;
    }

    public TaskOutcome run(Task task) {
        Instant startedAt = clock.instant();

        try {
            if (!taskRepository.markRunning(task.id(), startedAt)) {
                log.info("Task {} not started: missing or already completed", task.id());
                return new TaskOutcome(task, TaskOutcome.Result.SKIPPED, true);
            }
        } catch (StoreException e) {
            log.warn("Task {} not started, storage error: {}", task.id(), e.getMessage());
            return new TaskOutcome(backOff(task, "Storage error: " + e.getMessage(), startedAt),
                    TaskOutcome.Result.FAILED, false);
        }

        Task running = task.toBuilder()
                .status(TaskStatus.RUNNING)
                .startedAt(startedAt)
                .error(null)
                .build();
        tenantLog.info(task.ownerId(), "Task " + task.id() + " started for resource " + task.resourceId());

        ExecutionResult result;
        try {
            result = execute(running);
        } catch (Exception e) {
            return fail(running, e);
        }

        return complete(running, result);
    }

    /**
     * Copy of the task held back by the retry policy, for in-memory requeueing.
     */
    public Task backOff(Task task, String error, Instant failedAt) {
        Instant nextAttemptAt = retryPolicy.scheduleRetry(task, backoffWindow, failedAt);
        return task.toBuilder()
                .status(TaskStatus.FAILED)
                .error(error)
                .progress(task.progress().withNextAttemptAt(nextAttemptAt))
                .updatedAt(failedAt)
                .build();
    }

    private ExecutionResult execute(Task task) throws TaskExecutionException {
        TaskSettings settings = healthGate.decide(task.resourceId(), task.settings());
        if (settings.forcePassive() && !task.settings().forcePassive()) {
            tenantLog.warn(task.ownerId(), "Resource " + task.resourceId() + " switched to passive mode");
        }

        TaskExecutor executor = executors.findByKind(task.kind())
                .orElseThrow(() -> new TaskExecutionException("No executor for task kind: " + task.kind()));

        ExecutionResult result = executor.execute(task.resourceId(), settings);
        return result != null ? result : ExecutionResult.empty();
    }

    private TaskOutcome complete(Task task, ExecutionResult result) {
        Instant finishedAt = clock.instant();
        TaskProgress progress = task.progress().afterSession(result, finishedAt);
        Task completed = task.toBuilder()
                .status(TaskStatus.COMPLETED)
                .progress(progress)
                .completedAt(finishedAt)
                .updatedAt(finishedAt)
                .build();

        boolean recorded;
        try {
            recorded = taskRepository.markCompleted(task.id(), progress, finishedAt);
        } catch (StoreException e) {
            log.warn("Task {} completed but not persisted: {}", task.id(), e.getMessage());
            Task pending = completed.toBuilder().status(TaskStatus.RUNNING).build();
            return new TaskOutcome(backOff(pending, "Completion not persisted", finishedAt),
                    TaskOutcome.Result.COMPLETED, false);
        }

        if (!recorded) {
            log.warn("Task {} finished but is no longer RUNNING in storage, completion not recorded", task.id());
            tenantLog.warn(task.ownerId(), "Task " + task.id() + " finished but was changed elsewhere, result discarded");
            return new TaskOutcome(task, TaskOutcome.Result.SKIPPED, true);
        }

        log.debug("Task {} completed ({} actions)", task.id(), result.totalActions());
        tenantLog.info(task.ownerId(), "Task " + task.id() + " completed: " + result.totalActions()
                + " actions, " + result.errors().size() + " errors");
        return new TaskOutcome(completed, TaskOutcome.Result.COMPLETED, true);
    }

    private TaskOutcome fail(Task task, Exception cause) {
        Instant failedAt = clock.instant();
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        Task failed = backOff(task, error, failedAt);

        if (cause instanceof TaskExecutionException) {
            log.info("Task {} failed: {}", task.id(), error);
        } else {
            log.warn("Task {} failed unexpectedly", task.id(), cause);
        }
        tenantLog.error(task.ownerId(), "Task " + task.id() + " failed: " + error
                + ", next attempt at " + failed.nextAttemptAt());

        try {
            taskRepository.markFailed(task.id(), error, failed.progress(), failedAt);
        } catch (StoreException e) {
            log.warn("Failure of task {} not persisted: {}", task.id(), e.getMessage());
            return new TaskOutcome(failed, TaskOutcome.Result.FAILED, false);
        }
        return new TaskOutcome(failed, TaskOutcome.Result.FAILED, true);
    }
}
