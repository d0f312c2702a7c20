package autowarm.engine.repository;

import autowarm.engine.model.Task;
import autowarm.engine.model.TaskProgress;
import autowarm.engine.model.TaskStatus;
import autowarm.engine.model.TenantTaskStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Task persistence.
 *
 * Lookups exposed to tenants take the owner id and filter on it in the query,
 * so a task of another owner is reported as not found. Lifecycle updates keyed
 * by task id are for the scheduler only.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Save multiple tasks in a batch.
     *
     * @param tasks the tasks to save
     */
    void saveAll(List<Task> tasks);

    // ---------- tenant-scoped ----------

    /**
     * Find a task of the given owner.
     *
     * @param ownerId the tenant
     * @param taskId  the task ID
     * @return the task, or empty if it does not exist or belongs to another owner
     */
    Optional<Task> findForOwner(long ownerId, String taskId);

    /**
     * Most recent tasks of an owner, newest first.
     */
    List<Task> findByOwner(long ownerId, int limit);

    List<Task> findByOwnerAndStatus(long ownerId, TaskStatus status, int limit);

    /**
     * Task and resource counters of one owner.
     */
    TenantTaskStats statsForOwner(long ownerId);

    // ---------- scheduler lifecycle ----------

    /**
     * Tasks the scheduler may pick up: PENDING, RUNNING left over from a
     * previous process, and FAILED whose backoff has elapsed at {@code now}.
     * Reads from the write route so it sees the scheduler's own updates.
     */
    List<Task> findDispatchable(Instant now, int limit);

    /**
     * Move a task to RUNNING.
     *
     * @return false if the task does not exist or is already COMPLETED
     */
    boolean markRunning(String taskId, Instant startedAt);

    /**
     * Move a RUNNING task to COMPLETED, storing its progress and clearing any backoff.
     *
     * @return false if the task was not RUNNING
     */
    boolean markCompleted(String taskId, TaskProgress progress, Instant completedAt);

    /**
     * Move a task to FAILED with an error and progress carrying next_attempt_at.
     *
     * @return false if the task does not exist
     */
    boolean markFailed(String taskId, String error, TaskProgress progress, Instant failedAt);

    /**
     * Count tasks in a status across all owners (ops only).
     */
    int countByStatus(TaskStatus status);
}
