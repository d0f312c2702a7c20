package autowarm.engine.store;

import autowarm.engine.model.Task;
import autowarm.engine.model.TaskProgress;
import autowarm.engine.model.TaskSettings;
import autowarm.engine.model.TaskStatus;
import autowarm.engine.model.TenantTaskStats;
import autowarm.engine.repository.IsolationViolationException;
import autowarm.engine.repository.TaskRepository;
import autowarm.engine.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository on top of {@link DurableStore}.
 * Tenant lookups read from replicas; lifecycle updates use the write route.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final String COLUMNS = """
            id, owner_id, resource_id, kind, status, settings, progress, error,
            created_at, started_at, completed_at, updated_at
            """;

    private final DurableStore store;

    public JdbcTaskRepository(DurableStore store) {
        this.store = store;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, owner_id, resource_id, kind, status, settings, progress, next_attempt_at,
                                       error, created_at, started_at, completed_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try {
            store.write(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bindInsert(ps, task);
                    return ps.executeUpdate();
                }
            });
        } catch (StoreException e) {
            throw wrap("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public void saveAll(List<Task> tasks) {
        if (tasks.isEmpty())
            return;

        String sql = """
                    INSERT INTO tasks (id, owner_id, resource_id, kind, status, settings, progress, next_attempt_at,
                                       error, created_at, started_at, completed_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try {
            store.write(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    for (Task task : tasks) {
                        bindInsert(ps, task);
                        ps.addBatch();
                    }
                    return ps.executeBatch();
                }
            });
            log.debug("Saved {} tasks in batch", tasks.size());
        } catch (StoreException e) {
            throw wrap("Failed to save tasks batch", e);
        }
    }

    private void bindInsert(PreparedStatement ps, Task task) throws SQLException {
        Instant now = Instant.now();
        ps.setString(1, task.id());
        ps.setLong(2, task.ownerId());
        ps.setLong(3, task.resourceId());
        ps.setString(4, task.kind());
        ps.setString(5, task.status().name());
        ps.setString(6, Jsons.toJson(task.settings()));
        ps.setString(7, Jsons.toJson(task.progress()));
        setTimestamp(ps, 8, task.nextAttemptAt());
        ps.setString(9, task.error());
        setTimestamp(ps, 10, task.createdAt() != null ? task.createdAt() : now);
        setTimestamp(ps, 11, task.startedAt());
        setTimestamp(ps, 12, task.completedAt());
        setTimestamp(ps, 13, task.updatedAt() != null ? task.updatedAt() : now);
    }

    // ==================== Tenant-scoped ====================

    @Override
    public Optional<Task> findForOwner(long ownerId, String taskId) {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE id = ? AND owner_id = ?";

        try {
            return store.read(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, taskId);
                    ps.setLong(2, ownerId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            return Optional.of(requireOwner(ownerId, mapRow(rs)));
                        }
                    }
                    return Optional.<Task>empty();
                }
            });
        } catch (StoreException e) {
            throw wrap("Failed to find task " + taskId + " for owner " + ownerId, e);
        }
    }

    @Override
    public List<Task> findByOwner(long ownerId, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE owner_id = ? ORDER BY created_at DESC LIMIT ?";

        try {
            return store.read(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setLong(1, ownerId);
                    ps.setInt(2, limit);
                    return executeOwnerQuery(ps, ownerId);
                }
            });
        } catch (StoreException e) {
            throw wrap("Failed to find tasks for owner " + ownerId, e);
        }
    }

    @Override
    public List<Task> findByOwnerAndStatus(long ownerId, TaskStatus status, int limit) {
        String sql = "SELECT " + COLUMNS
                + " FROM tasks WHERE owner_id = ? AND status = ? ORDER BY created_at DESC LIMIT ?";

        try {
            return store.read(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setLong(1, ownerId);
                    ps.setString(2, status.name());
                    ps.setInt(3, limit);
                    return executeOwnerQuery(ps, ownerId);
                }
            });
        } catch (StoreException e) {
            throw wrap("Failed to find " + status + " tasks for owner " + ownerId, e);
        }
    }

    @Override
    public TenantTaskStats statsForOwner(long ownerId) {
        String taskSql = "SELECT status, COUNT(*) FROM tasks WHERE owner_id = ? GROUP BY status";
        String resourceSql = """
                    SELECT COUNT(*), COALESCE(SUM(CASE WHEN active THEN 1 ELSE 0 END), 0)
                    FROM resources WHERE owner_id = ?
                """;

        try {
            return store.read(conn -> {
                int pending = 0;
                int running = 0;
                int completed = 0;
                int failed = 0;
                try (PreparedStatement ps = conn.prepareStatement(taskSql)) {
                    ps.setLong(1, ownerId);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            int count = rs.getInt(2);
                            switch (TaskStatus.valueOf(rs.getString(1))) {
                                case PENDING -> pending = count;
                                case RUNNING -> running = count;
                                case COMPLETED -> completed = count;
                                case FAILED -> failed = count;
                            }
                        }
                    }
                }

                int resources = 0;
                int activeResources = 0;
                try (PreparedStatement ps = conn.prepareStatement(resourceSql)) {
                    ps.setLong(1, ownerId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            resources = rs.getInt(1);
                            activeResources = rs.getInt(2);
                        }
                    }
                }

                return new TenantTaskStats(ownerId, pending, running, completed, failed, resources,
                        activeResources);
            });
        } catch (StoreException e) {
            throw wrap("Failed to compute stats for owner " + ownerId, e);
        }
    }

    // ==================== Scheduler lifecycle ====================

    @Override
    public List<Task> findDispatchable(Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + """
                    FROM tasks
                    WHERE status IN ('PENDING', 'RUNNING')
                       OR (status = 'FAILED' AND (next_attempt_at IS NULL OR next_attempt_at <= ?))
                    ORDER BY created_at
                    LIMIT ?
                """;

        try {
            return store.write(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setTimestamp(1, Timestamp.from(now));
                    ps.setInt(2, limit);
                    List<Task> tasks = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            tasks.add(mapRow(rs));
                        }
                    }
                    return tasks;
                }
            });
        } catch (StoreException e) {
            throw wrap("Failed to find dispatchable tasks", e);
        }
    }

    @Override
    public boolean markRunning(String taskId, Instant startedAt) {
        String sql = """
                    UPDATE tasks
                    SET status = 'RUNNING', started_at = ?, updated_at = ?
                    WHERE id = ? AND status <> 'COMPLETED'
                """;

        int updated = update("Failed to mark task running: " + taskId, sql, ps -> {
            ps.setTimestamp(1, Timestamp.from(startedAt));
            ps.setTimestamp(2, Timestamp.from(startedAt));
            ps.setString(3, taskId);
        });

        if (updated > 0) {
            log.debug("Task {} marked RUNNING", taskId);
        }
        return updated > 0;
    }

    @Override
    public boolean markCompleted(String taskId, TaskProgress progress, Instant completedAt) {
        String sql = """
                    UPDATE tasks
                    SET status = 'COMPLETED', progress = ?, next_attempt_at = NULL, error = NULL,
                        completed_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        TaskProgress cleared = progress.withNextAttemptAt(null);
        int updated = update("Failed to complete task: " + taskId, sql, ps -> {
            ps.setString(1, Jsons.toJson(cleared));
            ps.setTimestamp(2, Timestamp.from(completedAt));
            ps.setTimestamp(3, Timestamp.from(completedAt));
            ps.setString(4, taskId);
        });

        if (updated > 0) {
            log.debug("Task {} marked COMPLETED", taskId);
        }
        return updated > 0;
    }

    @Override
    public boolean markFailed(String taskId, String error, TaskProgress progress, Instant failedAt) {
        String sql = """
                    UPDATE tasks
                    SET status = 'FAILED', error = ?, progress = ?, next_attempt_at = ?,
                        completed_at = ?, updated_at = ?
                    WHERE id = ?
                """;

        int updated = update("Failed to mark task as failed: " + taskId, sql, ps -> {
            ps.setString(1, truncate(error, 4096));
            ps.setString(2, Jsons.toJson(progress));
            setTimestamp(ps, 3, progress.nextAttemptAt());
            ps.setTimestamp(4, Timestamp.from(failedAt));
            ps.setTimestamp(5, Timestamp.from(failedAt));
            ps.setString(6, taskId);
        });

        if (updated > 0) {
            log.debug("Task {} marked FAILED: {}", taskId, error);
        }
        return updated > 0;
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";

        try {
            return store.read(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, status.name());
                    try (ResultSet rs = ps.executeQuery()) {
                        return rs.next() ? rs.getInt(1) : 0;
                    }
                }
            });
        } catch (StoreException e) {
            throw wrap("Failed to count tasks", e);
        }
    }

    // ==================== Helpers ====================

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private int update(String failureMessage, String sql, Binder binder) {
        try {
            return store.write(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    binder.bind(ps);
                    return ps.executeUpdate();
                }
            });
        } catch (StoreException e) {
            throw wrap(failureMessage, e);
        }
    }

    private List<Task> executeOwnerQuery(PreparedStatement ps, long ownerId) throws SQLException {
        List<Task> tasks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tasks.add(requireOwner(ownerId, mapRow(rs)));
            }
        }
        return tasks;
    }

    private static Task requireOwner(long ownerId, Task task) {
        if (task.ownerId() != ownerId) {
            throw new IsolationViolationException("task", task.id(), ownerId, task.ownerId());
        }
        return task;
    }

    /**
     * Unavailability passes through unchanged so callers can tell it apart.
     */
    private static StoreException wrap(String message, StoreException e) {
        if (e instanceof StorageUnavailableException) {
            return e;
        }
        return new StoreException(message, e);
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        String settings = rs.getString("settings");
        String progress = rs.getString("progress");
        return Task.builder()
                .id(rs.getString("id"))
                .ownerId(rs.getLong("owner_id"))
                .resourceId(rs.getLong("resource_id"))
                .kind(rs.getString("kind"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .settings(settings != null ? Jsons.fromJson(settings, TaskSettings.class) : TaskSettings.empty())
                .progress(progress != null ? Jsons.fromJson(progress, TaskProgress.class) : TaskProgress.initial())
                .error(rs.getString("error"))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .completedAt(getInstant(rs, "completed_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) {
            return s;
        }
        return s.substring(0, max);
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
