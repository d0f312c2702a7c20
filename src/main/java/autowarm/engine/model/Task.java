package autowarm.engine.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable domain model of a scheduled automation task.
 * Updates go through {@link #toBuilder()}; persistence only through the repository.
 */
public final class Task {

    public static final String DEFAULT_KIND = "warmup";

    private final String id;
    private final long ownerId; // tenant, never changes after creation
    private final long resourceId; // at most one RUNNING task per resource
    private final String kind; // selects the executor
    private final TaskStatus status;
    private final TaskSettings settings;
    private final TaskProgress progress;
    private final String error;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        if (builder.ownerId == null) {
            throw new IllegalArgumentException("ownerId is required");
        }
        if (builder.resourceId == null) {
            throw new IllegalArgumentException("resourceId is required");
        }
        this.ownerId = builder.ownerId;
        this.resourceId = builder.resourceId;
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.settings = builder.settings != null ? builder.settings : TaskSettings.empty();
        this.progress = builder.progress != null ? builder.progress : TaskProgress.initial();
        this.error = builder.error;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public long ownerId() {
        return ownerId;
    }

    public long resourceId() {
        return resourceId;
    }

    public String kind() {
        return kind;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskSettings settings() {
        return settings;
    }

    public TaskProgress progress() {
        return progress;
    }

    public String error() {
        return error;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Shortcut for progress().nextAttemptAt() */
    public Instant nextAttemptAt() {
        return progress.nextAttemptAt();
    }

    /**
     * Whether the task may be dispatched at {@code now}: not completed, and
     * not inside a backoff window.
     */
    public boolean isEligibleAt(Instant now) {
        return status != TaskStatus.COMPLETED && !progress.isBackingOff(now);
    }

    public boolean isTerminal() {
        return status == TaskStatus.COMPLETED;
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .ownerId(ownerId)
                .resourceId(resourceId)
                .kind(kind)
                .status(status)
                .settings(settings)
                .progress(progress)
                .error(error)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** New PENDING task with a random id. */
    public static Task pending(long ownerId, long resourceId, TaskSettings settings) {
        return builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .resourceId(resourceId)
                .settings(settings)
                .createdAt(Instant.now())
                .build();
    }

    public static final class Builder {
        private String id;
        private Long ownerId;
        private Long resourceId;
        private String kind = DEFAULT_KIND;
        private TaskStatus status = TaskStatus.PENDING;
        private TaskSettings settings;
        private TaskProgress progress;
        private String error;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ownerId(long ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder resourceId(long resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder settings(TaskSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder progress(TaskProgress progress) {
            this.progress = progress;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', owner=" + ownerId + ", resource=" + resourceId + ", status=" + status + '}';
    }
}
