package autowarm.engine.scheduler;

import autowarm.engine.model.Task;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission bookkeeping for the dispatch loop: which resources have a task in
 * flight and how many tasks each tenant is running.
 *
 * Both structures are guarded by one lock, so the check and the mark happen
 * as a single step and a release can never be observed half-applied.
 */
public final class AdmissionControl {

    public enum Decision {
        ADMITTED,
        /** Another task of the same resource is in flight */
        RESOURCE_BUSY,
        /** Tenant already runs maxPerUser tasks */
        TENANT_LIMIT,
        /** next_attempt_at is still in the future */
        BACKING_OFF
    }

    public record Snapshot(Set<Long> activeResources, Map<Long, Integer> activeByOwner) {
    }

    private final int maxPerUser;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<Long> activeResources = new HashSet<>();
    private final Map<Long, Integer> activeByOwner = new HashMap<>();

    public AdmissionControl(int maxPerUser) {
        if (maxPerUser < 1) {
            throw new IllegalArgumentException("maxPerUser must be >= 1: " + maxPerUser);
        }
        this.maxPerUser = maxPerUser;
    }

    /**
     * Check the task against exclusivity, the tenant cap and its backoff, in
     * that order. On {@link Decision#ADMITTED} the resource is marked active
     * and the tenant counter incremented.
     */
    public Decision tryAdmit(Task task, Instant now) {
        lock.lock();
        try {
            if (activeResources.contains(task.resourceId())) {
                return Decision.RESOURCE_BUSY;
            }
            if (activeByOwner.getOrDefault(task.ownerId(), 0) >= maxPerUser) {
                return Decision.TENANT_LIMIT;
            }
            if (task.progress().isBackingOff(now)) {
                return Decision.BACKING_OFF;
            }
            activeResources.add(task.resourceId());
            activeByOwner.merge(task.ownerId(), 1, Integer::sum);
            return Decision.ADMITTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Undo a successful admission. Releasing a task that was never admitted is a no-op
     * for the resource set and never drives a counter below zero.
     */
    public void release(Task task) {
        lock.lock();
        try {
            activeResources.remove(task.resourceId());
            activeByOwner.computeIfPresent(task.ownerId(), (owner, count) -> count > 1 ? count - 1 : null);
        } finally {
            lock.unlock();
        }
    }

    public int activeCount(long ownerId) {
        lock.lock();
        try {
            return activeByOwner.getOrDefault(ownerId, 0);
        } finally {
            lock.unlock();
        }
    }

    public boolean isResourceActive(long resourceId) {
        lock.lock();
        try {
            return activeResources.contains(resourceId);
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return new Snapshot(
                    Collections.unmodifiableSet(new HashSet<>(activeResources)),
                    Collections.unmodifiableMap(new HashMap<>(activeByOwner)));
        } finally {
            lock.unlock();
        }
    }

    public int maxPerUser() {
        return maxPerUser;
    }
}
