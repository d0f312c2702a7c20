package autowarm.engine.retry;

import autowarm.engine.model.Task;

import java.time.Instant;

/**
 * Decides when a failed task becomes eligible again.
 */
public interface RetryPolicy {

    /**
     * Calculates the next attempt time for a task that failed at {@code failedAt}.
     *
     * @param task     the failed task (its progress as of the failed attempt)
     * @param window   configured backoff window
     * @param failedAt when the attempt failed
     * @return the instant before which the task must not be dispatched
     */
    Instant scheduleRetry(Task task, BackoffWindow window, Instant failedAt);
}
