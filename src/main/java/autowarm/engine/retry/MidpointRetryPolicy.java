package autowarm.engine.retry;

import autowarm.engine.model.Task;

import java.time.Duration;
import java.time.Instant;

/**
 * Retries at the midpoint of the backoff window, whatever the number of
 * previous failures. No exponential growth and no jitter.
 */
public class MidpointRetryPolicy implements RetryPolicy {

    @Override
    public Instant scheduleRetry(Task task, BackoffWindow window, Instant failedAt) {
        return failedAt.plus(delay(window));
    }

    /** Whole minutes, rounded down: (min + max) / 2 over the effective bounds. */
    public Duration delay(BackoffWindow window) {
        int minutes = (window.effectiveMin() + window.effectiveMax()) / 2;
        return Duration.ofMinutes(minutes);
    }
}
