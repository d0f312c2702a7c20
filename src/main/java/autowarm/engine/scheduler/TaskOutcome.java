package autowarm.engine.scheduler;

import autowarm.engine.model.Task;

/**
 * What a worker did with one task.
 *
 * @param task      latest in-memory copy of the task
 * @param result    how the attempt ended
 * @param persisted false when the final state could not be written; the
 *                  scheduler then keeps the task in memory and retries later
 */
public record TaskOutcome(Task task, Result result, boolean persisted) {

    public enum Result {
        COMPLETED,
        FAILED,
        /** Not started, or finished after the stored task was completed or removed elsewhere */
        SKIPPED
    }

    public boolean requeue() {
        return !persisted && result != Result.SKIPPED;
    }
}
