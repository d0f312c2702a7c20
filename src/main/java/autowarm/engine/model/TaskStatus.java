package autowarm.engine.model;

/**
 * Task execution status.
 */
public enum TaskStatus {
    /** Task created by a producer, waiting to be dispatched */
    PENDING,
    /** Task admitted by the scheduler and being executed */
    RUNNING,
    /** Task completed successfully (terminal) */
    COMPLETED,
    /** Last attempt failed; eligible again once next_attempt_at has elapsed */
    FAILED
}
