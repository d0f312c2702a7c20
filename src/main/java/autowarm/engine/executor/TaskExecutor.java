package autowarm.engine.executor;

import autowarm.engine.model.ExecutionResult;
import autowarm.engine.model.TaskSettings;

/**
 * Performs one session of automated work against a resource.
 *
 * Implementations must tolerate being invoked again for the same task on a
 * later attempt; delivery is at-least-once.
 */
public interface TaskExecutor {

    /** Task kind this executor handles */
    String kind();

    ExecutionResult execute(long resourceId, TaskSettings settings) throws TaskExecutionException;
}
