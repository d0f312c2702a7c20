package autowarm.engine.executor;

/**
 * The automated action against a resource failed.
 * The task is marked FAILED and retried after the backoff window.
 */
public class TaskExecutionException extends Exception {

    public TaskExecutionException(String message) {
        super(message);
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
