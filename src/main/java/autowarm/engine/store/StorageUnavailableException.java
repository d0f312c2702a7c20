package autowarm.engine.store;

/**
 * No storage endpoint is available for the requested operation class.
 * Surfaced to the caller instead of being retried inline.
 */
public class StorageUnavailableException extends StoreException {

    private final String operation;

    public StorageUnavailableException(String operation, String message) {
        super("Storage unavailable for " + operation + ": " + message);
        this.operation = operation;
    }

    public StorageUnavailableException(String operation, String message, Throwable cause) {
        super("Storage unavailable for " + operation + ": " + message, cause);
        this.operation = operation;
    }

    /** "read", "write" or "failover" */
    public String operation() {
        return operation;
    }
}
