package autowarm.engine.store;

/**
 * A storage operation failed for a reason other than endpoint availability
 * (constraint violation, bad SQL, unreadable row).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
