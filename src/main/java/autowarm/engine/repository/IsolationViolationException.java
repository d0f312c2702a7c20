package autowarm.engine.repository;

/**
 * A tenant-scoped accessor produced a record of another tenant.
 * This is a programming error in the accessor, never a recoverable condition.
 */
public class IsolationViolationException extends IllegalStateException {

    private final long requestedOwner;
    private final long actualOwner;

    public IsolationViolationException(String recordType, String recordId, long requestedOwner, long actualOwner) {
        super(recordType + " " + recordId + " of owner " + actualOwner + " returned for owner " + requestedOwner);
        this.requestedOwner = requestedOwner;
        this.actualOwner = actualOwner;
    }

    public long requestedOwner() {
        return requestedOwner;
    }

    public long actualOwner() {
        return actualOwner;
    }
}
