package autowarm.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * External resource a tenant's tasks act upon (e.g. a remote account).
 * Owned by exactly one tenant.
 */
public record Resource(long id, long ownerId, String handle, boolean active, Instant createdAt) {

    public Resource {
        Objects.requireNonNull(handle, "handle is required");
        if (handle.isBlank()) {
            throw new IllegalArgumentException("handle must not be blank");
        }
    }

    public Resource withActive(boolean active) {
        return new Resource(id, ownerId, handle, active, createdAt);
    }

    public Resource withHandle(String handle) {
        return new Resource(id, ownerId, handle, active, createdAt);
    }
}
