package autowarm.engine.store;

import autowarm.engine.model.Resource;
import autowarm.engine.repository.IsolationViolationException;
import autowarm.engine.repository.ResourceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of ResourceRepository on top of {@link DurableStore}.
 */
public class JdbcResourceRepository implements ResourceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcResourceRepository.class);

    private final DurableStore store;

    public JdbcResourceRepository(DurableStore store) {
        this.store = store;
    }

    @Override
    public void save(Resource resource) {
        String sql = "INSERT INTO resources (id, owner_id, handle, active, created_at) VALUES (?, ?, ?, ?, ?)";

        try {
            store.write(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setLong(1, resource.id());
                    ps.setLong(2, resource.ownerId());
                    ps.setString(3, resource.handle());
                    ps.setBoolean(4, resource.active());
                    ps.setTimestamp(5, Timestamp.from(
                            resource.createdAt() != null ? resource.createdAt() : Instant.now()));
                    return ps.executeUpdate();
                }
            });
            log.debug("Resource {} saved for owner {}", resource.id(), resource.ownerId());
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (StoreException e) {
            throw new StoreException("Failed to save resource: " + resource.id(), e);
        }
    }

    @Override
    public Optional<Resource> findForOwner(long ownerId, long resourceId) {
        String sql = "SELECT * FROM resources WHERE id = ? AND owner_id = ?";

        try {
            return store.read(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setLong(1, resourceId);
                    ps.setLong(2, ownerId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            return Optional.of(requireOwner(ownerId, mapRow(rs)));
                        }
                    }
                    return Optional.<Resource>empty();
                }
            });
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (StoreException e) {
            throw new StoreException("Failed to find resource " + resourceId + " for owner " + ownerId, e);
        }
    }

    @Override
    public List<Resource> findByOwner(long ownerId, boolean onlyActive) {
        String sql = onlyActive
                ? "SELECT * FROM resources WHERE owner_id = ? AND active = TRUE ORDER BY id"
                : "SELECT * FROM resources WHERE owner_id = ? ORDER BY id";

        try {
            return store.read(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setLong(1, ownerId);
                    List<Resource> resources = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            resources.add(requireOwner(ownerId, mapRow(rs)));
                        }
                    }
                    return resources;
                }
            });
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (StoreException e) {
            throw new StoreException("Failed to find resources for owner " + ownerId, e);
        }
    }

    @Override
    public boolean update(long ownerId, Resource resource) {
        if (resource.ownerId() != ownerId) {
            throw new IllegalArgumentException("Resource " + resource.id() + " cannot move to owner " + ownerId);
        }

        String sql = "UPDATE resources SET handle = ?, active = ? WHERE id = ? AND owner_id = ?";

        return executeUpdate("Failed to update resource: " + resource.id(), sql, ps -> {
            ps.setString(1, resource.handle());
            ps.setBoolean(2, resource.active());
            ps.setLong(3, resource.id());
            ps.setLong(4, ownerId);
        }) > 0;
    }

    @Override
    public boolean deactivate(long ownerId, long resourceId) {
        String sql = "UPDATE resources SET active = FALSE WHERE id = ? AND owner_id = ?";

        int updated = executeUpdate("Failed to deactivate resource: " + resourceId, sql, ps -> {
            ps.setLong(1, resourceId);
            ps.setLong(2, ownerId);
        });

        if (updated > 0) {
            log.info("Resource {} of owner {} deactivated", resourceId, ownerId);
        }
        return updated > 0;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private int executeUpdate(String failureMessage, String sql, Binder binder) {
        try {
            return store.write(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    binder.bind(ps);
                    return ps.executeUpdate();
                }
            });
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (StoreException e) {
            throw new StoreException(failureMessage, e);
        }
    }

    private static Resource requireOwner(long ownerId, Resource resource) {
        if (resource.ownerId() != ownerId) {
            throw new IsolationViolationException("resource", String.valueOf(resource.id()), ownerId,
                    resource.ownerId());
        }
        return resource;
    }

    private Resource mapRow(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new Resource(
                rs.getLong("id"),
                rs.getLong("owner_id"),
                rs.getString("handle"),
                rs.getBoolean("active"),
                created != null ? created.toInstant() : null);
    }
}
