package autowarm.engine.repository;

import autowarm.engine.model.Resource;

import java.util.List;
import java.util.Optional;

/**
 * Tenant-scoped access to resources. Every call filters on the owner id in
 * the query itself.
 */
public interface ResourceRepository {

    void save(Resource resource);

    /**
     * @return the resource, or empty if it does not exist or belongs to another owner
     */
    Optional<Resource> findForOwner(long ownerId, long resourceId);

    List<Resource> findByOwner(long ownerId, boolean onlyActive);

    /**
     * Update handle and active flag of a resource the owner holds.
     *
     * @return false if no such resource exists for the owner
     */
    boolean update(long ownerId, Resource resource);

    /**
     * @return false if no such resource exists for the owner
     */
    boolean deactivate(long ownerId, long resourceId);
}
