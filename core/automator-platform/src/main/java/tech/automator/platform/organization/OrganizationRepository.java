package tech.automator.platform.organization;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Organization entities.
 */
public interface OrganizationRepository {

    // Read operations
    Optional<Organization> findByIdOptional(String id);
    Optional<Organization> findByName(String name);
    List<Organization> findPage(int skip, int limit);
    long count();

    // Write operations
    void persist(Organization organization);
    void update(Organization organization);
    boolean deleteById(String id);

    // Reverse references, returning the number of organizations modified
    long addBusinessUnit(String orgId, String buId);
    long removeBusinessUnit(String orgId, String buId);
    long addProject(String orgId, String projectId);
    long removeProject(String orgId, String projectId);
}
