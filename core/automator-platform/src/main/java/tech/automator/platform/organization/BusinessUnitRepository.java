package tech.automator.platform.organization;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for BusinessUnit entities.
 */
public interface BusinessUnitRepository {

    // Read operations
    Optional<BusinessUnit> findByIdOptional(String id);
    Optional<BusinessUnit> findInOrganization(String orgId, String buId);
    Optional<BusinessUnit> findByNameInOrganization(String orgId, String name);
    List<BusinessUnit> findByIds(Collection<String> ids);
    List<BusinessUnit> findPageByOrganization(String orgId, int skip, int limit);
    long countByOrganization(String orgId);
    long countChildren(String buId);

    // Write operations
    void persist(BusinessUnit businessUnit);
    void update(BusinessUnit businessUnit);
    boolean deleteById(String id);
}
