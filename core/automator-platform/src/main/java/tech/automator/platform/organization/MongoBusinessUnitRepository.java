package tech.automator.platform.organization;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of BusinessUnitRepository.
 * Package-private to prevent direct injection - use BusinessUnitRepository interface.
 */
@ApplicationScoped
@Typed(BusinessUnitRepository.class)
class MongoBusinessUnitRepository implements PanacheMongoRepositoryBase<BusinessUnit, String>, BusinessUnitRepository {

    @Override
    public Optional<BusinessUnit> findInOrganization(String orgId, String buId) {
        return find("{'_id': ?1, 'parentOrg': ?2}", buId, orgId).firstResultOptional();
    }

    @Override
    public Optional<BusinessUnit> findByNameInOrganization(String orgId, String name) {
        return find("parentOrg = ?1 and name = ?2", orgId, name).firstResultOptional();
    }

    @Override
    public List<BusinessUnit> findByIds(Collection<String> ids) {
        return find("{'_id': {'$in': ?1}}", ids).list();
    }

    @Override
    public List<BusinessUnit> findPageByOrganization(String orgId, int skip, int limit) {
        return find("parentOrg", Sort.descending("createdAt"), orgId)
            .range(skip, skip + limit - 1)
            .list();
    }

    @Override
    public long countByOrganization(String orgId) {
        return count("parentOrg", orgId);
    }

    @Override
    public long countChildren(String buId) {
        return count("parentBuId", buId);
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<BusinessUnit> findByIdOptional(String id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(BusinessUnit businessUnit) {
        PanacheMongoRepositoryBase.super.persist(businessUnit);
    }

    @Override
    public void update(BusinessUnit businessUnit) {
        PanacheMongoRepositoryBase.super.update(businessUnit);
    }

    @Override
    public boolean deleteById(String id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
