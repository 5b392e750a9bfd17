package tech.automator.platform.organization;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of OrganizationRepository.
 * Package-private to prevent direct injection - use OrganizationRepository interface.
 */
@ApplicationScoped
@Typed(OrganizationRepository.class)
class MongoOrganizationRepository implements PanacheMongoRepositoryBase<Organization, String>, OrganizationRepository {

    @Override
    public Optional<Organization> findByName(String name) {
        return find("name", name).firstResultOptional();
    }

    @Override
    public List<Organization> findPage(int skip, int limit) {
        return findAll(Sort.descending("createdAt")).range(skip, skip + limit - 1).list();
    }

    @Override
    public long addBusinessUnit(String orgId, String buId) {
        return update("{'$addToSet': {'businessUnits': ?1}, '$set': {'updatedAt': ?2}}", buId, Instant.now())
            .where("_id", orgId);
    }

    @Override
    public long removeBusinessUnit(String orgId, String buId) {
        return update("{'$pull': {'businessUnits': ?1}, '$set': {'updatedAt': ?2}}", buId, Instant.now())
            .where("_id", orgId);
    }

    @Override
    public long addProject(String orgId, String projectId) {
        return update("{'$addToSet': {'projects': ?1}, '$set': {'updatedAt': ?2}}", projectId, Instant.now())
            .where("_id", orgId);
    }

    @Override
    public long removeProject(String orgId, String projectId) {
        return update("{'$pull': {'projects': ?1}, '$set': {'updatedAt': ?2}}", projectId, Instant.now())
            .where("_id", orgId);
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<Organization> findByIdOptional(String id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public long count() {
        return PanacheMongoRepositoryBase.super.count();
    }

    @Override
    public void persist(Organization organization) {
        PanacheMongoRepositoryBase.super.persist(organization);
    }

    @Override
    public void update(Organization organization) {
        PanacheMongoRepositoryBase.super.update(organization);
    }

    @Override
    public boolean deleteById(String id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
