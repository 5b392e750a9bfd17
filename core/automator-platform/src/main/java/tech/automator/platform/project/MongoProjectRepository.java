package tech.automator.platform.project;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ProjectRepository.
 * Package-private to prevent direct injection - use ProjectRepository interface.
 */
@ApplicationScoped
@Typed(ProjectRepository.class)
class MongoProjectRepository implements PanacheMongoRepositoryBase<Project, String>, ProjectRepository {

    @Override
    public Optional<Project> findByNameInOrganization(String orgId, String name) {
        return find("orgId = ?1 and name = ?2", orgId, name).firstResultOptional();
    }

    @Override
    public List<Project> findPageByOrganization(String orgId, int skip, int limit) {
        return find("orgId", Sort.descending("createdAt"), orgId)
            .range(skip, skip + limit - 1)
            .list();
    }

    @Override
    public long countByOrganization(String orgId) {
        return count("orgId", orgId);
    }

    @Override
    public long addModule(String projectId, String moduleId) {
        return update("{'$addToSet': {'modules': ?1}, '$set': {'updatedAt': ?2}}", moduleId, Instant.now())
            .where("_id", projectId);
    }

    @Override
    public long removeModule(String projectId, String moduleId) {
        return update("{'$pull': {'modules': ?1}, '$set': {'updatedAt': ?2}}", moduleId, Instant.now())
            .where("_id", projectId);
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<Project> findByIdOptional(String id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(Project project) {
        PanacheMongoRepositoryBase.super.persist(project);
    }

    @Override
    public void update(Project project) {
        PanacheMongoRepositoryBase.super.update(project);
    }

    @Override
    public boolean deleteById(String id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
