package tech.automator.platform.project;

import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.util.List;
import java.util.Optional;

/**
 * MongoDB implementation of ModuleRepository.
 * Package-private to prevent direct injection - use ModuleRepository interface.
 */
@ApplicationScoped
@Typed(ModuleRepository.class)
class MongoModuleRepository implements PanacheMongoRepositoryBase<Module, String>, ModuleRepository {

    @Override
    public Optional<Module> findInProject(String projectId, String moduleId) {
        return find("{'_id': ?1, 'projectId': ?2}", moduleId, projectId).firstResultOptional();
    }

    @Override
    public Optional<Module> findByNameInProject(String projectId, String name) {
        return find("projectId = ?1 and name = ?2", projectId, name).firstResultOptional();
    }

    @Override
    public List<Module> findPageByProject(String projectId, int skip, int limit) {
        return find("projectId", Sort.descending("createdAt"), projectId)
            .range(skip, skip + limit - 1)
            .list();
    }

    @Override
    public long countByProject(String projectId) {
        return count("projectId", projectId);
    }

    // Delegate to Panache methods via interface
    @Override
    public Optional<Module> findByIdOptional(String id) {
        return PanacheMongoRepositoryBase.super.findByIdOptional(id);
    }

    @Override
    public void persist(Module module) {
        PanacheMongoRepositoryBase.super.persist(module);
    }

    @Override
    public void update(Module module) {
        PanacheMongoRepositoryBase.super.update(module);
    }

    @Override
    public boolean deleteById(String id) {
        return PanacheMongoRepositoryBase.super.deleteById(id);
    }
}
