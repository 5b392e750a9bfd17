package tech.automator.platform.project;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Module entities.
 */
public interface ModuleRepository {

    // Read operations
    Optional<Module> findByIdOptional(String id);
    Optional<Module> findInProject(String projectId, String moduleId);
    Optional<Module> findByNameInProject(String projectId, String name);
    List<Module> findPageByProject(String projectId, int skip, int limit);
    long countByProject(String projectId);

    // Write operations
    void persist(Module module);
    void update(Module module);
    boolean deleteById(String id);
}
