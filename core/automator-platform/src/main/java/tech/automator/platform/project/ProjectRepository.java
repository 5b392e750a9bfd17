package tech.automator.platform.project;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Project entities.
 */
public interface ProjectRepository {

    // Read operations
    Optional<Project> findByIdOptional(String id);
    Optional<Project> findByNameInOrganization(String orgId, String name);
    List<Project> findPageByOrganization(String orgId, int skip, int limit);
    long countByOrganization(String orgId);

    // Write operations
    void persist(Project project);
    void update(Project project);
    boolean deleteById(String id);

    // Module references, returning the number of projects modified
    long addModule(String projectId, String moduleId);
    long removeModule(String projectId, String moduleId);
}
