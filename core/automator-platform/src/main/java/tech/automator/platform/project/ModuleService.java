package tech.automator.platform.project;

import com.mongodb.MongoException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.Page;
import tech.automator.platform.shared.PageRequest;
import tech.automator.platform.shared.PartialUpdate;
import tech.automator.platform.shared.ServiceResult;
import tech.automator.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static tech.automator.platform.shared.Strings.trimToNull;

/**
 * Service for modules nested under a project. Access follows the owning project.
 */
@ApplicationScoped
public class ModuleService {

    private static final Logger LOG = Logger.getLogger(ModuleService.class);

    @Inject
    ModuleRepository moduleRepository;

    @Inject
    ProjectRepository projectRepository;

    @Inject
    ProjectService projectService;

    public ServiceResult<ModuleView> createModule(AuthenticatedPrincipal caller, String projectId,
                                                  ModuleRequest request) {
        ServiceResult<Project> parent = projectService.loadProject(caller, projectId);
        if (!parent.isSuccess()) {
            return parent.map(project -> null);
        }
        Project project = parent.value();

        String name = trimToNull(request.name());
        if (name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_MODULE_NAME);
        }

        String moduleId = trimToNull(request.moduleId());
        if (moduleId != null && moduleRepository.findByIdOptional(moduleId).isPresent()) {
            return ServiceResult.failure(ErrorCode.MODULE_ID_ALREADY_EXISTS);
        }
        if (moduleRepository.findByNameInProject(project.id, name).isPresent()) {
            return ServiceResult.failure(ErrorCode.MODULE_NAME_ALREADY_EXISTS);
        }

        Module module = new Module();
        module.id = moduleId != null ? moduleId : TsidGenerator.generate();
        module.name = name;
        module.description = request.description();
        if (request.status() != null) {
            module.status = request.status();
        }
        module.projectId = project.id;
        module.owner = request.owner() != null ? request.owner() : caller.userId();
        module.startDate = request.startDate();
        module.dueDate = request.dueDate();
        module.completedAt = request.completedAt();
        if (request.members() != null) {
            module.members = new ArrayList<>(request.members());
        }
        if (request.tags() != null) {
            module.tags = new ArrayList<>(request.tags());
        }
        module.priority = request.priority();
        if (request.metadata() != null) {
            module.metadata = new HashMap<>(request.metadata());
        }

        moduleRepository.persist(module);
        LOG.infof("Module %s created in project %s by user %s", module.id, project.id, caller.userId());

        linkToProject(project.id, module.id);
        return ServiceResult.success(ModuleView.from(module));
    }

    public ServiceResult<ModuleView> getModule(AuthenticatedPrincipal caller, String projectId, String moduleId) {
        return projectService.loadProject(caller, projectId)
            .flatMap(project -> findModule(project.id, moduleId))
            .map(ModuleView::from);
    }

    public ServiceResult<ModuleView> updateModule(AuthenticatedPrincipal caller, String projectId, String moduleId,
                                                  ModuleRequest request) {
        ServiceResult<Module> loaded = projectService.loadProject(caller, projectId)
            .flatMap(project -> findModule(project.id, moduleId));
        if (!loaded.isSuccess()) {
            return loaded.map(ModuleView::from);
        }
        Module module = loaded.value();

        String name = trimToNull(request.name());
        if (request.name() != null && name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_MODULE_NAME);
        }
        if (name != null && !name.equals(module.name)) {
            Optional<Module> sameName = moduleRepository.findByNameInProject(module.projectId, name);
            if (sameName.isPresent() && !sameName.get().id.equals(module.id)) {
                return ServiceResult.failure(ErrorCode.MODULE_NAME_ALREADY_EXISTS);
            }
        }

        PartialUpdate update = PartialUpdate.builder();
        if (request.moduleId() != null && !request.moduleId().equals(module.id)) {
            update.reject("module_id", "Module id cannot be changed");
        }
        if (request.projectId() != null && !request.projectId().equals(module.projectId)) {
            update.reject("project_id", "Module cannot be moved to another project");
        }
        update
            .field("name", name, module.name, v -> module.name = v)
            .field("description", request.description(), module.description, v -> module.description = v)
            .field("status", request.status(), module.status, v -> module.status = v)
            .field("owner", request.owner(), module.owner, v -> module.owner = v)
            .field("start_date", request.startDate(), module.startDate, v -> module.startDate = v)
            .field("due_date", request.dueDate(), module.dueDate, v -> module.dueDate = v)
            .field("completed_at", request.completedAt(), module.completedAt, v -> module.completedAt = v)
            .field("members", request.members(), module.members, v -> module.members = new ArrayList<>(v))
            .field("tags", request.tags(), module.tags, v -> module.tags = new ArrayList<>(v))
            .field("priority", request.priority(), module.priority, v -> module.priority = v)
            .field("metadata", module.metadata != null, request.metadata(), module.metadata,
                v -> module.metadata = new HashMap<>(v));

        ServiceResult<List<String>> changed = update.apply();
        if (!changed.isSuccess()) {
            return changed.map(fields -> ModuleView.from(module));
        }

        module.updatedAt = Instant.now();
        moduleRepository.update(module);
        LOG.infof("Module %s updated by user %s: %s", module.id, caller.userId(), changed.value());
        return ServiceResult.success(ModuleView.from(module));
    }

    public ServiceResult<Void> deleteModule(AuthenticatedPrincipal caller, String projectId, String moduleId) {
        ServiceResult<Module> loaded = projectService.loadProject(caller, projectId)
            .flatMap(project -> findModule(project.id, moduleId));
        if (!loaded.isSuccess()) {
            return loaded.map(module -> null);
        }
        Module module = loaded.value();

        moduleRepository.deleteById(module.id);
        LOG.infof("Module %s deleted by user %s", module.id, caller.userId());

        unlinkFromProject(module.projectId, module.id);
        return ServiceResult.success(null);
    }

    public ServiceResult<Page<ModuleView>> listModules(AuthenticatedPrincipal caller, String projectId,
                                                       PageRequest page) {
        ServiceResult<Project> parent = projectService.loadProject(caller, projectId);
        if (!parent.isSuccess()) {
            return parent.map(project -> null);
        }
        String parentId = parent.value().id;

        List<ModuleView> items = moduleRepository.findPageByProject(parentId, page.skip(), page.limit()).stream()
            .map(ModuleView::from)
            .toList();
        long total = moduleRepository.countByProject(parentId);
        return ServiceResult.success(Page.of(items, total, page));
    }

    private ServiceResult<Module> findModule(String projectId, String moduleId) {
        String id = trimToNull(moduleId);
        if (id == null) {
            return ServiceResult.failure(ErrorCode.MODULE_NOT_FOUND);
        }
        return moduleRepository.findInProject(projectId, id)
            .map(ServiceResult::success)
            .orElseGet(() -> ServiceResult.failure(ErrorCode.MODULE_NOT_FOUND));
    }

    // ==================== Reverse references ====================

    private void linkToProject(String projectId, String moduleId) {
        try {
            if (projectRepository.addModule(projectId, moduleId) == 0) {
                LOG.warnf("Project %s not updated with module %s", projectId, moduleId);
            }
        } catch (MongoException e) {
            LOG.warnf(e, "Failed to add module %s to project %s", moduleId, projectId);
        }
    }

    private void unlinkFromProject(String projectId, String moduleId) {
        try {
            projectRepository.removeModule(projectId, moduleId);
        } catch (MongoException e) {
            LOG.warnf(e, "Failed to remove module %s from project %s", moduleId, projectId);
        }
    }
}
