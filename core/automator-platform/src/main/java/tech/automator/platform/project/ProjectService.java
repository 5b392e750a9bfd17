package tech.automator.platform.project;

import com.mongodb.MongoException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.authorization.AccessRules;
import tech.automator.platform.organization.OrganizationRepository;
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
 * Service for projects. A project belongs to the organization of the caller that created it
 * and is only reachable by callers whose token carries the same organization.
 *
 * Projects of other organizations are reported as not found. Creating a project for another
 * organization raises {@link tech.automator.platform.authorization.AccessDeniedException}.
 */
@ApplicationScoped
public class ProjectService {

    private static final Logger LOG = Logger.getLogger(ProjectService.class);

    @Inject
    ProjectRepository projectRepository;

    @Inject
    ModuleRepository moduleRepository;

    @Inject
    OrganizationRepository organizationRepository;

    public ServiceResult<ProjectView> createProject(AuthenticatedPrincipal caller, ProjectRequest request) {
        String orgId = trimToNull(caller.orgId());
        if (orgId == null) {
            LOG.warnf("Project creation refused: caller %s has no organization", caller.userId());
            return ServiceResult.failure(ErrorCode.INVALID_ORGANIZATION);
        }
        if (request.orgId() != null) {
            AccessRules.inOrganization(request.orgId()).enforce(caller);
        }

        String name = trimToNull(request.name());
        if (name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_PROJECT_NAME);
        }

        String projectId = trimToNull(request.projectId());
        if (projectId != null && projectRepository.findByIdOptional(projectId).isPresent()) {
            return ServiceResult.failure(ErrorCode.PROJECT_ID_ALREADY_EXISTS);
        }
        if (projectRepository.findByNameInOrganization(orgId, name).isPresent()) {
            return ServiceResult.failure(ErrorCode.PROJECT_NAME_ALREADY_EXISTS);
        }

        Project project = new Project();
        project.id = projectId != null ? projectId : TsidGenerator.generate();
        project.name = name;
        project.description = request.description();
        if (request.status() != null) {
            project.status = request.status();
        }
        project.owner = request.owner() != null ? request.owner() : caller.userId();
        project.parentProjectId = request.parentProjectId();
        project.orgId = orgId;
        project.startDate = request.startDate();
        project.dueDate = request.dueDate();
        project.completedAt = request.completedAt();
        if (request.members() != null) {
            project.members = new ArrayList<>(request.members());
        }
        if (request.tags() != null) {
            project.tags = new ArrayList<>(request.tags());
        }
        project.budget = request.budget();
        project.priority = request.priority();
        if (request.metadata() != null) {
            project.metadata = new HashMap<>(request.metadata());
        }

        projectRepository.persist(project);
        LOG.infof("Project %s created in organization %s by user %s", project.id, orgId, caller.userId());

        linkToOrganization(orgId, project.id);
        return ServiceResult.success(ProjectView.from(project));
    }

    public ServiceResult<ProjectView> getProject(AuthenticatedPrincipal caller, String projectId) {
        return loadProject(caller, projectId).map(ProjectView::from);
    }

    public ServiceResult<ProjectView> updateProject(AuthenticatedPrincipal caller, String projectId,
                                                    ProjectRequest request) {
        ServiceResult<Project> loaded = loadProject(caller, projectId);
        if (!loaded.isSuccess()) {
            return loaded.map(ProjectView::from);
        }
        Project project = loaded.value();

        String name = trimToNull(request.name());
        if (request.name() != null && name == null) {
            return ServiceResult.failure(ErrorCode.MISSING_PROJECT_NAME);
        }
        if (name != null && !name.equals(project.name)) {
            Optional<Project> sameName = projectRepository.findByNameInOrganization(project.orgId, name);
            if (sameName.isPresent() && !sameName.get().id.equals(project.id)) {
                return ServiceResult.failure(ErrorCode.PROJECT_NAME_ALREADY_EXISTS);
            }
        }

        PartialUpdate update = PartialUpdate.builder();
        if (request.projectId() != null && !request.projectId().equals(project.id)) {
            update.reject("project_id", "Project id cannot be changed");
        }
        if (request.orgId() != null && !request.orgId().equals(project.orgId)) {
            update.reject("org_id", "Project cannot be moved to another organization");
        }
        if (request.parentProjectId() != null && request.parentProjectId().equals(project.id)) {
            update.reject("parent_project_id", "Project cannot be its own parent");
        }
        update
            .field("name", name, project.name, v -> project.name = v)
            .field("description", request.description(), project.description, v -> project.description = v)
            .field("status", request.status(), project.status, v -> project.status = v)
            .field("owner", request.owner(), project.owner, v -> project.owner = v)
            .field("parent_project_id", request.parentProjectId(), project.parentProjectId,
                v -> project.parentProjectId = v)
            .field("start_date", request.startDate(), project.startDate, v -> project.startDate = v)
            .field("due_date", request.dueDate(), project.dueDate, v -> project.dueDate = v)
            .field("completed_at", request.completedAt(), project.completedAt, v -> project.completedAt = v)
            .field("members", request.members(), project.members, v -> project.members = new ArrayList<>(v))
            .field("tags", request.tags(), project.tags, v -> project.tags = new ArrayList<>(v))
            .field("budget", request.budget(), project.budget, v -> project.budget = v)
            .field("priority", request.priority(), project.priority, v -> project.priority = v)
            .field("metadata", project.metadata != null, request.metadata(), project.metadata,
                v -> project.metadata = new HashMap<>(v));

        ServiceResult<List<String>> changed = update.apply();
        if (!changed.isSuccess()) {
            return changed.map(fields -> ProjectView.from(project));
        }

        project.updatedAt = Instant.now();
        projectRepository.update(project);
        LOG.infof("Project %s updated by user %s: %s", project.id, caller.userId(), changed.value());
        return ServiceResult.success(ProjectView.from(project));
    }

    /**
     * Delete a project. Refused while any module still belongs to it.
     */
    public ServiceResult<Void> deleteProject(AuthenticatedPrincipal caller, String projectId) {
        ServiceResult<Project> loaded = loadProject(caller, projectId);
        if (!loaded.isSuccess()) {
            return loaded.map(project -> null);
        }
        Project project = loaded.value();

        long modules = moduleRepository.countByProject(project.id);
        if (modules > 0) {
            LOG.warnf("Project %s not deleted: %d modules remain", project.id, modules);
            return ServiceResult.failure(ErrorCode.PROJECT_HAS_DEPENDENCIES);
        }

        projectRepository.deleteById(project.id);
        LOG.infof("Project %s deleted by user %s", project.id, caller.userId());

        unlinkFromOrganization(project.orgId, project.id);
        return ServiceResult.success(null);
    }

    /**
     * Projects of the caller's organization, newest first.
     */
    public ServiceResult<Page<ProjectView>> listProjects(AuthenticatedPrincipal caller, PageRequest page) {
        String orgId = trimToNull(caller.orgId());
        if (orgId == null) {
            return ServiceResult.failure(ErrorCode.INVALID_ORGANIZATION);
        }
        List<ProjectView> items = projectRepository.findPageByOrganization(orgId, page.skip(), page.limit()).stream()
            .map(ProjectView::from)
            .toList();
        long total = projectRepository.countByOrganization(orgId);
        return ServiceResult.success(Page.of(items, total, page));
    }

    /**
     * Load a project of the caller's organization. A project owned by another organization
     * is reported as not found.
     */
    ServiceResult<Project> loadProject(AuthenticatedPrincipal caller, String projectId) {
        String id = trimToNull(projectId);
        Optional<Project> found = id == null ? Optional.empty() : projectRepository.findByIdOptional(id);
        if (found.isPresent() && !AccessRules.inOrganization(found.get().orgId).permits(caller)) {
            LOG.warnf("Project %s hidden from user %s of organization %s", id, caller.userId(), caller.orgId());
            found = Optional.empty();
        }
        return found.map(ServiceResult::success)
            .orElseGet(() -> ServiceResult.failure(ErrorCode.PROJECT_NOT_FOUND));
    }

    // ==================== Reverse references ====================

    private void linkToOrganization(String orgId, String projectId) {
        try {
            if (organizationRepository.addProject(orgId, projectId) == 0) {
                LOG.warnf("Organization %s not updated with project %s", orgId, projectId);
            }
        } catch (MongoException e) {
            LOG.warnf(e, "Failed to add project %s to organization %s", projectId, orgId);
        }
    }

    private void unlinkFromOrganization(String orgId, String projectId) {
        try {
            organizationRepository.removeProject(orgId, projectId);
        } catch (MongoException e) {
            LOG.warnf(e, "Failed to remove project %s from organization %s", projectId, orgId);
        }
    }
}
