package tech.automator.platform.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.authentication.AuthenticationGuard;
import tech.automator.platform.project.ModuleRequest;
import tech.automator.platform.project.ModuleService;
import tech.automator.platform.project.ProjectRequest;
import tech.automator.platform.project.ProjectService;
import tech.automator.platform.shared.ApiResponses;
import tech.automator.platform.shared.PageRequest;

/**
 * Projects and their modules, scoped to the caller's organization.
 */
@Path("/projects")
@Tag(name = "Project Admin", description = "Operations for projects and modules")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ProjectAdminResource {

    @Inject
    AuthenticationGuard authenticationGuard;

    @Inject
    ProjectService projectService;

    @Inject
    ModuleService moduleService;

    // ==================== Projects ====================

    @POST
    @Operation(summary = "Create a project in the caller's organization")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Project created"),
        @APIResponse(responseCode = "400", description = "Validation failed or project already exists")
    })
    public Response createProject(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                  ProjectRequest request) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(projectService.createProject(caller, request),
            Status.CREATED, "Project created successfully");
    }

    @GET
    @Path("/{project_id}")
    @Operation(summary = "Get project by ID")
    public Response getProject(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                               @PathParam("project_id") String projectId) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(projectService.getProject(caller, projectId),
            Status.OK, "Project retrieved successfully");
    }

    @PUT
    @Path("/{project_id}")
    @Operation(summary = "Update project", description = "Only the supplied fields are changed")
    public Response updateProject(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                  @PathParam("project_id") String projectId,
                                  ProjectRequest request) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(projectService.updateProject(caller, projectId, request),
            Status.OK, "Project updated successfully");
    }

    @DELETE
    @Path("/{project_id}")
    @Operation(summary = "Delete project")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Project deleted"),
        @APIResponse(responseCode = "400", description = "Project still has modules")
    })
    public Response deleteProject(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                  @PathParam("project_id") String projectId) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.noContent(projectService.deleteProject(caller, projectId));
    }

    @GET
    @Operation(summary = "List projects of the caller's organization")
    public Response listProjects(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                 @QueryParam("limit") Integer limit,
                                 @QueryParam("skip") Integer skip) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(
            PageRequest.of(limit, skip).flatMap(page -> projectService.listProjects(caller, page)),
            Status.OK, "Projects retrieved successfully");
    }

    // ==================== Modules ====================

    @POST
    @Path("/{project_id}/modules")
    @Operation(summary = "Create a module in a project")
    public Response createModule(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                 @PathParam("project_id") String projectId,
                                 ModuleRequest request) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(moduleService.createModule(caller, projectId, request),
            Status.CREATED, "Module created successfully");
    }

    @GET
    @Path("/{project_id}/modules/{module_id}")
    @Operation(summary = "Get module by ID")
    public Response getModule(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                              @PathParam("project_id") String projectId,
                              @PathParam("module_id") String moduleId) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(moduleService.getModule(caller, projectId, moduleId),
            Status.OK, "Module retrieved successfully");
    }

    @PUT
    @Path("/{project_id}/modules/{module_id}")
    @Operation(summary = "Update module", description = "Only the supplied fields are changed")
    public Response updateModule(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                 @PathParam("project_id") String projectId,
                                 @PathParam("module_id") String moduleId,
                                 ModuleRequest request) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(moduleService.updateModule(caller, projectId, moduleId, request),
            Status.OK, "Module updated successfully");
    }

    @DELETE
    @Path("/{project_id}/modules/{module_id}")
    @Operation(summary = "Delete module")
    public Response deleteModule(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                 @PathParam("project_id") String projectId,
                                 @PathParam("module_id") String moduleId) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.noContent(moduleService.deleteModule(caller, projectId, moduleId));
    }

    @GET
    @Path("/{project_id}/modules")
    @Operation(summary = "List modules of a project")
    public Response listModules(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                @PathParam("project_id") String projectId,
                                @QueryParam("limit") Integer limit,
                                @QueryParam("skip") Integer skip) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(
            PageRequest.of(limit, skip).flatMap(page -> moduleService.listModules(caller, projectId, page)),
            Status.OK, "Modules retrieved successfully");
    }
}
