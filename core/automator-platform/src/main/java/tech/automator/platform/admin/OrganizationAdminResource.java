package tech.automator.platform.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.automator.platform.authentication.AuthenticatedPrincipal;
import tech.automator.platform.authentication.AuthenticationGuard;
import tech.automator.platform.authorization.AccessRule;
import tech.automator.platform.authorization.AccessRules;
import tech.automator.platform.organization.BusinessUnitRequest;
import tech.automator.platform.organization.BusinessUnitService;
import tech.automator.platform.organization.OrganizationRequest;
import tech.automator.platform.organization.OrganizationService;
import tech.automator.platform.shared.ApiResponses;
import tech.automator.platform.shared.PageRequest;

/**
 * Admin API for organizations and their business units.
 *
 * Organization writes are admin only. Business unit writes are open to organization
 * admins of the same organization. Every operation except creating and listing
 * organizations also requires the caller's own organization to be active.
 */
@Path("/organizations")
@Tag(name = "Organization Admin", description = "Administrative operations for organizations and business units")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OrganizationAdminResource {

    private static final Logger LOG = Logger.getLogger(OrganizationAdminResource.class);

    static final String ORG_ADMIN_ROLE = "org_admin";

    @Inject
    AuthenticationGuard authenticationGuard;

    @Inject
    OrganizationService organizationService;

    @Inject
    BusinessUnitService businessUnitService;

    // ==================== Organizations ====================

    @POST
    @Operation(summary = "Create an organization")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Organization created"),
        @APIResponse(responseCode = "400", description = "Validation failed or organization already exists"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "403", description = "Insufficient permissions")
    })
    public Response createOrganization(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                       OrganizationRequest request) {
        AuthenticatedPrincipal caller = AccessRules.admin().enforce(authenticationGuard.authenticate(authorization));
        LOG.debugf("Create organization requested by %s", caller.userId());
        return ApiResponses.respond(organizationService.createOrganization(caller, request),
            Status.CREATED, "Organization created successfully");
    }

    @GET
    @Path("/{org_id}")
    @Operation(summary = "Get organization by ID")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Organization details"),
        @APIResponse(responseCode = "404", description = "Organization not found")
    })
    public Response getOrganization(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                    @PathParam("org_id") String orgId) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(organizationService.getOrganization(caller, orgId),
            Status.OK, "Organization retrieved successfully");
    }

    @PUT
    @Path("/{org_id}")
    @Operation(summary = "Update organization", description = "Only the supplied fields are changed")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Organization updated"),
        @APIResponse(responseCode = "400", description = "Invalid field or nothing to change"),
        @APIResponse(responseCode = "404", description = "Organization not found")
    })
    public Response updateOrganization(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                       @PathParam("org_id") String orgId,
                                       OrganizationRequest request) {
        AuthenticatedPrincipal caller = AccessRules.admin().enforce(authenticationGuard.authenticate(authorization));
        return ApiResponses.respond(organizationService.updateOrganization(caller, orgId, request),
            Status.OK, "Organization updated successfully");
    }

    @DELETE
    @Path("/{org_id}")
    @Operation(summary = "Delete organization")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Organization deleted"),
        @APIResponse(responseCode = "400", description = "Organization still has business units"),
        @APIResponse(responseCode = "404", description = "Organization not found")
    })
    public Response deleteOrganization(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                       @PathParam("org_id") String orgId) {
        AuthenticatedPrincipal caller = AccessRules.admin().enforce(authenticationGuard.authenticate(authorization));
        return ApiResponses.noContent(organizationService.deleteOrganization(caller, orgId));
    }

    @GET
    @Operation(summary = "List organizations", description = "Newest first")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Page of organizations"),
        @APIResponse(responseCode = "400", description = "Invalid limit or skip")
    })
    public Response listOrganizations(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                      @QueryParam("limit") @Parameter(description = "Page size, 1 to 1000") Integer limit,
                                      @QueryParam("skip") @Parameter(description = "Records to skip") Integer skip) {
        authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(PageRequest.of(limit, skip).flatMap(organizationService::listOrganizations),
            Status.OK, "Organizations retrieved successfully");
    }

    @GET
    @Path("/{org_id}/units")
    @Operation(summary = "Get organization with its business units")
    public Response getOrganizationUnits(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                         @PathParam("org_id") String orgId) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(organizationService.getOrganizationUnits(caller, orgId),
            Status.OK, "Organization units retrieved successfully");
    }

    // ==================== Business units ====================

    @POST
    @Path("/{org_id}/business-units")
    @Operation(summary = "Create a business unit")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Business unit created"),
        @APIResponse(responseCode = "404", description = "Parent organization not found")
    })
    public Response createBusinessUnit(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                       @PathParam("org_id") String orgId,
                                       BusinessUnitRequest request) {
        AuthenticatedPrincipal caller = manageUnits(orgId).enforce(authenticationGuard.authenticate(authorization));
        return ApiResponses.respond(businessUnitService.createBusinessUnit(caller, orgId, request),
            Status.CREATED, "Business unit created successfully");
    }

    @GET
    @Path("/{org_id}/business-units/{bu_id}")
    @Operation(summary = "Get business unit", description = "Admins, or members of the business unit")
    public Response getBusinessUnit(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                    @PathParam("org_id") String orgId,
                                    @PathParam("bu_id") String buId) {
        AuthenticatedPrincipal caller = AccessRules.admin().or(AccessRules.inAnyBusinessUnit(buId))
            .enforce(authenticationGuard.authenticate(authorization));
        return ApiResponses.respond(businessUnitService.getBusinessUnit(caller, orgId, buId),
            Status.OK, "Business unit retrieved successfully");
    }

    @PUT
    @Path("/{org_id}/business-units/{bu_id}")
    @Operation(summary = "Update business unit", description = "Only the supplied fields are changed")
    public Response updateBusinessUnit(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                       @PathParam("org_id") String orgId,
                                       @PathParam("bu_id") String buId,
                                       BusinessUnitRequest request) {
        AuthenticatedPrincipal caller = manageUnits(orgId).enforce(authenticationGuard.authenticate(authorization));
        return ApiResponses.respond(businessUnitService.updateBusinessUnit(caller, orgId, buId, request),
            Status.OK, "Business unit updated successfully");
    }

    @DELETE
    @Path("/{org_id}/business-units/{bu_id}")
    @Operation(summary = "Delete business unit")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Business unit deleted"),
        @APIResponse(responseCode = "400", description = "Business unit still has child units")
    })
    public Response deleteBusinessUnit(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                       @PathParam("org_id") String orgId,
                                       @PathParam("bu_id") String buId) {
        AuthenticatedPrincipal caller = manageUnits(orgId).enforce(authenticationGuard.authenticate(authorization));
        return ApiResponses.noContent(businessUnitService.deleteBusinessUnit(caller, orgId, buId));
    }

    @GET
    @Path("/{org_id}/business-units")
    @Operation(summary = "List business units of an organization")
    public Response listBusinessUnits(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                      @PathParam("org_id") String orgId,
                                      @QueryParam("limit") Integer limit,
                                      @QueryParam("skip") Integer skip) {
        AuthenticatedPrincipal caller = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(
            PageRequest.of(limit, skip).flatMap(page -> businessUnitService.listBusinessUnits(caller, orgId, page)),
            Status.OK, "Business units retrieved successfully");
    }

    /**
     * Organization admins of this organization, or platform admins.
     */
    static AccessRule manageUnits(String orgId) {
        return AccessRules.orgAndRoles(orgId, AuthenticatedPrincipal.ADMIN_ROLE, ORG_ADMIN_ROLE)
            .or(AccessRules.admin());
    }
}
