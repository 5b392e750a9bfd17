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
import tech.automator.platform.authorization.AccessRules;
import tech.automator.platform.principal.UserRequest;
import tech.automator.platform.principal.UserService;
import tech.automator.platform.shared.ApiResponses;
import tech.automator.platform.shared.PageRequest;

/**
 * Admin API for user accounts. Every operation requires the admin role.
 */
@Path("/users")
@Tag(name = "User Admin", description = "Administrative operations for user accounts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserAdminResource {

    @Inject
    AuthenticationGuard authenticationGuard;

    @Inject
    UserService userService;

    @POST
    @Operation(summary = "Create a user", description = "Admins may assign roles and verification flags")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "User created"),
        @APIResponse(responseCode = "400", description = "Validation failed or user already exists"),
        @APIResponse(responseCode = "403", description = "Insufficient permissions")
    })
    public Response createUser(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, UserRequest request) {
        requireAdmin(authorization);
        return ApiResponses.respond(userService.createUser(request, true, "admin"),
            Status.CREATED, "User created successfully");
    }

    @GET
    @Path("/{user_id}")
    @Operation(summary = "Get user by ID")
    public Response getUser(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                            @PathParam("user_id") String userId) {
        requireAdmin(authorization);
        return ApiResponses.respond(userService.getUser(userId), Status.OK, "User retrieved successfully");
    }

    @PUT
    @Path("/{user_id}")
    @Operation(summary = "Update user", description = "Only the supplied fields are changed")
    public Response updateUser(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                               @PathParam("user_id") String userId,
                               UserRequest request) {
        AuthenticatedPrincipal caller = requireAdmin(authorization);
        return ApiResponses.respond(userService.updateUser(caller, userId, request),
            Status.OK, "User updated successfully");
    }

    @DELETE
    @Path("/{user_id}")
    @Operation(summary = "Delete user")
    public Response deleteUser(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                               @PathParam("user_id") String userId) {
        AuthenticatedPrincipal caller = requireAdmin(authorization);
        return ApiResponses.noContent(userService.deleteUser(caller, userId));
    }

    @GET
    @Operation(summary = "List users", description = "Newest first")
    public Response listUsers(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                              @QueryParam("limit") Integer limit,
                              @QueryParam("skip") Integer skip) {
        requireAdmin(authorization);
        return ApiResponses.respond(PageRequest.of(limit, skip).flatMap(userService::listUsers),
            Status.OK, "Users retrieved successfully");
    }

    private AuthenticatedPrincipal requireAdmin(String authorization) {
        return AccessRules.admin().enforce(authenticationGuard.authenticate(authorization));
    }
}
