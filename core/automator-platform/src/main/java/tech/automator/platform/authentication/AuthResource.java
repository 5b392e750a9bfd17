package tech.automator.platform.authentication;

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
import tech.automator.platform.principal.UserRequest;
import tech.automator.platform.shared.ApiResponses;

/**
 * Authentication endpoints: login, token refresh, logout, current user and registration.
 */
@Path("/auth")
@Tag(name = "Authentication", description = "User authentication endpoints")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    @Inject
    AuthService authService;

    @Inject
    AuthenticationGuard authenticationGuard;

    @POST
    @Path("/login")
    @Operation(summary = "Login with email and password")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Login successful"),
        @APIResponse(responseCode = "400", description = "Missing credentials or malformed email"),
        @APIResponse(responseCode = "401", description = "Invalid credentials"),
        @APIResponse(responseCode = "403", description = "Account cannot log in")
    })
    public Response login(AuthService.LoginRequest request) {
        return ApiResponses.respond(authService.login(request), Status.OK, "Login successful");
    }

    /**
     * The bearer credential on this endpoint is the refresh token, not an access token.
     */
    @POST
    @Path("/refresh")
    @Operation(summary = "Exchange a refresh token for a new access token")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Token refreshed"),
        @APIResponse(responseCode = "401", description = "Refresh token rejected")
    })
    public Response refresh(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        String refreshToken = AuthenticationGuard.extractBearerToken(authorization)
            .orElseThrow(() -> new AuthenticationException(
                AuthenticationException.Reason.MISSING_CREDENTIALS, "Missing refresh token"));
        return ApiResponses.respond(authService.refresh(refreshToken), Status.OK, "Token refreshed successfully");
    }

    @DELETE
    @Path("/logout")
    @Operation(summary = "Logout the current user")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Logged out"),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response logout(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        AuthenticatedPrincipal principal = authenticationGuard.authenticate(authorization);
        return ApiResponses.noContent(authService.logout(principal));
    }

    @GET
    @Path("/me")
    @Operation(summary = "Get the current user")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Current user"),
        @APIResponse(responseCode = "401", description = "Not authenticated")
    })
    public Response me(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        AuthenticatedPrincipal principal = authenticationGuard.authenticate(authorization);
        return ApiResponses.respond(authService.me(principal), Status.OK, "User retrieved successfully");
    }

    @POST
    @Path("/register")
    @Operation(summary = "Register a new user",
        description = "Anonymous callers get the default role; an admin caller may assign roles")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "User registered"),
        @APIResponse(responseCode = "400", description = "Validation failed or user already exists")
    })
    public Response register(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, UserRequest request) {
        return ApiResponses.respond(
            authService.register(request, authenticationGuard.authenticateOptional(authorization)),
            Status.CREATED, "User registered successfully");
    }
}
