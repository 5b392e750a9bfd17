package tech.automator.platform.authentication;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.automator.platform.config.TestSecurityConfig;
import tech.automator.platform.shared.ApiExceptionMappers;
import tech.automator.platform.shared.ApiResponse;
import tech.automator.platform.shared.ErrorDetail;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AuthenticationGuard against a real TokenService.
 */
class AuthenticationGuardTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private TokenService tokenService;
    private AuthenticationGuard guard;

    @BeforeEach
    void setUp() {
        tokenService = new TokenService();
        tokenService.config = new TestSecurityConfig();
        tokenService.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        tokenService.init();

        guard = new AuthenticationGuard();
        guard.tokenService = tokenService;
    }

    @Test
    @DisplayName("authenticate should build a principal from a valid access token")
    void authenticate_shouldReturnPrincipal_whenAccessTokenValid() {
        // Arrange
        String token = tokenService.issueAccess("user-7", List.of("user", "admin"), "org-1", List.of("bu-1"), null);

        // Act
        AuthenticatedPrincipal principal = guard.authenticate("Bearer " + token);

        // Assert
        assertThat(principal.userId()).isEqualTo("user-7");
        assertThat(principal.roles()).containsExactlyInAnyOrder("user", "admin");
        assertThat(principal.orgId()).isEqualTo("org-1");
        assertThat(principal.businessUnitIds()).containsExactly("bu-1");
        assertThat(principal.isAdmin()).isTrue();
        assertThat(principal.claims()).containsEntry(TokenService.CLAIM_USER_ID, "user-7");
    }

    @Test
    @DisplayName("authenticate should accept the scheme in any case")
    void authenticate_shouldAcceptLowercaseScheme() {
        String token = tokenService.issueAccess("user-7", List.of("user"), "org-1", null, null);

        assertThat(guard.authenticate("bearer " + token).userId()).isEqualTo("user-7");
    }

    @Test
    @DisplayName("authenticate should reject a missing or non-bearer header")
    void authenticate_shouldThrowMissingCredentials_whenHeaderMissing() {
        assertThatThrownBy(() -> guard.authenticate(null))
            .isInstanceOfSatisfying(AuthenticationException.class,
                e -> assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.MISSING_CREDENTIALS));
        assertThatThrownBy(() -> guard.authenticate("Basic dXNlcjpwYXNz"))
            .isInstanceOfSatisfying(AuthenticationException.class,
                e -> assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.MISSING_CREDENTIALS));
        assertThatThrownBy(() -> guard.authenticate("Bearer "))
            .isInstanceOfSatisfying(AuthenticationException.class,
                e -> assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.MISSING_CREDENTIALS));
    }

    @Test
    @DisplayName("authenticate should reject a refresh token presented as an access token")
    void authenticate_shouldThrowTypeMismatch_whenRefreshTokenPresented() {
        String refresh = tokenService.issueRefresh("user-7", "org-1", null, null);

        assertThatThrownBy(() -> guard.authenticate("Bearer " + refresh))
            .isInstanceOfSatisfying(AuthenticationException.class,
                e -> assertThat(e.reason()).isEqualTo(AuthenticationException.Reason.TOKEN_TYPE_MISMATCH));
    }

    @Test
    @DisplayName("an expired token should carry an expiry reason but produce the same 401 as any other failure")
    void authenticate_shouldProduceUniform401_whenTokenExpired() {
        // Arrange
        String token = tokenService.issueAccess("user-7", List.of("user"), "org-1", null, null);
        tokenService.clock = Clock.fixed(NOW.plus(Duration.ofHours(1)), ZoneOffset.UTC);
        ApiExceptionMappers mappers = new ApiExceptionMappers();

        // Act
        AuthenticationException expired = catchThrowableOfType(
            () -> guard.authenticate("Bearer " + token), AuthenticationException.class);
        AuthenticationException garbage = catchThrowableOfType(
            () -> guard.authenticate("Bearer not.a.token"), AuthenticationException.class);
        Response expiredResponse = mappers.mapAuthentication(expired);
        Response garbageResponse = mappers.mapAuthentication(garbage);

        // Assert
        assertThat(expired.reason()).isEqualTo(AuthenticationException.Reason.TOKEN_EXPIRED);
        assertThat(garbage.reason()).isEqualTo(AuthenticationException.Reason.TOKEN_INVALID);
        assertThat(expiredResponse.getStatus()).isEqualTo(401);
        assertThat(expiredResponse.getEntity()).isEqualTo(garbageResponse.getEntity());
        ApiResponse<?> body = (ApiResponse<?>) expiredResponse.getEntity();
        assertThat(body.success()).isFalse();
        assertThat(body.message()).isEqualTo("Invalid authentication credentials");
        assertThat(body.errors()).extracting(ErrorDetail::code).containsExactly("INVALID_TOKEN");
    }

    @Test
    @DisplayName("authenticateOptional should yield empty when no usable credentials are sent")
    void authenticateOptional_shouldReturnEmpty_whenNoCredentials() {
        assertThat(guard.authenticateOptional(null)).isEmpty();
        assertThat(guard.authenticateOptional("Bearer not.a.token")).isEmpty();
    }

    @Test
    @DisplayName("extractBearerToken should trim the token")
    void extractBearerToken_shouldTrimToken() {
        assertThat(AuthenticationGuard.extractBearerToken("  Bearer   abc.def.ghi  ")).contains("abc.def.ghi");
        assertThat(AuthenticationGuard.extractBearerToken("Token abc")).isEmpty();
    }
}
