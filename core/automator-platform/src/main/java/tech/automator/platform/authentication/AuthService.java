package tech.automator.platform.authentication;

import com.mongodb.MongoException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.BSONException;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.jboss.logging.Logger;
import tech.automator.platform.principal.PasswordService;
import tech.automator.platform.principal.User;
import tech.automator.platform.principal.UserRepository;
import tech.automator.platform.principal.UserRequest;
import tech.automator.platform.principal.UserService;
import tech.automator.platform.principal.UserView;
import tech.automator.platform.shared.EmailAddresses;
import tech.automator.platform.shared.ErrorCode;
import tech.automator.platform.shared.ServiceResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Login, logout, token refresh and self-service account operations.
 *
 * <p>Login runs a fixed sequence of checks and stops at the first failure:
 * credentials present, email syntax, record lookup, record integrity, active / banned /
 * suspended, organization, email verification, stored hash, password. An unknown email
 * and a wrong password produce the same response.
 *
 * <p>Session bookkeeping ({@code loggedIn}, last login and activity timestamps) is
 * advisory. A failed bookkeeping write after a successful login is logged and ignored.
 */
@ApplicationScoped
public class AuthService {

    private static final Logger LOG = Logger.getLogger(AuthService.class);

    public static final String TOKEN_TYPE_BEARER = "Bearer";

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    TokenService tokenService;

    @Inject
    UserService userService;

    public record LoginRequest(String email, String password) {
    }

    public record LoginResponse(String accessToken, String refreshToken, String tokenType, long expiresIn) {
    }

    public record RefreshResponse(String accessToken, String tokenType, long expiresIn) {
    }

    // ==================== Login ====================

    public ServiceResult<LoginResponse> login(LoginRequest request) {
        if (request == null || isBlank(request.email()) || isBlank(request.password())) {
            LOG.info("Login rejected: missing credentials");
            return ServiceResult.failure(ErrorCode.MISSING_CREDENTIALS);
        }

        String email = EmailAddresses.normalize(request.email());
        if (!EmailAddresses.isValid(email)) {
            LOG.infof("Login rejected: malformed email %s", email);
            return ServiceResult.failure(ErrorCode.INVALID_EMAIL_FORMAT);
        }

        LOG.debugf("Login attempt for email: %s", email);

        Optional<User> found;
        try {
            found = userRepository.findByEmail(email);
        } catch (BSONException | CodecConfigurationException e) {
            LOG.errorf(e, "Stored user record for %s could not be decoded", email);
            return ServiceResult.failure(ErrorCode.USER_DATA_FORMAT_ERROR);
        } catch (MongoException e) {
            LOG.errorf(e, "User lookup failed for %s", email);
            return ServiceResult.failure(ErrorCode.DATABASE_ERROR);
        }

        if (found.isEmpty()) {
            LOG.infof("Login failed: user not found for email %s", email);
            return ServiceResult.failure(ErrorCode.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (user.id == null || user.email == null) {
            LOG.errorf("Stored user record for %s is missing its id or email", email);
            return ServiceResult.failure(ErrorCode.USER_DATA_FORMAT_ERROR);
        }

        Optional<ErrorCode> statusProblem = accountStatusProblem(user);
        if (statusProblem.isPresent()) {
            LOG.infof("Login refused for user %s: %s", user.id, statusProblem.get());
            return ServiceResult.failure(statusProblem.get());
        }

        if (!user.hasOrganization()) {
            LOG.infof("Login refused for user %s: no organization", user.id);
            return ServiceResult.failure(ErrorCode.NO_ORGANIZATION);
        }

        if (!user.emailVerified()) {
            LOG.infof("Login refused for user %s: email not verified", user.id);
            return ServiceResult.failure(ErrorCode.EMAIL_NOT_VERIFIED);
        }

        String passwordHash = user.passwordHash();
        if (passwordHash == null || passwordHash.isBlank()) {
            LOG.errorf("User %s has no stored password hash", user.id);
            return ServiceResult.failure(ErrorCode.ACCOUNT_CONFIG_ERROR);
        }

        if (!passwordService.verify(request.password(), passwordHash)) {
            LOG.infof("Login failed: invalid password for %s", email);
            return ServiceResult.failure(ErrorCode.INVALID_CREDENTIALS);
        }

        if (user.loggedIn) {
            LOG.debugf("User %s already has a session; issuing another", user.id);
        }

        String accessToken;
        String refreshToken;
        try {
            accessToken = tokenService.issueAccess(user.id, user.roles, user.orgId, user.businessUnitIds, null);
            refreshToken = tokenService.issueRefresh(user.id, user.orgId, user.businessUnitIds, null);
        } catch (TokenIssuanceException e) {
            LOG.errorf(e, "Token generation failed for user %s", user.id);
            return ServiceResult.failure(ErrorCode.TOKEN_GENERATION_ERROR);
        }

        recordLogin(user.id);

        LOG.infof("Login successful for user: %s", user.id);
        return ServiceResult.success(new LoginResponse(
            accessToken, refreshToken, TOKEN_TYPE_BEARER, tokenService.accessTokenTtlSeconds()));
    }

    // ==================== Logout ====================

    /**
     * Mark the user logged out. Calling it again for a logged-out user succeeds without a write.
     * Issued access tokens stay valid until they expire.
     */
    public ServiceResult<Void> logout(AuthenticatedPrincipal principal) {
        ServiceResult<User> loaded = loadUser(principal.userId());
        if (!loaded.isSuccess()) {
            return loaded.map(user -> null);
        }
        User user = loaded.value();

        if (!user.loggedIn) {
            LOG.debugf("User %s already logged out", user.id);
            return ServiceResult.success(null);
        }

        try {
            userRepository.markLoggedOut(user.id, Instant.now());
        } catch (MongoException e) {
            LOG.errorf(e, "Failed to record logout for user %s", user.id);
            return ServiceResult.failure(ErrorCode.LOGOUT_FAILED);
        }

        LOG.infof("User %s logged out", user.id);
        return ServiceResult.success(null);
    }

    // ==================== Refresh ====================

    /**
     * Exchange a refresh token for a new access token carrying the user's current roles.
     * The account must still pass the login status checks.
     */
    public ServiceResult<RefreshResponse> refresh(String refreshToken) {
        DecodedToken decoded;
        try {
            decoded = tokenService.decodeRefresh(refreshToken);
        } catch (TokenException e) {
            LOG.warnf("Refresh rejected [%s]: %s", e.reason(), e.getMessage());
            return ServiceResult.failure(ErrorCode.INVALID_TOKEN);
        }

        Optional<User> found;
        try {
            found = userRepository.findByIdOptional(decoded.subject());
        } catch (MongoException e) {
            LOG.errorf(e, "User lookup failed during refresh for %s", decoded.subject());
            return ServiceResult.failure(ErrorCode.DATABASE_ERROR);
        }
        if (found.isEmpty()) {
            LOG.warnf("Refresh rejected [%s]: user %s no longer exists",
                AuthenticationException.Reason.UNKNOWN_PRINCIPAL, decoded.subject());
            return ServiceResult.failure(ErrorCode.INVALID_TOKEN);
        }
        User user = found.get();

        Optional<ErrorCode> statusProblem = accountStatusProblem(user);
        if (statusProblem.isPresent()) {
            LOG.infof("Refresh refused for user %s: %s", user.id, statusProblem.get());
            return ServiceResult.failure(statusProblem.get());
        }

        String accessToken;
        try {
            accessToken = tokenService.refreshAccess(refreshToken, user.roles);
        } catch (TokenException e) {
            LOG.warnf("Refresh rejected [%s]: %s", e.reason(), e.getMessage());
            return ServiceResult.failure(ErrorCode.INVALID_TOKEN);
        } catch (TokenIssuanceException e) {
            LOG.errorf(e, "Token generation failed during refresh for user %s", user.id);
            return ServiceResult.failure(ErrorCode.TOKEN_GENERATION_ERROR);
        }

        LOG.infof("Access token refreshed for user %s", user.id);
        return ServiceResult.success(new RefreshResponse(
            accessToken, TOKEN_TYPE_BEARER, tokenService.accessTokenTtlSeconds()));
    }

    // ==================== Account ====================

    public ServiceResult<UserView> me(AuthenticatedPrincipal principal) {
        return loadUser(principal.userId()).map(UserView::from);
    }

    /**
     * Register a new account. Anonymous and non-admin callers always get the default role
     * and an unverified email; an admin caller may set both.
     */
    public ServiceResult<UserView> register(UserRequest request, Optional<AuthenticatedPrincipal> caller) {
        if (request == null) {
            return ServiceResult.failure(ErrorCode.MISSING_REQUIRED_FIELDS);
        }
        boolean privileged = caller.map(AuthenticatedPrincipal::isAdmin).orElse(false);
        return userService.createUser(request, privileged, privileged ? "admin" : "self_registration");
    }

    // ==================== Helpers ====================

    /**
     * Status checks shared by login and refresh, in their fixed order.
     */
    static Optional<ErrorCode> accountStatusProblem(User user) {
        if (!user.active) {
            return Optional.of(ErrorCode.ACCOUNT_INACTIVE);
        }
        if (user.banned) {
            return Optional.of(ErrorCode.ACCOUNT_BANNED);
        }
        if (user.suspended) {
            return Optional.of(ErrorCode.ACCOUNT_SUSPENDED);
        }
        return Optional.empty();
    }

    private void recordLogin(String userId) {
        try {
            if (userRepository.markLoggedIn(userId, Instant.now()) == 0) {
                LOG.warnf("Login bookkeeping matched no record for user %s", userId);
            }
        } catch (MongoException e) {
            LOG.warnf(e, "Login bookkeeping failed for user %s", userId);
        }
    }

    private ServiceResult<User> loadUser(String userId) {
        Optional<User> found;
        try {
            found = userRepository.findByIdOptional(userId);
        } catch (MongoException e) {
            LOG.errorf(e, "User lookup failed for %s", userId);
            return ServiceResult.failure(ErrorCode.DATABASE_ERROR);
        }
        return found.map(ServiceResult::success)
            .orElseGet(() -> ServiceResult.failure(ErrorCode.USER_NOT_FOUND));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
