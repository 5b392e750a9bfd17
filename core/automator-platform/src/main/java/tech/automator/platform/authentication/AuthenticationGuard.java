package tech.automator.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Turns an {@code Authorization: Bearer <token>} header into an {@link AuthenticatedPrincipal}.
 *
 * Every failure surfaces to the client as the same 401. The specific reason is
 * carried on the exception and logged by the exception mapper.
 */
@ApplicationScoped
public class AuthenticationGuard {

    private static final Logger LOG = Logger.getLogger(AuthenticationGuard.class);

    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    TokenService tokenService;

    /**
     * @throws AuthenticationException if the header is missing or malformed, or the token is rejected
     */
    public AuthenticatedPrincipal authenticate(String authorizationHeader) {
        String token = extractBearerToken(authorizationHeader)
            .orElseThrow(() -> new AuthenticationException(
                AuthenticationException.Reason.MISSING_CREDENTIALS, "Missing or malformed Authorization header"));

        try {
            DecodedToken decoded = tokenService.decodeAccess(token);
            return new AuthenticatedPrincipal(
                decoded.subject(),
                decoded.roles(),
                decoded.orgId(),
                decoded.businessUnitIds(),
                decoded.claims());
        } catch (TokenException e) {
            throw new AuthenticationException(e.reason(), e.getMessage(), e);
        }
    }

    /**
     * Same decode path as {@link #authenticate(String)}, but yields empty instead of failing.
     */
    public Optional<AuthenticatedPrincipal> authenticateOptional(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(authenticate(authorizationHeader));
        } catch (AuthenticationException e) {
            LOG.debugf("Optional authentication ignored credentials [%s]", e.reason());
            return Optional.empty();
        }
    }

    /**
     * Extract the raw token from a bearer header. The scheme is matched case-insensitively.
     */
    public static Optional<String> extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String header = authorizationHeader.trim();
        if (header.length() <= BEARER_PREFIX.length()
            || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
