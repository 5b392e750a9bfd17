package tech.automator.platform.authentication;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.automator.platform.config.SecurityConfig;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues and verifies HMAC-signed JWT access and refresh tokens.
 *
 * <p>Claim set:
 * <pre>
 * { "user_id", "roles" (access only), "token_type", "iat", "exp", "iss", "aud",
 *   "org_id" (optional), "business_units" (optional) }
 * </pre>
 *
 * <p>Refresh tokens never carry roles. A refreshed access token takes its roles from
 * the caller, which is expected to look them up fresh, so role changes apply on the
 * next refresh.
 *
 * <p>Expiry is checked against {@link #clock} with no leeway.
 */
@ApplicationScoped
public class TokenService {

    private static final Logger LOG = Logger.getLogger(TokenService.class);

    public static final String CLAIM_USER_ID = "user_id";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_TOKEN_TYPE = "token_type";
    public static final String CLAIM_ORG_ID = "org_id";
    public static final String CLAIM_BUSINESS_UNITS = "business_units";

    @Inject
    SecurityConfig config;

    Clock clock = Clock.systemUTC();

    private SecretKey signingKey;
    private SignatureAlgorithm algorithm;
    private Duration accessTtl;
    private Duration refreshTtl;

    /**
     * Derive the signing key. Fails startup on a missing, weak or non-HMAC configuration.
     */
    @PostConstruct
    void init() {
        SecurityConfig.Jwt jwt = config.jwt();
        String secret = jwt.secretKey();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("automator.security.jwt.secret-key must be set");
        }

        try {
            algorithm = SignatureAlgorithm.forName(jwt.algorithm());
            if (!algorithm.isHmac()) {
                throw new IllegalStateException("Only HMAC signing algorithms are supported, got " + jwt.algorithm());
            }
            signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
            algorithm.assertValidSigningKey(signingKey);
        } catch (JwtException e) {
            throw new IllegalStateException("Invalid JWT signing configuration: " + e.getMessage(), e);
        }

        accessTtl = Duration.ofMinutes(jwt.accessTokenExpireMinutes());
        refreshTtl = Duration.ofDays(jwt.refreshTokenExpireDays());
        LOG.infof("Token service initialized [algorithm=%s, accessTtl=%s, refreshTtl=%s]",
            algorithm.getValue(), accessTtl, refreshTtl);
    }

    // ==================== Issuance ====================

    /**
     * @throws TokenIssuanceException if signing fails
     */
    public String issueAccess(String subject, Collection<String> roles, String orgId,
                              List<String> businessUnitIds, Map<String, Object> extraClaims) {
        List<String> roleClaim = roles != null ? List.copyOf(roles) : List.of();
        return issue(TokenType.ACCESS, subject, roleClaim, orgId, businessUnitIds, extraClaims, accessTtl);
    }

    /**
     * @throws TokenIssuanceException if signing fails
     */
    public String issueRefresh(String subject, String orgId, List<String> businessUnitIds,
                               Map<String, Object> extraClaims) {
        return issue(TokenType.REFRESH, subject, null, orgId, businessUnitIds, extraClaims, refreshTtl);
    }

    /**
     * Issue a new access token for the subject of a refresh token, carrying {@code currentRoles}
     * and the organization and business units recorded in the refresh token.
     *
     * @throws TokenException if the refresh token is rejected
     */
    public String refreshAccess(String refreshToken, Collection<String> currentRoles) {
        DecodedToken refresh = decodeRefresh(refreshToken);
        return issueAccess(refresh.subject(), currentRoles, refresh.orgId(), refresh.businessUnitIds(), null);
    }

    private String issue(TokenType type, String subject, List<String> roles, String orgId,
                         List<String> businessUnitIds, Map<String, Object> extraClaims, Duration ttl) {
        Map<String, Object> claims = new LinkedHashMap<>();
        if (extraClaims != null) {
            claims.putAll(extraClaims);
        }
        claims.put(CLAIM_USER_ID, subject);
        claims.remove(CLAIM_ROLES);
        if (roles != null) {
            claims.put(CLAIM_ROLES, roles);
        }
        claims.put(CLAIM_TOKEN_TYPE, type.claimValue());
        if (orgId != null) {
            claims.put(CLAIM_ORG_ID, orgId);
        }
        if (businessUnitIds != null && !businessUnitIds.isEmpty()) {
            claims.put(CLAIM_BUSINESS_UNITS, List.copyOf(businessUnitIds));
        }

        Instant now = clock.instant();
        try {
            return Jwts.builder()
                .setClaims(claims)
                .setIssuer(config.jwt().issuer())
                .setAudience(config.jwt().audience())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, algorithm)
                .compact();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenIssuanceException("Failed to sign " + type.claimValue() + " token", e);
        }
    }

    // ==================== Verification ====================

    /**
     * @throws TokenExpiredException      if the token has expired
     * @throws TokenInvalidException      if signature, issuer, audience or structure is wrong
     * @throws TokenTypeMismatchException if the token is not an access token
     */
    public DecodedToken decodeAccess(String token) {
        return decode(token, TokenType.ACCESS);
    }

    /**
     * Refresh-token counterpart of {@link #decodeAccess(String)}.
     */
    public DecodedToken decodeRefresh(String token) {
        return decode(token, TokenType.REFRESH);
    }

    public long accessTokenTtlSeconds() {
        return accessTtl.toSeconds();
    }

    private DecodedToken decode(String token, TokenType expected) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Token is empty");
        }

        Jws<Claims> jws;
        try {
            jws = parser().parseClaimsJws(token);
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenInvalidException("Token failed verification: " + e.getClass().getSimpleName(), e);
        }

        if (!algorithm.getValue().equals(jws.getHeader().getAlgorithm())) {
            throw new TokenInvalidException("Unexpected signing algorithm " + jws.getHeader().getAlgorithm());
        }

        Claims claims = jws.getBody();
        Object type = claims.get(CLAIM_TOKEN_TYPE);
        if (!expected.claimValue().equals(type)) {
            throw new TokenTypeMismatchException(expected, type);
        }

        Object subject = claims.get(CLAIM_USER_ID);
        if (!(subject instanceof String userId) || userId.isBlank()) {
            throw new TokenInvalidException("Token has no user_id claim");
        }

        return new DecodedToken(
            userId,
            expected,
            stringList(claims.get(CLAIM_ROLES)),
            claims.get(CLAIM_ORG_ID) instanceof String orgId ? orgId : null,
            stringList(claims.get(CLAIM_BUSINESS_UNITS)),
            claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
            claims.getExpiration() != null ? claims.getExpiration().toInstant() : null,
            new LinkedHashMap<>(claims)
        );
    }

    private JwtParser parser() {
        return Jwts.parserBuilder()
            .setSigningKey(signingKey)
            .requireIssuer(config.jwt().issuer())
            .requireAudience(config.jwt().audience())
            .setClock(() -> Date.from(clock.instant()))
            .build();
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        return items.stream()
            .filter(String.class::isInstance)
            .map(String.class::cast)
            .toList();
    }
}
