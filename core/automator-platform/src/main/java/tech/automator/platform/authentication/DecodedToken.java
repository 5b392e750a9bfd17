package tech.automator.platform.authentication;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Verified contents of a token.
 *
 * @param roles empty for refresh tokens, which never carry roles
 */
public record DecodedToken(
    String subject,
    TokenType type,
    List<String> roles,
    String orgId,
    List<String> businessUnitIds,
    Instant issuedAt,
    Instant expiresAt,
    Map<String, Object> claims
) {
}
