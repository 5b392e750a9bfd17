package tech.automator.platform.authentication;

import java.util.List;
import java.util.Map;

/**
 * Identity reconstructed from a verified access token, scoped to one request.
 *
 * @param userId          token subject
 * @param roles           role claim, empty when absent
 * @param orgId           organization claim, null when absent
 * @param businessUnitIds business unit claim, empty when absent
 * @param claims          the full decoded claim set
 */
public record AuthenticatedPrincipal(
    String userId,
    List<String> roles,
    String orgId,
    List<String> businessUnitIds,
    Map<String, Object> claims
) {

    public static final String ADMIN_ROLE = "admin";

    public AuthenticatedPrincipal {
        roles = roles != null ? List.copyOf(roles) : List.of();
        businessUnitIds = businessUnitIds != null ? List.copyOf(businessUnitIds) : List.of();
        claims = claims != null ? Map.copyOf(claims) : Map.of();
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean isAdmin() {
        return hasRole(ADMIN_ROLE);
    }
}
