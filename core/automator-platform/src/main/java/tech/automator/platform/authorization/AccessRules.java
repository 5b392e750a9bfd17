package tech.automator.platform.authorization;

import tech.automator.platform.authentication.AuthenticatedPrincipal;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Factory for the standard access rules.
 */
public final class AccessRules {

    private AccessRules() {
    }

    /**
     * Passes if the principal holds at least one of the given roles.
     */
    public static AccessRule hasAnyRole(String... roles) {
        List<String> required = List.of(roles);
        return principal -> intersects(principal.roles(), required)
            ? null
            : "user " + principal.userId() + " lacks roles " + required;
    }

    /**
     * Passes if the principal belongs to exactly this organization.
     */
    public static AccessRule inOrganization(String orgId) {
        return principal -> orgId != null && Objects.equals(principal.orgId(), orgId)
            ? null
            : "user " + principal.userId() + " is not in organization " + orgId;
    }

    /**
     * Passes if the principal belongs to at least one of the given business units.
     */
    public static AccessRule inAnyBusinessUnit(String... businessUnitIds) {
        List<String> required = List.of(businessUnitIds);
        return principal -> intersects(principal.businessUnitIds(), required)
            ? null
            : "user " + principal.userId() + " is not in business units " + required;
    }

    /**
     * Organization match first, then role membership.
     */
    public static AccessRule orgAndRoles(String orgId, String... roles) {
        return inOrganization(orgId).and(hasAnyRole(roles));
    }

    public static AccessRule admin() {
        return hasAnyRole(AuthenticatedPrincipal.ADMIN_ROLE);
    }

    private static boolean intersects(Collection<String> held, Collection<String> required) {
        for (String value : required) {
            if (held.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
