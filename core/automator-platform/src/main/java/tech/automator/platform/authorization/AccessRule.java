package tech.automator.platform.authorization;

import tech.automator.platform.authentication.AuthenticatedPrincipal;

/**
 * A check over an authenticated principal. Rules compose with {@link #and} and {@link #or}.
 */
@FunctionalInterface
public interface AccessRule {

    /**
     * @return the reason for rejection, or null when the principal passes
     */
    String denialReason(AuthenticatedPrincipal principal);

    default boolean permits(AuthenticatedPrincipal principal) {
        return denialReason(principal) == null;
    }

    /**
     * @return the principal unchanged
     * @throws AccessDeniedException if the rule rejects the principal
     */
    default AuthenticatedPrincipal enforce(AuthenticatedPrincipal principal) {
        String reason = denialReason(principal);
        if (reason != null) {
            throw new AccessDeniedException(reason);
        }
        return principal;
    }

    /**
     * Both rules must pass; this one is evaluated first.
     */
    default AccessRule and(AccessRule other) {
        return principal -> {
            String reason = denialReason(principal);
            return reason != null ? reason : other.denialReason(principal);
        };
    }

    default AccessRule or(AccessRule other) {
        return principal -> {
            String reason = denialReason(principal);
            if (reason == null) {
                return null;
            }
            String otherReason = other.denialReason(principal);
            return otherReason == null ? null : reason + "; " + otherReason;
        };
    }
}
