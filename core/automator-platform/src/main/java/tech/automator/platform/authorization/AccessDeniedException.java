package tech.automator.platform.authorization;

/**
 * Authenticated caller failed an access rule. Mapped to a generic 403.
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
