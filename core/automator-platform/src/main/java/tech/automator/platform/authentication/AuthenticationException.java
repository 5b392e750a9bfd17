package tech.automator.platform.authentication;

/**
 * Request could not be authenticated.
 *
 * Clients always receive the same 401 envelope; {@link #reason()} is for server logs only.
 */
public class AuthenticationException extends RuntimeException {

    public enum Reason {
        MISSING_CREDENTIALS,
        TOKEN_EXPIRED,
        TOKEN_INVALID,
        TOKEN_TYPE_MISMATCH,
        UNKNOWN_PRINCIPAL
    }

    private final Reason reason;

    public AuthenticationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
