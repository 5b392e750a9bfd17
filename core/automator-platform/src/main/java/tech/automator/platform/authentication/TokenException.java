package tech.automator.platform.authentication;

/**
 * A presented token was rejected. Subclasses identify why, for server-side logging.
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract AuthenticationException.Reason reason();
}
