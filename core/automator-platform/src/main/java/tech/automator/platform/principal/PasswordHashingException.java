package tech.automator.platform.principal;

/**
 * Password could not be hashed: empty input or a failure of the hashing primitive.
 */
public class PasswordHashingException extends RuntimeException {

    public PasswordHashingException(String message) {
        super(message);
    }

    public PasswordHashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
