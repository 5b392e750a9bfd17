package tech.automator.platform.authentication;

/**
 * Bad signature, issuer, audience or algorithm, or a malformed token.
 */
public class TokenInvalidException extends TokenException {

    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public AuthenticationException.Reason reason() {
        return AuthenticationException.Reason.TOKEN_INVALID;
    }
}
