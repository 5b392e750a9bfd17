package tech.automator.platform.authentication;

/**
 * A valid token of the wrong kind, such as a refresh token presented as an access token.
 */
public class TokenTypeMismatchException extends TokenException {

    public TokenTypeMismatchException(TokenType expected, Object actual) {
        super("Expected " + expected.claimValue() + " token but got " + actual);
    }

    @Override
    public AuthenticationException.Reason reason() {
        return AuthenticationException.Reason.TOKEN_TYPE_MISMATCH;
    }
}
