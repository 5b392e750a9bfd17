package tech.automator.platform.authentication;

public class TokenExpiredException extends TokenException {

    public TokenExpiredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public AuthenticationException.Reason reason() {
        return AuthenticationException.Reason.TOKEN_EXPIRED;
    }
}
