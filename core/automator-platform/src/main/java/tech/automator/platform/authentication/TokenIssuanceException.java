package tech.automator.platform.authentication;

public class TokenIssuanceException extends RuntimeException {

    public TokenIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
