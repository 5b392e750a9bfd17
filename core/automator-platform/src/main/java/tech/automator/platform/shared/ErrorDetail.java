package tech.automator.platform.shared;

/**
 * One entry of the {@code errors} array in the response envelope.
 */
public record ErrorDetail(String code, String message, String field) {

    public static ErrorDetail of(ErrorCode code) {
        return new ErrorDetail(code.name(), code.message(), code.field());
    }

    public static ErrorDetail of(ErrorCode code, String field) {
        return new ErrorDetail(code.name(), code.message(), field);
    }

    public static ErrorDetail of(ErrorCode code, String message, String field) {
        return new ErrorDetail(code.name(), message, field);
    }
}
