package tech.automator.platform.shared;

import java.util.List;

/**
 * Envelope wrapping every non-empty response body.
 *
 * @param <T> payload type
 */
public record ApiResponse<T>(
    boolean success,
    int statusCode,
    String message,
    T data,
    List<ErrorDetail> errors
) {

    public static <T> ApiResponse<T> ok(int statusCode, String message, T data) {
        return new ApiResponse<>(true, statusCode, message, data, List.of());
    }

    public static <T> ApiResponse<T> error(int statusCode, String message, List<ErrorDetail> errors) {
        return new ApiResponse<>(false, statusCode, message, null, errors);
    }

    public static <T> ApiResponse<T> error(ErrorCode code) {
        return error(code.status().getStatusCode(), code.message(), List.of(ErrorDetail.of(code)));
    }
}
