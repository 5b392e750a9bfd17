package tech.automator.platform.shared;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

/**
 * Converts service results into JAX-RS responses carrying the {@link ApiResponse} envelope.
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    public static <T> Response respond(ServiceResult<T> result, Status successStatus, String message) {
        if (result instanceof ServiceResult.Success<T> success) {
            return Response.status(successStatus)
                .entity(ApiResponse.ok(successStatus.getStatusCode(), message, success.value()))
                .build();
        }
        return failure((ServiceResult.Failure<T>) result);
    }

    /**
     * 204 with no body on success, the error envelope otherwise.
     */
    public static Response noContent(ServiceResult<?> result) {
        if (result instanceof ServiceResult.Failure<?> failure) {
            return failure(failure);
        }
        return Response.noContent().build();
    }

    public static Response failure(ServiceResult.Failure<?> failure) {
        ErrorCode code = failure.code();
        return Response.status(code.status())
            .entity(ApiResponse.error(code.status().getStatusCode(), code.message(), failure.errors()))
            .build();
    }

    public static Response error(ErrorCode code) {
        return Response.status(code.status()).entity(ApiResponse.error(code)).build();
    }
}
