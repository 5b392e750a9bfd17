package tech.automator.platform.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.mongodb.MongoException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import tech.automator.platform.authentication.AuthenticationException;
import tech.automator.platform.authorization.AccessDeniedException;

import java.util.List;

/**
 * Converts every exception that reaches the REST layer into the response envelope.
 * Causes of 5xx responses are logged here and never returned to the client.
 */
public class ApiExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ApiExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapAuthentication(AuthenticationException e) {
        LOG.warnf("Authentication rejected [%s]: %s", e.reason(), e.getMessage());
        return ApiResponses.error(ErrorCode.INVALID_TOKEN);
    }

    @ServerExceptionMapper
    public Response mapAccessDenied(AccessDeniedException e) {
        LOG.debugf("Access denied: %s", e.getMessage());
        return ApiResponses.error(ErrorCode.ACCESS_DENIED);
    }

    @ServerExceptionMapper
    public Response mapUnknownProperty(UnrecognizedPropertyException e) {
        String field = e.getPropertyName();
        LOG.debugf("Rejected unknown request field: %s", field);
        ErrorDetail detail = ErrorDetail.of(ErrorCode.INVALID_FIELD,
            "Field '" + field + "' is not allowed", field);
        return ApiResponses.failure(new ServiceResult.Failure<>(ErrorCode.INVALID_FIELD, List.of(detail)));
    }

    @ServerExceptionMapper
    public Response mapMalformedJson(JsonProcessingException e) {
        LOG.debugf("Malformed request body: %s", e.getOriginalMessage());
        return ApiResponses.error(ErrorCode.INVALID_REQUEST_BODY);
    }

    @ServerExceptionMapper
    public Response mapStoreFailure(MongoException e) {
        LOG.errorf(e, "Database operation failed (code %d)", e.getCode());
        return ApiResponses.error(ErrorCode.DATABASE_ERROR);
    }

    @ServerExceptionMapper
    public Response mapWebApplication(WebApplicationException e) {
        int status = e.getResponse().getStatus();
        if (status >= 500) {
            LOG.errorf(e, "Request failed with status %d", status);
            return ApiResponses.error(ErrorCode.INTERNAL_ERROR);
        }
        String message = e.getResponse().getStatusInfo().getReasonPhrase();
        return Response.status(status)
            .entity(ApiResponse.error(status, message,
                List.of(new ErrorDetail("HTTP_" + status, message, null))))
            .build();
    }

    @ServerExceptionMapper
    public Response mapUnexpected(Exception e) {
        LOG.errorf(e, "Unhandled exception: %s", e.getClass().getName());
        return ApiResponses.error(ErrorCode.INTERNAL_ERROR);
    }
}
