package aicodex.experiences.api.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.persistence.PersistenceException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import aicodex.experiences.api.types.ErrorResponseType;
import aicodex.experiences.exceptions.AuthenticationException;
import aicodex.experiences.exceptions.AuthorizationException;
import aicodex.experiences.exceptions.DuplicateResourceException;
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.exceptions.ValidationException;

/**
 * Renders every failure as {@code {"code": KIND, "error": message}}.
 *
 * <p>
 * Internal errors are logged with their stack trace and answered with a generic message. Security exceptions raised
 * by Quarkus keep their built-in mappers, which are more specific than {@link RuntimeException}.
 */
public class ApiExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ApiExceptionMappers.class);

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String AUTHENTICATION_ERROR = "AUTHENTICATION_ERROR";
    static final String AUTHORIZATION_ERROR = "AUTHORIZATION_ERROR";
    static final String NOT_FOUND = "NOT_FOUND";
    static final String CONFLICT = "CONFLICT";
    static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ServerExceptionMapper
    public Response mapValidation(ValidationException e) {
        return error(Response.Status.BAD_REQUEST, VALIDATION_ERROR, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapConstraintViolation(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream().map(ConstraintViolation::getMessage).sorted()
                .findFirst().orElse("Validation failed");
        return error(Response.Status.BAD_REQUEST, VALIDATION_ERROR, message);
    }

    @ServerExceptionMapper
    public Response mapMalformedJson(JsonProcessingException e) {
        LOG.debugf("Malformed request body: %s", e.getOriginalMessage());
        return error(Response.Status.BAD_REQUEST, VALIDATION_ERROR, "Malformed request body");
    }

    @ServerExceptionMapper
    public Response mapAuthentication(AuthenticationException e) {
        return error(Response.Status.UNAUTHORIZED, AUTHENTICATION_ERROR, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapAuthorization(AuthorizationException e) {
        return error(Response.Status.FORBIDDEN, AUTHORIZATION_ERROR, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapNotFound(ResourceNotFoundException e) {
        return error(Response.Status.NOT_FOUND, NOT_FOUND, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapDuplicate(DuplicateResourceException e) {
        return error(Response.Status.CONFLICT, CONFLICT, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapWebApplication(WebApplicationException e) {
        int status = e.getResponse().getStatus();
        String code = switch (status) {
            case 400 -> VALIDATION_ERROR;
            case 401 -> AUTHENTICATION_ERROR;
            case 403 -> AUTHORIZATION_ERROR;
            case 404 -> NOT_FOUND;
            case 405 -> METHOD_NOT_ALLOWED;
            case 409 -> CONFLICT;
            default -> status >= 500 ? INTERNAL_ERROR : VALIDATION_ERROR;
        };
        String message = e.getMessage();
        if (status >= 500) {
            LOG.errorf(e, "Request failed with status %d", status);
            message = "Internal server error";
        }
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(new ErrorResponseType(code, message))
                .build();
    }

    @ServerExceptionMapper
    public Response mapPersistence(PersistenceException e) {
        LOG.errorf(e, "Persistence failure");
        return error(Response.Status.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error");
    }

    @ServerExceptionMapper
    public Response mapUnexpected(RuntimeException e) {
        LOG.errorf(e, "Unexpected failure");
        return error(Response.Status.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error");
    }

    private static Response error(Response.Status status, String code, String message) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(new ErrorResponseType(code, message))
                .build();
    }
}
