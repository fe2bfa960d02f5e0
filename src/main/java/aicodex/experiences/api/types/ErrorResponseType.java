package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for every failed request.
 *
 * @param code
 *            Machine-readable kind: VALIDATION_ERROR, AUTHENTICATION_ERROR, AUTHORIZATION_ERROR, NOT_FOUND, CONFLICT or
 *            INTERNAL_ERROR
 * @param error
 *            Human-readable message
 */
public record ErrorResponseType(@JsonProperty("code") String code, @JsonProperty("error") String error) {
}
