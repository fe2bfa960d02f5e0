package aicodex.experiences.services;

/**
 * Response body of an upsert plus whether it created a row, so the resource can answer 201 or 200.
 *
 * @param body
 *            response body
 * @param created
 *            true when a new row became live
 * @param <T>
 *            body type
 */
public record InteractionResult<T>(T body, boolean created) {
}
