package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request to rate a prompt.
 *
 * <p>
 * The rating is kept as a raw JSON node so that strings, decimals and booleans reach {@code InteractionService} and
 * fail as validation errors instead of being coerced by Jackson.
 *
 * @param rating
 *            Integer 1-5
 */
public record RatingRequestType(@JsonProperty("rating") JsonNode rating) {
}
