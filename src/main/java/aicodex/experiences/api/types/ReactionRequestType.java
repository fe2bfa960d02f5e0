package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to react to an experience.
 *
 * @param reactionType
 *            helpful, creative, educational, innovative, problematic, like or bookmark (case-insensitive)
 */
public record ReactionRequestType(@JsonProperty("reaction_type") String reactionType) {
}
