package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tag usage count within a user's experiences.
 *
 * @param tag
 *            Normalized tag
 * @param count
 *            Number of the user's live experiences carrying the tag
 */
public record TagCountType(@JsonProperty("tag") String tag, @JsonProperty("count") long count) {
}
