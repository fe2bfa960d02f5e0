package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to add a comment. Content must be non-blank and at most 1000 characters.
 *
 * @param content
 *            Comment text
 */
public record CommentRequestType(@JsonProperty("content") String content) {
}
