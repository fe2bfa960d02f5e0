package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to a new comment.
 *
 * @param message
 *            Human-readable outcome
 * @param comment
 *            Stored comment
 * @param commentCount
 *            Live comments on the experience after the insert
 */
public record CommentResultType(@JsonProperty("message") String message, @JsonProperty("comment") CommentType comment,
        @JsonProperty("comment_count") int commentCount) {
}
