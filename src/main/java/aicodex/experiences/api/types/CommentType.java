package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.User;

import java.time.Instant;
import java.util.UUID;

/**
 * Comment with its author.
 *
 * @param id
 *            Comment UUID
 * @param experienceId
 *            Experience commented on
 * @param content
 *            Comment text
 * @param createdAt
 *            Creation timestamp
 * @param user
 *            Author
 */
public record CommentType(@JsonProperty("id") UUID id, @JsonProperty("experience_id") UUID experienceId,
        @JsonProperty("content") String content, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("user") AuthorType user) {

    public static CommentType fromEntity(Comment comment, User author) {
        return new CommentType(comment.id, comment.experienceId, comment.content, comment.createdAt,
                AuthorType.fromEntity(author));
    }
}
