package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import aicodex.experiences.data.models.User;

import java.util.UUID;

/**
 * Public author block embedded in experiences and comments.
 *
 * @param id
 *            User UUID
 * @param username
 *            Display name
 * @param avatarUrl
 *            Avatar URL (nullable)
 */
public record AuthorType(@JsonProperty("id") UUID id, @JsonProperty("username") String username,
        @JsonProperty("avatar_url") String avatarUrl) {

    public static AuthorType fromEntity(User user) {
        if (user == null) {
            return null;
        }
        return new AuthorType(user.id, user.username, user.avatarUrl);
    }
}
