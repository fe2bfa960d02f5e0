package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import aicodex.experiences.data.models.User;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Public profile of a user with statistics and experiences.
 *
 * @param id
 *            User UUID
 * @param username
 *            Display name
 * @param avatarUrl
 *            Avatar URL (nullable)
 * @param bio
 *            Biography (nullable)
 * @param githubUsername
 *            GitHub login
 * @param createdAt
 *            Account creation timestamp
 * @param stats
 *            Contribution statistics
 * @param experiences
 *            Live experiences, newest first, descriptions truncated
 */
public record UserProfileType(@JsonProperty("id") UUID id, @JsonProperty("username") String username,
        @JsonProperty("avatar_url") String avatarUrl, @JsonProperty("bio") String bio,
        @JsonProperty("github_username") String githubUsername, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("stats") UserStatsType stats,
        @JsonProperty("experiences") List<ExperienceSummaryType> experiences) {

    public static UserProfileType fromEntity(User user, UserStatsType stats, List<ExperienceSummaryType> experiences) {
        return new UserProfileType(user.id, user.username, user.avatarUrl, user.bio, user.githubUsername,
                user.createdAt, stats, experiences);
    }
}
