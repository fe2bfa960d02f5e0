package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Private profile of the authenticated user.
 *
 * @param id
 *            User UUID
 * @param username
 *            Display name
 * @param email
 *            Email (nullable)
 * @param avatarUrl
 *            Avatar URL (nullable)
 * @param bio
 *            Biography (nullable)
 * @param githubUsername
 *            GitHub login
 * @param createdAt
 *            Account creation timestamp
 * @param updatedAt
 *            Last profile update
 * @param stats
 *            Contribution statistics
 * @param averageRatingGiven
 *            Mean of the ratings the user gave, 0 when none
 * @param ratingReceivedPerVote
 *            Total rating received divided by the number of ratings (at least 1)
 * @param recentExperiences
 *            Most recent live experiences
 */
public record CurrentUserType(@JsonProperty("id") UUID id, @JsonProperty("username") String username,
        @JsonProperty("email") String email, @JsonProperty("avatar_url") String avatarUrl,
        @JsonProperty("bio") String bio, @JsonProperty("github_username") String githubUsername,
        @JsonProperty("created_at") Instant createdAt, @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("stats") UserStatsType stats, @JsonProperty("average_rating_given") double averageRatingGiven,
        @JsonProperty("rating_received_per_vote") double ratingReceivedPerVote,
        @JsonProperty("recent_experiences") List<ExperienceSummaryType> recentExperiences) {
}
