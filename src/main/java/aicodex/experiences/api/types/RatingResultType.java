package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.User;

import java.time.Instant;
import java.util.UUID;

/**
 * Response to a prompt rating.
 *
 * @param message
 *            Human-readable outcome
 * @param rating
 *            Stored rating
 * @param promptStats
 *            Refreshed prompt aggregates
 * @param experienceStats
 *            Refreshed experience aggregate
 */
public record RatingResultType(@JsonProperty("message") String message, @JsonProperty("rating") RatingItem rating,
        @JsonProperty("prompt_stats") PromptStats promptStats,
        @JsonProperty("experience_stats") ExperienceStats experienceStats) {

    public record RatingItem(@JsonProperty("id") UUID id, @JsonProperty("prompt_id") UUID promptId,
            @JsonProperty("rating") int rating, @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt, @JsonProperty("user") AuthorType user) {

        public static RatingItem fromEntity(PromptRating rating, User user) {
            return new RatingItem(rating.id, rating.promptId, rating.rating, rating.createdAt, rating.updatedAt,
                    AuthorType.fromEntity(user));
        }
    }

    public record PromptStats(@JsonProperty("average_rating") double averageRating,
            @JsonProperty("rating_count") int ratingCount) {
    }

    public record ExperienceStats(@JsonProperty("average_rating") double averageRating) {
    }
}
