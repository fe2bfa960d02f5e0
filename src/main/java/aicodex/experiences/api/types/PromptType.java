package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import aicodex.experiences.data.models.Prompt;

import java.time.Instant;
import java.util.UUID;

/**
 * Prompt as shown inside an experience.
 *
 * @param id
 *            Prompt UUID
 * @param experienceId
 *            Owning experience
 * @param content
 *            Prompt text
 * @param context
 *            Optional context note
 * @param resultsAchieved
 *            Optional outcome note
 * @param orderIndex
 *            Position within the experience
 * @param averageRating
 *            Mean of live ratings, two decimals
 * @param ratingCount
 *            Number of live ratings
 * @param createdAt
 *            Creation timestamp
 */
public record PromptType(@JsonProperty("id") UUID id, @JsonProperty("experience_id") UUID experienceId,
        @JsonProperty("content") String content, @JsonProperty("context") String context,
        @JsonProperty("results_achieved") String resultsAchieved, @JsonProperty("order_index") int orderIndex,
        @JsonProperty("average_rating") double averageRating, @JsonProperty("rating_count") int ratingCount,
        @JsonProperty("created_at") Instant createdAt) {

    public static PromptType fromEntity(Prompt prompt) {
        return new PromptType(prompt.id, prompt.experienceId, prompt.content, prompt.context, prompt.resultsAchieved,
                prompt.orderIndex, prompt.averageRating, prompt.ratingCount, prompt.createdAt);
    }
}
