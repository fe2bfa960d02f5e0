package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Contribution statistics shown on a user's profile.
 *
 * <p>
 * "Received" counts are interactions other users left on this user's live experiences; "given" counts are the user's
 * own interactions anywhere.
 *
 * @param experienceCount
 *            Live experiences authored
 * @param promptCount
 *            Live prompts across those experiences
 * @param totalReactionsReceived
 *            Live reactions on the user's experiences
 * @param totalCommentsReceived
 *            Live comments on the user's experiences
 * @param commentsGiven
 *            Live comments written by the user
 * @param reactionsGiven
 *            Live reactions left by the user
 * @param ratingsGiven
 *            Live prompt ratings given by the user
 * @param averageRatingReceived
 *            Mean of the user's experiences' average ratings, 0 without experiences
 * @param aiAssistantDistribution
 *            Experience count per AI assistant type, every type present
 * @param topTags
 *            Most used tags, highest count first
 */
public record UserStatsType(@JsonProperty("experience_count") long experienceCount,
        @JsonProperty("prompt_count") long promptCount,
        @JsonProperty("total_reactions_received") long totalReactionsReceived,
        @JsonProperty("total_comments_received") long totalCommentsReceived,
        @JsonProperty("comments_given") long commentsGiven, @JsonProperty("reactions_given") long reactionsGiven,
        @JsonProperty("ratings_given") long ratingsGiven,
        @JsonProperty("average_rating_received") double averageRatingReceived,
        @JsonProperty("ai_assistant_distribution") Map<String, Long> aiAssistantDistribution,
        @JsonProperty("top_tags") List<TagCountType> topTags) {
}
