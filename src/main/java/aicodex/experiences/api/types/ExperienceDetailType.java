package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Full experience view: scalar fields, author, prompts, comments and per-type reaction counts.
 *
 * @param id
 *            Experience UUID
 * @param title
 *            Title
 * @param description
 *            Full description
 * @param aiAssistantType
 *            AI assistant wire value
 * @param tags
 *            Normalized tags
 * @param githubUrls
 *            Repository URLs
 * @param isNews
 *            News flag
 * @param averageRating
 *            Mean of the rated prompts' averages
 * @param reactionCount
 *            Live reactions, all types
 * @param commentCount
 *            Live comments
 * @param promptCount
 *            Live prompts
 * @param createdAt
 *            Creation timestamp
 * @param updatedAt
 *            Last update timestamp
 * @param user
 *            Author
 * @param prompts
 *            Live prompts by order index
 * @param comments
 *            Live comments, newest first
 * @param reactionCounts
 *            Live reactions per type, types without reactions omitted
 */
public record ExperienceDetailType(@JsonProperty("id") UUID id, @JsonProperty("title") String title,
        @JsonProperty("description") String description, @JsonProperty("ai_assistant_type") String aiAssistantType,
        @JsonProperty("tags") List<String> tags, @JsonProperty("github_urls") List<String> githubUrls,
        @JsonProperty("is_news") boolean isNews, @JsonProperty("average_rating") double averageRating,
        @JsonProperty("reaction_count") int reactionCount, @JsonProperty("comment_count") int commentCount,
        @JsonProperty("prompt_count") int promptCount, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt, @JsonProperty("user") AuthorType user,
        @JsonProperty("prompts") List<PromptType> prompts, @JsonProperty("comments") List<CommentType> comments,
        @JsonProperty("reaction_counts") Map<String, Long> reactionCounts) {
}
