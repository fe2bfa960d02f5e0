package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.User;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Experience card as listed in the feed and on profiles.
 *
 * @param id
 *            Experience UUID
 * @param title
 *            Title
 * @param description
 *            Description (profiles truncate it)
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
 *            Author (null on profile listings, where the author is implied)
 */
public record ExperienceSummaryType(@JsonProperty("id") UUID id, @JsonProperty("title") String title,
        @JsonProperty("description") String description, @JsonProperty("ai_assistant_type") String aiAssistantType,
        @JsonProperty("tags") List<String> tags, @JsonProperty("github_urls") List<String> githubUrls,
        @JsonProperty("is_news") boolean isNews, @JsonProperty("average_rating") double averageRating,
        @JsonProperty("reaction_count") int reactionCount, @JsonProperty("comment_count") int commentCount,
        @JsonProperty("prompt_count") int promptCount, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt, @JsonProperty("user") AuthorType user) {

    static final int PROFILE_DESCRIPTION_LENGTH = 200;

    public static ExperienceSummaryType fromEntity(Experience experience, User author) {
        return new ExperienceSummaryType(experience.id, experience.title, experience.description,
                experience.aiAssistantType, experience.getTagList(), experience.getGithubUrlList(), experience.isNews,
                experience.averageRating, experience.reactionCount, experience.commentCount, experience.promptCount,
                experience.createdAt, experience.updatedAt, AuthorType.fromEntity(author));
    }

    /**
     * Profile listing variant: no author block, description cut to 200 characters.
     */
    public static ExperienceSummaryType forProfile(Experience experience) {
        String description = experience.description;
        if (description != null && description.length() > PROFILE_DESCRIPTION_LENGTH) {
            description = description.substring(0, PROFILE_DESCRIPTION_LENGTH);
        }
        return new ExperienceSummaryType(experience.id, experience.title, description, experience.aiAssistantType,
                experience.getTagList(), experience.getGithubUrlList(), experience.isNews, experience.averageRating,
                experience.reactionCount, experience.commentCount, experience.promptCount, experience.createdAt,
                experience.updatedAt, null);
    }
}
