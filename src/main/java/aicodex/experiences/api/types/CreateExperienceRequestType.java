package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request to publish an experience.
 *
 * <p>
 * Length limits are enforced by Bean Validation; assistant type, tag and URL rules by {@code ExperienceService}.
 *
 * @param title
 *            Title (5-200 characters)
 * @param description
 *            Description (20-2000 characters)
 * @param aiAssistantType
 *            github-copilot, claude, gpt, cursor or other
 * @param tags
 *            Free-form tags, normalized on write
 * @param githubUrls
 *            At least one GitHub repository URL
 * @param isNews
 *            Optional news flag
 * @param prompts
 *            Optional prompts, stored in submission order
 */
public record CreateExperienceRequestType(@JsonProperty("title") @NotBlank(
        message = "Title is required") @Size(
                min = 5,
                max = 200,
                message = "Title must be between 5 and 200 characters") String title,
        @JsonProperty("description") @NotBlank(
                message = "Description is required") @Size(
                        min = 20,
                        max = 2000,
                        message = "Description must be between 20 and 2000 characters") String description,
        @JsonProperty("ai_assistant_type") @NotBlank(
                message = "AI assistant type is required") String aiAssistantType,
        @JsonProperty("tags") List<String> tags, @JsonProperty("github_urls") @NotEmpty(
                message = "At least one GitHub URL is required") List<String> githubUrls,
        @JsonProperty("is_news") Boolean isNews, @JsonProperty("prompts") List<@Valid PromptRequestType> prompts) {
}
