package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Prompt submitted with a new experience or added later.
 *
 * @param content
 *            Prompt text (10-5000 characters)
 * @param context
 *            Optional context note (max 500)
 * @param resultsAchieved
 *            Optional outcome note (max 500)
 */
public record PromptRequestType(
        @JsonProperty("content") @NotBlank(
                message = "Prompt content is required") @Size(
                        min = 10,
                        max = 5000,
                        message = "Prompt content must be between 10 and 5000 characters") String content,
        @JsonProperty("context") @Size(
                max = 500,
                message = "Context must not exceed 500 characters") String context,
        @JsonProperty("results_achieved") @Size(
                max = 500,
                message = "Results achieved must not exceed 500 characters") String resultsAchieved) {
}
