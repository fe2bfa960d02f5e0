package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Outcome of restoring a soft-deleted user or experience.
 *
 * @param message
 *            Human-readable result
 * @param id
 *            Restored user or experience UUID
 * @param experiences
 *            Experiences brought back
 * @param prompts
 *            Prompts brought back
 * @param comments
 *            Comments brought back
 * @param reactions
 *            Reactions brought back
 * @param ratings
 *            Prompt ratings brought back
 */
public record RestoreResultType(@JsonProperty("message") String message, @JsonProperty("id") UUID id,
        @JsonProperty("experiences") int experiences, @JsonProperty("prompts") int prompts,
        @JsonProperty("comments") int comments, @JsonProperty("reactions") int reactions,
        @JsonProperty("ratings") int ratings) {
}
