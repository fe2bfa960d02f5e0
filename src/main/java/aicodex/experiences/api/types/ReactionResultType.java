package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response to adding or withdrawing a reaction.
 *
 * @param message
 *            Human-readable outcome
 * @param reaction
 *            Affected reaction
 * @param reactionCount
 *            Live reactions on the experience, all types
 * @param reactionCounts
 *            Live reactions per type
 */
public record ReactionResultType(@JsonProperty("message") String message,
        @JsonProperty("reaction") ReactionItem reaction, @JsonProperty("reaction_count") int reactionCount,
        @JsonProperty("reaction_counts") Map<String, Long> reactionCounts) {

    /**
     * @param id
     *            Reaction UUID
     * @param experienceId
     *            Experience reacted to
     * @param reactionType
     *            Lowercase type
     * @param createdAt
     *            Time the reaction became live
     * @param user
     *            Reacting user
     */
    public record ReactionItem(@JsonProperty("id") UUID id, @JsonProperty("experience_id") UUID experienceId,
            @JsonProperty("reaction_type") String reactionType, @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("user") AuthorType user) {

        public static ReactionItem fromEntity(Reaction reaction, User user) {
            return new ReactionItem(reaction.id, reaction.experienceId, reaction.reactionType, reaction.createdAt,
                    AuthorType.fromEntity(user));
        }
    }
}
