package aicodex.experiences.services;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.CommentRequestType;
import aicodex.experiences.api.types.CommentResultType;
import aicodex.experiences.api.types.CommentType;
import aicodex.experiences.api.types.RatingRequestType;
import aicodex.experiences.api.types.RatingResultType;
import aicodex.experiences.api.types.ReactionRequestType;
import aicodex.experiences.api.types.ReactionResultType;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.ReactionType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.AuthenticationException;
import aicodex.experiences.exceptions.DuplicateResourceException;
import aicodex.experiences.exceptions.ValidationException;
import aicodex.experiences.observability.InteractionMetrics;

import java.util.UUID;

/**
 * Validates user interactions (comments, reactions, ratings) and hands them to {@link AggregationService}.
 *
 * <p>
 * Every operation requires a resolved caller. Input is validated completely before the first write, so a rejected
 * request leaves no trace. Reactions and ratings follow the configured {@link DuplicatePolicy}; comments always
 * append.
 */
@ApplicationScoped
public class InteractionService {

    private static final Logger LOG = Logger.getLogger(InteractionService.class);

    @Inject
    AggregationService aggregationService;

    @Inject
    InteractionMetrics metrics;

    /**
     * Adds a comment to an experience.
     *
     * @param caller
     *            authenticated user
     * @param experienceId
     *            experience UUID
     * @param request
     *            comment body
     * @return stored comment and the refreshed comment count
     */
    @Transactional
    public CommentResultType addComment(User caller, UUID experienceId, CommentRequestType request) {
        requireCaller(caller);
        String content = request != null ? request.content() : null;

        Comment comment = aggregationService.recordComment(experienceId, caller.id, content);
        metrics.recordInteraction(InteractionMetrics.TYPE_COMMENT, InteractionMetrics.OUTCOME_CREATED);

        Experience experience = Experience.findById(experienceId);
        return new CommentResultType("Comment created successfully", CommentType.fromEntity(comment, caller),
                experience.commentCount);
    }

    /**
     * Adds a reaction, or resolves to the existing one under the upsert policy.
     *
     * @param caller
     *            authenticated user
     * @param experienceId
     *            experience UUID
     * @param request
     *            reaction body
     * @return reaction plus counts, flagged created when a new reaction became live
     */
    @Transactional
    public InteractionResult<ReactionResultType> react(User caller, UUID experienceId, ReactionRequestType request) {
        requireCaller(caller);
        ReactionType type = parseReactionType(request != null ? request.reactionType() : null);

        AggregationService.ReactionOutcome outcome;
        try {
            outcome = aggregationService.recordReaction(experienceId, caller.id, type);
        } catch (DuplicateResourceException e) {
            metrics.recordInteraction(InteractionMetrics.TYPE_REACTION, InteractionMetrics.OUTCOME_REJECTED);
            throw e;
        }

        metrics.recordInteraction(InteractionMetrics.TYPE_REACTION,
                outcome.created() ? InteractionMetrics.OUTCOME_CREATED : InteractionMetrics.OUTCOME_UPDATED);
        String message = outcome.created() ? "Reaction added successfully" : "Reaction updated successfully";
        ReactionResultType body = new ReactionResultType(message,
                ReactionResultType.ReactionItem.fromEntity(outcome.reaction(), caller), outcome.reactionCount(),
                outcome.countsByType());
        return new InteractionResult<>(body, outcome.created());
    }

    /**
     * Withdraws the caller's reaction of one type.
     *
     * @param caller
     *            authenticated user
     * @param experienceId
     *            experience UUID
     * @param rawType
     *            reaction type from the path
     * @return refreshed counts
     */
    @Transactional
    public ReactionResultType removeReaction(User caller, UUID experienceId, String rawType) {
        requireCaller(caller);
        ReactionType type = parseReactionType(rawType);

        AggregationService.ReactionOutcome outcome = aggregationService.removeReaction(experienceId, caller.id, type);
        return new ReactionResultType("Reaction removed successfully",
                ReactionResultType.ReactionItem.fromEntity(outcome.reaction(), caller), outcome.reactionCount(),
                outcome.countsByType());
    }

    /**
     * Rates a prompt, or replaces the caller's earlier rating under the upsert policy.
     *
     * @param caller
     *            authenticated user
     * @param promptId
     *            prompt UUID
     * @param request
     *            rating body
     * @return rating plus refreshed aggregates, flagged created when no earlier rating existed
     */
    @Transactional
    public InteractionResult<RatingResultType> rate(User caller, UUID promptId, RatingRequestType request) {
        requireCaller(caller);
        int rating = parseRating(request != null ? request.rating() : null);

        AggregationService.RatingOutcome outcome;
        try {
            outcome = aggregationService.recordRating(promptId, caller.id, rating);
        } catch (DuplicateResourceException e) {
            metrics.recordInteraction(InteractionMetrics.TYPE_RATING, InteractionMetrics.OUTCOME_REJECTED);
            throw e;
        }

        metrics.recordInteraction(InteractionMetrics.TYPE_RATING,
                outcome.created() ? InteractionMetrics.OUTCOME_CREATED : InteractionMetrics.OUTCOME_UPDATED);
        PromptRating row = outcome.rating();
        String message = outcome.created() ? "Rating added successfully" : "Rating updated successfully";
        RatingResultType body = new RatingResultType(message, RatingResultType.RatingItem.fromEntity(row, caller),
                new RatingResultType.PromptStats(outcome.promptAverageRating(), outcome.promptRatingCount()),
                new RatingResultType.ExperienceStats(outcome.experienceAverageRating()));
        return new InteractionResult<>(body, outcome.created());
    }

    /**
     * Accepts only JSON integers 1-5. Strings, decimals (including {@code 4.0}), booleans and null are rejected.
     *
     * @param node
     *            raw rating value
     * @return rating
     * @throws ValidationException
     *             if the value is not an integer in [1, 5]
     */
    static int parseRating(JsonNode node) {
        if (node == null || node.isNull() || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ValidationException("Rating must be an integer between 1 and 5");
        }
        int rating = node.intValue();
        if (rating < PromptRating.MIN_RATING || rating > PromptRating.MAX_RATING) {
            throw new ValidationException("Rating must be an integer between 1 and 5");
        }
        return rating;
    }

    static ReactionType parseReactionType(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Reaction type is required");
        }
        return ReactionType.fromValue(raw.trim()).orElseThrow(() -> {
            LOG.debugf("Rejected unknown reaction type '%s'", raw);
            return new ValidationException("Invalid reaction type: " + raw);
        });
    }

    private static void requireCaller(User caller) {
        if (caller == null) {
            throw new AuthenticationException("Authentication required");
        }
    }
}
