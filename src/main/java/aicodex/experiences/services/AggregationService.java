package aicodex.experiences.services;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.ReactionType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.DuplicateResourceException;
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.exceptions.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * AggregationService owns every cached aggregate column and the child writes that invalidate them.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Upsert prompt ratings and reactions (one row per user and target), append comments</li>
 * <li>Recompute {@code Prompt.averageRating/ratingCount} from the live rating rows</li>
 * <li>Recompute {@code Experience.averageRating/promptCount/commentCount/reactionCount} from the live children</li>
 * <li>Recompute {@code User.totalRating/ratingCount} received on the user's prompts</li>
 * </ul>
 *
 * <p>
 * Aggregates are always recomputed from the full live child set, never adjusted by increments, so a recomputation
 * repairs any earlier drift. Averages are stored rounded to two decimals. The child write and the recomputation run in
 * one transaction; a failure in either rolls back both.
 *
 * <p>
 * Concurrency: rating writes lock the prompt row and reaction/comment writes lock the experience row
 * ({@code PESSIMISTIC_WRITE}) so concurrent submissions on the same target serialize and each recomputation sees every
 * committed child.
 */
@ApplicationScoped
@Startup
public class AggregationService {

    private static final Logger LOG = Logger.getLogger(AggregationService.class);

    @ConfigProperty(
            name = "aicodex.interactions.duplicate-policy",
            defaultValue = "upsert")
    String duplicatePolicy;

    DuplicatePolicy policy;

    /**
     * Parses the duplicate policy once at startup so a misconfigured value stops the application from starting.
     *
     * @throws IllegalStateException
     *             if {@code aicodex.interactions.duplicate-policy} names no policy
     */
    @PostConstruct
    void validateConfiguration() {
        try {
            policy = DuplicatePolicy.fromConfig(duplicatePolicy);
        } catch (IllegalArgumentException e) {
            LOG.fatal(e.getMessage());
            throw new IllegalStateException("Invalid aicodex.interactions.duplicate-policy: " + e.getMessage(), e);
        }
        LOG.infof("Duplicate interaction policy: %s", policy);
    }

    /**
     * Creates or replaces a user's rating of a prompt and refreshes every aggregate that depends on it.
     *
     * @param promptId
     *            prompt being rated
     * @param userId
     *            rating user
     * @param rating
     *            integer in [1, 5]
     * @return the stored rating plus the refreshed prompt and experience aggregates
     * @throws ValidationException
     *             if rating is outside [1, 5]
     * @throws ResourceNotFoundException
     *             if the prompt does not exist or is soft-deleted
     * @throws DuplicateResourceException
     *             if the user already rated the prompt and the reject policy is active
     */
    @Transactional
    public RatingOutcome recordRating(UUID promptId, UUID userId, int rating) {
        if (rating < PromptRating.MIN_RATING || rating > PromptRating.MAX_RATING) {
            throw new ValidationException("Rating must be an integer between 1 and 5");
        }

        Prompt prompt = Prompt.lockActiveById(promptId)
                .orElseThrow(() -> new ResourceNotFoundException("Prompt not found: " + promptId));

        Optional<PromptRating> existing = PromptRating.findByUserAndPrompt(promptId, userId);
        Instant now = Instant.now();
        PromptRating row;
        boolean created;

        if (existing.isPresent() && existing.get().deletedAt == null) {
            if (policy == DuplicatePolicy.REJECT) {
                throw new DuplicateResourceException("User has already rated this prompt");
            }
            row = existing.get();
            int oldRating = row.rating;
            row.rating = rating;
            row.updatedAt = now;
            created = false;
            LOG.infof("Updated rating %s on prompt %s: %d → %d", row.id, promptId, oldRating, rating);
        } else {
            row = existing.orElseGet(PromptRating::new);
            row.promptId = promptId;
            row.userId = userId;
            row.rating = rating;
            row.createdAt = now;
            row.updatedAt = now;
            row.deletedAt = null;
            row.persist();
            created = true;
            LOG.infof("Created rating %s: user %s rated prompt %s with %d", row.id, userId, promptId, rating);
        }

        recomputePromptRating(prompt);
        Experience experience = recomputeExperienceRollup(prompt.experienceId);
        recomputeUserReceivedRating(experience.userId);

        return new RatingOutcome(row, created, prompt.averageRating, prompt.ratingCount, experience.averageRating);
    }

    /**
     * Adds a reaction of one type from a user to an experience. The same (user, experience, type) always resolves to
     * one stored row.
     *
     * @param experienceId
     *            experience being reacted to
     * @param userId
     *            reacting user
     * @param type
     *            reaction type
     * @return the stored reaction and the refreshed counts
     * @throws ResourceNotFoundException
     *             if the experience does not exist or is soft-deleted
     * @throws DuplicateResourceException
     *             if the reaction already exists and the reject policy is active
     */
    @Transactional
    public ReactionOutcome recordReaction(UUID experienceId, UUID userId, ReactionType type) {
        Experience experience = Experience.lockActiveById(experienceId)
                .orElseThrow(() -> new ResourceNotFoundException("Experience not found: " + experienceId));

        Optional<Reaction> existing = Reaction.findByKey(experienceId, userId, type);
        Reaction reaction;
        boolean created;

        if (existing.isPresent() && existing.get().deletedAt == null) {
            if (policy == DuplicatePolicy.REJECT) {
                throw new DuplicateResourceException("User has already reacted with " + type.value());
            }
            reaction = existing.get();
            created = false;
            LOG.infof("User %s already reacted %s on experience %s - no change", userId, type.value(), experienceId);
        } else {
            reaction = existing.orElseGet(Reaction::new);
            reaction.experienceId = experienceId;
            reaction.userId = userId;
            reaction.reactionType = type.value();
            reaction.createdAt = Instant.now();
            reaction.deletedAt = null;
            reaction.persist();
            created = true;
            LOG.infof("Created reaction %s: user %s reacted %s on experience %s", reaction.id, userId, type.value(),
                    experienceId);
        }

        recomputeReactionCount(experience);
        return new ReactionOutcome(reaction, created, experience.reactionCount, Reaction.countByType(experienceId));
    }

    /**
     * Withdraws a user's reaction of one type.
     *
     * @param experienceId
     *            experience UUID
     * @param userId
     *            reacting user
     * @param type
     *            reaction type to withdraw
     * @return refreshed counts
     * @throws ResourceNotFoundException
     *             if the experience or the user's live reaction does not exist
     */
    @Transactional
    public ReactionOutcome removeReaction(UUID experienceId, UUID userId, ReactionType type) {
        Experience experience = Experience.lockActiveById(experienceId)
                .orElseThrow(() -> new ResourceNotFoundException("Experience not found: " + experienceId));

        Reaction reaction = Reaction.findByKey(experienceId, userId, type).filter(r -> r.deletedAt == null)
                .orElseThrow(() -> new ResourceNotFoundException("Reaction " + type.value() + " not found for user "
                        + userId + " on experience " + experienceId));

        reaction.deletedAt = Instant.now();
        LOG.infof("Removed reaction %s: user %s withdrew %s from experience %s", reaction.id, userId, type.value(),
                experienceId);

        recomputeReactionCount(experience);
        return new ReactionOutcome(reaction, false, experience.reactionCount, Reaction.countByType(experienceId));
    }

    /**
     * Appends a comment to an experience.
     *
     * @param experienceId
     *            experience UUID
     * @param userId
     *            commenting user
     * @param content
     *            comment text, 1 to 1000 characters and not blank
     * @return the stored comment
     * @throws ValidationException
     *             if content is blank or too long
     * @throws ResourceNotFoundException
     *             if the experience does not exist or is soft-deleted
     */
    @Transactional
    public Comment recordComment(UUID experienceId, UUID userId, String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Comment must not be empty");
        }
        if (content.length() > Comment.CONTENT_MAX_LENGTH) {
            throw new ValidationException("Comment must not exceed 1000 characters");
        }

        Experience experience = Experience.lockActiveById(experienceId)
                .orElseThrow(() -> new ResourceNotFoundException("Experience not found: " + experienceId));

        Comment comment = new Comment();
        comment.experienceId = experienceId;
        comment.userId = userId;
        comment.content = content;
        comment.createdAt = Instant.now();
        comment.persist();

        experience.commentCount = (int) Comment.countActiveByExperienceId(experienceId);
        LOG.infof("Created comment %s on experience %s (comment_count=%d)", comment.id, experienceId,
                experience.commentCount);
        return comment;
    }

    /**
     * Recomputes every aggregate of an experience from its live children.
     *
     * <p>
     * {@code averageRating} is the mean of the averages of the prompts that have at least one rating; unrated prompts
     * do not pull the mean down. An experience without rated prompts averages 0.
     *
     * @param experienceId
     *            experience UUID (soft-deleted experiences are recomputed too)
     * @return the refreshed experience
     * @throws ResourceNotFoundException
     *             if no experience row exists
     */
    @Transactional
    public Experience recomputeExperienceRollup(UUID experienceId) {
        Experience experience = Experience.findById(experienceId);
        if (experience == null) {
            throw new ResourceNotFoundException("Experience not found: " + experienceId);
        }

        List<Prompt> prompts = Prompt.findActiveByExperienceId(experienceId);
        double ratedSum = 0;
        int ratedPrompts = 0;
        for (Prompt prompt : prompts) {
            if (prompt.ratingCount > 0) {
                ratedSum += prompt.averageRating;
                ratedPrompts++;
            }
        }

        experience.averageRating = ratedPrompts > 0 ? round2(ratedSum / ratedPrompts) : 0;
        experience.promptCount = prompts.size();
        experience.commentCount = (int) Comment.countActiveByExperienceId(experienceId);
        experience.reactionCount = (int) Reaction.countActiveByExperienceId(experienceId);

        LOG.debugf("Rollup for experience %s: avg=%.2f prompts=%d comments=%d reactions=%d", experienceId,
                experience.averageRating, experience.promptCount, experience.commentCount, experience.reactionCount);
        return experience;
    }

    /**
     * Recomputes the rating totals a user received on their live prompts and returns the per-rating average.
     *
     * @param userId
     *            content owner
     * @return {@code totalRating / max(ratingCount, 1)}, so 0 for a user without ratings
     * @throws ResourceNotFoundException
     *             if no user row exists
     */
    @Transactional
    public double recomputeUserReceivedRating(UUID userId) {
        User user = User.findById(userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }

        List<PromptRating> received = PromptRating.findActiveReceivedByUserId(userId);
        user.totalRating = received.stream().mapToInt(r -> r.rating).sum();
        user.ratingCount = received.size();
        return user.totalRating / Math.max(user.ratingCount, 1);
    }

    /**
     * Recomputes a prompt's average and count from its live ratings.
     *
     * @param prompt
     *            managed prompt entity
     */
    void recomputePromptRating(Prompt prompt) {
        List<PromptRating> ratings = PromptRating.findActiveByPromptId(prompt.id);
        int sum = ratings.stream().mapToInt(r -> r.rating).sum();
        prompt.ratingCount = ratings.size();
        prompt.averageRating = ratings.isEmpty() ? 0 : round2((double) sum / ratings.size());
    }

    private void recomputeReactionCount(Experience experience) {
        experience.reactionCount = (int) Reaction.countActiveByExperienceId(experience.id);
    }

    /**
     * Rounds half-up to two decimals.
     *
     * @param value
     *            raw average
     * @return value rounded to two decimals
     */
    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Result of a rating upsert.
     *
     * @param rating
     *            stored rating row
     * @param created
     *            true if a new row was written, false if an existing row was updated
     * @param promptAverageRating
     *            refreshed prompt average
     * @param promptRatingCount
     *            refreshed prompt rating count
     * @param experienceAverageRating
     *            refreshed experience average
     */
    public record RatingOutcome(PromptRating rating, boolean created, double promptAverageRating,
            int promptRatingCount, double experienceAverageRating) {
    }

    /**
     * Result of a reaction upsert or removal.
     *
     * @param reaction
     *            affected reaction row
     * @param created
     *            true if the reaction became live with this call
     * @param reactionCount
     *            refreshed total of live reactions on the experience
     * @param countsByType
     *            live reactions per type
     */
    public record ReactionOutcome(Reaction reaction, boolean created, int reactionCount,
            Map<String, Long> countsByType) {
    }
}
