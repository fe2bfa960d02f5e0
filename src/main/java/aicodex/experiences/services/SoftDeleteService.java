package aicodex.experiences.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.RestoreResultType;
import aicodex.experiences.api.types.SoftDeleteStatsType;
import aicodex.experiences.api.types.SoftDeleteStatsType.EntityCounts;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.exceptions.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Operator-side management of soft-deleted accounts and experiences.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>Soft-delete any user or experience on behalf of an operator</li>
 * <li>Restore a soft-deleted user or experience together with the rows its deletion cascaded to</li>
 * <li>Report live and deleted row counts</li>
 * </ul>
 *
 * <p>
 * A cascade stamps every row it touches with the parent's {@code deletedAt}, so restore brings back exactly the rows
 * carrying that timestamp. Rows deleted earlier on their own stay deleted, and so do rows whose author is still
 * deleted. Every aggregate over the restored rows is recomputed in the same transaction.
 */
@ApplicationScoped
public class SoftDeleteService {

    private static final Logger LOG = Logger.getLogger(SoftDeleteService.class);

    static final Duration RECENT_WINDOW = Duration.ofDays(30);

    @Inject
    AggregationService aggregationService;

    @Inject
    ExperienceService experienceService;

    @Inject
    UserService userService;

    /**
     * Soft-deletes a live experience and its children regardless of ownership.
     *
     * @param experienceId
     *            experience UUID
     * @throws ResourceNotFoundException
     *             if the experience is missing or already deleted
     */
    @Transactional
    public void deleteExperience(UUID experienceId) {
        Experience experience = Experience.lockActiveById(experienceId)
                .orElseThrow(() -> new ResourceNotFoundException("Experience not found: " + experienceId));
        experienceService.cascadeSoftDelete(experience, Instant.now());
        aggregationService.recomputeUserReceivedRating(experience.userId);
        LOG.infof("Operator soft-deleted experience %s of user %s", experienceId, experience.userId);
    }

    /**
     * Soft-deletes a live account with the same cascade as a self-service deletion.
     *
     * @param userId
     *            user UUID
     * @throws ResourceNotFoundException
     *             if the user is missing or already deleted
     */
    @Transactional
    public void deleteUser(UUID userId) {
        User user = User.findActiveById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        userService.softDeleteUser(user);
        LOG.infof("Operator soft-deleted user %s", userId);
    }

    /**
     * Restores a soft-deleted experience with the prompts, ratings, comments and reactions deleted alongside it.
     *
     * @param experienceId
     *            experience UUID
     * @return what was brought back
     * @throws ResourceNotFoundException
     *             if no experience row exists
     * @throws ValidationException
     *             if the experience is not deleted or its author still is
     */
    @Transactional
    public RestoreResultType restoreExperience(UUID experienceId) {
        Experience experience = Experience.findById(experienceId, LockModeType.PESSIMISTIC_WRITE);
        if (experience == null) {
            throw new ResourceNotFoundException("Experience not found: " + experienceId);
        }
        if (experience.deletedAt == null) {
            throw new ValidationException("Experience is not deleted");
        }
        if (User.findActiveById(experience.userId).isEmpty()) {
            throw new ValidationException("Cannot restore experience: author is deleted");
        }

        RestoreContext restored = new RestoreContext();
        restoreExperienceTree(experience, restored);
        aggregationService.recomputeUserReceivedRating(experience.userId);

        LOG.infof("Restored experience %s: %d prompts, %d ratings, %d comments, %d reactions", experienceId,
                restored.prompts, restored.ratings, restored.comments, restored.reactions);
        return restored.toResult("Experience restored", experienceId);
    }

    /**
     * Restores a soft-deleted account, the experiences its deletion cascaded to, and the ratings, comments and
     * reactions it had left on content that is still live.
     *
     * @param userId
     *            user UUID
     * @return what was brought back
     * @throws ResourceNotFoundException
     *             if no user row exists
     * @throws ValidationException
     *             if the user is not deleted
     */
    @Transactional
    public RestoreResultType restoreUser(UUID userId) {
        User user = User.findById(userId, LockModeType.PESSIMISTIC_WRITE);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }
        if (user.deletedAt == null) {
            throw new ValidationException("User is not deleted");
        }

        Instant deletedAt = user.deletedAt;
        user.deletedAt = null;
        user.updatedAt = Instant.now();

        RestoreContext restored = new RestoreContext();
        for (Experience experience : Experience.<Experience> list("userId = ?1 AND deletedAt = ?2", userId,
                deletedAt)) {
            restoreExperienceTree(experience, restored);
        }

        Set<UUID> affectedExperiences = new LinkedHashSet<>();
        for (PromptRating rating : PromptRating.<PromptRating> list("userId = ?1 AND deletedAt = ?2", userId,
                deletedAt)) {
            Optional<Prompt> prompt = Prompt.findActiveById(rating.promptId)
                    .filter(p -> Experience.findActiveById(p.experienceId).isPresent());
            if (prompt.isPresent()) {
                rating.deletedAt = null;
                restored.ratings++;
                aggregationService.recomputePromptRating(prompt.get());
                affectedExperiences.add(prompt.get().experienceId);
            }
        }
        for (Comment comment : Comment.<Comment> list("userId = ?1 AND deletedAt = ?2", userId, deletedAt)) {
            if (Experience.findActiveById(comment.experienceId).isPresent()) {
                comment.deletedAt = null;
                restored.comments++;
                affectedExperiences.add(comment.experienceId);
            }
        }
        for (Reaction reaction : Reaction.<Reaction> list("userId = ?1 AND deletedAt = ?2", userId, deletedAt)) {
            if (Experience.findActiveById(reaction.experienceId).isPresent()) {
                reaction.deletedAt = null;
                restored.reactions++;
                affectedExperiences.add(reaction.experienceId);
            }
        }

        Set<UUID> affectedOwners = new LinkedHashSet<>();
        affectedOwners.add(userId);
        for (UUID experienceId : affectedExperiences) {
            Experience experience = aggregationService.recomputeExperienceRollup(experienceId);
            affectedOwners.add(experience.userId);
        }
        for (UUID ownerId : affectedOwners) {
            aggregationService.recomputeUserReceivedRating(ownerId);
        }

        LOG.infof("Restored user %s: %d experiences, %d ratings, %d comments, %d reactions", userId,
                restored.experiences, restored.ratings, restored.comments, restored.reactions);
        return restored.toResult("User restored", userId);
    }

    /**
     * Counts users and experiences by deletion state.
     *
     * @return totals, live, deleted and deleted within the last 30 days
     */
    @Transactional
    public SoftDeleteStatsType getStats() {
        Instant now = Instant.now();
        Instant since = now.minus(RECENT_WINDOW);

        EntityCounts users = new EntityCounts(User.count(), User.count("deletedAt IS NULL"),
                User.count("deletedAt IS NOT NULL"), User.count("deletedAt >= ?1", since));
        EntityCounts experiences = new EntityCounts(Experience.count(), Experience.count("deletedAt IS NULL"),
                Experience.count("deletedAt IS NOT NULL"), Experience.count("deletedAt >= ?1", since));
        return new SoftDeleteStatsType(users, experiences, now);
    }

    private void restoreExperienceTree(Experience experience, RestoreContext restored) {
        Instant deletedAt = experience.deletedAt;
        experience.deletedAt = null;
        experience.updatedAt = Instant.now();
        restored.experiences++;

        for (Prompt prompt : Prompt.<Prompt> list("experienceId = ?1 AND deletedAt = ?2", experience.id,
                deletedAt)) {
            prompt.deletedAt = null;
            restored.prompts++;
            for (PromptRating rating : PromptRating.<PromptRating> list("promptId = ?1 AND deletedAt = ?2", prompt.id,
                    deletedAt)) {
                if (restored.isLive(rating.userId)) {
                    rating.deletedAt = null;
                    restored.ratings++;
                }
            }
            aggregationService.recomputePromptRating(prompt);
        }
        for (Comment comment : Comment.<Comment> list("experienceId = ?1 AND deletedAt = ?2", experience.id,
                deletedAt)) {
            if (restored.isLive(comment.userId)) {
                comment.deletedAt = null;
                restored.comments++;
            }
        }
        for (Reaction reaction : Reaction.<Reaction> list("experienceId = ?1 AND deletedAt = ?2", experience.id,
                deletedAt)) {
            if (restored.isLive(reaction.userId)) {
                reaction.deletedAt = null;
                restored.reactions++;
            }
        }
        aggregationService.recomputeExperienceRollup(experience.id);
    }

    private static final class RestoreContext {
        int experiences;
        int prompts;
        int ratings;
        int comments;
        int reactions;
        private final Map<UUID, Boolean> liveUsers = new HashMap<>();

        boolean isLive(UUID userId) {
            return liveUsers.computeIfAbsent(userId, id -> User.findActiveById(id).isPresent());
        }

        RestoreResultType toResult(String message, UUID id) {
            return new RestoreResultType(message, id, experiences, prompts, comments, reactions, ratings);
        }
    }
}
