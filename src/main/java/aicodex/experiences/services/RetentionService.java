package aicodex.experiences.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;

import java.time.Duration;
import java.time.Instant;

/**
 * Retention policy for soft-deleted data.
 *
 * <ul>
 * <li>Content (experiences, prompts, ratings, comments, reactions) soft-deleted longer than
 * {@code aicodex.retention.content-grace-days} ago is hard-deleted, children first.</li>
 * <li>Accounts soft-deleted longer than {@code aicodex.retention.account-grace-days} ago keep their row, username and
 * GitHub id, but lose email, bio and avatar.</li>
 * </ul>
 *
 * <p>
 * Only soft-deleted rows are removed, so no live aggregate changes. Within the grace periods everything can still be
 * restored through {@link SoftDeleteService}.
 */
@ApplicationScoped
public class RetentionService {

    private static final Logger LOG = Logger.getLogger(RetentionService.class);

    static final String EXPIRED_EXPERIENCES = "(SELECT e.id FROM Experience e WHERE e.deletedAt < ?1)";

    static final String EXPIRED_PROMPTS = "(SELECT p.id FROM Prompt p WHERE p.deletedAt < ?1 OR p.experienceId IN "
            + EXPIRED_EXPERIENCES + ")";

    @ConfigProperty(
            name = "aicodex.retention.content-grace-days",
            defaultValue = "30")
    int contentGraceDays;

    @ConfigProperty(
            name = "aicodex.retention.account-grace-days",
            defaultValue = "90")
    int accountGraceDays;

    /**
     * Rows removed or scrubbed by one purge run.
     */
    public record PurgeResult(long experiences, long prompts, long ratings, long comments, long reactions,
            long scrubbedAccounts) {

        public long total() {
            return experiences + prompts + ratings + comments + reactions + scrubbedAccounts;
        }
    }

    /**
     * Applies the retention policy relative to {@code now}.
     *
     * @param now
     *            reference time for both grace periods
     * @return counts per table
     */
    @Transactional
    public PurgeResult purgeExpired(Instant now) {
        Instant contentCutoff = now.minus(Duration.ofDays(contentGraceDays));
        Instant accountCutoff = now.minus(Duration.ofDays(accountGraceDays));

        long ratings = PromptRating.delete("deletedAt < ?1 OR promptId IN " + EXPIRED_PROMPTS, contentCutoff);
        long prompts = Prompt.delete("deletedAt < ?1 OR experienceId IN " + EXPIRED_EXPERIENCES, contentCutoff);
        long comments = Comment.delete("deletedAt < ?1 OR experienceId IN " + EXPIRED_EXPERIENCES, contentCutoff);
        long reactions = Reaction.delete("deletedAt < ?1 OR experienceId IN " + EXPIRED_EXPERIENCES, contentCutoff);
        long experiences = Experience.delete("deletedAt < ?1", contentCutoff);

        long scrubbed = User.update("email = null, bio = null, avatarUrl = null, updatedAt = ?2 WHERE deletedAt < ?1 "
                + "AND (email IS NOT NULL OR bio IS NOT NULL OR avatarUrl IS NOT NULL)", accountCutoff, now);

        PurgeResult result = new PurgeResult(experiences, prompts, ratings, comments, reactions, scrubbed);
        LOG.debugf("Retention purge before %s (accounts before %s): %s", contentCutoff, accountCutoff, result);
        return result;
    }
}
