package aicodex.experiences.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import aicodex.experiences.services.RetentionService;
import aicodex.experiences.services.RetentionService.PurgeResult;

import java.time.Instant;

/**
 * Scheduled job that applies the retention policy to soft-deleted data.
 *
 * <p>
 * Runs daily at {@code aicodex.retention.cron} (default 03:30). A run that is still going when the next one fires is
 * not overlapped.
 */
@ApplicationScoped
public class RetentionPurgeScheduler {

    private static final Logger LOG = Logger.getLogger(RetentionPurgeScheduler.class);

    @Inject
    RetentionService retentionService;

    @Scheduled(
            cron = "{aicodex.retention.cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void purgeExpired() {
        PurgeResult result = retentionService.purgeExpired(Instant.now());

        if (result.total() > 0) {
            LOG.infof("Retention purge removed %d experiences, %d prompts, %d ratings, %d comments, %d reactions; "
                    + "scrubbed %d accounts", result.experiences(), result.prompts(), result.ratings(),
                    result.comments(), result.reactions(), result.scrubbedAccounts());
        }
    }
}
