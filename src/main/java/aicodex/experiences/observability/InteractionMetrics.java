package aicodex.experiences.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.concurrent.Callable;

/**
 * Custom Micrometer meters for user interactions and feed queries.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counter:</b> {@code experiences_interactions_total{type,outcome}} - comments, reactions and ratings by
 * outcome (created, updated, rejected)</li>
 * <li><b>Timer:</b> {@code experiences_feed_query_duration} - feed query latency</li>
 * <li><b>Timer:</b> {@code experiences_profile_stats_duration} - profile statistics latency</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class InteractionMetrics {

    public static final String TYPE_COMMENT = "comment";
    public static final String TYPE_REACTION = "reaction";
    public static final String TYPE_RATING = "rating";

    public static final String OUTCOME_CREATED = "created";
    public static final String OUTCOME_UPDATED = "updated";
    public static final String OUTCOME_REJECTED = "rejected";

    @Inject
    MeterRegistry registry;

    public void recordInteraction(String type, String outcome) {
        Counter.builder("experiences_interactions_total").description("User interactions by type and outcome")
                .tag("type", type).tag("outcome", outcome).register(registry).increment();
    }

    public <T> T timeFeedQuery(Callable<T> query) {
        return time("experiences_feed_query_duration", query);
    }

    public <T> T timeProfileStats(Callable<T> query) {
        return time("experiences_profile_stats_duration", query);
    }

    private <T> T time(String name, Callable<T> work) {
        Timer timer = Timer.builder(name).register(registry);
        try {
            return timer.recordCallable(work);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Timed operation failed: " + name, e);
        }
    }
}
