package aicodex.experiences.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.TagCountType;
import aicodex.experiences.api.types.UserStatsType;
import aicodex.experiences.data.models.AiAssistantType;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.observability.InteractionMetrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Computes per-user statistic rollups for profile pages.
 *
 * <p>
 * All figures are read from live rows at request time; only {@code Experience.averageRating} is taken from the cached
 * aggregate. A user without experiences gets zeros everywhere, never NaN.
 */
@ApplicationScoped
public class ProfileStatsService {

    private static final Logger LOG = Logger.getLogger(ProfileStatsService.class);

    private static final String OWNED_EXPERIENCES = "(SELECT e.id FROM Experience e "
            + "WHERE e.userId = ?1 AND e.deletedAt IS NULL)";

    @Inject
    Tracer tracer;

    @Inject
    InteractionMetrics metrics;

    @ConfigProperty(
            name = "aicodex.profile.top-tags",
            defaultValue = "10")
    int topTagLimit;

    /**
     * Computes the statistics of a live user.
     *
     * @param userId
     *            user UUID
     * @return statistics rollup
     * @throws ResourceNotFoundException
     *             if the user does not exist or is soft-deleted
     */
    @Transactional
    public UserStatsType computeStats(UUID userId) {
        User user = User.findActiveById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));

        Span span = tracer.spanBuilder("experiences.profile_stats").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("user_id", user.id.toString());
            return metrics.timeProfileStats(() -> compute(user.id));
        } finally {
            span.end();
        }
    }

    /**
     * Mean of the ratings a user has given, rounded to two decimals.
     *
     * @param userId
     *            rating user
     * @return average given rating, 0 when the user rated nothing
     */
    @Transactional
    public double averageRatingGiven(UUID userId) {
        List<PromptRating> given = PromptRating.findActiveByUserId(userId);
        if (given.isEmpty()) {
            return 0;
        }
        double sum = given.stream().mapToInt(r -> r.rating).sum();
        return AggregationService.round2(sum / given.size());
    }

    private UserStatsType compute(UUID userId) {
        List<Experience> experiences = Experience.findActiveByUserId(userId);

        long promptCount = Prompt.count("deletedAt IS NULL AND experienceId IN " + OWNED_EXPERIENCES, userId);
        long reactionsReceived = Reaction.count("deletedAt IS NULL AND experienceId IN " + OWNED_EXPERIENCES, userId);
        long commentsReceived = Comment.count("deletedAt IS NULL AND experienceId IN " + OWNED_EXPERIENCES, userId);

        double averageReceived = 0;
        if (!experiences.isEmpty()) {
            double sum = experiences.stream().mapToDouble(e -> e.averageRating).sum();
            averageReceived = AggregationService.round2(sum / experiences.size());
        }

        UserStatsType stats = new UserStatsType(experiences.size(), promptCount, reactionsReceived, commentsReceived,
                Comment.countActiveByUserId(userId), Reaction.countActiveByUserId(userId),
                PromptRating.countActiveByUserId(userId), averageReceived, assistantDistribution(experiences),
                topTags(experiences, topTagLimit));

        LOG.debugf("Computed stats for user %s: %d experiences, %d prompts", userId, stats.experienceCount(),
                stats.promptCount());
        return stats;
    }

    /**
     * Counts experiences per AI assistant type. Every type appears, in declaration order, with 0 when unused.
     */
    static Map<String, Long> assistantDistribution(List<Experience> experiences) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (AiAssistantType type : AiAssistantType.values()) {
            distribution.put(type.value(), 0L);
        }
        for (Experience experience : experiences) {
            distribution.merge(experience.aiAssistantType, 1L, Long::sum);
        }
        return distribution;
    }

    /**
     * Ranks tags by frequency. Equal counts keep the order in which the tags were first seen in {@code experiences}.
     *
     * @param experiences
     *            experiences in listing order (newest first)
     * @param limit
     *            number of tags to return
     * @return at most {@code limit} tags, highest count first
     */
    static List<TagCountType> topTags(List<Experience> experiences, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Experience experience : experiences) {
            for (String tag : experience.getTagList()) {
                counts.merge(tag, 1L, Long::sum);
            }
        }

        List<TagCountType> ranked = new ArrayList<>();
        counts.forEach((tag, count) -> ranked.add(new TagCountType(tag, count)));
        // List.sort is stable: ties stay in first-seen order
        ranked.sort(Comparator.comparingLong(TagCountType::count).reversed());
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : ranked;
    }
}
