package aicodex.experiences.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.ExperienceSummaryType;
import aicodex.experiences.api.types.FeedCriteria;
import aicodex.experiences.api.types.FeedCriteria.FeedSort;
import aicodex.experiences.api.types.FeedPageType;
import aicodex.experiences.data.models.AiAssistantType;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.ValidationException;
import aicodex.experiences.observability.InteractionMetrics;
import aicodex.experiences.util.TagParser;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Assembles the paginated, filtered experience feed.
 *
 * <p>
 * <b>Filters</b> (AND across dimensions):
 * <ul>
 * <li>{@code aiAssistant} - exact match on {@code ai_assistant_type}</li>
 * <li>{@code tags} - experience carries ANY of the given tags; a filter without a single valid tag matches
 * nothing</li>
 * <li>{@code search} - case-insensitive literal substring of title, description or tag text</li>
 * </ul>
 *
 * <p>
 * Soft-deleted experiences and experiences of soft-deleted users are never listed. Orderings always end with the id
 * so consecutive pages neither repeat nor skip rows.
 */
@ApplicationScoped
public class FeedQueryService {

    private static final Logger LOG = Logger.getLogger(FeedQueryService.class);

    static final int MAX_SEARCH_LENGTH = 100;

    static final char LIKE_ESCAPE = '!';

    @Inject
    Tracer tracer;

    @Inject
    InteractionMetrics metrics;

    @ConfigProperty(
            name = "aicodex.feed.default-limit",
            defaultValue = "20")
    int defaultLimit;

    @ConfigProperty(
            name = "aicodex.feed.max-limit",
            defaultValue = "100")
    int maxLimit;

    /**
     * Validates raw feed query parameters.
     *
     * @param page
     *            1-based page, default 1
     * @param limit
     *            page size, default {@code aicodex.feed.default-limit}
     * @param aiAssistant
     *            AI assistant wire value
     * @param tags
     *            comma-separated tags
     * @param search
     *            free-text substring
     * @param sort
     *            rating | recent | popular
     * @return validated criteria
     * @throws ValidationException
     *             if a parameter is non-numeric, out of range or not a known value
     */
    public FeedCriteria parseCriteria(String page, String limit, String aiAssistant, String tags, String search,
            String sort) {
        int pageNumber = parseInt("page", page, 1);
        if (pageNumber < 1) {
            throw new ValidationException("page must be greater than or equal to 1");
        }

        int pageSize = parseInt("limit", limit, defaultLimit);
        if (pageSize < 1 || pageSize > maxLimit) {
            throw new ValidationException("limit must be between 1 and " + maxLimit);
        }

        String assistant = null;
        if (aiAssistant != null && !aiAssistant.isBlank()) {
            assistant = aiAssistant.trim();
            if (AiAssistantType.fromValue(assistant).isEmpty()) {
                throw new ValidationException("Unknown aiAssistant: " + assistant);
            }
        }

        String searchTerm = null;
        if (search != null && !search.isBlank()) {
            searchTerm = search.trim();
            if (searchTerm.length() > MAX_SEARCH_LENGTH) {
                throw new ValidationException("search must not exceed " + MAX_SEARCH_LENGTH + " characters");
            }
            searchTerm = searchTerm.toLowerCase(Locale.ROOT);
        }

        boolean tagsRequested = tags != null && !tags.isBlank();
        return new FeedCriteria(pageNumber, pageSize, assistant, TagParser.parseFilter(tags), tagsRequested,
                searchTerm, parseSort(sort));
    }

    /**
     * Runs a feed query.
     *
     * @param criteria
     *            validated criteria
     * @return page of experiences plus paging metadata
     */
    @Transactional
    public FeedPageType listFeed(FeedCriteria criteria) {
        Span span = tracer.spanBuilder("experiences.feed").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("page", criteria.page());
            span.setAttribute("limit", criteria.limit());
            span.setAttribute("ai_assistant", criteria.aiAssistant() != null ? criteria.aiAssistant() : "");
            span.setAttribute("tag_count", criteria.hasTagFilter() ? criteria.tags().size() : 0);
            span.setAttribute("has_search", criteria.search() != null);

            FeedPageType result = metrics.timeFeedQuery(() -> runQuery(criteria));
            span.setAttribute("total", result.total());
            return result;
        } finally {
            span.end();
        }
    }

    private FeedPageType runQuery(FeedCriteria criteria) {
        if (criteria.hasTagFilter() && criteria.tags().isEmpty()) {
            LOG.debugf("Tag filter without valid tags, returning an empty page");
            return new FeedPageType(List.of(), 0, criteria.page(), 0, criteria.limit());
        }

        StringBuilder hql = new StringBuilder(
                "deletedAt IS NULL AND userId IN (SELECT u.id FROM User u WHERE u.deletedAt IS NULL)");
        Parameters params = new Parameters();

        if (criteria.aiAssistant() != null) {
            hql.append(" AND aiAssistantType = :aiAssistant");
            params.and("aiAssistant", criteria.aiAssistant());
        }

        if (criteria.hasTagFilter()) {
            hql.append(" AND (");
            int i = 0;
            for (String tag : criteria.tags()) {
                if (i > 0) {
                    hql.append(" OR ");
                }
                // delimiters on both sides so "react" does not match "react-native"
                hql.append("CONCAT(',', tags, ',') LIKE :tag").append(i);
                params.and("tag" + i, "%," + tag + ",%");
                i++;
            }
            hql.append(")");
        }

        if (criteria.search() != null) {
            String escape = " ESCAPE '" + LIKE_ESCAPE + "'";
            hql.append(" AND (LOWER(title) LIKE :search").append(escape)
                    .append(" OR LOWER(description) LIKE :search").append(escape)
                    .append(" OR LOWER(tags) LIKE :search").append(escape).append(")");
            params.and("search", "%" + escapeLike(criteria.search()) + "%");
        }

        PanacheQuery<Experience> query = Experience.find(hql.toString(), buildSort(criteria.sort()), params);
        long total = query.count();
        List<Experience> experiences = query.page(Page.of(criteria.page() - 1, criteria.limit())).list();

        Map<UUID, User> authors = loadAuthors(experiences);
        List<ExperienceSummaryType> items = experiences.stream()
                .map(e -> ExperienceSummaryType.fromEntity(e, authors.get(e.userId))).toList();

        int pages = (int) ((total + criteria.limit() - 1) / criteria.limit());
        LOG.debugf("Feed page %d/%d (limit=%d, total=%d, sort=%s)", criteria.page(), pages, criteria.limit(), total,
                criteria.sort());
        return new FeedPageType(items, total, criteria.page(), pages, criteria.limit());
    }

    /**
     * Escapes LIKE wildcards so the term matches literally under {@code ESCAPE '!'}.
     */
    static String escapeLike(String term) {
        StringBuilder escaped = new StringBuilder(term.length() + 8);
        for (char c : term.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    static Sort buildSort(FeedSort sort) {
        return switch (sort) {
            case RECENT -> Sort.by("createdAt", Sort.Direction.Descending).and("id");
            case POPULAR -> Sort.by("reactionCount", Sort.Direction.Descending)
                    .and("createdAt", Sort.Direction.Descending).and("id");
            default -> Sort.by("averageRating", Sort.Direction.Descending).and("createdAt", Sort.Direction.Descending)
                    .and("id");
        };
    }

    private static Map<UUID, User> loadAuthors(List<Experience> experiences) {
        Set<UUID> userIds = experiences.stream().map(e -> e.userId).collect(Collectors.toSet());
        if (userIds.isEmpty()) {
            return Map.of();
        }
        List<User> users = User.list("id IN ?1", userIds);
        return users.stream().collect(Collectors.toMap(u -> u.id, Function.identity()));
    }

    private static FeedSort parseSort(String sort) {
        if (sort == null || sort.isBlank()) {
            return FeedSort.RATING;
        }
        try {
            return FeedSort.valueOf(sort.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sort must be one of rating, recent, popular", e);
        }
    }

    private static int parseInt(String name, String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be a number", e);
        }
    }
}
