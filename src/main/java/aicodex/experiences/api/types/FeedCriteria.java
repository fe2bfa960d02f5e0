package aicodex.experiences.api.types;

import java.util.Set;

/**
 * Validated feed query.
 *
 * <p>
 * Built by {@code FeedQueryService.parseCriteria} from raw query parameters. Filters combine with AND; tags match when
 * an experience carries any of them.
 *
 * @param page
 *            1-based page number
 * @param limit
 *            Page size (1-100)
 * @param aiAssistant
 *            Exact AI assistant wire value, or null
 * @param tags
 *            Lowercased valid tags; may be empty while a tag filter was requested
 * @param tagsRequested
 *            whether a non-blank {@code tags} parameter was given
 * @param search
 *            Lowercased substring to match in title, description or tags, or null
 * @param sort
 *            Ordering
 */
public record FeedCriteria(int page, int limit, String aiAssistant, Set<String> tags, boolean tagsRequested,
        String search, FeedSort sort) {

    public int offset() {
        return (page - 1) * limit;
    }

    public boolean hasTagFilter() {
        return tagsRequested || (tags != null && !tags.isEmpty());
    }

    /**
     * Feed orderings. Every ordering ends with the id so paging is deterministic.
     */
    public enum FeedSort {
        /** averageRating DESC, createdAt DESC */
        RATING,
        /** createdAt DESC */
        RECENT,
        /** reactionCount DESC, createdAt DESC */
        POPULAR
    }
}
