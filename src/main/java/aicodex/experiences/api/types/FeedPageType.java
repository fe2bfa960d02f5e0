package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of the experience feed.
 *
 * @param experiences
 *            Experiences on this page, in feed order
 * @param total
 *            Number of experiences matching the filters across all pages
 * @param page
 *            1-based page number
 * @param pages
 *            {@code ceil(total / limit)}
 * @param limit
 *            Page size
 */
public record FeedPageType(@JsonProperty("experiences") List<ExperienceSummaryType> experiences,
        @JsonProperty("total") long total, @JsonProperty("page") int page, @JsonProperty("pages") int pages,
        @JsonProperty("limit") int limit) {
}
