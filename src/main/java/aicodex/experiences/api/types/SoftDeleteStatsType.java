package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Soft-delete overview for operators.
 *
 * @param users
 *            User account counts
 * @param experiences
 *            Experience counts
 * @param generatedAt
 *            When the counts were taken
 */
public record SoftDeleteStatsType(@JsonProperty("users") EntityCounts users,
        @JsonProperty("experiences") EntityCounts experiences, @JsonProperty("generated_at") Instant generatedAt) {

    /**
     * Row counts of one entity type.
     *
     * @param total
     *            All rows
     * @param active
     *            Rows without a deletion marker
     * @param deleted
     *            Soft-deleted rows
     * @param recentlyDeleted
     *            Rows soft-deleted within the recent window
     */
    public record EntityCounts(@JsonProperty("total") long total, @JsonProperty("active") long active,
            @JsonProperty("deleted") long deleted, @JsonProperty("recently_deleted") long recentlyDeleted) {
    }
}
