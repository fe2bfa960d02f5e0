package aicodex.experiences.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.LockModeType;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Prompt entity: a single instruction given to an AI assistant inside an experience, independently rateable.
 *
 * <p>
 * Database mapping: prompts table. {@code average_rating} and {@code rating_count} are cached aggregates over the live
 * rows in prompt_ratings, written exclusively by {@code AggregationService}.
 */
@Entity
@Table(
        name = "prompts",
        indexes = {@Index(
                name = "prompts_experience_id_idx",
                columnList = "experience_id")})
public class Prompt extends PanacheEntityBase {

    public static final int CONTENT_MIN_LENGTH = 10;
    public static final int CONTENT_MAX_LENGTH = 5000;
    public static final int NOTE_MAX_LENGTH = 500;

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "experience_id",
            nullable = false)
    public UUID experienceId;

    @Column(
            nullable = false,
            length = CONTENT_MAX_LENGTH)
    public String content;

    @Column(
            length = NOTE_MAX_LENGTH)
    public String context;

    @Column(
            name = "results_achieved",
            length = NOTE_MAX_LENGTH)
    public String resultsAchieved;

    @Column(
            name = "order_index",
            nullable = false)
    public int orderIndex;

    @Column(
            name = "average_rating",
            nullable = false)
    public double averageRating;

    @Column(
            name = "rating_count",
            nullable = false)
    public int ratingCount;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    public static Optional<Prompt> findActiveById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return find("id = ?1 AND deletedAt IS NULL", id).firstResultOptional();
    }

    /**
     * Loads a live prompt holding a pessimistic write lock, serializing concurrent raters of the same prompt.
     *
     * @param id
     *            prompt UUID
     * @return Optional containing the locked prompt if found and not soft-deleted
     */
    public static Optional<Prompt> lockActiveById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        Prompt prompt = findById(id, LockModeType.PESSIMISTIC_WRITE);
        if (prompt == null || prompt.deletedAt != null) {
            return Optional.empty();
        }
        return Optional.of(prompt);
    }

    public static List<Prompt> findActiveByExperienceId(UUID experienceId) {
        return find("experienceId = ?1 AND deletedAt IS NULL ORDER BY orderIndex, createdAt", experienceId).list();
    }

    public static long countActiveByExperienceId(UUID experienceId) {
        return count("experienceId = ?1 AND deletedAt IS NULL", experienceId);
    }

    /**
     * Next free order index for a new prompt in an experience (counts deleted prompts too, so indexes never repeat).
     *
     * @param experienceId
     *            experience UUID
     * @return order index to assign
     */
    public static int nextOrderIndex(UUID experienceId) {
        return (int) count("experienceId", experienceId);
    }
}
