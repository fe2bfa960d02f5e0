package aicodex.experiences.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PromptRating entity representing a user's 1-5 star rating of a prompt.
 *
 * <p>
 * Rating mechanics:
 * <ul>
 * <li>Integer value in [1, 5]</li>
 * <li>One rating per user per prompt (enforced by unique constraint)</li>
 * <li>Re-rating updates the existing row in place</li>
 * </ul>
 */
@Entity
@Table(
        name = "prompt_ratings",
        uniqueConstraints = @UniqueConstraint(
                name = "prompt_ratings_user_prompt_key",
                columnNames = {"user_id", "prompt_id"}),
        indexes = {@Index(
                name = "prompt_ratings_prompt_id_idx",
                columnList = "prompt_id")})
public class PromptRating extends PanacheEntityBase {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "prompt_id",
            nullable = false)
    public UUID promptId;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            nullable = false)
    public int rating;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    public static Optional<PromptRating> findByUserAndPrompt(UUID promptId, UUID userId) {
        return find("promptId = ?1 AND userId = ?2", promptId, userId).firstResultOptional();
    }

    public static List<PromptRating> findActiveByPromptId(UUID promptId) {
        return list("promptId = ?1 AND deletedAt IS NULL", promptId);
    }

    public static List<PromptRating> findActiveByUserId(UUID userId) {
        return list("userId = ?1 AND deletedAt IS NULL", userId);
    }

    public static long countActiveByUserId(UUID userId) {
        return count("userId = ?1 AND deletedAt IS NULL", userId);
    }

    /**
     * Lists the live ratings received on every live prompt of a user's live experiences.
     *
     * @param ownerId
     *            user who authored the experiences
     * @return rating rows
     */
    public static List<PromptRating> findActiveReceivedByUserId(UUID ownerId) {
        return list("deletedAt IS NULL AND promptId IN (SELECT p.id FROM Prompt p WHERE p.deletedAt IS NULL "
                + "AND p.experienceId IN (SELECT e.id FROM Experience e WHERE e.userId = ?1 AND e.deletedAt IS NULL))",
                ownerId);
    }
}
