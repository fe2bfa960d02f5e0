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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reaction entity representing a typed endorsement of an experience.
 *
 * <p>
 * Reaction mechanics:
 * <ul>
 * <li>At most one row per (user, experience, reaction type), enforced by a unique constraint</li>
 * <li>Repeated submissions resolve to the existing row (upsert), never a second insert</li>
 * <li>Removing a reaction soft-deletes the row; reacting again revives it</li>
 * </ul>
 */
@Entity
@Table(
        name = "reactions",
        uniqueConstraints = @UniqueConstraint(
                name = "reactions_user_experience_type_key",
                columnNames = {"user_id", "experience_id", "reaction_type"}),
        indexes = {@Index(
                name = "reactions_experience_id_idx",
                columnList = "experience_id")})
public class Reaction extends PanacheEntityBase {

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
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "reaction_type",
            nullable = false,
            length = 32)
    public String reactionType;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    /**
     * Finds the caller's row for a reaction type, live or soft-deleted.
     *
     * @param experienceId
     *            experience UUID
     * @param userId
     *            reacting user
     * @param type
     *            reaction type
     * @return Optional containing the row if one was ever written
     */
    public static Optional<Reaction> findByKey(UUID experienceId, UUID userId, ReactionType type) {
        return find("experienceId = ?1 AND userId = ?2 AND reactionType = ?3", experienceId, userId, type.value())
                .firstResultOptional();
    }

    public static long countActiveByExperienceId(UUID experienceId) {
        return count("experienceId = ?1 AND deletedAt IS NULL", experienceId);
    }

    public static long countActiveByUserId(UUID userId) {
        return count("userId = ?1 AND deletedAt IS NULL", userId);
    }

    /**
     * Counts live reactions per type for one experience, in declaration order of {@link ReactionType}, omitting types
     * nobody used.
     *
     * @param experienceId
     *            experience UUID
     * @return map of reaction type value to count
     */
    public static Map<String, Long> countByType(UUID experienceId) {
        List<Reaction> live = list("experienceId = ?1 AND deletedAt IS NULL", experienceId);
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ReactionType type : ReactionType.values()) {
            long n = live.stream().filter(r -> type.value().equals(r.reactionType)).count();
            if (n > 0) {
                counts.put(type.value(), n);
            }
        }
        return counts;
    }
}
