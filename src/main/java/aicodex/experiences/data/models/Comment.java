package aicodex.experiences.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Comment entity. Comments are append-only: every submission inserts a new row.
 *
 * <p>
 * Database mapping: comments table.
 */
@Entity
@Table(
        name = "comments",
        indexes = {@Index(
                name = "comments_experience_id_created_at_idx",
                columnList = "experience_id, created_at"),
                @Index(
                        name = "comments_user_id_idx",
                        columnList = "user_id")})
public class Comment extends PanacheEntityBase {

    public static final int CONTENT_MAX_LENGTH = 1000;

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
            nullable = false,
            length = CONTENT_MAX_LENGTH)
    public String content;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    /**
     * Lists the live comments of an experience, newest first.
     *
     * @param experienceId
     *            experience UUID
     * @return comments ordered by created_at DESC
     */
    public static List<Comment> findActiveByExperienceId(UUID experienceId) {
        return find("experienceId = ?1 AND deletedAt IS NULL ORDER BY createdAt DESC, id DESC", experienceId).list();
    }

    public static long countActiveByExperienceId(UUID experienceId) {
        return count("experienceId = ?1 AND deletedAt IS NULL", experienceId);
    }

    public static long countActiveByUserId(UUID userId) {
        return count("userId = ?1 AND deletedAt IS NULL", userId);
    }
}
