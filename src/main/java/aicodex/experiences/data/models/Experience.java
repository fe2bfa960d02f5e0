package aicodex.experiences.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.LockModeType;
import jakarta.persistence.Table;
import aicodex.experiences.util.TagParser;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Experience entity: a user-authored post about an AI coding assistant session, bundling one or more prompts.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code user_id} (UUID, FK users) - Owning user</li>
 * <li>{@code title}, {@code description} (TEXT)</li>
 * <li>{@code ai_assistant_type} (TEXT) - One of {@link AiAssistantType} wire values</li>
 * <li>{@code tags} (TEXT) - Comma-delimited, normalized tag list</li>
 * <li>{@code github_urls} (TEXT) - Newline-delimited repository URLs</li>
 * <li>{@code is_news} (BOOLEAN)</li>
 * <li>{@code average_rating}, {@code reaction_count}, {@code comment_count}, {@code prompt_count} - Cached
 * aggregates</li>
 * <li>{@code created_at} / {@code updated_at} / {@code deleted_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * <p>
 * The aggregate columns are a cache over the live child rows. They are written exclusively by
 * {@code AggregationService}.
 */
@Entity
@Table(
        name = "experiences",
        indexes = {@Index(
                name = "experiences_user_id_created_at_idx",
                columnList = "user_id, created_at"),
                @Index(
                        name = "experiences_ai_assistant_type_created_at_idx",
                        columnList = "ai_assistant_type, created_at"),
                @Index(
                        name = "experiences_deleted_at_idx",
                        columnList = "deleted_at")})
public class Experience extends PanacheEntityBase {

    static final String URL_DELIMITER = "\n";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            nullable = false,
            length = 200)
    public String title;

    @Column(
            nullable = false,
            length = 2000)
    public String description;

    @Column(
            name = "ai_assistant_type",
            nullable = false,
            length = 32)
    public String aiAssistantType;

    @Column(
            length = 256)
    public String tags;

    @Column(
            name = "github_urls",
            nullable = false,
            length = 4000)
    public String githubUrls;

    @Column(
            name = "is_news",
            nullable = false)
    public boolean isNews;

    @Column(
            name = "average_rating",
            nullable = false)
    public double averageRating;

    @Column(
            name = "reaction_count",
            nullable = false)
    public int reactionCount;

    @Column(
            name = "comment_count",
            nullable = false)
    public int commentCount;

    @Column(
            name = "prompt_count",
            nullable = false)
    public int promptCount;

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

    /**
     * Finds a live experience by id.
     *
     * @param id
     *            experience UUID
     * @return Optional containing the experience if found and not soft-deleted
     */
    public static Optional<Experience> findActiveById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return find("id = ?1 AND deletedAt IS NULL", id).firstResultOptional();
    }

    /**
     * Loads a live experience holding a pessimistic write lock on its row until the transaction ends.
     *
     * <p>
     * Serializes concurrent interactions on the same experience so aggregate recomputation sees every committed child.
     *
     * @param id
     *            experience UUID
     * @return Optional containing the locked experience if found and not soft-deleted
     */
    public static Optional<Experience> lockActiveById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        Experience experience = findById(id, LockModeType.PESSIMISTIC_WRITE);
        if (experience == null || experience.deletedAt != null) {
            return Optional.empty();
        }
        return Optional.of(experience);
    }

    /**
     * Lists a user's live experiences, newest first.
     *
     * @param userId
     *            owning user
     * @return experiences ordered by created_at DESC
     */
    public static List<Experience> findActiveByUserId(UUID userId) {
        return find("userId = ?1 AND deletedAt IS NULL ORDER BY createdAt DESC, id DESC", userId).list();
    }

    /**
     * Counts a user's live experiences.
     *
     * @param userId
     *            owning user
     * @return number of non-deleted experiences
     */
    public static long countActiveByUserId(UUID userId) {
        return count("userId = ?1 AND deletedAt IS NULL", userId);
    }

    public List<String> getTagList() {
        return TagParser.parseStored(tags);
    }

    public void setTagList(List<String> tagList) {
        this.tags = TagParser.toStored(tagList);
    }

    public List<String> getGithubUrlList() {
        if (githubUrls == null || githubUrls.isBlank()) {
            return List.of();
        }
        return Arrays.stream(githubUrls.split(URL_DELIMITER)).filter(url -> !url.isBlank()).toList();
    }

    public void setGithubUrlList(List<String> urls) {
        this.githubUrls = String.join(URL_DELIMITER, urls);
    }

    public boolean isOwnedBy(UUID candidateUserId) {
        return candidateUserId != null && candidateUserId.equals(userId);
    }
}
