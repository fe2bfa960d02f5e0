package aicodex.experiences.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * User entity implementing the Panache ActiveRecord pattern for accounts verified through GitHub OAuth.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code github_id} (TEXT, unique) - Provider-specific user ID, the verified external identity</li>
 * <li>{@code github_username} (TEXT) - Provider login at provisioning time</li>
 * <li>{@code username} (TEXT, unique) - Display name chosen on the platform</li>
 * <li>{@code email} (TEXT) - Optional email address</li>
 * <li>{@code avatar_url} (TEXT) - Optional profile picture URL</li>
 * <li>{@code bio} (TEXT) - Optional biography (max 500 chars)</li>
 * <li>{@code total_rating} (DOUBLE) - Sum of live ratings received on the user's prompts</li>
 * <li>{@code rating_count} (INT) - Number of live ratings received on the user's prompts</li>
 * <li>{@code created_at} / {@code updated_at} (TIMESTAMPTZ)</li>
 * <li>{@code deleted_at} (TIMESTAMPTZ) - Soft deletion timestamp; users are never hard-deleted</li>
 * </ul>
 *
 * <p>
 * {@code totalRating} and {@code ratingCount} are written only by {@code AggregationService}.
 */
@Entity
@Table(
        name = "users")
public class User extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(User.class);

    /** Role granted to operators listed in {@code aicodex.admin.github-ids}. */
    public static final String ROLE_ADMIN = "admin";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "github_id",
            nullable = false,
            unique = true)
    public String githubId;

    @Column(
            name = "github_username",
            nullable = false)
    public String githubUsername;

    @Column(
            nullable = false,
            unique = true,
            length = 30)
    public String username;

    @Column
    public String email;

    @Column(
            name = "avatar_url")
    public String avatarUrl;

    @Column(
            length = 500)
    public String bio;

    @Column(
            name = "total_rating",
            nullable = false)
    public double totalRating;

    @Column(
            name = "rating_count",
            nullable = false)
    public int ratingCount;

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
     * Finds a live (not soft-deleted) user by primary key.
     *
     * @param id
     *            user UUID
     * @return Optional containing the user if found and not deleted
     */
    public static Optional<User> findActiveById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return find("id = ?1 AND deletedAt IS NULL", id).firstResultOptional();
    }

    /**
     * Finds a user by the external provider id, including soft-deleted accounts.
     *
     * @param githubId
     *            provider-specific user ID
     * @return Optional containing the user if found
     */
    public static Optional<User> findByGithubId(String githubId) {
        if (githubId == null || githubId.isBlank()) {
            return Optional.empty();
        }
        return find("githubId", githubId).firstResultOptional();
    }

    /**
     * Checks whether a username is held by any account other than {@code excludeUserId}.
     *
     * <p>
     * Soft-deleted accounts still hold their username because the column is unique.
     *
     * @param username
     *            candidate username
     * @param excludeUserId
     *            user to ignore (the one being renamed), may be null
     * @return true if another account already uses the username
     */
    public static boolean isUsernameTaken(String username, UUID excludeUserId) {
        if (excludeUserId == null) {
            return count("lower(username) = lower(?1)", username) > 0;
        }
        return count("lower(username) = lower(?1) AND id <> ?2", username, excludeUserId) > 0;
    }

    /**
     * Creates and persists a new user for a freshly verified external identity.
     *
     * @param githubId
     *            provider-specific user ID
     * @param githubUsername
     *            provider login
     * @param username
     *            unique platform username
     * @param email
     *            email address, may be null
     * @param avatarUrl
     *            avatar URL, may be null
     * @return persisted user with generated UUID
     */
    public static User create(String githubId, String githubUsername, String username, String email,
            String avatarUrl) {
        User user = new User();
        user.githubId = githubId;
        user.githubUsername = githubUsername;
        user.username = username;
        user.email = email;
        user.avatarUrl = avatarUrl;
        user.totalRating = 0;
        user.ratingCount = 0;
        user.createdAt = Instant.now();
        user.updatedAt = user.createdAt;
        user.persist();
        LOG.infof("Created user %s (github_id=%s) with id: %s", username, githubId, user.id);
        return user;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
