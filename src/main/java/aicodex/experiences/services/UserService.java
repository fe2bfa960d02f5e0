package aicodex.experiences.services;

import io.quarkus.oidc.UserInfo;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.CurrentUserType;
import aicodex.experiences.api.types.ExperienceSummaryType;
import aicodex.experiences.api.types.UpdateUserRequestType;
import aicodex.experiences.api.types.UserProfileType;
import aicodex.experiences.api.types.UserStatsType;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.AuthenticationException;
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.exceptions.ValidationException;
import aicodex.experiences.observability.LoggingConfig;
import aicodex.experiences.util.EmailValidator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * User accounts: caller resolution, profiles, profile edits and account deletion.
 *
 * <p>
 * The identity provider is the only source of accounts. The first request carrying a verified identity provisions a
 * {@link User} keyed by the provider id (the security principal name). Soft-deleted accounts are never revived and
 * their identities are refused.
 */
@ApplicationScoped
public class UserService {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    static final int USERNAME_MIN_LENGTH = 3;
    static final int USERNAME_MAX_LENGTH = 30;
    static final int BIO_MAX_LENGTH = 500;
    static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final Pattern USERNAME_INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_-]");
    private static final String USERINFO_ATTRIBUTE = "userinfo";

    @Inject
    ProfileStatsService profileStatsService;

    @Inject
    AggregationService aggregationService;

    @Inject
    ExperienceService experienceService;

    @ConfigProperty(
            name = "aicodex.profile.recent-experiences",
            defaultValue = "5")
    int recentExperienceLimit;

    /**
     * Maps the security identity of the current request to a live user, provisioning one on first sight.
     *
     * @param identity
     *            current security identity
     * @return live user
     * @throws AuthenticationException
     *             if the request is anonymous or the account was deleted
     */
    @Transactional
    public User resolveCaller(SecurityIdentity identity) {
        if (identity == null || identity.isAnonymous()) {
            throw new AuthenticationException("Authentication required");
        }

        String githubId = identity.getPrincipal().getName();
        Optional<User> existing = User.findByGithubId(githubId);
        if (existing.isPresent()) {
            User user = existing.get();
            if (user.isDeleted()) {
                LOG.warnf("Rejected login for deleted account %s (github_id=%s)", user.id, githubId);
                throw new AuthenticationException("Account has been deleted");
            }
            LoggingConfig.setUserId(user.id);
            return user;
        }

        String login = githubId;
        String email = null;
        String avatarUrl = null;
        Object attribute = identity.getAttribute(USERINFO_ATTRIBUTE);
        if (attribute instanceof UserInfo userInfo) {
            if (userInfo.getString("login") != null) {
                login = userInfo.getString("login");
            }
            email = userInfo.getString("email");
            avatarUrl = userInfo.getString("avatar_url");
        }

        User user = User.create(githubId, login, uniqueUsername(login), email, avatarUrl);
        LoggingConfig.setUserId(user.id);
        return user;
    }

    /**
     * Public profile of a live user.
     *
     * @param userId
     *            user UUID
     * @return profile with statistics and experiences
     * @throws ResourceNotFoundException
     *             if the user does not exist or is deleted
     */
    @Transactional
    public UserProfileType getPublicProfile(UUID userId) {
        User user = User.findActiveById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        UserStatsType stats = profileStatsService.computeStats(user.id);
        List<ExperienceSummaryType> experiences = Experience.findActiveByUserId(user.id).stream()
                .map(ExperienceSummaryType::forProfile).toList();
        return UserProfileType.fromEntity(user, stats, experiences);
    }

    /**
     * Private profile of the caller.
     *
     * @param caller
     *            resolved caller
     * @return profile with statistics, given/received rating figures and recent experiences
     */
    @Transactional
    public CurrentUserType getCurrentUser(User caller) {
        UserStatsType stats = profileStatsService.computeStats(caller.id);
        double averageGiven = profileStatsService.averageRatingGiven(caller.id);
        double receivedPerVote = AggregationService
                .round2(aggregationService.recomputeUserReceivedRating(caller.id));
        List<ExperienceSummaryType> recent = Experience.findActiveByUserId(caller.id).stream()
                .limit(recentExperienceLimit).map(ExperienceSummaryType::forProfile).toList();

        User user = User.findById(caller.id);
        return new CurrentUserType(user.id, user.username, user.email, user.avatarUrl, user.bio, user.githubUsername,
                user.createdAt, user.updatedAt, stats, averageGiven, receivedPerVote, recent);
    }

    /**
     * Applies a partial profile update.
     *
     * @param caller
     *            resolved caller
     * @param request
     *            fields to change
     * @return refreshed private profile
     * @throws ValidationException
     *             if a field is invalid or the username is taken
     */
    @Transactional
    public CurrentUserType updateProfile(User caller, UpdateUserRequestType request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        User user = User.findActiveById(caller.id)
                .orElseThrow(() -> new AuthenticationException("Account has been deleted"));

        String username = null;
        if (request.username() != null) {
            username = request.username().trim();
            validateUsername(username);
            if (!username.equals(user.username) && User.isUsernameTaken(username, user.id)) {
                throw new ValidationException("Username is already taken");
            }
        }

        String email = null;
        if (request.email() != null && !request.email().isBlank()) {
            email = request.email().trim();
            if (!EmailValidator.isValidFormat(email)) {
                throw new ValidationException("Invalid email format");
            }
            if (EmailValidator.isDisposableEmail(email)) {
                throw new ValidationException("Disposable email addresses are not allowed");
            }
        }

        if (request.bio() != null && request.bio().length() > BIO_MAX_LENGTH) {
            throw new ValidationException("Bio must not exceed 500 characters");
        }

        String avatarUrl = null;
        if (request.avatarUrl() != null && !request.avatarUrl().isBlank()) {
            avatarUrl = request.avatarUrl().trim();
            validateAvatarUrl(avatarUrl);
        }

        if (username != null) {
            user.username = username;
        }
        if (request.email() != null) {
            user.email = email;
        }
        if (request.bio() != null) {
            user.bio = request.bio().isBlank() ? null : request.bio().trim();
        }
        if (request.avatarUrl() != null) {
            user.avatarUrl = avatarUrl;
        }
        user.updatedAt = Instant.now();

        LOG.infof("Updated profile of user %s", user.id);
        return getCurrentUser(user);
    }

    /**
     * Soft-deletes an account with everything it contributed.
     *
     * <p>
     * The user's experiences are deleted with their children. Comments, reactions and ratings the user left on other
     * experiences are deleted too, and every affected aggregate is recomputed.
     *
     * @param caller
     *            resolved caller
     */
    @Transactional
    public void softDeleteUser(User caller) {
        User user = User.findActiveById(caller.id)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + caller.id));
        Instant now = Instant.now();

        List<Experience> owned = Experience.findActiveByUserId(user.id);
        for (Experience experience : owned) {
            experienceService.cascadeSoftDelete(experience, now);
        }

        Set<UUID> affectedPrompts = new LinkedHashSet<>();
        Set<UUID> affectedExperiences = new LinkedHashSet<>();

        for (PromptRating rating : PromptRating.findActiveByUserId(user.id)) {
            rating.deletedAt = now;
            affectedPrompts.add(rating.promptId);
        }
        List<Comment> comments = Comment.list("userId = ?1 AND deletedAt IS NULL", user.id);
        for (Comment comment : comments) {
            comment.deletedAt = now;
            affectedExperiences.add(comment.experienceId);
        }
        List<Reaction> reactions = Reaction.list("userId = ?1 AND deletedAt IS NULL", user.id);
        for (Reaction reaction : reactions) {
            reaction.deletedAt = now;
            affectedExperiences.add(reaction.experienceId);
        }

        for (UUID promptId : affectedPrompts) {
            Prompt.findActiveById(promptId).ifPresent(prompt -> {
                aggregationService.recomputePromptRating(prompt);
                affectedExperiences.add(prompt.experienceId);
            });
        }

        Set<UUID> affectedOwners = new LinkedHashSet<>();
        for (UUID experienceId : affectedExperiences) {
            Experience.findActiveById(experienceId).ifPresent(experience -> {
                aggregationService.recomputeExperienceRollup(experience.id);
                affectedOwners.add(experience.userId);
            });
        }
        affectedOwners.add(user.id);
        for (UUID ownerId : affectedOwners) {
            aggregationService.recomputeUserReceivedRating(ownerId);
        }

        user.deletedAt = now;
        user.updatedAt = now;
        LOG.infof("Soft-deleted user %s: %d experiences, %d comments, %d reactions, %d ratings", user.id,
                owned.size(), comments.size(), reactions.size(), affectedPrompts.size());
    }

    static void validateUsername(String username) {
        if (username.length() < USERNAME_MIN_LENGTH || username.length() > USERNAME_MAX_LENGTH) {
            throw new ValidationException("Username must be between 3 and 30 characters");
        }
        if (!USERNAME_PATTERN.matcher(username).matches()) {
            throw new ValidationException("Username can only contain letters, numbers, underscores, and hyphens");
        }
    }

    static void validateAvatarUrl(String avatarUrl) {
        try {
            URI uri = new URI(avatarUrl);
            String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
            if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
                throw new ValidationException("Avatar URL must be a valid http or https URL");
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("Avatar URL must be a valid http or https URL", e);
        }
    }

    /**
     * Derives a free username from the provider login, appending a number on collision.
     */
    static String uniqueUsername(String login) {
        String base = USERNAME_INVALID_CHARS.matcher(login != null ? login : "").replaceAll("-");
        if (base.length() < USERNAME_MIN_LENGTH) {
            base = "user-" + base;
        }
        if (base.length() > USERNAME_MAX_LENGTH) {
            base = base.substring(0, USERNAME_MAX_LENGTH);
        }

        String candidate = base;
        int suffix = 1;
        while (User.isUsernameTaken(candidate, null)) {
            String tail = String.valueOf(suffix++);
            candidate = base.substring(0, Math.min(base.length(), USERNAME_MAX_LENGTH - tail.length())) + tail;
        }
        return candidate;
    }
}
