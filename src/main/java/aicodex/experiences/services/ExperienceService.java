package aicodex.experiences.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.AuthorType;
import aicodex.experiences.api.types.CommentType;
import aicodex.experiences.api.types.CreateExperienceRequestType;
import aicodex.experiences.api.types.ExperienceDetailType;
import aicodex.experiences.api.types.PromptRequestType;
import aicodex.experiences.api.types.PromptType;
import aicodex.experiences.api.types.UpdateExperienceRequestType;
import aicodex.experiences.data.models.AiAssistantType;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.AuthenticationException;
import aicodex.experiences.exceptions.AuthorizationException;
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.exceptions.ValidationException;
import aicodex.experiences.util.GitHubUrlValidator;
import aicodex.experiences.util.TagParser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Experience lifecycle: publish, edit, delete (with cascade), and prompt management.
 *
 * <p>
 * Only the owning user may mutate an experience or its prompts. Deletion is soft and cascades explicitly to the
 * children: prompts, the ratings of those prompts, comments and reactions. Every mutation that changes the child set
 * ends with {@link AggregationService#recomputeExperienceRollup(UUID)} and a refresh of the owner's received-rating
 * totals.
 */
@ApplicationScoped
public class ExperienceService {

    private static final Logger LOG = Logger.getLogger(ExperienceService.class);

    static final int TITLE_MIN_LENGTH = 5;
    static final int TITLE_MAX_LENGTH = 200;
    static final int DESCRIPTION_MIN_LENGTH = 20;
    static final int DESCRIPTION_MAX_LENGTH = 2000;
    static final int MAX_GITHUB_URLS = 10;

    @Inject
    AggregationService aggregationService;

    /**
     * Publishes a new experience with its initial prompts.
     *
     * @param caller
     *            authenticated author
     * @param request
     *            experience fields and optional prompts
     * @return stored experience with refreshed aggregates
     * @throws ValidationException
     *             if any field or prompt is invalid (nothing is written)
     */
    @Transactional
    public ExperienceDetailType createExperience(User caller, CreateExperienceRequestType request) {
        requireCaller(caller);
        if (request == null) {
            throw new ValidationException("Request body is required");
        }

        String title = validateTitle(request.title());
        String description = validateDescription(request.description());
        AiAssistantType assistant = validateAssistant(request.aiAssistantType());
        List<String> urls = validateGithubUrls(request.githubUrls());
        List<PromptRequestType> prompts = request.prompts() != null ? request.prompts() : List.of();
        for (PromptRequestType prompt : prompts) {
            validatePrompt(prompt);
        }

        Instant now = Instant.now();
        Experience experience = new Experience();
        experience.userId = caller.id;
        experience.title = title;
        experience.description = description;
        experience.aiAssistantType = assistant.value();
        experience.setTagList(TagParser.sanitize(request.tags()));
        experience.setGithubUrlList(urls);
        experience.isNews = Boolean.TRUE.equals(request.isNews());
        experience.createdAt = now;
        experience.updatedAt = now;
        experience.persist();

        int orderIndex = 0;
        for (PromptRequestType prompt : prompts) {
            persistPrompt(experience.id, prompt, orderIndex++, now);
        }

        aggregationService.recomputeExperienceRollup(experience.id);
        LOG.infof("Created experience %s by user %s with %d prompts", experience.id, caller.id, prompts.size());
        return buildDetail(experience, caller);
    }

    /**
     * Replaces the scalar fields of an experience.
     *
     * @param caller
     *            authenticated user, must own the experience
     * @param experienceId
     *            experience UUID
     * @param request
     *            new field values
     * @return updated experience
     * @throws ResourceNotFoundException
     *             if the experience does not exist or is deleted
     * @throws AuthorizationException
     *             if the caller is not the owner
     */
    @Transactional
    public ExperienceDetailType updateExperience(User caller, UUID experienceId, UpdateExperienceRequestType request) {
        requireCaller(caller);
        Experience experience = loadOwned(caller, experienceId);
        if (request == null) {
            throw new ValidationException("Request body is required");
        }

        String title = validateTitle(request.title());
        String description = validateDescription(request.description());
        AiAssistantType assistant = validateAssistant(request.aiAssistantType());
        List<String> urls = validateGithubUrls(request.githubUrls());

        experience.title = title;
        experience.description = description;
        experience.aiAssistantType = assistant.value();
        experience.setTagList(TagParser.sanitize(request.tags()));
        experience.setGithubUrlList(urls);
        if (request.isNews() != null) {
            experience.isNews = request.isNews();
        }
        experience.updatedAt = Instant.now();

        LOG.infof("Updated experience %s", experienceId);
        return buildDetail(experience, caller);
    }

    /**
     * Soft-deletes an experience and all its children.
     *
     * @param caller
     *            authenticated user, must own the experience
     * @param experienceId
     *            experience UUID
     */
    @Transactional
    public void deleteExperience(User caller, UUID experienceId) {
        requireCaller(caller);
        Experience experience = loadOwned(caller, experienceId);

        cascadeSoftDelete(experience, Instant.now());
        aggregationService.recomputeUserReceivedRating(experience.userId);
        LOG.infof("Soft-deleted experience %s by user %s", experienceId, caller.id);
    }

    /**
     * Appends a prompt to an experience.
     *
     * @param caller
     *            authenticated user, must own the experience
     * @param experienceId
     *            experience UUID
     * @param request
     *            prompt fields
     * @return stored prompt
     */
    @Transactional
    public PromptType addPrompt(User caller, UUID experienceId, PromptRequestType request) {
        requireCaller(caller);
        Experience experience = loadOwned(caller, experienceId);
        validatePrompt(request);

        Prompt prompt = persistPrompt(experience.id, request, Prompt.nextOrderIndex(experience.id), Instant.now());
        experience.updatedAt = Instant.now();
        aggregationService.recomputeExperienceRollup(experience.id);
        aggregationService.recomputeUserReceivedRating(experience.userId);

        LOG.infof("Added prompt %s to experience %s", prompt.id, experienceId);
        return PromptType.fromEntity(prompt);
    }

    /**
     * Soft-deletes a prompt and its ratings.
     *
     * @param caller
     *            authenticated user, must own the prompt's experience
     * @param promptId
     *            prompt UUID
     */
    @Transactional
    public void deletePrompt(User caller, UUID promptId) {
        requireCaller(caller);
        Prompt prompt = Prompt.findActiveById(promptId)
                .orElseThrow(() -> new ResourceNotFoundException("Prompt not found: " + promptId));
        Experience experience = loadOwned(caller, prompt.experienceId);

        Instant now = Instant.now();
        PromptRating.update("deletedAt = ?1 WHERE promptId = ?2 AND deletedAt IS NULL", now, promptId);
        prompt.deletedAt = now;
        aggregationService.recomputePromptRating(prompt);
        experience.updatedAt = now;

        aggregationService.recomputeExperienceRollup(experience.id);
        aggregationService.recomputeUserReceivedRating(experience.userId);
        LOG.infof("Soft-deleted prompt %s of experience %s", promptId, experience.id);
    }

    /**
     * Loads the full view of a live experience.
     *
     * @param experienceId
     *            experience UUID
     * @return experience with author, prompts, comments and reaction counts
     * @throws ResourceNotFoundException
     *             if the experience or its author is deleted
     */
    @Transactional
    public ExperienceDetailType getExperienceDetail(UUID experienceId) {
        Experience experience = Experience.findActiveById(experienceId)
                .orElseThrow(() -> new ResourceNotFoundException("Experience not found: " + experienceId));
        User author = User.findActiveById(experience.userId)
                .orElseThrow(() -> new ResourceNotFoundException("Experience not found: " + experienceId));
        return buildDetail(experience, author);
    }

    /**
     * Soft-deletes an experience and its prompts, prompt ratings, comments and reactions, then zeroes the rollups of
     * the experience and of each of its prompts.
     *
     * @param experience
     *            managed experience
     * @param now
     *            deletion timestamp shared by all rows
     */
    void cascadeSoftDelete(Experience experience, Instant now) {
        PromptRating.update("deletedAt = ?1 WHERE deletedAt IS NULL AND promptId IN "
                + "(SELECT p.id FROM Prompt p WHERE p.experienceId = ?2)", now, experience.id);
        for (Prompt prompt : Prompt.findActiveByExperienceId(experience.id)) {
            prompt.deletedAt = now;
            aggregationService.recomputePromptRating(prompt);
        }
        Comment.update("deletedAt = ?1 WHERE experienceId = ?2 AND deletedAt IS NULL", now, experience.id);
        Reaction.update("deletedAt = ?1 WHERE experienceId = ?2 AND deletedAt IS NULL", now, experience.id);

        experience.deletedAt = now;
        experience.updatedAt = now;
        aggregationService.recomputeExperienceRollup(experience.id);
    }

    private Experience loadOwned(User caller, UUID experienceId) {
        Experience experience = Experience.lockActiveById(experienceId)
                .orElseThrow(() -> new ResourceNotFoundException("Experience not found: " + experienceId));
        if (!experience.isOwnedBy(caller.id)) {
            LOG.warnf("User %s attempted to modify experience %s owned by %s", caller.id, experienceId,
                    experience.userId);
            throw new AuthorizationException("Only the author can modify this experience");
        }
        return experience;
    }

    private static Prompt persistPrompt(UUID experienceId, PromptRequestType request, int orderIndex, Instant now) {
        Prompt prompt = new Prompt();
        prompt.experienceId = experienceId;
        prompt.content = request.content().trim();
        prompt.context = blankToNull(request.context());
        prompt.resultsAchieved = blankToNull(request.resultsAchieved());
        prompt.orderIndex = orderIndex;
        prompt.createdAt = now;
        prompt.persist();
        return prompt;
    }

    private static ExperienceDetailType buildDetail(Experience experience, User author) {
        List<PromptType> prompts = Prompt.findActiveByExperienceId(experience.id).stream().map(PromptType::fromEntity)
                .toList();

        List<Comment> comments = Comment.findActiveByExperienceId(experience.id);
        Map<UUID, User> commenters = loadUsers(comments.stream().map(c -> c.userId).collect(Collectors.toSet()));
        List<CommentType> commentTypes = comments.stream()
                .map(c -> CommentType.fromEntity(c, commenters.get(c.userId))).toList();

        return new ExperienceDetailType(experience.id, experience.title, experience.description,
                experience.aiAssistantType, experience.getTagList(), experience.getGithubUrlList(), experience.isNews,
                experience.averageRating, experience.reactionCount, experience.commentCount, experience.promptCount,
                experience.createdAt, experience.updatedAt, AuthorType.fromEntity(author), prompts, commentTypes,
                Reaction.countByType(experience.id));
    }

    private static Map<UUID, User> loadUsers(Set<UUID> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        List<User> users = User.list("id IN ?1", userIds);
        return users.stream().collect(Collectors.toMap(u -> u.id, Function.identity()));
    }

    static String validateTitle(String raw) {
        String title = raw != null ? raw.trim() : "";
        if (title.length() < TITLE_MIN_LENGTH || title.length() > TITLE_MAX_LENGTH) {
            throw new ValidationException("Title must be between 5 and 200 characters");
        }
        return title;
    }

    static String validateDescription(String raw) {
        String description = raw != null ? raw.trim() : "";
        if (description.length() < DESCRIPTION_MIN_LENGTH || description.length() > DESCRIPTION_MAX_LENGTH) {
            throw new ValidationException("Description must be between 20 and 2000 characters");
        }
        return description;
    }

    static AiAssistantType validateAssistant(String raw) {
        if (raw == null) {
            throw new ValidationException("AI assistant type is required");
        }
        return AiAssistantType.fromValue(raw.trim())
                .orElseThrow(() -> new ValidationException("Invalid AI assistant type: " + raw));
    }

    /**
     * Validates and normalizes repository URLs. Blank entries are ignored; at least one valid URL must remain.
     */
    static List<String> validateGithubUrls(List<String> rawUrls) {
        Set<String> urls = new LinkedHashSet<>();
        if (rawUrls != null) {
            for (String raw : rawUrls) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                String normalized = GitHubUrlValidator.validateAndNormalize(raw);
                if (normalized == null) {
                    throw new ValidationException("Invalid GitHub repository URL: " + raw.trim());
                }
                urls.add(normalized);
            }
        }
        if (urls.isEmpty()) {
            throw new ValidationException("At least one GitHub URL is required");
        }
        if (urls.size() > MAX_GITHUB_URLS) {
            throw new ValidationException("At most " + MAX_GITHUB_URLS + " GitHub URLs are allowed");
        }
        return new ArrayList<>(urls);
    }

    static void validatePrompt(PromptRequestType prompt) {
        if (prompt == null || prompt.content() == null) {
            throw new ValidationException("Prompt content is required");
        }
        int length = prompt.content().trim().length();
        if (length < Prompt.CONTENT_MIN_LENGTH || length > Prompt.CONTENT_MAX_LENGTH) {
            throw new ValidationException("Prompt content must be between 10 and 5000 characters");
        }
        if (prompt.context() != null && prompt.context().length() > Prompt.NOTE_MAX_LENGTH) {
            throw new ValidationException("Context must not exceed 500 characters");
        }
        if (prompt.resultsAchieved() != null && prompt.resultsAchieved().length() > Prompt.NOTE_MAX_LENGTH) {
            throw new ValidationException("Results achieved must not exceed 500 characters");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static void requireCaller(User caller) {
        if (caller == null) {
            throw new AuthenticationException("Authentication required");
        }
    }
}
