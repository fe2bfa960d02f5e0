package aicodex.experiences.services;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.ResourceNotFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the personal data export of an account.
 *
 * <p>
 * The export covers every row the account owns, soft-deleted rows included (each carries {@code deleted_at}):
 *
 * <pre>
 * {
 *   "exported_at": "2026-01-09T10:00:00Z",
 *   "user": { ... },
 *   "experiences": [ { ..., "prompts": [...], "comments": [...], "reactions": [...] } ],
 *   "comments": [ ... ],        // written by the user anywhere
 *   "reactions": [ ... ],       // given by the user anywhere
 *   "prompt_ratings": [ ... ]   // given by the user anywhere
 * }
 * </pre>
 *
 * Comments and reactions nested under an experience may come from other users and expose only their content, type
 * and timestamps.
 */
@ApplicationScoped
public class DataExportService {

    private static final Logger LOG = Logger.getLogger(DataExportService.class);

    @Inject
    Tracer tracer;

    /**
     * Aggregates all data of a user into a JSON-ready map.
     *
     * @param userId
     *            the user's ID, live or soft-deleted
     * @return export document
     * @throws ResourceNotFoundException
     *             if no user row exists
     */
    @Transactional
    public Map<String, Object> exportUserData(UUID userId) {
        Span span = tracer.spanBuilder("users.export").setAttribute("user_id", userId.toString()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            User user = User.findById(userId);
            if (user == null) {
                throw new ResourceNotFoundException("User not found: " + userId);
            }

            Map<String, Object> exportData = new LinkedHashMap<>();
            exportData.put("exported_at", Instant.now());
            exportData.put("user", serializeUser(user));

            List<Experience> experiences = Experience.list("userId = ?1 ORDER BY createdAt", userId);
            exportData.put("experiences", experiences.stream().map(DataExportService::serializeExperience).toList());

            List<Comment> comments = Comment.list("userId = ?1 ORDER BY createdAt", userId);
            exportData.put("comments", comments.stream().map(DataExportService::serializeComment).toList());

            List<Reaction> reactions = Reaction.list("userId = ?1 ORDER BY createdAt", userId);
            exportData.put("reactions", reactions.stream().map(DataExportService::serializeReaction).toList());

            List<PromptRating> ratings = PromptRating.list("userId = ?1 ORDER BY createdAt", userId);
            exportData.put("prompt_ratings", ratings.stream().map(DataExportService::serializeRating).toList());

            long rowCount = 1L + experiences.size() + comments.size() + reactions.size() + ratings.size();
            span.addEvent("data.aggregated", Attributes.of(AttributeKey.longKey("row_count"), rowCount));
            LOG.infof("Exported data of user %s: %d experiences, %d comments, %d reactions, %d ratings", userId,
                    experiences.size(), comments.size(), reactions.size(), ratings.size());
            return exportData;
        } finally {
            span.end();
        }
    }

    private static Map<String, Object> serializeUser(User user) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", user.id);
        data.put("github_username", user.githubUsername);
        data.put("username", user.username);
        data.put("email", user.email);
        data.put("avatar_url", user.avatarUrl);
        data.put("bio", user.bio);
        data.put("created_at", user.createdAt);
        data.put("updated_at", user.updatedAt);
        data.put("deleted_at", user.deletedAt);
        return data;
    }

    private static Map<String, Object> serializeExperience(Experience experience) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", experience.id);
        data.put("title", experience.title);
        data.put("description", experience.description);
        data.put("ai_assistant_type", experience.aiAssistantType);
        data.put("tags", experience.getTagList());
        data.put("github_urls", experience.getGithubUrlList());
        data.put("is_news", experience.isNews);
        data.put("created_at", experience.createdAt);
        data.put("updated_at", experience.updatedAt);
        data.put("deleted_at", experience.deletedAt);

        List<Prompt> prompts = Prompt.list("experienceId = ?1 ORDER BY orderIndex, createdAt", experience.id);
        data.put("prompts", prompts.stream().map(DataExportService::serializePrompt).toList());

        List<Comment> comments = Comment.list("experienceId = ?1 ORDER BY createdAt", experience.id);
        data.put("comments", comments.stream().map(c -> {
            Map<String, Object> comment = new LinkedHashMap<>();
            comment.put("id", c.id);
            comment.put("content", c.content);
            comment.put("created_at", c.createdAt);
            comment.put("deleted_at", c.deletedAt);
            return comment;
        }).toList());

        List<Reaction> reactions = Reaction.list("experienceId = ?1 ORDER BY createdAt", experience.id);
        data.put("reactions", reactions.stream().map(r -> {
            Map<String, Object> reaction = new LinkedHashMap<>();
            reaction.put("id", r.id);
            reaction.put("reaction_type", r.reactionType);
            reaction.put("created_at", r.createdAt);
            reaction.put("deleted_at", r.deletedAt);
            return reaction;
        }).toList());
        return data;
    }

    private static Map<String, Object> serializePrompt(Prompt prompt) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", prompt.id);
        data.put("content", prompt.content);
        data.put("context", prompt.context);
        data.put("results_achieved", prompt.resultsAchieved);
        data.put("order_index", prompt.orderIndex);
        data.put("created_at", prompt.createdAt);
        data.put("deleted_at", prompt.deletedAt);
        return data;
    }

    private static Map<String, Object> serializeComment(Comment comment) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", comment.id);
        data.put("experience_id", comment.experienceId);
        data.put("content", comment.content);
        data.put("created_at", comment.createdAt);
        data.put("deleted_at", comment.deletedAt);
        return data;
    }

    private static Map<String, Object> serializeReaction(Reaction reaction) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", reaction.id);
        data.put("experience_id", reaction.experienceId);
        data.put("reaction_type", reaction.reactionType);
        data.put("created_at", reaction.createdAt);
        data.put("deleted_at", reaction.deletedAt);
        return data;
    }

    private static Map<String, Object> serializeRating(PromptRating rating) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", rating.id);
        data.put("prompt_id", rating.promptId);
        data.put("rating", rating.rating);
        data.put("created_at", rating.createdAt);
        data.put("updated_at", rating.updatedAt);
        data.put("deleted_at", rating.deletedAt);
        return data;
    }
}
