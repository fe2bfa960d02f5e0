package aicodex.experiences.testing;

import aicodex.experiences.TestConstants;
import aicodex.experiences.data.models.AiAssistantType;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.User;

import java.time.Instant;
import java.util.List;

/**
 * Persists fixture rows directly, bypassing the services. Must be called inside a transaction.
 *
 * <p>
 * Aggregate columns start at zero; tests that need consistent aggregates go through {@code AggregationService}.
 */
public final class TestDataFactory {

    private TestDataFactory() {
    }

    /**
     * Deletes every row, children first.
     */
    public static void cleanAll() {
        PromptRating.delete("1=1");
        Reaction.delete("1=1");
        Comment.delete("1=1");
        Prompt.delete("1=1");
        Experience.delete("1=1");
        User.delete("1=1");
    }

    public static User user(String githubId, String username) {
        return User.create(githubId, username, username, username + "@example.com", null);
    }

    public static Experience experience(User author, String title, AiAssistantType assistant, List<String> tags,
            Instant createdAt) {
        Experience experience = new Experience();
        experience.userId = author.id;
        experience.title = title;
        experience.description = TestConstants.VALID_DESCRIPTION;
        experience.aiAssistantType = assistant.value();
        experience.setTagList(tags);
        experience.setGithubUrlList(List.of(TestConstants.VALID_GITHUB_URL));
        experience.isNews = false;
        experience.createdAt = createdAt;
        experience.updatedAt = createdAt;
        experience.persist();
        return experience;
    }

    public static Experience experience(User author, String title) {
        return experience(author, title, AiAssistantType.CLAUDE, List.of(), Instant.now());
    }

    public static Prompt prompt(Experience experience, int orderIndex) {
        Prompt prompt = new Prompt();
        prompt.experienceId = experience.id;
        prompt.content = TestConstants.VALID_PROMPT + " #" + orderIndex;
        prompt.orderIndex = orderIndex;
        prompt.createdAt = Instant.now();
        prompt.persist();
        return prompt;
    }
}
