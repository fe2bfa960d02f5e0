package aicodex.experiences.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import aicodex.experiences.TestConstants;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.ReactionType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.testing.TestDataFactory;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

/**
 * Tests for {@link RetentionService}: expired soft-deleted content is removed, everything else is kept.
 */
@QuarkusTest
class RetentionServiceTest {

    @Inject
    RetentionService retentionService;

    @Inject
    AggregationService aggregationService;

    @Inject
    UserService userService;

    private User alice;
    private User bob;
    private UUID liveExperienceId;
    private UUID livePromptId;
    private UUID doomedExperienceId;

    @BeforeEach
    @Transactional
    public void setupTestData() {
        TestDataFactory.cleanAll();
        alice = TestDataFactory.user(TestConstants.ALICE_GITHUB_ID, TestConstants.ALICE_USERNAME);
        bob = TestDataFactory.user(TestConstants.BOB_GITHUB_ID, TestConstants.BOB_USERNAME);

        Experience live = TestDataFactory.experience(alice, TestConstants.VALID_TITLE);
        liveExperienceId = live.id;
        livePromptId = TestDataFactory.prompt(live, 0).id;

        Experience doomed = TestDataFactory.experience(bob, "Bob's experience");
        doomedExperienceId = doomed.id;
        TestDataFactory.prompt(doomed, 0);
    }

    @Test
    public void testPurgeExpired_RemovesOnlyExpiredDeletedRows() {
        // Given: bob's account and content are deleted, and alice removed a comment herself
        QuarkusTransaction.requiringNew().run(() -> {
            Prompt doomedPrompt = Prompt.find("experienceId", doomedExperienceId).firstResult();
            aggregationService.recordRating(doomedPrompt.id, alice.id, 4);
            aggregationService.recordRating(livePromptId, bob.id, 5);
            aggregationService.recordReaction(liveExperienceId, bob.id, ReactionType.HELPFUL);
            Comment own = aggregationService.recordComment(liveExperienceId, alice.id, "Edited out later");
            own.deletedAt = Instant.now();
            aggregationService.recordComment(liveExperienceId, alice.id, "Still here");
        });
        userService.softDeleteUser(bob);

        // When: the content grace period (30 days) has passed, the account one (90 days) has not
        RetentionService.PurgeResult result = retentionService.purgeExpired(Instant.now().plus(31, ChronoUnit.DAYS));

        // Then
        assertEquals(1, result.experiences());
        assertEquals(1, result.prompts());
        assertEquals(2, result.ratings());
        assertEquals(1, result.comments());
        assertEquals(1, result.reactions());
        assertEquals(0, result.scrubbedAccounts());
        QuarkusTransaction.requiringNew().run(() -> {
            assertNull(Experience.findById(doomedExperienceId));
            assertEquals(0, Prompt.count("experienceId", doomedExperienceId));
            assertEquals(0, PromptRating.count());
            assertEquals(0, Reaction.count());
            assertEquals(1, Comment.count());
            assertNotNull(Experience.findById(liveExperienceId));
            assertNotNull(Prompt.findById(livePromptId));

            User deleted = User.findById(bob.id);
            assertEquals("bob@example.com", deleted.email);
        });
    }

    @Test
    public void testPurgeExpired_ScrubsExpiredAccounts() {
        QuarkusTransaction.requiringNew().run(() -> {
            User deleted = User.findById(bob.id);
            deleted.bio = "Writes compilers";
        });
        userService.softDeleteUser(bob);

        RetentionService.PurgeResult result = retentionService.purgeExpired(Instant.now().plus(91, ChronoUnit.DAYS));

        assertEquals(1, result.scrubbedAccounts());
        QuarkusTransaction.requiringNew().run(() -> {
            User scrubbed = User.findById(bob.id);
            assertNull(scrubbed.email);
            assertNull(scrubbed.bio);
            assertEquals(TestConstants.BOB_USERNAME, scrubbed.username);
            assertEquals(TestConstants.BOB_GITHUB_ID, scrubbed.githubId);

            User live = User.findById(alice.id);
            assertEquals("alice@example.com", live.email);
        });
    }

    @Test
    public void testPurgeExpired_WithinGracePeriod_KeepsEverything() {
        userService.softDeleteUser(bob);

        RetentionService.PurgeResult result = retentionService.purgeExpired(Instant.now().plus(29, ChronoUnit.DAYS));

        assertEquals(0, result.total());
        QuarkusTransaction.requiringNew().run(() -> assertNotNull(Experience.findById(doomedExperienceId)));
    }
}
