package aicodex.experiences.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;

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
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.exceptions.ValidationException;
import aicodex.experiences.testing.TestDataFactory;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

/**
 * Tests for {@link AggregationService}.
 *
 * <p>
 * Tests cover:
 * <ul>
 * <li>Prompt rating averages and counts, including re-rating</li>
 * <li>Experience rollup over rated prompts</li>
 * <li>Reaction upsert, withdrawal and revival</li>
 * <li>Comment counts</li>
 * <li>Received-rating totals of the content owner</li>
 * <li>Concurrent submissions on one target</li>
 * </ul>
 */
@QuarkusTest
class AggregationServiceTest {

    private static final int CONCURRENT_CALLERS = 8;

    @Inject
    AggregationService aggregationService;

    private UUID ownerId;
    private UUID bobId;
    private UUID carolId;
    private UUID daveId;
    private UUID experienceId;
    private UUID promptId;
    private UUID secondPromptId;
    private UUID thirdPromptId;

    @BeforeEach
    @Transactional
    public void setupTestData() {
        TestDataFactory.cleanAll();

        User owner = TestDataFactory.user(TestConstants.ALICE_GITHUB_ID, TestConstants.ALICE_USERNAME);
        ownerId = owner.id;
        bobId = TestDataFactory.user(TestConstants.BOB_GITHUB_ID, TestConstants.BOB_USERNAME).id;
        carolId = TestDataFactory.user(TestConstants.CAROL_GITHUB_ID, TestConstants.CAROL_USERNAME).id;
        daveId = TestDataFactory.user(TestConstants.DAVE_GITHUB_ID, TestConstants.DAVE_USERNAME).id;

        Experience experience = TestDataFactory.experience(owner, TestConstants.VALID_TITLE);
        experienceId = experience.id;
        promptId = TestDataFactory.prompt(experience, 0).id;
        secondPromptId = TestDataFactory.prompt(experience, 1).id;
        thirdPromptId = TestDataFactory.prompt(experience, 2).id;
    }

    // ========== Ratings ==========

    @Test
    @Transactional
    public void testRecordRating_ThreeRatings_AveragesAndCounts() {
        // When: three users rate 5, 3 and 4
        aggregationService.recordRating(promptId, bobId, 5);
        aggregationService.recordRating(promptId, carolId, 3);
        AggregationService.RatingOutcome outcome = aggregationService.recordRating(promptId, daveId, 4);

        // Then: prompt aggregates reflect all three
        assertTrue(outcome.created());
        assertEquals(4.0, outcome.promptAverageRating());
        assertEquals(3, outcome.promptRatingCount());

        Prompt prompt = Prompt.findById(promptId);
        assertEquals(4.0, prompt.averageRating);
        assertEquals(3, prompt.ratingCount);

        // And: the experience and its owner are refreshed
        Experience experience = Experience.findById(experienceId);
        assertEquals(4.0, experience.averageRating);
        User owner = User.findById(ownerId);
        assertEquals(12.0, owner.totalRating);
        assertEquals(3, owner.ratingCount);
    }

    @Test
    @Transactional
    public void testRecordRating_FourthRating_UpdatesAverage() {
        // Given: ratings 5, 3, 4
        aggregationService.recordRating(promptId, bobId, 5);
        aggregationService.recordRating(promptId, carolId, 3);
        aggregationService.recordRating(promptId, daveId, 4);

        // When: the owner adds a 2
        AggregationService.RatingOutcome outcome = aggregationService.recordRating(promptId, ownerId, 2);

        // Then
        assertEquals(3.5, outcome.promptAverageRating());
        assertEquals(4, outcome.promptRatingCount());
    }

    @Test
    @Transactional
    public void testRecordRating_Rerate_ReplacesValueAndKeepsCount() {
        // Given
        aggregationService.recordRating(promptId, bobId, 5);
        aggregationService.recordRating(promptId, carolId, 3);

        // When: bob changes his mind
        AggregationService.RatingOutcome outcome = aggregationService.recordRating(promptId, bobId, 1);

        // Then: one row per user, average over the new values
        assertFalse(outcome.created());
        assertEquals(2, outcome.promptRatingCount());
        assertEquals(2.0, outcome.promptAverageRating());
        assertEquals(1, PromptRating.count("promptId = ?1 AND userId = ?2", promptId, bobId));
        assertEquals(1, PromptRating.findByUserAndPrompt(promptId, bobId).orElseThrow().rating);
    }

    @Test
    @Transactional
    public void testRecordRating_RepeatingAverage_RoundedToTwoDecimals() {
        aggregationService.recordRating(promptId, bobId, 5);
        aggregationService.recordRating(promptId, carolId, 4);
        AggregationService.RatingOutcome outcome = aggregationService.recordRating(promptId, daveId, 4);

        assertEquals(4.33, outcome.promptAverageRating());
        assertEquals(4.33, outcome.experienceAverageRating());
    }

    @Test
    public void testRecordRating_OutOfRange_WritesNothing() {
        assertThrows(ValidationException.class, () -> aggregationService.recordRating(promptId, bobId, 6));
        assertThrows(ValidationException.class, () -> aggregationService.recordRating(promptId, bobId, 0));

        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(0, PromptRating.count());
            Prompt prompt = Prompt.findById(promptId);
            assertEquals(0, prompt.ratingCount);
            assertEquals(0.0, prompt.averageRating);
        });
    }

    @Test
    public void testRecordRating_UnknownPrompt_ThrowsNotFound() {
        assertThrows(ResourceNotFoundException.class,
                () -> aggregationService.recordRating(UUID.randomUUID(), bobId, 3));
    }

    // ========== Experience rollup ==========

    @Test
    @Transactional
    public void testRollup_AveragesRatedPromptsOnly() {
        // Given: prompt 1 rated 5, prompt 2 rated 2, prompt 3 unrated
        aggregationService.recordRating(promptId, bobId, 5);
        aggregationService.recordRating(secondPromptId, bobId, 2);

        // When
        Experience experience = aggregationService.recomputeExperienceRollup(experienceId);

        // Then: the unrated prompt does not drag the mean down
        assertEquals(3.5, experience.averageRating);
        assertEquals(3, experience.promptCount);
    }

    @Test
    @Transactional
    public void testRollup_NoRatings_AveragesZero() {
        Experience experience = aggregationService.recomputeExperienceRollup(experienceId);

        assertEquals(0.0, experience.averageRating);
        assertEquals(3, experience.promptCount);
        assertEquals(0, experience.commentCount);
        assertEquals(0, experience.reactionCount);
    }

    @Test
    @Transactional
    public void testRollup_RepairsDriftedCounters() {
        // Given: a comment and counters that disagree with the rows
        aggregationService.recordComment(experienceId, bobId, "Nice write-up");
        Experience drifted = Experience.findById(experienceId);
        drifted.commentCount = 42;
        drifted.reactionCount = 7;
        drifted.promptCount = 0;

        // When
        Experience experience = aggregationService.recomputeExperienceRollup(experienceId);

        // Then
        assertEquals(1, experience.commentCount);
        assertEquals(0, experience.reactionCount);
        assertEquals(3, experience.promptCount);
    }

    @Test
    @Transactional
    public void testRollup_DeletedPromptExcluded() {
        // Given
        aggregationService.recordRating(promptId, bobId, 5);
        aggregationService.recordRating(thirdPromptId, bobId, 1);
        Prompt third = Prompt.findById(thirdPromptId);
        third.deletedAt = java.time.Instant.now();

        // When
        Experience experience = aggregationService.recomputeExperienceRollup(experienceId);

        // Then
        assertEquals(5.0, experience.averageRating);
        assertEquals(2, experience.promptCount);
    }

    // ========== Reactions ==========

    @Test
    @Transactional
    public void testRecordReaction_Repeated_StaysOneRow() {
        // When: bob reacts helpful twice
        AggregationService.ReactionOutcome first = aggregationService.recordReaction(experienceId, bobId,
                ReactionType.HELPFUL);
        AggregationService.ReactionOutcome second = aggregationService.recordReaction(experienceId, bobId,
                ReactionType.HELPFUL);

        // Then
        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.reaction().id, second.reaction().id);
        assertEquals(1, second.reactionCount());
        assertEquals(1, Reaction.count("experienceId", experienceId));
    }

    @Test
    @Transactional
    public void testRecordReaction_DistinctTypes_CountedPerType() {
        aggregationService.recordReaction(experienceId, bobId, ReactionType.HELPFUL);
        aggregationService.recordReaction(experienceId, bobId, ReactionType.CREATIVE);
        AggregationService.ReactionOutcome outcome = aggregationService.recordReaction(experienceId, carolId,
                ReactionType.HELPFUL);

        assertEquals(3, outcome.reactionCount());
        assertEquals(Map.of("helpful", 2L, "creative", 1L), outcome.countsByType());
        assertEquals(3, ((Experience) Experience.findById(experienceId)).reactionCount);
    }

    @Test
    @Transactional
    public void testRemoveReaction_ThenReact_RevivesRow() {
        // Given
        AggregationService.ReactionOutcome added = aggregationService.recordReaction(experienceId, bobId,
                ReactionType.BOOKMARK);

        // When: withdrawn
        AggregationService.ReactionOutcome removed = aggregationService.removeReaction(experienceId, bobId,
                ReactionType.BOOKMARK);

        // Then
        assertEquals(0, removed.reactionCount());
        assertTrue(removed.countsByType().isEmpty());

        // When: reacted again
        AggregationService.ReactionOutcome revived = aggregationService.recordReaction(experienceId, bobId,
                ReactionType.BOOKMARK);

        // Then: the same row is live again
        assertTrue(revived.created());
        assertEquals(added.reaction().id, revived.reaction().id);
        assertNull(revived.reaction().deletedAt);
        assertEquals(1, revived.reactionCount());
    }

    @Test
    public void testRemoveReaction_NoneLive_ThrowsNotFound() {
        assertThrows(ResourceNotFoundException.class,
                () -> aggregationService.removeReaction(experienceId, bobId, ReactionType.LIKE));
    }

    @Test
    public void testRecordReaction_UnknownExperience_ThrowsNotFound() {
        assertThrows(ResourceNotFoundException.class,
                () -> aggregationService.recordReaction(UUID.randomUUID(), bobId, ReactionType.LIKE));
    }

    // ========== Comments ==========

    @Test
    @Transactional
    public void testRecordComment_AppendsAndCounts() {
        aggregationService.recordComment(experienceId, bobId, "First!");
        Comment second = aggregationService.recordComment(experienceId, bobId, "Second thought");

        assertEquals("Second thought", second.content);
        assertEquals(2, Comment.count("experienceId", experienceId));
        assertEquals(2, ((Experience) Experience.findById(experienceId)).commentCount);
    }

    @Test
    public void testRecordComment_InvalidContent_WritesNothing() {
        assertThrows(ValidationException.class, () -> aggregationService.recordComment(experienceId, bobId, "   "));
        assertThrows(ValidationException.class, () -> aggregationService.recordComment(experienceId, bobId, null));
        assertThrows(ValidationException.class,
                () -> aggregationService.recordComment(experienceId, bobId, "x".repeat(1001)));

        QuarkusTransaction.requiringNew().run(() -> assertEquals(0, Comment.count()));
    }

    @Test
    @Transactional
    public void testRecordComment_MaxLength_Accepted() {
        Comment comment = aggregationService.recordComment(experienceId, bobId, "x".repeat(1000));

        assertEquals(1000, comment.content.length());
    }

    // ========== Received ratings ==========

    @Test
    @Transactional
    public void testRecomputeUserReceivedRating_NoRatings_ReturnsZero() {
        assertEquals(0.0, aggregationService.recomputeUserReceivedRating(ownerId));
        assertEquals(0.0, aggregationService.recomputeUserReceivedRating(bobId));
    }

    @Test
    @Transactional
    public void testRecomputeUserReceivedRating_AcrossPrompts() {
        aggregationService.recordRating(promptId, bobId, 5);
        aggregationService.recordRating(secondPromptId, carolId, 2);

        double perVote = aggregationService.recomputeUserReceivedRating(ownerId);

        assertEquals(3.5, perVote);
        User owner = User.findById(ownerId);
        assertEquals(7.0, owner.totalRating);
        assertEquals(2, owner.ratingCount);
    }

    // ========== Concurrency ==========

    @Test
    public void testRecordReaction_ConcurrentSameUser_SingleRow() throws InterruptedException {
        List<Throwable> errors = runConcurrently(CONCURRENT_CALLERS,
                i -> () -> aggregationService.recordReaction(experienceId, bobId, ReactionType.HELPFUL));

        assertEquals(List.of(), errors);
        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(1, Reaction.count("experienceId = ?1 AND userId = ?2 AND reactionType = ?3", experienceId,
                    bobId, ReactionType.HELPFUL.value()));
            Experience experience = Experience.findById(experienceId);
            assertEquals(1, experience.reactionCount);
        });
    }

    @Test
    public void testRecordRating_ConcurrentDifferentUsers_CountsEveryRating() throws InterruptedException {
        // Given: one rater per thread, rating 1..5 in turn
        List<UUID> raters = QuarkusTransaction.requiringNew().call(() -> {
            List<UUID> ids = new ArrayList<>();
            for (int i = 0; i < CONCURRENT_CALLERS; i++) {
                ids.add(TestDataFactory.user("gh-rater-" + i, "rater" + i).id);
            }
            return ids;
        });

        // When
        List<Throwable> errors = runConcurrently(CONCURRENT_CALLERS,
                i -> () -> aggregationService.recordRating(promptId, raters.get(i), i % 5 + 1));

        // Then: ratings 1,2,3,4,5,1,2,3 sum to 21 over 8
        assertEquals(List.of(), errors);
        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals(CONCURRENT_CALLERS, PromptRating.count("promptId", promptId));
            Prompt prompt = Prompt.findById(promptId);
            assertEquals(CONCURRENT_CALLERS, prompt.ratingCount);
            assertEquals(2.63, prompt.averageRating);
            Experience experience = Experience.findById(experienceId);
            assertEquals(2.63, experience.averageRating);
            User owner = User.findById(ownerId);
            assertEquals(CONCURRENT_CALLERS, owner.ratingCount);
            assertEquals(21.0, owner.totalRating);
        });
    }

    private static List<Throwable> runConcurrently(int callers, IntFunction<Runnable> task)
            throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(callers);
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                Runnable call = task.apply(i);
                executor.submit(() -> {
                    try {
                        start.await();
                        call.run();
                    } catch (Throwable t) {
                        errors.add(t);
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS), "concurrent callers did not finish");
        } finally {
            executor.shutdownNow();
        }
        return errors;
    }

    @Test
    public void testRound2_HalfUp() {
        assertEquals(4.34, AggregationService.round2(4.335));
        assertEquals(3.33, AggregationService.round2(10.0 / 3));
        assertEquals(0.0, AggregationService.round2(0));
    }
}
