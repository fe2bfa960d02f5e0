package aicodex.experiences.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import aicodex.experiences.TestConstants;
import aicodex.experiences.api.types.CurrentUserType;
import aicodex.experiences.api.types.UpdateUserRequestType;
import aicodex.experiences.api.types.UserProfileType;
import aicodex.experiences.data.models.Comment;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.Prompt;
import aicodex.experiences.data.models.PromptRating;
import aicodex.experiences.data.models.Reaction;
import aicodex.experiences.data.models.ReactionType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.exceptions.AuthenticationException;
import aicodex.experiences.exceptions.ResourceNotFoundException;
import aicodex.experiences.exceptions.ValidationException;
import aicodex.experiences.testing.TestDataFactory;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.oidc.UserInfo;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusPrincipal;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

/**
 * Tests for {@link UserService}.
 *
 * <p>
 * Tests cover:
 * <ul>
 * <li>Caller resolution and first-login provisioning</li>
 * <li>Profile reads and partial updates</li>
 * <li>Account deletion and the recomputation of everything it touched</li>
 * </ul>
 */
@QuarkusTest
class UserServiceTest {

    @Inject
    UserService userService;

    @Inject
    AggregationService aggregationService;

    private User alice;
    private User bob;
    private UUID aliceExperienceId;
    private UUID alicePromptId;
    private UUID bobExperienceId;
    private UUID bobPromptId;

    @BeforeEach
    @Transactional
    public void setupTestData() {
        TestDataFactory.cleanAll();
        alice = TestDataFactory.user(TestConstants.ALICE_GITHUB_ID, TestConstants.ALICE_USERNAME);
        bob = TestDataFactory.user(TestConstants.BOB_GITHUB_ID, TestConstants.BOB_USERNAME);

        Experience aliceExperience = TestDataFactory.experience(alice, "Alice's experience");
        aliceExperience.description = "d".repeat(300);
        aliceExperienceId = aliceExperience.id;
        alicePromptId = TestDataFactory.prompt(aliceExperience, 0).id;

        Experience bobExperience = TestDataFactory.experience(bob, "Bob's experience");
        bobExperienceId = bobExperience.id;
        bobPromptId = TestDataFactory.prompt(bobExperience, 0).id;
    }

    private static SecurityIdentity identity(String principal) {
        return QuarkusSecurityIdentity.builder().setPrincipal(new QuarkusPrincipal(principal)).addRole("USER")
                .setAnonymous(false).build();
    }

    // ========== Caller resolution ==========

    @Test
    public void testResolveCaller_ExistingUser() {
        User resolved = userService.resolveCaller(identity(TestConstants.ALICE_GITHUB_ID));

        assertEquals(alice.id, resolved.id);
        QuarkusTransaction.requiringNew().run(() -> assertEquals(2, User.count()));
    }

    @Test
    public void testResolveCaller_FirstLogin_ProvisionsFromPrincipal() {
        User resolved = userService.resolveCaller(identity(TestConstants.NEWCOMER_GITHUB_ID));

        assertNotNull(resolved.id);
        assertEquals(TestConstants.NEWCOMER_GITHUB_ID, resolved.githubId);
        assertEquals(TestConstants.NEWCOMER_GITHUB_ID, resolved.username);

        // a second request finds the same account
        User again = userService.resolveCaller(identity(TestConstants.NEWCOMER_GITHUB_ID));
        assertEquals(resolved.id, again.id);
        QuarkusTransaction.requiringNew().run(() -> assertEquals(3, User.count()));
    }

    @Test
    public void testResolveCaller_FirstLogin_UsesProviderProfile() {
        SecurityIdentity identity = QuarkusSecurityIdentity.builder()
                .setPrincipal(new QuarkusPrincipal("4242"))
                .addAttribute("userinfo", new UserInfo("{\"login\":\"alice\",\"email\":\"octo@example.com\","
                        + "\"avatar_url\":\"https://avatars.example.com/u/4242\"}"))
                .setAnonymous(false).build();

        User resolved = userService.resolveCaller(identity);

        assertEquals("alice", resolved.githubUsername);
        // "alice" is taken
        assertEquals("alice1", resolved.username);
        assertEquals("octo@example.com", resolved.email);
        assertEquals("https://avatars.example.com/u/4242", resolved.avatarUrl);
    }

    @Test
    public void testResolveCaller_AnonymousOrDeleted_Unauthenticated() {
        assertThrows(AuthenticationException.class, () -> userService.resolveCaller(null));
        assertThrows(AuthenticationException.class,
                () -> userService.resolveCaller(QuarkusSecurityIdentity.builder().setAnonymous(true).build()));

        userService.softDeleteUser(bob);
        assertThrows(AuthenticationException.class,
                () -> userService.resolveCaller(identity(TestConstants.BOB_GITHUB_ID)));
    }

    @Test
    public void testUniqueUsername_SanitizesLogin() {
        QuarkusTransaction.requiringNew().run(() -> {
            assertEquals("john-doe", UserService.uniqueUsername("john.doe"));
            assertEquals("user-ab", UserService.uniqueUsername("ab"));
            assertEquals("bob1", UserService.uniqueUsername("bob"));
        });
    }

    // ========== Profiles ==========

    @Test
    public void testGetPublicProfile_TruncatesDescriptions() {
        UserProfileType profile = userService.getPublicProfile(alice.id);

        assertEquals(TestConstants.ALICE_USERNAME, profile.username());
        assertEquals(1, profile.stats().experienceCount());
        assertEquals(1, profile.experiences().size());
        assertEquals(200, profile.experiences().get(0).description().length());
        assertNull(profile.experiences().get(0).user());
    }

    @Test
    public void testGetPublicProfile_Missing_NotFound() {
        assertThrows(ResourceNotFoundException.class, () -> userService.getPublicProfile(UUID.randomUUID()));
    }

    @Test
    @Transactional
    public void testGetCurrentUser_RatingFigures() {
        // Given: bob rates alice's prompt 4, alice rates bob's prompt 2
        aggregationService.recordRating(alicePromptId, bob.id, 4);
        aggregationService.recordRating(bobPromptId, alice.id, 2);

        // When
        CurrentUserType me = userService.getCurrentUser(User.findById(alice.id));

        // Then
        assertEquals(4.0, me.ratingReceivedPerVote());
        assertEquals(2.0, me.averageRatingGiven());
        assertEquals(1, me.stats().ratingsGiven());
        assertEquals(1, me.recentExperiences().size());
    }

    // ========== Profile updates ==========

    @Test
    public void testUpdateProfile_ChangesGivenFieldsOnly() {
        CurrentUserType updated = userService.updateProfile(alice,
                new UpdateUserRequestType("alice_new", null, "Writes parsers", null));

        assertEquals("alice_new", updated.username());
        assertEquals("Writes parsers", updated.bio());
        assertEquals(TestConstants.ALICE_USERNAME + "@example.com", updated.email());

        CurrentUserType cleared = userService.updateProfile(alice, new UpdateUserRequestType(null, null, "", null));
        assertNull(cleared.bio());
        assertEquals("alice_new", cleared.username());
    }

    @Test
    public void testUpdateProfile_UsernameTaken() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> userService.updateProfile(alice, new UpdateUserRequestType("BOB", null, null, null)));

        assertEquals("Username is already taken", e.getMessage());
    }

    @Test
    public void testUpdateProfile_UsernameOfDeletedAccountStaysTaken() {
        QuarkusTransaction.requiringNew().run(() -> {
            User deleted = User.findById(bob.id);
            deleted.deletedAt = Instant.now();
        });

        ValidationException e = assertThrows(ValidationException.class,
                () -> userService.updateProfile(alice, new UpdateUserRequestType("bob", null, null, null)));

        assertEquals("Username is already taken", e.getMessage());
    }

    @Test
    public void testUpdateProfile_InvalidFields() {
        assertThrows(ValidationException.class,
                () -> userService.updateProfile(alice, new UpdateUserRequestType("no spaces", null, null, null)));
        assertThrows(ValidationException.class,
                () -> userService.updateProfile(alice, new UpdateUserRequestType("ab", null, null, null)));
        assertThrows(ValidationException.class,
                () -> userService.updateProfile(alice, new UpdateUserRequestType(null, "not-an-email", null, null)));
        assertThrows(ValidationException.class, () -> userService.updateProfile(alice,
                new UpdateUserRequestType(null, "someone@mailinator.com", null, null)));
        assertThrows(ValidationException.class,
                () -> userService.updateProfile(alice, new UpdateUserRequestType(null, null, "b".repeat(501), null)));
        assertThrows(ValidationException.class, () -> userService.updateProfile(alice,
                new UpdateUserRequestType(null, null, null, "ftp://example.com/a.png")));

        QuarkusTransaction.requiringNew().run(() -> {
            User unchanged = User.findById(alice.id);
            assertEquals(TestConstants.ALICE_USERNAME, unchanged.username);
            assertNull(unchanged.bio);
        });
    }

    // ========== Account deletion ==========

    @Test
    public void testSoftDeleteUser_CascadesAndRecomputes() {
        // Given: alice and bob interact with each other's experiences
        QuarkusTransaction.requiringNew().run(() -> {
            aggregationService.recordRating(alicePromptId, bob.id, 4);
            aggregationService.recordComment(aliceExperienceId, bob.id, "Nice one");
            aggregationService.recordRating(bobPromptId, alice.id, 5);
            aggregationService.recordRating(bobPromptId, bob.id, 3);
            aggregationService.recordComment(bobExperienceId, alice.id, "Thanks bob");
            aggregationService.recordReaction(bobExperienceId, alice.id, ReactionType.HELPFUL);
        });

        // When
        userService.softDeleteUser(alice);

        // Then: alice's own content is gone
        QuarkusTransaction.requiringNew().run(() -> {
            assertNotNull(User.<User> findById(alice.id).deletedAt);
            assertEquals(0, Experience.count("id = ?1 AND deletedAt IS NULL", aliceExperienceId));
            assertEquals(0, Prompt.count("id = ?1 AND deletedAt IS NULL", alicePromptId));
            assertEquals(0, Comment.count("experienceId = ?1 AND deletedAt IS NULL", aliceExperienceId));

            // And: her activity on bob's experience is withdrawn and bob's aggregates follow
            assertEquals(0, Comment.count("userId = ?1 AND deletedAt IS NULL", alice.id));
            assertEquals(0, Reaction.count("userId = ?1 AND deletedAt IS NULL", alice.id));
            assertEquals(0, PromptRating.count("userId = ?1 AND deletedAt IS NULL", alice.id));

            Prompt bobPrompt = Prompt.findById(bobPromptId);
            assertEquals(1, bobPrompt.ratingCount);
            assertEquals(3.0, bobPrompt.averageRating);

            Experience bobExperience = Experience.findById(bobExperienceId);
            assertEquals(0, bobExperience.commentCount);
            assertEquals(0, bobExperience.reactionCount);
            assertEquals(3.0, bobExperience.averageRating);

            User bobNow = User.findById(bob.id);
            assertEquals(1, bobNow.ratingCount);
            assertEquals(3.0, bobNow.totalRating);
        });

        assertThrows(ResourceNotFoundException.class, () -> userService.getPublicProfile(alice.id));
    }
}
