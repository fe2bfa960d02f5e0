package aicodex.experiences.api.rest.admin;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Instant;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import aicodex.experiences.TestConstants;
import aicodex.experiences.data.models.Experience;
import aicodex.experiences.data.models.User;
import aicodex.experiences.testing.TestDataFactory;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import jakarta.transaction.Transactional;

/**
 * Integration tests for SoftDeleteAdminResource and the self-service data export.
 *
 * <p>
 * Tests cover:
 * <ul>
 * <li>Admin role required on every operator endpoint</li>
 * <li>Restore, delete, stats and export through HTTP</li>
 * <li>Error kinds for bad ids and invalid restores</li>
 * <li>GET /users/me/export</li>
 * </ul>
 */
@QuarkusTest
public class SoftDeleteAdminResourceTest {

    private static final String OPERATOR_GITHUB_ID = "gh-operator";

    private UUID aliceId;
    private UUID liveExperienceId;
    private UUID deletedExperienceId;

    @BeforeEach
    @Transactional
    public void setUp() {
        TestDataFactory.cleanAll();
        User alice = TestDataFactory.user(TestConstants.ALICE_GITHUB_ID, TestConstants.ALICE_USERNAME);
        aliceId = alice.id;

        Experience live = TestDataFactory.experience(alice, TestConstants.VALID_TITLE);
        liveExperienceId = live.id;
        TestDataFactory.prompt(live, 0);

        Experience deleted = TestDataFactory.experience(alice, "Removed by its author");
        deleted.deletedAt = Instant.now();
        deletedExperienceId = deleted.id;
    }

    @Test
    public void testStats_Unauthenticated_Returns401() {
        given().when().get("/admin/api/soft-delete/stats").then().statusCode(401);
    }

    @Test
    @TestSecurity(
            user = TestConstants.ALICE_GITHUB_ID,
            roles = {"USER"})
    public void testAdminEndpoints_WithoutAdminRole_Return403() {
        given().when().get("/admin/api/soft-delete/stats").then().statusCode(403);
        given().when().post("/admin/api/experiences/" + deletedExperienceId + "/restore").then().statusCode(403);
        given().when().delete("/admin/api/users/" + aliceId).then().statusCode(403);

        QuarkusTransaction.requiringNew().run(() -> {
            Experience stillDeleted = Experience.findById(deletedExperienceId);
            assertNotNull(stillDeleted.deletedAt);
        });
    }

    @Test
    @TestSecurity(
            user = OPERATOR_GITHUB_ID,
            roles = {User.ROLE_ADMIN})
    public void testStats() {
        given().when().get("/admin/api/soft-delete/stats").then().statusCode(200).body("users.total", equalTo(1),
                "experiences.total", equalTo(2), "experiences.deleted", equalTo(1),
                "experiences.recently_deleted", equalTo(1), "generated_at", notNullValue());
    }

    @Test
    @TestSecurity(
            user = OPERATOR_GITHUB_ID,
            roles = {User.ROLE_ADMIN})
    public void testRestoreExperience() {
        given().when().post("/admin/api/experiences/" + deletedExperienceId + "/restore").then().statusCode(200)
                .body("message", equalTo("Experience restored"), "id", equalTo(deletedExperienceId.toString()),
                        "experiences", equalTo(1));

        QuarkusTransaction.requiringNew().run(() -> {
            Experience restored = Experience.findById(deletedExperienceId);
            assertNull(restored.deletedAt);
        });
    }

    @Test
    @TestSecurity(
            user = OPERATOR_GITHUB_ID,
            roles = {User.ROLE_ADMIN})
    public void testRestoreExperience_NotDeleted_Returns400() {
        given().when().post("/admin/api/experiences/" + liveExperienceId + "/restore").then().statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"), "error", equalTo("Experience is not deleted"));
    }

    @Test
    @TestSecurity(
            user = OPERATOR_GITHUB_ID,
            roles = {User.ROLE_ADMIN})
    public void testRestoreUser_BadIdOrMissing() {
        given().when().post("/admin/api/users/not-a-uuid/restore").then().statusCode(400).body("code",
                equalTo("VALIDATION_ERROR"));
        given().when().post("/admin/api/users/" + UUID.randomUUID() + "/restore").then().statusCode(404)
                .body("code", equalTo("NOT_FOUND"));
    }

    @Test
    @TestSecurity(
            user = OPERATOR_GITHUB_ID,
            roles = {User.ROLE_ADMIN})
    public void testDeleteThenRestoreUser() {
        given().when().delete("/admin/api/users/" + aliceId).then().statusCode(204);
        given().when().delete("/admin/api/users/" + aliceId).then().statusCode(404);

        given().when().post("/admin/api/users/" + aliceId + "/restore").then().statusCode(200).body("message",
                equalTo("User restored"), "experiences", equalTo(1), "prompts", equalTo(1));

        QuarkusTransaction.requiringNew().run(() -> {
            Experience live = Experience.findById(liveExperienceId);
            assertNull(live.deletedAt);
            Experience deletedEarlier = Experience.findById(deletedExperienceId);
            assertNotNull(deletedEarlier.deletedAt);
        });
    }

    @Test
    @TestSecurity(
            user = OPERATOR_GITHUB_ID,
            roles = {User.ROLE_ADMIN})
    public void testDeleteExperience() {
        given().when().delete("/admin/api/experiences/" + liveExperienceId).then().statusCode(204);

        QuarkusTransaction.requiringNew().run(() -> {
            Experience deleted = Experience.findById(liveExperienceId);
            assertNotNull(deleted.deletedAt);
        });
    }

    @Test
    @TestSecurity(
            user = OPERATOR_GITHUB_ID,
            roles = {User.ROLE_ADMIN})
    public void testExportUser() {
        given().when().get("/admin/api/users/" + aliceId + "/export").then().statusCode(200).body("user.username",
                equalTo(TestConstants.ALICE_USERNAME), "experiences.size()", equalTo(2));
    }

    @Test
    @TestSecurity(
            user = TestConstants.ALICE_GITHUB_ID,
            roles = {"USER"})
    public void testExportCurrentUser() {
        given().when().get("/users/me/export").then().statusCode(200)
                .header("Content-Disposition", equalTo("attachment; filename=\"user-data-" + aliceId + ".json\""))
                .body("user.id", equalTo(aliceId.toString()), "experiences.size()", equalTo(2),
                        "prompt_ratings.size()", equalTo(0));
    }
}
