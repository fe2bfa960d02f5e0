package aicodex.experiences.api.rest;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.CurrentUserType;
import aicodex.experiences.api.types.UpdateUserRequestType;
import aicodex.experiences.api.types.UserProfileType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.services.DataExportService;
import aicodex.experiences.services.UserService;
import aicodex.experiences.util.IdParser;

/**
 * User profiles.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /users/me - Caller's private profile and statistics</li>
 * <li>PUT /users/me - Partial profile update</li>
 * <li>DELETE /users/me - Delete the caller's account</li>
 * <li>GET /users/me/export - Download all of the caller's data</li>
 * <li>GET /users/{id} - Public profile and statistics</li>
 * </ul>
 */
@Path("/users")
@Produces(MediaType.APPLICATION_JSON)
@Authenticated
@Tag(
        name = "Users",
        description = "User profiles and contribution statistics")
public class UserResource {

    private static final Logger LOG = Logger.getLogger(UserResource.class);

    @Inject
    SecurityIdentity securityIdentity;

    @Inject
    UserService userService;

    @Inject
    DataExportService dataExportService;

    @GET
    @Path("/me")
    @Operation(
            summary = "Get current user's profile")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Profile returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CurrentUserType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    public CurrentUserType getCurrentUser() {
        User caller = userService.resolveCaller(securityIdentity);
        return userService.getCurrentUser(caller);
    }

    @PUT
    @Path("/me")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Update current user's profile",
            description = "Only the fields present in the body change")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Profile updated",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CurrentUserType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid field or username taken"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    public CurrentUserType updateCurrentUser(@Valid UpdateUserRequestType request) {
        User caller = userService.resolveCaller(securityIdentity);
        return userService.updateProfile(caller, request);
    }

    @DELETE
    @Path("/me")
    @Operation(
            summary = "Delete current user's account",
            description = "Soft-deletes the account, its experiences and its interactions")
    @APIResponse(
            responseCode = "204",
            description = "Account deleted")
    public Response deleteCurrentUser() {
        User caller = userService.resolveCaller(securityIdentity);
        LOG.infof("User %s requested account deletion", caller.id);
        userService.softDeleteUser(caller);
        return Response.noContent().build();
    }

    @GET
    @Path("/me/export")
    @Operation(
            summary = "Export current user's data",
            description = "Returns every row the account owns, soft-deleted rows included")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Export returned"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    public Response exportCurrentUser() {
        User caller = userService.resolveCaller(securityIdentity);
        LOG.infof("User %s requested a data export", caller.id);
        return Response.ok(dataExportService.exportUserData(caller.id))
                .header("Content-Disposition", "attachment; filename=\"user-data-" + caller.id + ".json\"").build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get a user's public profile")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Profile returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = UserProfileType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid user ID"),
                    @APIResponse(
                            responseCode = "404",
                            description = "User not found")})
    public UserProfileType getUser(@PathParam("id") String id) {
        userService.resolveCaller(securityIdentity);
        return userService.getPublicProfile(IdParser.parseUuid(id, "user"));
    }
}
