package aicodex.experiences.api.rest;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.POST;
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
import aicodex.experiences.api.types.RatingRequestType;
import aicodex.experiences.api.types.RatingResultType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.services.ExperienceService;
import aicodex.experiences.services.InteractionResult;
import aicodex.experiences.services.InteractionService;
import aicodex.experiences.services.UserService;
import aicodex.experiences.util.IdParser;

/**
 * Prompt ratings and prompt removal.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /prompts/{id}/ratings - Rate a prompt 1-5</li>
 * <li>DELETE /prompts/{id} - Remove a prompt (experience owner only)</li>
 * </ul>
 */
@Path("/prompts")
@Produces(MediaType.APPLICATION_JSON)
@Authenticated
@Tag(
        name = "Prompts",
        description = "Prompt ratings")
public class PromptResource {

    @Inject
    SecurityIdentity securityIdentity;

    @Inject
    UserService userService;

    @Inject
    InteractionService interactionService;

    @Inject
    ExperienceService experienceService;

    @POST
    @Path("/{id}/ratings")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Rate a prompt",
            description = "One rating per user and prompt. 201 when added, 200 when an earlier rating was replaced")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Rating added",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = RatingResultType.class))),
                    @APIResponse(
                            responseCode = "200",
                            description = "Rating updated"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Rating is not an integer between 1 and 5"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Prompt not found"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Duplicate rating (reject policy)")})
    public Response ratePrompt(@PathParam("id") String id, RatingRequestType request) {
        User caller = userService.resolveCaller(securityIdentity);
        InteractionResult<RatingResultType> result = interactionService.rate(caller, IdParser.parseUuid(id, "prompt"),
                request);
        return Response.status(result.created() ? Response.Status.CREATED : Response.Status.OK).entity(result.body())
                .build();
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Remove a prompt (experience owner only)")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "204",
                    description = "Prompt removed"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Not the author"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Prompt not found")})
    public Response deletePrompt(@PathParam("id") String id) {
        User caller = userService.resolveCaller(securityIdentity);
        experienceService.deletePrompt(caller, IdParser.parseUuid(id, "prompt"));
        return Response.noContent().build();
    }
}
