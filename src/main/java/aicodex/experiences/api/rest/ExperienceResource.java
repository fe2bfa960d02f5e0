package aicodex.experiences.api.rest;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.CommentRequestType;
import aicodex.experiences.api.types.CommentResultType;
import aicodex.experiences.api.types.CreateExperienceRequestType;
import aicodex.experiences.api.types.ErrorResponseType;
import aicodex.experiences.api.types.ExperienceDetailType;
import aicodex.experiences.api.types.FeedCriteria;
import aicodex.experiences.api.types.FeedPageType;
import aicodex.experiences.api.types.PromptRequestType;
import aicodex.experiences.api.types.PromptType;
import aicodex.experiences.api.types.ReactionRequestType;
import aicodex.experiences.api.types.ReactionResultType;
import aicodex.experiences.api.types.UpdateExperienceRequestType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.services.ExperienceService;
import aicodex.experiences.services.FeedQueryService;
import aicodex.experiences.services.InteractionResult;
import aicodex.experiences.services.InteractionService;
import aicodex.experiences.services.UserService;
import aicodex.experiences.util.IdParser;

import java.util.UUID;

/**
 * Experience feed, experience lifecycle, and the comment/reaction interactions on an experience.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /experiences - Filtered, paginated feed</li>
 * <li>POST /experiences - Publish an experience</li>
 * <li>GET /experiences/{id} - Experience detail</li>
 * <li>PUT /experiences/{id} - Edit (owner only)</li>
 * <li>DELETE /experiences/{id} - Delete with cascade (owner only)</li>
 * <li>POST /experiences/{id}/prompts - Add a prompt (owner only)</li>
 * <li>POST /experiences/{id}/comments - Add a comment</li>
 * <li>POST /experiences/{id}/reactions - Add a reaction</li>
 * <li>DELETE /experiences/{id}/reactions/{type} - Withdraw a reaction</li>
 * </ul>
 *
 * <p>
 * Errors propagate as exceptions and are rendered by {@link ApiExceptionMappers}.
 */
@Path("/experiences")
@Produces(MediaType.APPLICATION_JSON)
@Authenticated
@Tag(
        name = "Experiences",
        description = "Experience feed, publishing and interactions")
public class ExperienceResource {

    private static final Logger LOG = Logger.getLogger(ExperienceResource.class);

    @Inject
    SecurityIdentity securityIdentity;

    @Inject
    UserService userService;

    @Inject
    FeedQueryService feedQueryService;

    @Inject
    ExperienceService experienceService;

    @Inject
    InteractionService interactionService;

    @GET
    @Operation(
            summary = "List experiences",
            description = "Feed filtered by AI assistant, tags (any of) and free-text search, best rated first")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Feed page",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = FeedPageType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid query parameters",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponseType.class))),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    public FeedPageType listExperiences(@QueryParam("page") String page, @QueryParam("limit") String limit,
            @QueryParam("aiAssistant") String aiAssistant, @QueryParam("tags") String tags,
            @QueryParam("search") String search, @QueryParam("sort") String sort) {
        userService.resolveCaller(securityIdentity);
        FeedCriteria criteria = feedQueryService.parseCriteria(page, limit, aiAssistant, tags, search, sort);
        return feedQueryService.listFeed(criteria);
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Publish an experience")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Experience created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ExperienceDetailType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Validation failed"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Authentication required")})
    public Response createExperience(@Valid CreateExperienceRequestType request) {
        User caller = userService.resolveCaller(securityIdentity);
        ExperienceDetailType created = experienceService.createExperience(caller, request);
        return Response.status(Response.Status.CREATED).entity(created).build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get experience detail",
            description = "Experience with author, prompts, comments and reaction counts per type")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Experience found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ExperienceDetailType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid experience ID"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience not found")})
    public ExperienceDetailType getExperience(@PathParam("id") String id) {
        userService.resolveCaller(securityIdentity);
        return experienceService.getExperienceDetail(IdParser.parseUuid(id, "experience"));
    }

    @PUT
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Update an experience (owner only)")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Experience updated"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Validation failed"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Not the author"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience not found")})
    public ExperienceDetailType updateExperience(@PathParam("id") String id,
            @Valid UpdateExperienceRequestType request) {
        User caller = userService.resolveCaller(securityIdentity);
        return experienceService.updateExperience(caller, IdParser.parseUuid(id, "experience"), request);
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete an experience (owner only)",
            description = "Soft-deletes the experience with its prompts, ratings, comments and reactions")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "204",
                    description = "Experience deleted"),
                    @APIResponse(
                            responseCode = "403",
                            description = "Not the author"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience not found")})
    public Response deleteExperience(@PathParam("id") String id) {
        User caller = userService.resolveCaller(securityIdentity);
        experienceService.deleteExperience(caller, IdParser.parseUuid(id, "experience"));
        return Response.noContent().build();
    }

    @POST
    @Path("/{id}/prompts")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Add a prompt to an experience (owner only)")
    @APIResponse(
            responseCode = "201",
            description = "Prompt created",
            content = @Content(
                    mediaType = MediaType.APPLICATION_JSON,
                    schema = @Schema(
                            implementation = PromptType.class)))
    public Response addPrompt(@PathParam("id") String id, @Valid PromptRequestType request) {
        User caller = userService.resolveCaller(securityIdentity);
        PromptType prompt = experienceService.addPrompt(caller, IdParser.parseUuid(id, "experience"), request);
        return Response.status(Response.Status.CREATED).entity(prompt).build();
    }

    @POST
    @Path("/{id}/comments")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Comment on an experience")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Comment created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = CommentResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Empty or too long comment"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience not found")})
    public Response addComment(@PathParam("id") String id, CommentRequestType request) {
        User caller = userService.resolveCaller(securityIdentity);
        CommentResultType result = interactionService.addComment(caller, IdParser.parseUuid(id, "experience"),
                request);
        return Response.status(Response.Status.CREATED).entity(result).build();
    }

    @POST
    @Path("/{id}/reactions")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "React to an experience",
            description = "One reaction per user, experience and type. 201 when added, 200 when it already existed")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Reaction added",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ReactionResultType.class))),
                    @APIResponse(
                            responseCode = "200",
                            description = "Reaction already present"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid reaction type"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience not found"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Duplicate reaction (reject policy)")})
    public Response addReaction(@PathParam("id") String id, ReactionRequestType request) {
        User caller = userService.resolveCaller(securityIdentity);
        InteractionResult<ReactionResultType> result = interactionService.react(caller,
                IdParser.parseUuid(id, "experience"), request);
        return Response.status(result.created() ? Response.Status.CREATED : Response.Status.OK).entity(result.body())
                .build();
    }

    @DELETE
    @Path("/{id}/reactions/{type}")
    @Operation(
            summary = "Withdraw a reaction")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Reaction removed",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ReactionResultType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience or reaction not found")})
    public ReactionResultType removeReaction(@PathParam("id") String id, @PathParam("type") String type) {
        User caller = userService.resolveCaller(securityIdentity);
        UUID experienceId = IdParser.parseUuid(id, "experience");
        LOG.debugf("User %s withdrawing %s from experience %s", caller.id, type, experienceId);
        return interactionService.removeReaction(caller, experienceId, type);
    }
}
