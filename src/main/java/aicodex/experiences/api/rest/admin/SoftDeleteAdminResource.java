package aicodex.experiences.api.rest.admin;

import io.quarkus.security.identity.SecurityIdentity;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import aicodex.experiences.api.types.RestoreResultType;
import aicodex.experiences.api.types.SoftDeleteStatsType;
import aicodex.experiences.data.models.User;
import aicodex.experiences.services.DataExportService;
import aicodex.experiences.services.SoftDeleteService;
import aicodex.experiences.util.IdParser;

import java.util.Map;
import java.util.UUID;

/**
 * Operator endpoints for soft-deleted accounts and experiences.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /admin/api/soft-delete/stats - Live and deleted row counts</li>
 * <li>DELETE /admin/api/users/{id} - Soft-delete an account</li>
 * <li>POST /admin/api/users/{id}/restore - Restore an account and its cascaded rows</li>
 * <li>GET /admin/api/users/{id}/export - Export an account's data, deleted or not</li>
 * <li>DELETE /admin/api/experiences/{id} - Soft-delete any experience</li>
 * <li>POST /admin/api/experiences/{id}/restore - Restore an experience and its cascaded rows</li>
 * </ul>
 *
 * <p>
 * Requires the {@code admin} role, which {@code AdminRoleAugmentor} grants to the configured GitHub ids.
 */
@Path("/admin/api")
@RolesAllowed(User.ROLE_ADMIN)
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Admin",
        description = "Soft-delete management (requires admin role)")
public class SoftDeleteAdminResource {

    private static final Logger LOG = Logger.getLogger(SoftDeleteAdminResource.class);

    @Inject
    SecurityIdentity securityIdentity;

    @Inject
    SoftDeleteService softDeleteService;

    @Inject
    DataExportService dataExportService;

    @GET
    @Path("/soft-delete/stats")
    @Operation(
            summary = "Soft-delete statistics")
    public SoftDeleteStatsType getStats() {
        return softDeleteService.getStats();
    }

    @DELETE
    @Path("/users/{id}")
    @Operation(
            summary = "Soft-delete a user account")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "204",
                    description = "Account deleted"),
                    @APIResponse(
                            responseCode = "404",
                            description = "User not found or already deleted")})
    public Response deleteUser(@PathParam("id") String id) {
        UUID userId = IdParser.parseUuid(id, "user");
        LOG.infof("Operator %s deleting user %s", operator(), userId);
        softDeleteService.deleteUser(userId);
        return Response.noContent().build();
    }

    @POST
    @Path("/users/{id}/restore")
    @Operation(
            summary = "Restore a soft-deleted user account")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Account restored"),
                    @APIResponse(
                            responseCode = "400",
                            description = "User is not deleted"),
                    @APIResponse(
                            responseCode = "404",
                            description = "User not found")})
    public RestoreResultType restoreUser(@PathParam("id") String id) {
        UUID userId = IdParser.parseUuid(id, "user");
        LOG.infof("Operator %s restoring user %s", operator(), userId);
        return softDeleteService.restoreUser(userId);
    }

    @GET
    @Path("/users/{id}/export")
    @Operation(
            summary = "Export a user's data")
    public Map<String, Object> exportUser(@PathParam("id") String id) {
        UUID userId = IdParser.parseUuid(id, "user");
        LOG.infof("Operator %s exporting data of user %s", operator(), userId);
        return dataExportService.exportUserData(userId);
    }

    @DELETE
    @Path("/experiences/{id}")
    @Operation(
            summary = "Soft-delete an experience")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "204",
                    description = "Experience deleted"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience not found or already deleted")})
    public Response deleteExperience(@PathParam("id") String id) {
        UUID experienceId = IdParser.parseUuid(id, "experience");
        LOG.infof("Operator %s deleting experience %s", operator(), experienceId);
        softDeleteService.deleteExperience(experienceId);
        return Response.noContent().build();
    }

    @POST
    @Path("/experiences/{id}/restore")
    @Operation(
            summary = "Restore a soft-deleted experience")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Experience restored"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Experience is not deleted or its author is deleted"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Experience not found")})
    public RestoreResultType restoreExperience(@PathParam("id") String id) {
        UUID experienceId = IdParser.parseUuid(id, "experience");
        LOG.infof("Operator %s restoring experience %s", operator(), experienceId);
        return softDeleteService.restoreExperience(experienceId);
    }

    private String operator() {
        return securityIdentity.getPrincipal().getName();
    }
}
