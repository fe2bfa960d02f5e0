package aicodex.experiences.api.rest;

import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import aicodex.experiences.data.models.User;
import aicodex.experiences.services.UserService;

import java.net.URI;

/**
 * Login entry point. Reaching the method means the GitHub code flow completed; the account is provisioned on first
 * login and the browser is sent back to the application.
 */
@Path("/auth")
@Tag(
        name = "Auth",
        description = "GitHub login")
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    @Inject
    SecurityIdentity securityIdentity;

    @Inject
    UserService userService;

    @GET
    @Path("/login")
    @Authenticated
    @Operation(
            summary = "Log in with GitHub",
            description = "Triggers the GitHub OAuth flow and redirects to / once authenticated")
    public Response login() {
        User user = userService.resolveCaller(securityIdentity);
        LOG.infof("User %s logged in", user.id);
        return Response.seeOther(URI.create("/")).build();
    }
}
