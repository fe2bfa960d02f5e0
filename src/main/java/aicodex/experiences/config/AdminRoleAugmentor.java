package aicodex.experiences.config;

import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.identity.SecurityIdentityAugmentor;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import aicodex.experiences.data.models.User;

import java.util.List;
import java.util.Optional;

/**
 * Grants {@link User#ROLE_ADMIN} to verified identities whose GitHub id is listed in {@code aicodex.admin.github-ids}.
 *
 * <p>
 * GitHub OAuth carries no roles of its own, so operator access is configured per deployment. Admin endpoints are
 * guarded with {@code @RolesAllowed(User.ROLE_ADMIN)}.
 */
@ApplicationScoped
public class AdminRoleAugmentor implements SecurityIdentityAugmentor {

    private static final Logger LOG = Logger.getLogger(AdminRoleAugmentor.class);

    @ConfigProperty(
            name = "aicodex.admin.github-ids")
    Optional<List<String>> adminGithubIds;

    @Override
    public Uni<SecurityIdentity> augment(SecurityIdentity identity, AuthenticationRequestContext context) {
        if (identity.isAnonymous() || identity.hasRole(User.ROLE_ADMIN)) {
            return Uni.createFrom().item(identity);
        }
        String githubId = identity.getPrincipal().getName();
        if (!isAdmin(githubId)) {
            return Uni.createFrom().item(identity);
        }
        LOG.debugf("Granting %s role to github_id=%s", User.ROLE_ADMIN, githubId);
        return Uni.createFrom().item(QuarkusSecurityIdentity.builder(identity).addRole(User.ROLE_ADMIN).build());
    }

    boolean isAdmin(String githubId) {
        if (githubId == null || githubId.isBlank()) {
            return false;
        }
        return adminGithubIds.map(ids -> ids.stream().map(String::trim).anyMatch(githubId::equals)).orElse(false);
    }
}
