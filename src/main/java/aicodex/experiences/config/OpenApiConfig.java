package aicodex.experiences.config;

import org.eclipse.microprofile.openapi.annotations.Components;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 document for the AI Codex experiences API, served at {@code /q/openapi}.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "AI Codex Experiences API",
                version = "1.0.0",
                description = """
                        Share experiences with AI coding assistants and rate the prompts that worked.

                        ## Features
                        - **Experiences**: Publish sessions with GitHub Copilot, Claude, GPT, Cursor and others
                        - **Feed**: Filter by assistant, tags and free text; sort by rating, recency or popularity
                        - **Interactions**: Comments, typed reactions and 1-5 star prompt ratings
                        - **Profiles**: Contribution statistics, top tags and assistant distribution
                        - **Data export**: Download everything an account owns
                        - **Admin**: Restore soft-deleted accounts and experiences (admin role)

                        ## Authentication
                        Every endpoint requires a GitHub login. Unauthenticated requests get 401.

                        ## Errors
                        Failures return `{"code": KIND, "error": message}` with KIND one of VALIDATION_ERROR,
                        AUTHENTICATION_ERROR, AUTHORIZATION_ERROR, NOT_FOUND, CONFLICT, INTERNAL_ERROR.
                        """,
                license = @License(
                        name = "MIT")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Experiences",
                description = "Experience feed, publishing and interactions"),
                @Tag(
                        name = "Prompts",
                        description = "Prompt ratings"),
                @Tag(
                        name = "Users",
                        description = "User profiles and contribution statistics"),
                @Tag(
                        name = "Auth",
                        description = "GitHub login"),
                @Tag(
                        name = "Admin",
                        description = "Soft-delete management (requires admin role)")},
        security = @SecurityRequirement(
                name = "githubOAuth"),
        components = @Components(
                securitySchemes = {@SecurityScheme(
                        securitySchemeName = "githubOAuth",
                        type = SecuritySchemeType.APIKEY,
                        apiKeyName = "q_session",
                        in = SecuritySchemeIn.COOKIE,
                        description = "Session cookie issued after GitHub login at /auth/login")}))
public class OpenApiConfig extends Application {
}
