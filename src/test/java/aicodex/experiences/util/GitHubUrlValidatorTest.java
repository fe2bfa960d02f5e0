package aicodex.experiences.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for GitHubUrlValidator.
 */
class GitHubUrlValidatorTest {

    @Test
    void testValidateAndNormalize_RepositoryLinks() {
        assertEquals("https://github.com/acme/widgets",
                GitHubUrlValidator.validateAndNormalize("https://github.com/acme/widgets"));
        assertEquals("https://github.com/acme/widgets",
                GitHubUrlValidator.validateAndNormalize("  https://GitHub.com/Acme/Widgets "));
        assertEquals("https://github.com/acme/widgets/tree/main",
                GitHubUrlValidator.validateAndNormalize("https://github.com/acme/widgets/tree/main"));
        assertEquals("https://github.com/acme/widgets/pull/12",
                GitHubUrlValidator.validateAndNormalize("https://github.com/acme/widgets/pull/12"));
    }

    @Test
    void testValidateAndNormalize_Rejected() {
        assertNull(GitHubUrlValidator.validateAndNormalize(null));
        assertNull(GitHubUrlValidator.validateAndNormalize("  "));
        assertNull(GitHubUrlValidator.validateAndNormalize("http://github.com/acme/widgets"), "Plain http");
        assertNull(GitHubUrlValidator.validateAndNormalize("https://gitlab.com/acme/widgets"), "Other host");
        assertNull(GitHubUrlValidator.validateAndNormalize("https://github.com/acme"), "Owner only");
        assertNull(GitHubUrlValidator.validateAndNormalize("https://github.com/acme/widgets/unknown"), "Bad subpath");
        assertNull(GitHubUrlValidator.validateAndNormalize("https://github.com/-acme/widgets"), "Leading hyphen");
        assertNull(GitHubUrlValidator.validateAndNormalize("https://github.com/acme/../widgets"), "Traversal");
        assertNull(GitHubUrlValidator.validateAndNormalize("javascript:alert(1)"));
    }

    @Test
    void testContainsMaliciousPatterns() {
        assertTrue(GitHubUrlValidator.containsMaliciousPatterns("https://github.com/a/b<script>"));
        assertTrue(GitHubUrlValidator.containsMaliciousPatterns("data:text/html,hi"));
        assertFalse(GitHubUrlValidator.containsMaliciousPatterns("https://github.com/acme/widgets"));
    }

    @Test
    void testSanitize_StripsMarkupAndQuotes() {
        assertEquals("https://github.com/acme/widgets",
                GitHubUrlValidator.sanitize("<a>https://github.com/acme/widgets</a>"));
        assertEquals("https://github.com/acme/widgets",
                GitHubUrlValidator.sanitize("'https://github.com/acme/widgets'"));
        assertEquals("", GitHubUrlValidator.sanitize(null));
    }
}
