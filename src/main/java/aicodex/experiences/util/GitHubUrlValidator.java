package aicodex.experiences.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation for repository links attached to experiences. Every link must point at a repository on
 * {@code github.com}.
 *
 * <h3>Rules:</h3>
 * <ol>
 * <li>Sanitize: trim, strip HTML tags and quotes, drop script protocols, lowercase</li>
 * <li>Shape: {@code https://github.com/<owner>/<repo>[/<subpath>...]}</li>
 * <li>Owner and repo use {@code [A-Za-z0-9_.-]} and neither starts nor ends with a dot or hyphen</li>
 * <li>A third path segment, when present, must be a known GitHub section (tree, blob, issues, ...)</li>
 * <li>No path traversal and no known script-injection patterns</li>
 * </ol>
 *
 * <pre>
 * String url = GitHubUrlValidator.validateAndNormalize(" https://GitHub.com/acme/widgets ");
 * // "https://github.com/acme/widgets"
 * </pre>
 */
public final class GitHubUrlValidator {

    private static final String GITHUB_HOST = "github.com";
    private static final Pattern REPO_URL = Pattern
            .compile("^https://github\\.com/[a-zA-Z0-9_.-]+/[a-zA-Z0-9_.-]+(?:/.*|#.*)?$");
    private static final List<Pattern> MALICIOUS_PATTERNS = List.of(
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("vbscript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("onload=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("onerror=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("data:text/html", Pattern.CASE_INSENSITIVE));
    private static final Set<String> VALID_SUBPATHS = Set.of("tree", "blob", "releases", "issues", "pull", "wiki",
            "settings", "graphs", "network", "pulse", "commits", "tags", "branches");

    private GitHubUrlValidator() {
    }

    /**
     * Checks whether an already-sanitized URL points at a GitHub repository.
     *
     * @param url
     *            URL to check
     * @return true if the URL is an acceptable repository link
     */
    public static boolean isValidGitHubUrl(String url) {
        if (url == null || url.isBlank() || !REPO_URL.matcher(url).matches() || url.contains("..")
                || containsMaliciousPatterns(url)) {
            return false;
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return false;
        }
        if (!GITHUB_HOST.equalsIgnoreCase(uri.getHost()) || uri.getPath() == null) {
            return false;
        }

        List<String> parts = Arrays.stream(uri.getPath().split("/")).filter(part -> !part.isEmpty()).toList();
        if (parts.size() < 2) {
            return false;
        }
        if (!isValidName(parts.get(0)) || !isValidName(parts.get(1))) {
            return false;
        }
        return parts.size() == 2 || VALID_SUBPATHS.contains(parts.get(2));
    }

    public static boolean containsMaliciousPatterns(String url) {
        return MALICIOUS_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(url).find());
    }

    /**
     * Removes markup, quotes and script fragments from a submitted URL and lowercases it.
     *
     * @param url
     *            raw URL
     * @return sanitized URL, empty string for null input
     */
    public static String sanitize(String url) {
        if (url == null) {
            return "";
        }
        String sanitized = url.trim();
        sanitized = sanitized.replaceAll("<[^>]*>", "");
        sanitized = sanitized.replaceAll("[<>'\"]", "");
        sanitized = sanitized.replaceAll("(?i)javascript:[^&?#]*", "");
        sanitized = sanitized.replaceAll("(?i)vbscript:[^&?#]*", "");
        sanitized = sanitized.replaceAll("(?i)on\\w+\\s*=\\s*[^&?#\"]*", "");
        sanitized = sanitized.replaceAll("(\\w)\\s+(\\w)", "$1$2");
        return sanitized.toLowerCase(Locale.ROOT);
    }

    /**
     * Sanitizes and validates a submitted URL.
     *
     * @param url
     *            raw URL
     * @return the normalized URL, or null when it is not a valid repository link
     */
    public static String validateAndNormalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String sanitized = sanitize(url);
        return isValidGitHubUrl(sanitized) ? sanitized : null;
    }

    private static boolean isValidName(String name) {
        return !(name.startsWith(".") || name.startsWith("-") || name.endsWith(".") || name.endsWith("-"));
    }
}
