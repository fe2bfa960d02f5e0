package aicodex.experiences.util;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Email validation used when a user edits the address on their profile.
 *
 * <p>
 * Two checks:
 * <ul>
 * <li><b>Format validation:</b> simplified RFC 5322 pattern</li>
 * <li><b>Disposable email detection:</b> blocklist of throwaway mail domains</li>
 * </ul>
 *
 * <pre>
 * if (!EmailValidator.isValidFormat(email) || EmailValidator.isDisposableEmail(email)) {
 *     throw new ValidationException("Invalid email address");
 * }
 * </pre>
 */
public class EmailValidator {

    public static final int MAX_LENGTH = 255;

    /**
     * Local part of alphanumerics, dots, plus, hyphen and underscore; domain labels of alphanumerics and hyphens; TLD
     * of two or more letters.
     */
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?(?:\\.[a-zA-Z0-9-]+)*\\.[a-zA-Z]{2,}$");

    private static final Set<String> DISPOSABLE_DOMAINS = Set.of("mailinator.com", "guerrillamail.com",
            "10minutemail.com", "temp-mail.org", "throwaway.email", "yopmail.com", "trashmail.com",
            "sharklasers.com", "getnada.com", "dispostable.com");

    /**
     * Validates email format.
     *
     * @param email
     *            address to validate
     * @return true if the address is non-blank, at most {@value #MAX_LENGTH} characters and well formed
     */
    public static boolean isValidFormat(String email) {
        if (email == null || email.isBlank() || email.length() > MAX_LENGTH) {
            return false;
        }
        return EMAIL_PATTERN.matcher(email.trim()).matches();
    }

    /**
     * Checks the address against the disposable-domain blocklist.
     *
     * @param email
     *            address to check
     * @return true if the domain is a known throwaway provider
     */
    public static boolean isDisposableEmail(String email) {
        if (email == null || !email.contains("@")) {
            return false;
        }
        String domain = email.substring(email.lastIndexOf('@') + 1).trim().toLowerCase();
        return DISPOSABLE_DOMAINS.contains(domain);
    }
}
