package aicodex.experiences.exceptions;

/**
 * Exception thrown when the caller is authenticated but does not own the target resource.
 *
 * <p>
 * Mapped to HTTP 403 Forbidden ({@code AUTHORIZATION_ERROR}).
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }
}
