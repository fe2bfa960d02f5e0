package aicodex.experiences.exceptions;

/**
 * Exception thrown when an operation needs a verified caller identity and none is present.
 *
 * <p>
 * Mapped to HTTP 401 Unauthorized ({@code AUTHENTICATION_ERROR}).
 */
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
