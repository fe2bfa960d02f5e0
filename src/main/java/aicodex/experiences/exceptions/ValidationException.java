package aicodex.experiences.exceptions;

/**
 * Exception thrown when input validation fails (e.g., out-of-range rating, malformed id, comment too long).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request ({@code VALIDATION_ERROR}).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
