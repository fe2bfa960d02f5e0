package aicodex.experiences.exceptions;

/**
 * Exception thrown when a uniqueness rule rejects a submission instead of updating the existing row.
 *
 * <p>
 * Only raised when the {@code reject} duplicate policy is configured. Mapped to HTTP 409 Conflict ({@code CONFLICT}).
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
