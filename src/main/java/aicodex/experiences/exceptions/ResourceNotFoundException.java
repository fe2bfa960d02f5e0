package aicodex.experiences.exceptions;

/**
 * Exception thrown when a requested resource is missing or soft-deleted (e.g., user, experience, prompt).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found ({@code NOT_FOUND}).
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
