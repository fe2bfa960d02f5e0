package aicodex.experiences.util;

import aicodex.experiences.exceptions.ValidationException;

import java.util.UUID;

/**
 * Parses path identifiers so that a malformed id is a validation error (400) rather than an unmatched route (404).
 */
public final class IdParser {

    private IdParser() {
    }

    /**
     * @param raw
     *            path segment
     * @param resourceName
     *            name used in the error message, e.g. "experience"
     * @return parsed UUID
     * @throws ValidationException
     *             if raw is not a UUID
     */
    public static UUID parseUuid(String raw, String resourceName) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Invalid " + resourceName + " ID");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + resourceName + " ID", e);
        }
    }
}
