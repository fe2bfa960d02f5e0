package aicodex.experiences.services;

import java.util.Locale;

/**
 * What a repeated reaction or rating from the same user on the same target does.
 *
 * <p>
 * Configured with {@code aicodex.interactions.duplicate-policy}.
 */
public enum DuplicatePolicy {

    /** Repeated submission resolves to the existing row; the last value wins. */
    UPSERT,

    /** Repeated submission fails with a conflict and writes nothing. */
    REJECT;

    /**
     * Parses a configured value, case-insensitively.
     *
     * @param value
     *            raw config value; blank means {@link #UPSERT}
     * @return the policy
     * @throws IllegalArgumentException
     *             if the value names no policy
     */
    public static DuplicatePolicy fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return UPSERT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown duplicate policy '" + value.trim() + "', expected one of: upsert, reject", e);
        }
    }
}
