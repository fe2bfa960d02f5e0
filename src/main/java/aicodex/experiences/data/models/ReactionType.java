package aicodex.experiences.data.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Reaction kinds a user may attach to an experience. Stored and serialized as the lowercase {@link #value()}.
 */
public enum ReactionType {

    HELPFUL,
    CREATIVE,
    EDUCATIONAL,
    INNOVATIVE,
    PROBLEMATIC,
    LIKE,
    BOOKMARK;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a reaction type case-insensitively.
     *
     * @param raw
     *            client-supplied value such as {@code "helpful"} or {@code "HELPFUL"}
     * @return the matching type, or empty when unknown
     */
    public static Optional<ReactionType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(type -> type.name().equals(normalized)).findFirst();
    }
}
