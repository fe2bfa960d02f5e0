package aicodex.experiences.data.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * AI coding assistants an experience can be tagged with. The {@link #value()} is what the database and the API carry.
 */
public enum AiAssistantType {

    GITHUB_COPILOT("github-copilot"),
    CLAUDE("claude"),
    GPT("gpt"),
    CURSOR("cursor"),
    OTHER("other");

    private final String value;

    AiAssistantType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Exact-match lookup by wire value.
     *
     * @param raw
     *            value such as {@code "github-copilot"}
     * @return the matching type, or empty when unknown
     */
    public static Optional<AiAssistantType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(type -> type.value.equals(raw)).findFirst();
    }
}
