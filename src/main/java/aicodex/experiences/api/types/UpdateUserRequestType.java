package aicodex.experiences.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update. Null fields are left unchanged; an empty string clears email, bio or avatar.
 *
 * @param username
 *            3-30 characters of letters, digits, underscore or hyphen, unique
 * @param email
 *            Email address
 * @param bio
 *            Biography (max 500)
 * @param avatarUrl
 *            http(s) URL
 */
public record UpdateUserRequestType(@JsonProperty("username") String username, @JsonProperty("email") String email,
        @JsonProperty("bio") @Size(
                max = 500,
                message = "Bio must not exceed 500 characters") String bio,
        @JsonProperty("avatar_url") String avatarUrl) {
}
