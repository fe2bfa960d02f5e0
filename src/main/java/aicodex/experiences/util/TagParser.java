package aicodex.experiences.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsing and normalization for experience tags.
 *
 * <p>
 * Tags are stored as a single comma-delimited column ({@code "react,testing,refactor"}) and exposed as a list. Input
 * tags are normalized to lowercase {@code [a-z0-9-]}, at most {@value #MAX_TAG_LENGTH} characters each and at most
 * {@value #MAX_TAGS} per experience. Tags that cannot be normalized are dropped rather than rejected.
 */
public final class TagParser {

    public static final int MAX_TAGS = 10;
    public static final int MAX_TAG_LENGTH = 20;

    private static final String DELIMITER = ",";
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern SPECIAL_CHAR = Pattern.compile("[^\\w\\s-]");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^\\w.-]");
    private static final Pattern VALID_TAG = Pattern.compile("^[a-z0-9-]+$");
    private static final Pattern SCRIPT_KEYWORD = Pattern
            .compile("^(alert|eval|function|var|let|const|if|for|while)\\d*$", Pattern.CASE_INSENSITIVE);

    private TagParser() {
    }

    /**
     * Splits a stored tag column into its tags.
     *
     * @param stored
     *            comma-delimited column value, may be null
     * @return tags in stored order, empty when none
     */
    public static List<String> parseStored(String stored) {
        if (stored == null || stored.isBlank()) {
            return List.of();
        }
        return Arrays.stream(stored.split(DELIMITER)).map(String::trim).filter(tag -> !tag.isEmpty()).toList();
    }

    /**
     * Joins already-normalized tags into the stored column form.
     *
     * @param tags
     *            normalized tags, may be null
     * @return comma-delimited value, empty string when there are no tags
     */
    public static String toStored(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return String.join(DELIMITER, tags);
    }

    /**
     * Normalizes user-supplied tags, dropping anything that does not survive sanitization and removing duplicates.
     *
     * @param rawTags
     *            tags as submitted, may be null
     * @return at most {@value #MAX_TAGS} normalized, distinct tags in submission order
     */
    public static List<String> sanitize(List<String> rawTags) {
        if (rawTags == null) {
            return List.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String raw : rawTags) {
            if (result.size() == MAX_TAGS) {
                break;
            }
            String normalized = normalize(raw);
            if (normalized != null) {
                result.add(normalized);
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Parses a comma-separated tag filter from a query string.
     *
     * @param csv
     *            value of the {@code tags} query parameter, may be null
     * @return distinct lowercase tags that are valid tag names; entries that are not are dropped
     */
    public static Set<String> parseFilter(String csv) {
        Set<String> tags = new LinkedHashSet<>();
        if (csv == null || csv.isBlank()) {
            return tags;
        }
        for (String part : csv.split(DELIMITER)) {
            String tag = part.trim().toLowerCase(Locale.ROOT);
            if (VALID_TAG.matcher(tag).matches()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String original = raw.trim();
        if (original.isEmpty() || original.contains(" ") || original.contains("_")) {
            return null;
        }
        if (SPECIAL_CHAR.matcher(original).results().count() > 2) {
            return null;
        }
        String cleaned = original.toLowerCase(Locale.ROOT);
        cleaned = HTML_TAG.matcher(cleaned).replaceAll("");
        cleaned = INVALID_CHARS.matcher(cleaned).replaceAll("");
        cleaned = cleaned.replaceAll("\\.+", "-").replaceAll("^-+|-+$", "").replaceAll("-+", "-");

        if (cleaned.isEmpty() || cleaned.length() > MAX_TAG_LENGTH || !VALID_TAG.matcher(cleaned).matches()
                || SCRIPT_KEYWORD.matcher(cleaned).matches()) {
            return null;
        }
        return cleaned;
    }
}
