package ai.storygen.chapters.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Whitespace helpers shared by the segmenter, the navigation resolver and the readers.
 */
public final class TextNormalizer {

    // Unicode-aware so that non-breaking spaces left by markup count as whitespace.
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    /**
     * Collapses every whitespace run into a single space and trims both ends.
     *
     * @param text raw text, may be {@code null}
     * @return the normalized text, empty when {@code text} is {@code null} or blank
     */
    public static String normalizeSpacing(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static boolean isBlank(String text) {
        return normalizeSpacing(text).isEmpty();
    }

    public static List<String> tokens(String text) {
        String normalized = normalizeSpacing(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split(" "));
    }
}
