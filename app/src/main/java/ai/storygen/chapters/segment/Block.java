package ai.storygen.chapters.segment;

import ai.storygen.chapters.util.TextNormalizer;

/**
 * A text-bearing element of a parsed document, as seen by the chapter segmenter.
 */
public interface Block {

    /**
     * Raw text content of the element and its descendants.
     */
    String text();

    BlockKind kind();

    /**
     * Whether the element embeds an image, such as a decorative chapter header.
     */
    boolean containsImage();

    default String normalizedText() {
        return TextNormalizer.normalizeSpacing(text());
    }

    default boolean isBlank() {
        return normalizedText().isEmpty();
    }
}
