package ai.storygen.chapters.config;

/**
 * Kind of input the extractor reads.
 */
public enum InputFormat {
    /**
     * HTML files, several of which may belong to one book.
     */
    HTML,
    /**
     * EPUB archives, one book each.
     */
    EPUB,
    /**
     * Plain-text books to be reflowed to one paragraph per line.
     */
    TEXT;

    public static InputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return HTML;
        }
        for (InputFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported input format: " + raw);
    }
}
