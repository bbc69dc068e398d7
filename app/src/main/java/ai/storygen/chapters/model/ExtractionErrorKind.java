package ai.storygen.chapters.model;

/**
 * Causes for which the extraction of a document or book is abandoned.
 */
public enum ExtractionErrorKind {
    /**
     * A designator had to be derived from a previous chapter that is missing or not numbered, or a headerless
     * fragment has no chapter to continue.
     */
    AMBIGUOUS_CONTINUATION,
    /**
     * The blocks ran out, or held no text, where a header's designator or title was expected.
     */
    UNTERMINATED_HEADER,
    /**
     * The navigation manifest yielded no usable chapter entries.
     */
    EMPTY_NAVIGATION,
    /**
     * A chapter lacks its designator, title or paragraphs.
     */
    INCOMPLETE_CHAPTER,
    /**
     * Chapters are not in ascending designator order.
     */
    OUT_OF_ORDER
}
