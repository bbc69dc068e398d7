package ai.storygen.chapters.segment;

/**
 * What to drop after a "table of contents" marker.
 */
public enum TableOfContentsPolicy {
    /**
     * Always drop the block right after the marker; used for standalone HTML books.
     */
    DISCARD_FOLLOWING,
    /**
     * Drop the next non-blank block only when it is boilerplate such as "Start" or "Contents"; used for EPUB
     * documents.
     */
    DISCARD_BLACKLISTED_FOLLOWING
}
