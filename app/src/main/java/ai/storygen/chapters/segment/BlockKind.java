package ai.storygen.chapters.segment;

/**
 * Structural category of a text-bearing block.
 */
public enum BlockKind {
    HEADING,
    SUBHEADING,
    PARAGRAPH
}
