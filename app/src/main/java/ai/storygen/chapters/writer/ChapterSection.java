package ai.storygen.chapters.writer;

import java.util.List;
import java.util.Objects;

/**
 * A rendered chapter: its header line and its paragraphs, one per output line.
 */
public record ChapterSection(String heading, List<String> paragraphs) {

    public ChapterSection {
        Objects.requireNonNull(heading, "heading");
        paragraphs = List.copyOf(Objects.requireNonNull(paragraphs, "paragraphs"));
    }
}
