package ai.storygen.chapters.merge;

import ai.storygen.chapters.model.Chapter;
import java.util.List;
import java.util.Objects;

/**
 * Chapters segmented from one source document.
 */
public record SourceChapters(String source, List<Chapter> chapters) {

    public SourceChapters {
        Objects.requireNonNull(source, "source");
        chapters = List.copyOf(Objects.requireNonNull(chapters, "chapters"));
    }
}
