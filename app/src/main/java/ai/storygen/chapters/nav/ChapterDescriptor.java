package ai.storygen.chapters.nav;

import ai.storygen.chapters.model.ChapterSortKey;
import java.util.Objects;

/**
 * A chapter announced by the navigation manifest, used to order and locate the chapter documents.
 */
public record ChapterDescriptor(String seq, String name, String source) {

    public ChapterDescriptor {
        Objects.requireNonNull(seq, "seq");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
    }

    public ChapterSortKey sortKey() {
        return ChapterSortKey.of(seq);
    }
}
