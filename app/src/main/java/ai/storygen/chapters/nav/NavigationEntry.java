package ai.storygen.chapters.nav;

import java.util.Objects;

/**
 * One entry of a book's navigation manifest.
 *
 * @param label the displayed label, e.g. {@code "Chapter 3: The Storm"}
 * @param source reference to the document the entry points at, possibly with a {@code #fragment}
 */
public record NavigationEntry(String label, String source) {

    public NavigationEntry {
        label = label == null ? "" : label;
        Objects.requireNonNull(source, "source");
    }
}
