package ai.storygen.chapters.segment;

import ai.storygen.chapters.model.Chapter;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable chapter under construction; {@link #seal()} turns it into an immutable {@link Chapter}.
 */
final class ChapterAccumulator {

    private final String seq;
    private final String title;
    private final List<String> pars = new ArrayList<>();

    ChapterAccumulator() {
        this("", "");
    }

    ChapterAccumulator(String seq, String title) {
        this.seq = seq;
        this.title = title;
    }

    void addParagraph(String normalizedText) {
        if (!normalizedText.isEmpty()) {
            pars.add(normalizedText);
        }
    }

    Chapter seal() {
        return new Chapter(seq, title, pars);
    }
}
