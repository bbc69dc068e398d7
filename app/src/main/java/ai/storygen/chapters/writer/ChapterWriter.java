package ai.storygen.chapters.writer;

import ai.storygen.chapters.model.Chapter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders chapters into the plain-text book layout.
 *
 * <p>Each chapter is written as its header line, two empty lines and its paragraphs one per line. Chapters after
 * the first are preceded by two empty lines and a line of 64 {@code =} characters.
 */
public class ChapterWriter {

    public static final String CHAPTER_DELIMITER = "=".repeat(64);

    private static final String NEWLINE = "\n";

    public void write(List<Chapter> chapters, Appendable out) throws IOException {
        writeSections(chapters.stream().map(ChapterWriter::toSection).collect(Collectors.toList()), out);
    }

    public void writeSections(List<ChapterSection> sections, Appendable out) throws IOException {
        if (sections.isEmpty()) {
            throw new IllegalArgumentException("At least one chapter is required");
        }
        boolean first = true;
        for (ChapterSection section : sections) {
            if (!first) {
                out.append(NEWLINE).append(NEWLINE);
                out.append(CHAPTER_DELIMITER).append(NEWLINE);
            }
            out.append(section.heading()).append(NEWLINE);
            out.append(NEWLINE).append(NEWLINE);
            for (String paragraph : section.paragraphs()) {
                out.append(paragraph).append(NEWLINE);
            }
            first = false;
        }
    }

    public String render(List<Chapter> chapters) {
        StringBuilder builder = new StringBuilder();
        try {
            write(chapters, builder);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return builder.toString();
    }

    static ChapterSection toSection(Chapter chapter) {
        return new ChapterSection(heading(chapter), chapter.pars());
    }

    static String heading(Chapter chapter) {
        String designator = chapter.isNonNumeric()
                ? chapter.seq().toUpperCase(Locale.ROOT)
                : "CHAPTER " + chapter.seq();
        return designator + ": " + chapter.title();
    }
}
