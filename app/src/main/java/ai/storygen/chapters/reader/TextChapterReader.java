package ai.storygen.chapters.reader;

import ai.storygen.chapters.util.TextNormalizer;
import ai.storygen.chapters.writer.ChapterSection;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads plain-text books whose paragraphs may be hard-wrapped, so that they can be rewritten with one paragraph
 * per line.
 *
 * <p>The first non-blank line of each chapter is its header; an empty line ends a paragraph and a line of
 * {@code =} characters ends the chapter.
 */
public class TextChapterReader {

    private static final Pattern CHAPTER_DELIMITER = Pattern.compile("=+");

    public List<ChapterSection> read(Path file) {
        try {
            return read(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read text file: " + file, ex);
        }
    }

    public List<ChapterSection> read(List<String> lines) {
        List<ChapterSection> sections = new ArrayList<>();
        SectionBuilder section = null;
        for (String rawLine : lines) {
            String line = rawLine.strip();
            if (section == null) {
                if (!line.isEmpty()) {
                    section = new SectionBuilder(line);
                }
            } else if (CHAPTER_DELIMITER.matcher(line).matches()) {
                sections.add(section.build());
                section = null;
            } else if (line.isEmpty()) {
                section.endParagraph();
            } else {
                section.addLine(line);
            }
        }
        if (section != null) {
            sections.add(section.build());
        }
        return sections;
    }

    private static final class SectionBuilder {

        private final String heading;
        private final List<String> paragraphs = new ArrayList<>();
        private final List<String> currentTokens = new ArrayList<>();

        private SectionBuilder(String heading) {
            this.heading = heading;
        }

        void addLine(String line) {
            currentTokens.addAll(TextNormalizer.tokens(line));
        }

        void endParagraph() {
            if (!currentTokens.isEmpty()) {
                paragraphs.add(String.join(" ", currentTokens));
                currentTokens.clear();
            }
        }

        ChapterSection build() {
            endParagraph();
            return new ChapterSection(heading, paragraphs);
        }
    }
}
