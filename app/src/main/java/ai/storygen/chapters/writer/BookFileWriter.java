package ai.storygen.chapters.writer;

import ai.storygen.chapters.model.Book;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes rendered books into the output directory, one UTF-8 text file per book.
 */
public class BookFileWriter {

    private static final String EXTENSION = ".txt";

    private final ChapterWriter chapterWriter;

    public BookFileWriter() {
        this(new ChapterWriter());
    }

    public BookFileWriter(ChapterWriter chapterWriter) {
        this.chapterWriter = Objects.requireNonNull(chapterWriter, "chapterWriter");
    }

    public Path write(Path outputDirectory, Book book) {
        if (outputDirectory == null || book == null) {
            throw new IllegalArgumentException("outputDirectory and book must be provided");
        }
        return writeContent(outputDirectory, book.title(), chapterWriter.render(book.chapters()));
    }

    public Path write(Path outputDirectory, String name, List<ChapterSection> sections) {
        if (outputDirectory == null || name == null) {
            throw new IllegalArgumentException("outputDirectory and name must be provided");
        }
        StringBuilder content = new StringBuilder();
        try {
            chapterWriter.writeSections(sections, content);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return writeContent(outputDirectory, name, content.toString());
    }

    public static String fileNameFor(String title) {
        return title.replace('/', '_').replace('\\', '_') + EXTENSION;
    }

    // The content is rendered completely before the file is opened, so a failing book leaves no partial file.
    private Path writeContent(Path outputDirectory, String title, String content) {
        Path target = outputDirectory.resolve(fileNameFor(title));
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(target, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write book file: " + target, ex);
        }
    }
}
