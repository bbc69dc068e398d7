package ai.storygen.chapters.writer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.storygen.chapters.model.Book;
import ai.storygen.chapters.model.Chapter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BookFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesBookAndCreatesDirectories() throws Exception {
        BookFileWriter writer = new BookFileWriter();
        Book book = new Book("Tales / Part One", List.of(new Chapter("1", "Start", List.of("Über."))));

        Path written = writer.write(tempDir.resolve("out"), book);

        assertThat(written).isEqualTo(tempDir.resolve("out").resolve("Tales _ Part One.txt"));
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo("CHAPTER 1: Start\n\n\nÜber.\n");
    }

    @Test
    void overwritesExistingFileWithSections() throws Exception {
        BookFileWriter writer = new BookFileWriter();
        Files.writeString(tempDir.resolve("notes.txt"), "old content that is longer than the new one");

        Path written = writer.write(tempDir, "notes", List.of(new ChapterSection("CHAPTER 1: A", List.of("b"))));

        assertThat(Files.readString(written)).isEqualTo("CHAPTER 1: A\n\n\nb\n");
    }
}
