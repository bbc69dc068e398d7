package ai.storygen.chapters.reader;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BookFileWalkerTest {

    @TempDir
    Path tempDir;

    private final BookFileWalker walker = new BookFileWalker();

    @Test
    void findsMatchingFilesInNaturalOrder() throws Exception {
        Path ten = Files.writeString(tempDir.resolve("b_10.html"), "");
        Path two = Files.writeString(tempDir.resolve("b_2.HTM"), "");
        Files.writeString(tempDir.resolve("notes.txt"), "");
        Files.createDirectories(tempDir.resolve("sub"));
        Path nested = Files.writeString(tempDir.resolve("sub/c.xhtml"), "");

        List<Path> files = walker.walk(List.of(tempDir, two, tempDir.resolve("missing")), BookFileWalker.htmlFiles());

        assertThat(files).containsExactly(two, ten, nested);
    }

    @Test
    void namesFilesWithoutExtension() {
        assertThat(BookFileWalker.baseName(Path.of("dir/book.one.html"))).isEqualTo("book.one");
        assertThat(BookFileWalker.baseName(Path.of(".hidden"))).isEqualTo(".hidden");
        assertThat(BookFileWalker.extension(Path.of("Book.EPUB"))).isEqualTo("epub");
        assertThat(BookFileWalker.textFiles().test(Path.of("a.txt"))).isTrue();
    }
}
