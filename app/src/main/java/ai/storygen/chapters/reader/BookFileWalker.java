package ai.storygen.chapters.reader;

import ai.storygen.chapters.model.NaturalKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the input files of a run below the given paths.
 */
public class BookFileWalker {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookFileWalker.class);

    private static final Pattern HTML_EXTENSION = Pattern.compile("x?html?", Pattern.CASE_INSENSITIVE);

    /**
     * Returns the matching regular files, following symbolic links into directories, de-duplicated and in natural
     * order of their paths.
     */
    public List<Path> walk(Collection<Path> inputs, Predicate<Path> matcher) {
        Set<Path> found = new LinkedHashSet<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> files = Files.walk(input, FileVisitOption.FOLLOW_LINKS)) {
                    files.filter(Files::isRegularFile)
                            .filter(matcher)
                            .map(Path::normalize)
                            .forEach(found::add);
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to walk input directory: " + input, ex);
                }
            } else if (Files.isRegularFile(input) && matcher.test(input)) {
                found.add(input.normalize());
            } else if (!Files.exists(input)) {
                LOGGER.warn("Input path \"{}\" does not exist", input);
            }
        }
        return found.stream()
                .sorted(Comparator.comparing(path -> NaturalKey.of(path.toString())))
                .collect(Collectors.toList());
    }

    public static Predicate<Path> htmlFiles() {
        return path -> HTML_EXTENSION.matcher(extension(path)).matches();
    }

    public static Predicate<Path> epubFiles() {
        return path -> extension(path).equalsIgnoreCase("epub") || EpubArchive.isEpub(path);
    }

    public static Predicate<Path> textFiles() {
        return path -> extension(path).equalsIgnoreCase("txt");
    }

    static String extension(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static String baseName(Path path) {
        String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }
}
