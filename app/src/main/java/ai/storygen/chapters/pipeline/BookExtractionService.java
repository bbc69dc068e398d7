package ai.storygen.chapters.pipeline;

import ai.storygen.chapters.config.Config;
import ai.storygen.chapters.model.Book;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.reader.BookFileWalker;
import ai.storygen.chapters.reader.BookJob;
import ai.storygen.chapters.reader.EpubBookReader;
import ai.storygen.chapters.reader.HtmlBookReader;
import ai.storygen.chapters.reader.TextChapterReader;
import ai.storygen.chapters.writer.BookFileWriter;
import ai.storygen.chapters.writer.ChapterSection;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs discovery, extraction and output for every book found under the configured input paths.
 *
 * <p>Books are processed one at a time; a book that fails is logged and reported while the others are still
 * written, unless the configuration asks to stop at the first failure.
 */
public class BookExtractionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookExtractionService.class);

    static final String MDC_BOOK = "book";

    private final BookFileWalker fileWalker;
    private final HtmlBookReader htmlReader;
    private final EpubBookReader epubReader;
    private final TextChapterReader textReader;
    private final BookFileWriter fileWriter;

    public BookExtractionService() {
        this(new BookFileWalker(), new HtmlBookReader(), new EpubBookReader(), new TextChapterReader(),
                new BookFileWriter());
    }

    public BookExtractionService(BookFileWalker fileWalker, HtmlBookReader htmlReader, EpubBookReader epubReader,
                                 TextChapterReader textReader, BookFileWriter fileWriter) {
        this.fileWalker = Objects.requireNonNull(fileWalker, "fileWalker");
        this.htmlReader = Objects.requireNonNull(htmlReader, "htmlReader");
        this.epubReader = Objects.requireNonNull(epubReader, "epubReader");
        this.textReader = Objects.requireNonNull(textReader, "textReader");
        this.fileWriter = Objects.requireNonNull(fileWriter, "fileWriter");
    }

    public ExtractionReport run(Config config) {
        LOGGER.info("Will look for {} data under {}", config.inputFormat(), config.inputPaths());
        return switch (config.inputFormat()) {
            case HTML -> extractBooks(htmlReader.plan(fileWalker.walk(config.inputPaths(), BookFileWalker.htmlFiles())), config);
            case EPUB -> extractBooks(epubReader.plan(fileWalker.walk(config.inputPaths(), BookFileWalker.epubFiles())), config);
            case TEXT -> reflowTexts(fileWalker.walk(config.inputPaths(), BookFileWalker.textFiles()), config);
        };
    }

    ExtractionReport extractBooks(List<BookJob> jobs, Config config) {
        List<Path> written = new ArrayList<>();
        List<ExtractionReport.Failure> failures = new ArrayList<>();
        for (BookJob job : jobs) {
            MDC.put(MDC_BOOK, job.label());
            try {
                Book book = job.extract();
                ensureNotWritten(written, config.outputDirectory(), book.title());
                Path target = fileWriter.write(config.outputDirectory(), book);
                LOGGER.info("Wrote book titled \"{}\" ({} chapters) to \"{}\".", book.title(), book.chapters().size(), target);
                written.add(target);
            } catch (ChapterExtractionException ex) {
                LOGGER.error("Skipping book {}: {} {}", job.label(), ex.kind(),
                        ex.source().map(source -> "in " + source + ": ").orElse("") + ex.getMessage());
                failures.add(new ExtractionReport.Failure(job.label(), ex.kind() + ": " + ex.getMessage()));
                if (config.failFast()) {
                    throw ex;
                }
            } catch (IOException ex) {
                recordIoFailure(job.label(), new UncheckedIOException(ex), failures, config);
            } catch (UncheckedIOException ex) {
                recordIoFailure(job.label(), ex, failures, config);
            } finally {
                MDC.remove(MDC_BOOK);
            }
        }
        LOGGER.info("Finished writing {} file(s); {} book(s) failed.", written.size(), failures.size());
        return new ExtractionReport(written, failures);
    }

    // Distinct titles can share a file name once path separators are replaced.
    private static void ensureNotWritten(List<Path> written, Path outputDirectory, String title) {
        Path target = outputDirectory.resolve(BookFileWriter.fileNameFor(title));
        if (written.contains(target)) {
            throw new UncheckedIOException(new FileAlreadyExistsException(target.toString(), null,
                    "already written for another book in this run"));
        }
    }

    private void recordIoFailure(String label, UncheckedIOException ex, List<ExtractionReport.Failure> failures,
                                 Config config) {
        LOGGER.error("Skipping book {}: {}", label, ex.getCause().getMessage(), ex);
        failures.add(new ExtractionReport.Failure(label, String.valueOf(ex.getCause().getMessage())));
        if (config.failFast()) {
            throw ex;
        }
    }

    private ExtractionReport reflowTexts(List<Path> files, Config config) {
        List<Path> written = new ArrayList<>();
        List<ExtractionReport.Failure> failures = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            MDC.put(MDC_BOOK, name);
            try {
                LOGGER.info("Reading \"{}\".", file);
                List<ChapterSection> sections = textReader.read(file);
                if (sections.isEmpty()) {
                    LOGGER.warn("No text found in \"{}\"", file);
                    failures.add(new ExtractionReport.Failure(name, "no text found"));
                    continue;
                }
                String title = name.endsWith(".txt") ? name.substring(0, name.length() - 4) : name;
                ensureNotWritten(written, config.outputDirectory(), title);
                written.add(fileWriter.write(config.outputDirectory(), title, sections));
            } catch (UncheckedIOException ex) {
                recordIoFailure(name, ex, failures, config);
            } finally {
                MDC.remove(MDC_BOOK);
            }
        }
        LOGGER.info("Finished writing {} file(s).", written.size());
        return new ExtractionReport(written, failures);
    }
}
