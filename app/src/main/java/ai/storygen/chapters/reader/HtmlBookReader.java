package ai.storygen.chapters.reader;

import ai.storygen.chapters.merge.ChapterMerger;
import ai.storygen.chapters.model.Book;
import ai.storygen.chapters.model.Chapter;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.segment.ChapterSegmenter;
import ai.storygen.chapters.segment.TableOfContentsPolicy;
import ai.storygen.chapters.util.TextNormalizer;
import ai.storygen.chapters.validate.ChapterValidator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reads books stored as one or more HTML files, grouping files by the title in their {@code <head>}.
 *
 * <p>Files are read and segmented one at a time and only their chapters are kept. A file that cannot be read
 * becomes a failed job of its own; a file that cannot be segmented fails the book it belongs to. Files without
 * chapters are skipped, so a book made only of such files yields no job.
 */
public class HtmlBookReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(HtmlBookReader.class);

    private final ChapterSegmenter segmenter;
    private final ChapterMerger merger;
    private final ChapterValidator validator;

    public HtmlBookReader() {
        this(new ChapterSegmenter(TableOfContentsPolicy.DISCARD_FOLLOWING), new ChapterMerger(), new ChapterValidator());
    }

    public HtmlBookReader(ChapterSegmenter segmenter, ChapterMerger merger, ChapterValidator validator) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Reads the given files and groups them into jobs: failed jobs for unreadable files first, then one job per
     * book title in title order.
     */
    public List<BookJob> plan(Collection<Path> files) {
        List<BookJob> jobs = new ArrayList<>();
        Map<String, List<HtmlSource>> sourcesByTitle = new TreeMap<>();
        Map<String, ChapterExtractionException> failuresByTitle = new TreeMap<>();
        for (Path file : files) {
            LOGGER.info("Reading \"{}\".", file);
            Document document;
            try {
                document = parse(file);
            } catch (UncheckedIOException ex) {
                LOGGER.error("Cannot read \"{}\": {}", file, ex.getMessage());
                jobs.add(new FailedBookJob(file.toString(), ex));
                continue;
            }
            String title = titleOf(file, document);
            LOGGER.debug("Parsing data for book titled \"{}\".", title);
            try {
                List<Chapter> chapters = segment(file, document);
                if (chapters.isEmpty()) {
                    LOGGER.debug("No chapters found in \"{}\"", file);
                    continue;
                }
                sourcesByTitle.computeIfAbsent(title, key -> new ArrayList<>()).add(new HtmlSource(file, chapters));
            } catch (ChapterExtractionException ex) {
                failuresByTitle.putIfAbsent(title, ex);
            }
        }

        TreeSet<String> titles = new TreeSet<>(sourcesByTitle.keySet());
        titles.addAll(failuresByTitle.keySet());
        LOGGER.info("Read data for {} book(s): {}", titles.size(), titles);
        for (String title : titles) {
            ChapterExtractionException failure = failuresByTitle.get(title);
            jobs.add(failure != null
                    ? new FailedBookJob(title, failure)
                    : new HtmlBookJob(title, sourcesByTitle.get(title)));
        }
        return jobs;
    }

    public List<Book> read(Collection<Path> files) throws IOException {
        List<Book> books = new ArrayList<>();
        for (BookJob job : plan(files)) {
            books.add(job.extract());
        }
        return books;
    }

    Book assemble(String title, List<HtmlSource> sources) {
        Map<String, List<Chapter>> chaptersBySource = new LinkedHashMap<>();
        for (HtmlSource source : sources) {
            chaptersBySource.put(source.path().toString(), source.chapters());
        }
        List<Chapter> merged = merger.mergeByIdentifier(chaptersBySource);
        validator.validate(merged);
        LOGGER.debug("Assembled {} chapter(s) for book titled \"{}\"", merged.size(), title);
        return new Book(title, merged);
    }

    private List<Chapter> segment(Path file, Document document) {
        MDC.put(BookJob.MDC_SOURCE, file.toString());
        try {
            return segmenter.segment(JsoupBlock.extract(document));
        } catch (ChapterExtractionException ex) {
            throw ex.inSource(file.toString());
        } finally {
            MDC.remove(BookJob.MDC_SOURCE);
        }
    }

    private static Document parse(Path file) {
        try {
            return Jsoup.parse(file.toFile(), StandardCharsets.UTF_8.name());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read HTML file: " + file, ex);
        }
    }

    private static String titleOf(Path file, Document document) {
        String title = TextNormalizer.normalizeSpacing(document.title());
        return title.isEmpty() ? BookFileWalker.baseName(file) : title;
    }

    record HtmlSource(Path path, List<Chapter> chapters) {

        HtmlSource {
            chapters = List.copyOf(chapters);
        }
    }

    private final class HtmlBookJob implements BookJob {

        private final String title;
        private final List<HtmlSource> sources;

        private HtmlBookJob(String title, List<HtmlSource> sources) {
            this.title = title;
            this.sources = List.copyOf(sources);
        }

        @Override
        public String label() {
            return title;
        }

        @Override
        public Book extract() {
            return assemble(title, sources);
        }
    }

    /**
     * Job for input that already failed while planning; extracting it reports that failure.
     */
    private static final class FailedBookJob implements BookJob {

        private final String label;
        private final RuntimeException failure;

        private FailedBookJob(String label, RuntimeException failure) {
            this.label = label;
            this.failure = failure;
        }

        @Override
        public String label() {
            return label;
        }

        @Override
        public Book extract() {
            throw failure;
        }
    }
}
