package ai.storygen.chapters.reader;

import ai.storygen.chapters.merge.ChapterMerger;
import ai.storygen.chapters.merge.SourceChapters;
import ai.storygen.chapters.model.Book;
import ai.storygen.chapters.model.Chapter;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.model.ExtractionErrorKind;
import ai.storygen.chapters.nav.ChapterDescriptor;
import ai.storygen.chapters.nav.NavigationResolver;
import ai.storygen.chapters.segment.ChapterSegmenter;
import ai.storygen.chapters.segment.TableOfContentsPolicy;
import ai.storygen.chapters.validate.ChapterValidator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reads one book per EPUB archive, visiting the chapter documents in navigation order.
 */
public class EpubBookReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(EpubBookReader.class);

    private final NavigationResolver navigationResolver;
    private final ChapterSegmenter segmenter;
    private final ChapterMerger merger;
    private final ChapterValidator validator;

    public EpubBookReader() {
        this(new NavigationResolver(), new ChapterSegmenter(TableOfContentsPolicy.DISCARD_BLACKLISTED_FOLLOWING),
                new ChapterMerger(), new ChapterValidator());
    }

    public EpubBookReader(NavigationResolver navigationResolver, ChapterSegmenter segmenter, ChapterMerger merger,
                          ChapterValidator validator) {
        this.navigationResolver = Objects.requireNonNull(navigationResolver, "navigationResolver");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public List<BookJob> plan(Collection<Path> archives) {
        return archives.stream()
                .map(EpubBookJob::new)
                .collect(Collectors.toList());
    }

    public Book read(Path archivePath) throws IOException {
        LOGGER.info("Reading \"{}\".", archivePath);
        try (EpubArchive archive = EpubArchive.open(archivePath)) {
            String title = archive.title().orElseGet(() -> BookFileWalker.baseName(archivePath));
            LOGGER.debug("Parsing data for book titled \"{}\".", title);
            List<ChapterDescriptor> descriptors = navigationResolver.resolve(archive.navigationEntries());

            List<SourceChapters> sources = new ArrayList<>(descriptors.size());
            for (ChapterDescriptor descriptor : descriptors) {
                LOGGER.debug("Parsing document with HREF \"{}\".", descriptor.source());
                Document document = archive.readDocument(descriptor.source());
                sources.add(new SourceChapters(descriptor.source(), segment(descriptor, document)));
            }
            List<Chapter> chapters = merger.merge(sources);
            if (chapters.isEmpty()) {
                throw new ChapterExtractionException(ExtractionErrorKind.INCOMPLETE_CHAPTER,
                        "None of the " + descriptors.size() + " navigated document(s) holds a chapter");
            }
            validator.validate(chapters);
            LOGGER.debug("Parsed {} chapter(s) for book titled \"{}\".", chapters.size(), title);
            return new Book(title, chapters);
        } catch (ChapterExtractionException ex) {
            throw ex.inSource(archivePath.toString());
        }
    }

    private List<Chapter> segment(ChapterDescriptor descriptor, Document document) {
        MDC.put(BookJob.MDC_SOURCE, descriptor.source());
        try {
            return segmenter.segment(JsoupBlock.extract(document));
        } catch (ChapterExtractionException ex) {
            throw ex.inSource(descriptor.source());
        } finally {
            MDC.remove(BookJob.MDC_SOURCE);
        }
    }

    private final class EpubBookJob implements BookJob {

        private final Path archivePath;

        private EpubBookJob(Path archivePath) {
            this.archivePath = archivePath;
        }

        @Override
        public String label() {
            return archivePath.toString();
        }

        @Override
        public Book extract() throws IOException {
            return read(archivePath);
        }
    }
}
