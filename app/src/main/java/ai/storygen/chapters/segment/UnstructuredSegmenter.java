package ai.storygen.chapters.segment;

import ai.storygen.chapters.model.Chapter;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.model.ExtractionErrorKind;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linear scan that recognises chapter headers, prologue/epilogue markers, tables of contents and the end of the
 * book in a stream of blocks without relying on heading markup.
 */
public class UnstructuredSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnstructuredSegmenter.class);

    private final TableOfContentsPolicy tocPolicy;

    public UnstructuredSegmenter(TableOfContentsPolicy tocPolicy) {
        this.tocPolicy = Objects.requireNonNull(tocPolicy, "tocPolicy");
    }

    /**
     * Segments the remaining blocks of {@code cursor}.
     *
     * @return the non-empty chapters in document order; a leading chapter without header holds text that
     *         precedes the first header
     * @throws ChapterExtractionException when a header cannot be completed
     */
    public List<Chapter> segment(BlockCursor cursor) {
        List<Chapter> chapters = new ArrayList<>();
        ChapterAccumulator current = new ChapterAccumulator();
        while (cursor.hasNext()) {
            String text = cursor.next().normalizedText();
            if (text.isEmpty()) {
                continue;
            }
            Matcher header = ChapterPatterns.CHAPTER_HEADER.matcher(text);
            if (header.lookingAt()) {
                Chapter previous = current.seal();
                chapters.add(previous);
                String seq = header.group(1) != null ? header.group(1) : readSequence(cursor, previous);
                current = new ChapterAccumulator(seq, readTitle(cursor, seq));
            } else if (ChapterPatterns.isNonNumericSeq(text)) {
                chapters.add(current.seal());
                String seq = text.toLowerCase(Locale.ROOT);
                current = new ChapterAccumulator(seq, readTitle(cursor, seq));
            } else if (ChapterPatterns.isTableOfContentsHeader(text)) {
                skipTableOfContents(cursor);
            } else if (ChapterPatterns.isBookEnd(text, cursor.peekNonBlank().map(Block::normalizedText).orElse(null))) {
                LOGGER.debug("Reached end-of-book marker \"{}\"; ignoring the remaining blocks", text);
                break;
            } else {
                current.addParagraph(text);
            }
        }
        chapters.add(current.seal());
        return chapters.stream()
                .filter(chapter -> !chapter.isEmpty())
                .collect(Collectors.toList());
    }

    private String readSequence(BlockCursor cursor, Chapter previous) {
        if (!cursor.hasNext()) {
            throw new ChapterExtractionException(ExtractionErrorKind.UNTERMINATED_HEADER,
                    "Chapter header at end of document has no chapter number");
        }
        String seq = cursor.next().normalizedText();
        if (!seq.isEmpty()) {
            return seq;
        }
        return incrementSequence(previous);
    }

    static String incrementSequence(Chapter previous) {
        if (!previous.hasSeq()) {
            throw new ChapterExtractionException(ExtractionErrorKind.AMBIGUOUS_CONTINUATION,
                    "Cannot number a chapter without a preceding numbered chapter; previous was " + previous.describe());
        }
        try {
            return new BigInteger(previous.seq()).add(BigInteger.ONE).toString();
        } catch (NumberFormatException ex) {
            throw new ChapterExtractionException(ExtractionErrorKind.AMBIGUOUS_CONTINUATION,
                    "Cannot number a chapter following non-numeric chapter " + previous.describe());
        }
    }

    /**
     * Reads the title following a header, stepping over blocks that only hold a decorative image.
     */
    static String readTitle(BlockCursor cursor, String seq) {
        while (cursor.hasNext()) {
            Block block = cursor.next();
            String title = block.normalizedText();
            if (!title.isEmpty()) {
                return title;
            }
            if (!block.containsImage()) {
                throw new ChapterExtractionException(ExtractionErrorKind.UNTERMINATED_HEADER,
                        "Chapter \"" + seq + "\" is followed by an empty block instead of a title");
            }
        }
        throw new ChapterExtractionException(ExtractionErrorKind.UNTERMINATED_HEADER,
                "Document ended before the title of chapter \"" + seq + "\"");
    }

    private void skipTableOfContents(BlockCursor cursor) {
        switch (tocPolicy) {
            case DISCARD_FOLLOWING -> {
                if (cursor.hasNext()) {
                    cursor.next();
                }
            }
            case DISCARD_BLACKLISTED_FOLLOWING -> {
                Optional<Block> following = cursor.peekNonBlank();
                if (following.isPresent() && ChapterPatterns.isBlacklistedTitle(following.get().text())) {
                    cursor.skipThroughNonBlank();
                }
            }
        }
    }
}
