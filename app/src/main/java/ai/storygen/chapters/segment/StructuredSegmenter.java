package ai.storygen.chapters.segment;

import ai.storygen.chapters.model.Chapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Segments documents whose markup carries the chapter designator in a heading and the chapter title in a
 * subheading (or in a second heading).
 */
public class StructuredSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructuredSegmenter.class);

    /**
     * Segments a fully materialised document.
     *
     * @return the chapters found, empty when the document has no heading structure to rely on
     */
    public List<Chapter> segment(List<? extends Block> blocks) {
        List<Integer> headings = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).kind() == BlockKind.HEADING) {
                headings.add(i);
            }
        }
        if (headings.isEmpty()) {
            return List.of();
        }

        List<HeaderPair> pairs = pairHeadings(blocks, headings);
        List<Chapter> chapters = new ArrayList<>(pairs.size());
        for (HeaderPair pair : pairs) {
            int end = nextHeading(headings, pair.title(), blocks.size());
            ChapterAccumulator accumulator = new ChapterAccumulator(
                    designator(blocks.get(pair.designator())), blocks.get(pair.title()).normalizedText());
            boolean bookEnded = collectParagraphs(blocks, pair.title() + 1, end, accumulator);
            Chapter chapter = accumulator.seal();
            if (!chapter.isEmpty()) {
                chapters.add(chapter);
            }
            if (bookEnded) {
                break;
            }
        }
        return chapters;
    }

    private List<HeaderPair> pairHeadings(List<? extends Block> blocks, List<Integer> headings) {
        List<HeaderPair> pairs = new ArrayList<>(headings.size());
        for (int h = 0; h < headings.size(); h++) {
            int start = headings.get(h);
            int bound = h + 1 < headings.size() ? headings.get(h + 1) : blocks.size();
            for (int i = start + 1; i < bound; i++) {
                if (blocks.get(i).kind() == BlockKind.SUBHEADING) {
                    pairs.add(new HeaderPair(start, i));
                    break;
                }
            }
        }
        if (pairs.size() == headings.size()) {
            return pairs;
        }

        // Heading and subheading counts disagree: fall back to reading the headings themselves in pairs.
        LOGGER.debug("Found {} subheading(s) for {} heading(s); pairing headings instead", pairs.size(), headings.size());
        List<HeaderPair> headingPairs = new ArrayList<>();
        for (int h = 0; h + 1 < headings.size(); h += 2) {
            headingPairs.add(new HeaderPair(headings.get(h), headings.get(h + 1)));
        }
        return headingPairs;
    }

    private boolean collectParagraphs(List<? extends Block> blocks, int from, int to, ChapterAccumulator accumulator) {
        for (int i = from; i < to; i++) {
            Block block = blocks.get(i);
            if (block.kind() != BlockKind.PARAGRAPH) {
                continue;
            }
            String text = block.normalizedText();
            if (text.isEmpty()) {
                continue;
            }
            if (ChapterPatterns.isBookEnd(text, followingParagraphText(blocks, i + 1))) {
                LOGGER.debug("Reached end-of-book marker \"{}\"", text);
                return true;
            }
            accumulator.addParagraph(text);
        }
        return false;
    }

    private static String followingParagraphText(List<? extends Block> blocks, int from) {
        for (int i = from; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (block.kind() == BlockKind.PARAGRAPH && !block.isBlank()) {
                return block.normalizedText();
            }
        }
        return null;
    }

    static String designator(Block heading) {
        String text = heading.normalizedText();
        Matcher matcher = ChapterPatterns.CHAPTER_HEADER.matcher(text);
        if (matcher.lookingAt()) {
            String numeral = matcher.group(1);
            return numeral == null ? "" : numeral;
        }
        // e.g. "Prologue" and "Epilogue"
        return text.toLowerCase(Locale.ROOT);
    }

    private static int nextHeading(List<Integer> headings, int after, int fallback) {
        for (int index : headings) {
            if (index > after) {
                return index;
            }
        }
        return fallback;
    }

    private record HeaderPair(int designator, int title) {
    }
}
