package ai.storygen.chapters.segment;

import ai.storygen.chapters.model.Chapter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the blocks of one document into chapters, preferring heading markup and falling back to a linear scan.
 */
public class ChapterSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChapterSegmenter.class);

    private final StructuredSegmenter structuredSegmenter;
    private final UnstructuredSegmenter unstructuredSegmenter;

    public ChapterSegmenter(TableOfContentsPolicy tocPolicy) {
        this(new StructuredSegmenter(), new UnstructuredSegmenter(tocPolicy));
    }

    ChapterSegmenter(StructuredSegmenter structuredSegmenter, UnstructuredSegmenter unstructuredSegmenter) {
        this.structuredSegmenter = Objects.requireNonNull(structuredSegmenter, "structuredSegmenter");
        this.unstructuredSegmenter = Objects.requireNonNull(unstructuredSegmenter, "unstructuredSegmenter");
    }

    public List<Chapter> segment(List<? extends Block> blocks) {
        List<Chapter> structured = structuredSegmenter.segment(blocks);
        if (!structured.isEmpty()) {
            LOGGER.debug("Read {} chapter(s) from heading markup", structured.size());
            return structured;
        }
        List<Chapter> unstructured = unstructuredSegmenter.segment(BlockCursor.over(blocks));
        LOGGER.debug("Read {} chapter(s) by linear scan of {} block(s)", unstructured.size(), blocks.size());
        return unstructured;
    }
}
