package ai.storygen.chapters.merge;

import ai.storygen.chapters.model.Chapter;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.model.ExtractionErrorKind;
import ai.storygen.chapters.model.NaturalKey;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins the chapters of the documents making up one book, attaching headerless fragments to the chapter they
 * continue.
 */
public class ChapterMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChapterMerger.class);

    /**
     * Merges documents ordered by the natural key of their identifiers.
     */
    public List<Chapter> mergeByIdentifier(Map<String, List<Chapter>> chaptersBySource) {
        List<SourceChapters> ordered = chaptersBySource.entrySet().stream()
                .sorted(Comparator.comparing(entry -> NaturalKey.of(entry.getKey())))
                .map(entry -> new SourceChapters(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        return merge(ordered);
    }

    /**
     * Merges documents in the given order.
     *
     * @throws ChapterExtractionException when the first chapter is a headerless fragment
     */
    public List<Chapter> merge(List<SourceChapters> sources) {
        List<Chapter> merged = new ArrayList<>();
        for (SourceChapters source : sources) {
            for (Chapter chapter : source.chapters()) {
                if (!chapter.isHeaderless()) {
                    merged.add(chapter);
                    continue;
                }
                if (merged.isEmpty()) {
                    throw new ChapterExtractionException(ExtractionErrorKind.AMBIGUOUS_CONTINUATION,
                            "Headerless text with " + chapter.pars().size() + " paragraph(s) has no preceding chapter",
                            source.source());
                }
                int last = merged.size() - 1;
                LOGGER.debug("Appending {} paragraph(s) from {} to {}", chapter.pars().size(), source.source(),
                        merged.get(last).describe());
                merged.set(last, merged.get(last).withAppendedParagraphs(chapter.pars()));
            }
        }
        return merged;
    }
}
