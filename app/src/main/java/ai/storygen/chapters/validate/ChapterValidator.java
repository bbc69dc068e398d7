package ai.storygen.chapters.validate;

import ai.storygen.chapters.model.Chapter;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.model.ChapterSortKey;
import ai.storygen.chapters.model.ExtractionErrorKind;
import java.util.List;

/**
 * Checks that a merged chapter list is complete and in ascending designator order.
 */
public class ChapterValidator {

    public void validate(List<Chapter> chapters) {
        ChapterSortKey previousKey = ChapterSortKey.MINIMUM;
        for (Chapter chapter : chapters) {
            ChapterSortKey key = chapter.sortKey();
            if (previousKey.compareTo(key) > 0) {
                throw new ChapterExtractionException(ExtractionErrorKind.OUT_OF_ORDER,
                        "Chapter is out of order: " + chapter.describe());
            }
            validateChapter(chapter);
            previousKey = key;
        }
    }

    private void validateChapter(Chapter chapter) {
        if (!chapter.hasSeq()) {
            throw new ChapterExtractionException(ExtractionErrorKind.INCOMPLETE_CHAPTER,
                    "Chapter titled \"" + chapter.title() + "\" has no sequence designator");
        }
        if (!chapter.hasTitle()) {
            throw new ChapterExtractionException(ExtractionErrorKind.INCOMPLETE_CHAPTER,
                    "Chapter \"" + chapter.seq() + "\" has no title");
        }
        if (chapter.pars().isEmpty()) {
            throw new ChapterExtractionException(ExtractionErrorKind.INCOMPLETE_CHAPTER,
                    "Chapter \"" + chapter.seq() + "\" titled \"" + chapter.title() + "\" has no paragraphs");
        }
    }
}
