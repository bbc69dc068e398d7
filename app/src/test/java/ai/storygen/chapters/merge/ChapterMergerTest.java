package ai.storygen.chapters.merge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ai.storygen.chapters.model.Chapter;
import ai.storygen.chapters.model.ChapterExtractionException;
import ai.storygen.chapters.model.ExtractionErrorKind;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChapterMergerTest {

    private final ChapterMerger merger = new ChapterMerger();

    @Test
    void appendsHeaderlessFragmentToChapterOfPreviousDocument() {
        Map<String, List<Chapter>> chaptersBySource = new LinkedHashMap<>();
        chaptersBySource.put("b_002.html", List.of(
                Chapter.headerless(List.of("continued")),
                new Chapter("2", "Middle", List.of("Third."))));
        chaptersBySource.put("b_001.html", List.of(new Chapter("1", "Beginning", List.of("First."))));

        List<Chapter> merged = merger.mergeByIdentifier(chaptersBySource);

        assertThat(merged).containsExactly(
                new Chapter("1", "Beginning", List.of("First.", "continued")),
                new Chapter("2", "Middle", List.of("Third.")));
    }

    @Test
    void ordersIdentifiersNaturally() {
        Map<String, List<Chapter>> chaptersBySource = new LinkedHashMap<>();
        chaptersBySource.put("b_10.html", List.of(new Chapter("10", "Ten", List.of("x"))));
        chaptersBySource.put("b_2.html", List.of(new Chapter("2", "Two", List.of("y"))));

        assertThat(merger.mergeByIdentifier(chaptersBySource)).extracting(Chapter::seq).containsExactly("2", "10");
    }

    @Test
    void headerlessFirstChapterIsAmbiguous() {
        ChapterExtractionException ex = catchThrowableOfType(() -> merger.merge(List.of(
                        new SourceChapters("intro.xhtml", List.of(Chapter.headerless(List.of("orphan")))))),
                ChapterExtractionException.class);

        assertThat(ex.kind()).isEqualTo(ExtractionErrorKind.AMBIGUOUS_CONTINUATION);
        assertThat(ex.source()).contains("intro.xhtml");
    }
}
