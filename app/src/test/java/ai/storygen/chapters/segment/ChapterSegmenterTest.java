package ai.storygen.chapters.segment;

import static org.assertj.core.api.Assertions.assertThat;

import ai.storygen.chapters.model.Chapter;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChapterSegmenterTest {

    private final ChapterSegmenter segmenter = new ChapterSegmenter(TableOfContentsPolicy.DISCARD_FOLLOWING);

    @Test
    void usesHeadingMarkupWhenPresent() {
        List<Chapter> chapters = segmenter.segment(List.of(
                FakeBlock.heading("Chapter 1"), FakeBlock.subheading("Start"), FakeBlock.paragraph("Text.")));

        assertThat(chapters).containsExactly(new Chapter("1", "Start", List.of("Text.")));
    }

    @Test
    void fallsBackToLinearScan() {
        List<Chapter> chapters = segmenter.segment(FakeBlock.paragraphs("Chapter 1", "Start", "Text."));

        assertThat(chapters).containsExactly(new Chapter("1", "Start", List.of("Text.")));
    }

    @Test
    void documentWithoutChaptersYieldsHeaderlessText() {
        assertThat(segmenter.segment(FakeBlock.paragraphs("just", "text")))
                .containsExactly(Chapter.headerless(List.of("just", "text")));
        assertThat(segmenter.segment(List.of())).isEmpty();
    }
}
