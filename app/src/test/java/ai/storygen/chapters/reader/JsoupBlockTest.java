package ai.storygen.chapters.reader;

import static org.assertj.core.api.Assertions.assertThat;

import ai.storygen.chapters.segment.BlockKind;
import java.util.List;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

class JsoupBlockTest {

    @Test
    void extractsTextBlocksInDocumentOrder() {
        List<JsoupBlock> blocks = JsoupBlock.extract(Jsoup.parse(
                "<h1>Ignored</h1><h2>Chapter 1</h2><h3>Start</h3><div><p>One&nbsp; two</p></div>"
                        + "<blockquote>Quoted</blockquote><p><img src=\"x.png\"></p>"));

        assertThat(blocks).extracting(JsoupBlock::kind).containsExactly(
                BlockKind.HEADING, BlockKind.SUBHEADING, BlockKind.PARAGRAPH, BlockKind.PARAGRAPH, BlockKind.PARAGRAPH);
        assertThat(blocks.get(2).normalizedText()).isEqualTo("One two");
        assertThat(blocks.get(4).isBlank()).isTrue();
        assertThat(blocks.get(4).containsImage()).isTrue();
        assertThat(blocks.get(3).containsImage()).isFalse();
    }
}
