package ai.storygen.chapters.reader;

import ai.storygen.chapters.segment.Block;
import ai.storygen.chapters.segment.BlockKind;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * {@link Block} backed by a jsoup element.
 */
public final class JsoupBlock implements Block {

    /**
     * Elements that carry chapter text. Chapter titles are occasionally placed in {@code blockquote}s.
     */
    static final String BLOCK_SELECTOR = "p, blockquote, h2, h3";

    private final Element element;

    public JsoupBlock(Element element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    public static List<JsoupBlock> extract(Document document) {
        return document.select(BLOCK_SELECTOR).stream()
                .map(JsoupBlock::new)
                .collect(Collectors.toList());
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public BlockKind kind() {
        return switch (element.normalName()) {
            case "h2" -> BlockKind.HEADING;
            case "h3" -> BlockKind.SUBHEADING;
            default -> BlockKind.PARAGRAPH;
        };
    }

    @Override
    public boolean containsImage() {
        return element.selectFirst("img, image") != null;
    }

    @Override
    public String toString() {
        return "<" + element.normalName() + "> " + normalizedText();
    }
}
