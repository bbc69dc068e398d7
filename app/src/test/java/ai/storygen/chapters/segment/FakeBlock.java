package ai.storygen.chapters.segment;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

record FakeBlock(String text, BlockKind kind, boolean containsImage) implements Block {

    static FakeBlock paragraph(String text) {
        return new FakeBlock(text, BlockKind.PARAGRAPH, false);
    }

    static FakeBlock heading(String text) {
        return new FakeBlock(text, BlockKind.HEADING, false);
    }

    static FakeBlock subheading(String text) {
        return new FakeBlock(text, BlockKind.SUBHEADING, false);
    }

    static FakeBlock image() {
        return new FakeBlock("", BlockKind.PARAGRAPH, true);
    }

    static List<Block> paragraphs(String... texts) {
        return Arrays.stream(texts).map(FakeBlock::paragraph).collect(Collectors.toList());
    }
}
