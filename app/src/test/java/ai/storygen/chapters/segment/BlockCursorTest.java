package ai.storygen.chapters.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class BlockCursorTest {

    @Test
    void peekedBlocksAreReturnedInOrder() {
        BlockCursor cursor = BlockCursor.over(FakeBlock.paragraphs("a", " ", "", "b", "c"));

        assertThat(cursor.peekNonBlank()).map(Block::text).contains("b");
        assertThat(cursor.next().text()).isEqualTo("a");
        assertThat(cursor.peek()).map(Block::text).contains(" ");
        assertThat(cursor.skipThroughNonBlank()).map(Block::text).contains("b");
        assertThat(cursor.next().text()).isEqualTo("c");
        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.peek()).isEmpty();
        assertThat(cursor.peekNonBlank()).isEmpty();
    }

    @Test
    void nextOnExhaustedCursorThrows() {
        BlockCursor cursor = BlockCursor.over(FakeBlock.paragraphs());

        assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
    }
}
