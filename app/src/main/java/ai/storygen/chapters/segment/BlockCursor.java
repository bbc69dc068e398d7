package ai.storygen.chapters.segment;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-pass cursor over a block stream that can look ahead without consuming.
 *
 * <p>Blocks returned by {@link #next()} are gone for good; blocks only peeked at are buffered and returned by
 * later calls to {@link #next()} in stream order.
 */
public final class BlockCursor {

    private final Iterator<? extends Block> source;
    private final Deque<Block> lookahead = new ArrayDeque<>();

    public BlockCursor(Iterator<? extends Block> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public static BlockCursor over(Iterable<? extends Block> blocks) {
        return new BlockCursor(blocks.iterator());
    }

    public boolean hasNext() {
        return !lookahead.isEmpty() || source.hasNext();
    }

    public Optional<Block> peek() {
        if (lookahead.isEmpty()) {
            if (!source.hasNext()) {
                return Optional.empty();
            }
            lookahead.addLast(source.next());
        }
        return Optional.of(lookahead.peekFirst());
    }

    public Block next() {
        if (!lookahead.isEmpty()) {
            return lookahead.pollFirst();
        }
        if (!source.hasNext()) {
            throw new NoSuchElementException("Block stream exhausted");
        }
        return source.next();
    }

    /**
     * Returns the next block with non-blank text, buffering any blank blocks in front of it.
     */
    public Optional<Block> peekNonBlank() {
        for (Block buffered : lookahead) {
            if (!buffered.isBlank()) {
                return Optional.of(buffered);
            }
        }
        while (source.hasNext()) {
            Block block = source.next();
            lookahead.addLast(block);
            if (!block.isBlank()) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    /**
     * Consumes blocks up to and including the next non-blank one.
     *
     * @return the consumed non-blank block, empty when the stream ran out first
     */
    public Optional<Block> skipThroughNonBlank() {
        while (hasNext()) {
            Block block = next();
            if (!block.isBlank()) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }
}
