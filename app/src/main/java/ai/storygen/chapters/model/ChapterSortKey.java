package ai.storygen.chapters.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Ordering key of a chapter designator: PROLOGUE first, numbered chapters next, EPILOGUE last, and natural
 * ordering of the designator within each group.
 */
public record ChapterSortKey(int group, NaturalKey naturalKey) implements Comparable<ChapterSortKey> {

    public static final int PROLOGUE_GROUP = -1;
    public static final int NUMBERED_GROUP = 0;
    public static final int EPILOGUE_GROUP = 1;

    /**
     * Key comparing below the key of every designator.
     */
    public static final ChapterSortKey MINIMUM = new ChapterSortKey(Integer.MIN_VALUE, NaturalKey.of(""));

    private static final Comparator<ChapterSortKey> ORDER = Comparator
            .comparingInt(ChapterSortKey::group)
            .thenComparing(ChapterSortKey::naturalKey);

    public ChapterSortKey {
        Objects.requireNonNull(naturalKey, "naturalKey");
    }

    public static ChapterSortKey of(String seq) {
        String value = seq == null ? "" : seq;
        int group = NUMBERED_GROUP;
        if (value.equalsIgnoreCase(Chapter.PROLOGUE)) {
            group = PROLOGUE_GROUP;
        } else if (value.equalsIgnoreCase(Chapter.EPILOGUE)) {
            group = EPILOGUE_GROUP;
        }
        return new ChapterSortKey(group, NaturalKey.of(value));
    }

    @Override
    public int compareTo(ChapterSortKey other) {
        return ORDER.compare(this, other);
    }
}
