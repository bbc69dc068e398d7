package ai.storygen.chapters.segment;

import ai.storygen.chapters.model.Chapter;
import ai.storygen.chapters.util.TextNormalizer;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Textual markers recognised while segmenting documents and resolving navigation labels.
 */
public final class ChapterPatterns {

    /**
     * A chapter header with an optional numeral, e.g. {@code Chapter}, {@code CHAPTER 12} or {@code Chapter 3:},
     * matched at the start of a block; anything after it, such as a trailing period, is ignored.
     */
    public static final Pattern CHAPTER_HEADER = Pattern.compile("CHAPTER\\s*(\\d+)?:?", Pattern.CASE_INSENSITIVE);

    public static final Pattern SINGLE_BOOK_END = Pattern.compile(
            "The\\s+End\\s+of\\s+the\\s+\\w+\\s+Book\\s+of", Pattern.CASE_INSENSITIVE);

    public static final Pattern BOOK_END_FIRST_LINE = Pattern.compile("The\\s+End", Pattern.CASE_INSENSITIVE);

    public static final Pattern BOOK_END_SECOND_LINE = Pattern.compile(
            "of\\s+the\\s+\\w+\\s+Book\\s+of", Pattern.CASE_INSENSITIVE);

    /**
     * Front matter and back matter titles that never name a chapter, lowercase.
     */
    public static final Set<String> TITLE_BLACKLIST = Set.of(
            "cover", "cover page", "title", "title page", "copyright", "copyright page",
            "dedication", "contents", "table of contents", "maps", "glossary",
            "about the author", "start");

    static final String TABLE_OF_CONTENTS = "table of contents";

    static final int MAX_NON_NUMERIC_SEQ_LENGTH = Chapter.NON_NUMERIC_SEQS.stream()
            .mapToInt(String::length)
            .max()
            .orElse(0);

    private ChapterPatterns() {
    }

    public static boolean isBlacklistedTitle(String text) {
        return TITLE_BLACKLIST.contains(TextNormalizer.normalizeSpacing(text).toLowerCase(Locale.ROOT));
    }

    static boolean isNonNumericSeq(String text) {
        if (text.length() > MAX_NON_NUMERIC_SEQ_LENGTH) {
            return false;
        }
        return Chapter.NON_NUMERIC_SEQS.contains(text.toLowerCase(Locale.ROOT));
    }

    static boolean isTableOfContentsHeader(String text) {
        if (text.length() > TABLE_OF_CONTENTS.length()) {
            return false;
        }
        return text.equalsIgnoreCase(TABLE_OF_CONTENTS);
    }

    /**
     * Checks whether {@code text} marks the end of the book, either on its own or together with the next
     * non-blank block.
     *
     * @param text normalized text of the current block
     * @param followingText normalized text of the next non-blank block, or {@code null} when there is none
     */
    static boolean isBookEnd(String text, String followingText) {
        if (SINGLE_BOOK_END.matcher(text).lookingAt()) {
            return true;
        }
        return followingText != null
                && BOOK_END_FIRST_LINE.matcher(text).lookingAt()
                && BOOK_END_SECOND_LINE.matcher(followingText).lookingAt();
    }
}
