package ai.storygen.chapters.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One chapter of a book: its sequence designator, its display title and its paragraphs.
 *
 * <p>Absent values are represented by empty strings and an empty paragraph list. A chapter without designator
 * and title is a headerless fragment continuing the chapter before it.
 *
 * @param seq the designator: a numeral, or {@code prologue}/{@code epilogue} in any case
 * @param title the whitespace-normalized title
 * @param pars the whitespace-normalized, non-empty paragraphs
 */
public record Chapter(String seq, String title, List<String> pars) {

    public static final String PROLOGUE = "prologue";
    public static final String EPILOGUE = "epilogue";

    /**
     * Designators that are not numerals, lowercase.
     */
    public static final Set<String> NON_NUMERIC_SEQS = Set.of(PROLOGUE, EPILOGUE);

    public Chapter {
        seq = seq == null ? "" : seq;
        title = title == null ? "" : title;
        pars = pars == null ? List.of() : List.copyOf(pars);
    }

    public static Chapter headerless(List<String> pars) {
        return new Chapter("", "", pars);
    }

    public boolean hasSeq() {
        return !seq.isEmpty();
    }

    public boolean hasTitle() {
        return !title.isEmpty();
    }

    public boolean isEmpty() {
        return seq.isEmpty() && title.isEmpty() && pars.isEmpty();
    }

    public boolean isHeaderless() {
        return seq.isEmpty() && title.isEmpty();
    }

    public boolean isNonNumeric() {
        return NON_NUMERIC_SEQS.contains(seq.toLowerCase(Locale.ROOT));
    }

    public ChapterSortKey sortKey() {
        return ChapterSortKey.of(seq);
    }

    public Chapter withAppendedParagraphs(List<String> additional) {
        List<String> combined = new ArrayList<>(pars.size() + additional.size());
        combined.addAll(pars);
        combined.addAll(additional);
        return new Chapter(seq, title, combined);
    }

    /**
     * Short description used in log lines and error messages.
     */
    public String describe() {
        return "Chapter{seq=\"" + seq + "\", title=\"" + title + "\", pars=" + pars.size() + "}";
    }
}
