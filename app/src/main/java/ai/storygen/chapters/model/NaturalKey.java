package ai.storygen.chapters.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Comparison key that orders embedded digit runs by numeric magnitude, so that {@code "2"} sorts before
 * {@code "10"} and {@code "b_2.html"} before {@code "b_10.html"}.
 *
 * <p>The text is split into alternating non-digit and digit runs. Runs are compared pairwise: two digit runs by
 * value, two text runs lexicographically, and a digit run sorts before a text run. When one key is a prefix of
 * the other, the shorter key sorts first.
 */
public final class NaturalKey implements Comparable<NaturalKey> {

    private static final NaturalKey EMPTY = new NaturalKey("", List.of());

    private final String source;
    private final List<Run> runs;

    private NaturalKey(String source, List<Run> runs) {
        this.source = source;
        this.runs = runs;
    }

    public static NaturalKey of(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        List<Run> runs = new ArrayList<>();
        int start = 0;
        boolean digits = isAsciiDigit(text.charAt(0));
        for (int i = 1; i <= text.length(); i++) {
            boolean boundary = i == text.length() || isAsciiDigit(text.charAt(i)) != digits;
            if (boundary) {
                String run = text.substring(start, i);
                runs.add(digits ? Run.number(new BigInteger(run)) : Run.text(run));
                if (i < text.length()) {
                    start = i;
                    digits = !digits;
                }
            }
        }
        return new NaturalKey(text, Collections.unmodifiableList(runs));
    }

    public static int compare(String left, String right) {
        return of(left).compareTo(of(right));
    }

    public String source() {
        return source;
    }

    @Override
    public int compareTo(NaturalKey other) {
        int shared = Math.min(runs.size(), other.runs.size());
        for (int i = 0; i < shared; i++) {
            int result = runs.get(i).compareTo(other.runs.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(runs.size(), other.runs.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NaturalKey other)) {
            return false;
        }
        return runs.equals(other.runs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runs);
    }

    @Override
    public String toString() {
        return "NaturalKey" + runs;
    }

    private static boolean isAsciiDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private record Run(BigInteger number, String text) implements Comparable<Run> {

        static Run number(BigInteger value) {
            return new Run(value, null);
        }

        static Run text(String value) {
            return new Run(null, value);
        }

        boolean isNumber() {
            return number != null;
        }

        @Override
        public int compareTo(Run other) {
            if (isNumber() && other.isNumber()) {
                return number.compareTo(other.number);
            }
            if (isNumber()) {
                return -1;
            }
            if (other.isNumber()) {
                return 1;
            }
            return text.compareTo(other.text);
        }

        @Override
        public String toString() {
            return isNumber() ? number.toString() : '"' + text + '"';
        }
    }
}
