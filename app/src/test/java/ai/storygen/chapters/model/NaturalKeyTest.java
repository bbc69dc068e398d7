package ai.storygen.chapters.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Test;

class NaturalKeyTest {

    @Test
    void ordersDigitRunsByValue() {
        assertThat(NaturalKey.compare("2", "10")).isNegative();
        assertThat(NaturalKey.compare("b_2.html", "b_10.html")).isNegative();
        assertThat(NaturalKey.compare("b_010.html", "b_10.html")).isZero();
    }

    @Test
    void sortsFileNamesNaturally() {
        List<String> names = new ArrayList<>(List.of("part10.xhtml", "part9.xhtml", "part1.xhtml", "intro.xhtml"));

        names.sort(Comparator.comparing(NaturalKey::of));

        assertThat(names).containsExactly("intro.xhtml", "part1.xhtml", "part9.xhtml", "part10.xhtml");
    }

    @Test
    void digitRunSortsBeforeTextAndPrefixSortsFirst() {
        assertThat(NaturalKey.compare("7", "a")).isNegative();
        assertThat(NaturalKey.compare("chapter", "chapter2")).isNegative();
        assertThat(NaturalKey.compare("", "1")).isNegative();
    }

    @Test
    void handlesNumbersBeyondLongRange() {
        assertThat(NaturalKey.compare("99999999999999999999", "100000000000000000000")).isNegative();
    }
}
