package stenojava;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static stenojava.Pat.alt;
import static stenojava.Pat.lit;
import static stenojava.Pat.seq;

class ChordTableTest {

    private static final Pat GAP = lit(Pat.OPTIONAL_VOWELS);

    private ChordTable table;

    @BeforeEach
    void setUp() {
        table = ChordTable.compileColumnLines(Arrays.asList(
                "S=s",
                "T=t K=k",
                "",
                "P=p KP=g",
                "H=h R=r PH=m SR=v"));
    }

    @Test
    void chordsKeepTheirOwnPattern() {
        assertThat(table.get("SR")).isEqualTo(lit('v'));
        assertThat(table.get("KP")).isEqualTo(lit('g'));
        assertThat(table.get("")).isEqualTo(seq());
    }

    @Test
    void disjointChordsCombineWithOptionalVowels() {
        assertThat(table.get("STR")).isEqualTo(seq(lit('s'), GAP, lit('t'), GAP, lit('r')));
        assertThat(table.get("SK")).isEqualTo(seq(lit('s'), GAP, lit('k')));
    }

    @Test
    void latestColumnSplitWins() {
        // K|PH rather than KP|H
        assertThat(table.get("KPH")).isEqualTo(seq(lit('k'), GAP, lit('m')));
    }

    @Test
    void keysInTheSameColumnDoNotCombine() {
        assertThat(table.contains("TK")).isFalse();
        assertThat(table.get("TK")).isNull();
    }

    @Test
    void builderDerivesNewTable() {
        ChordTable derived = table.toBuilder()
                .addAlternative("SR", lit('f'))
                .put("+", seq())
                .build();

        assertThat(derived.get("SR")).isEqualTo(alt(lit('v'), lit('f')));
        assertThat(derived.get("+")).isEqualTo(seq());
        assertThat(table.get("SR")).isEqualTo(lit('v'));
        assertThat(derived.size()).isEqualTo(table.size() + 1);
    }

    @Test
    void builderRejectsUnknownChord() {
        assertThatThrownBy(() -> table.toBuilder().addAlternative("Q", lit('q')))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Q");
    }

    @Test
    void parseEntriesKeepsOrderAndEmptySides() {
        Map<String, String> entries = ChordTable.parseEntries("  =  S=s T=t|d ");

        assertThat(entries).containsExactly(entry("", ""), entry("S", "s"), entry("T", "t|d"));
    }

    @Test
    void parseEntriesRejectsMalformedEntry() {
        assertThatThrownBy(() -> ChordTable.parseEntries("S=s T"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChordTable.parseEntries("a=b=c"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unbalancedColumnPatternFails() {
        assertThatThrownBy(() -> ChordTable.compileColumnLines(Arrays.asList("S=s)")))
                .isInstanceOf(PatSyntaxException.class);
    }
}
