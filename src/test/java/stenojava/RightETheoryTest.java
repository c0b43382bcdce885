package stenojava;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static stenojava.Pat.alt;
import static stenojava.Pat.lit;
import static stenojava.Pat.seq;

class RightETheoryTest {

    private static final Pat GAP = lit(Pat.OPTIONAL_VOWELS);

    private static RightETheory theory;

    @BeforeAll
    static void compileTheory() {
        theory = RightESteno.TheoryHolder.get();
    }

    @Test
    void continuationKeyAloneMatchesNothing() {
        assertThat(theory.left().get("+")).isEqualTo(seq());
    }

    @Test
    void kphMayAlsoSpellKn() {
        Pat k = alt(lit('k'), lit('c'), lit('g'));

        assertThat(theory.left().get("KPH"))
                .isEqualTo(alt(seq(k, GAP, lit('m')), seq(k, GAP, lit('n'))));
    }

    @Test
    void leftWrMayAlsoSpellHr() {
        Pat s = alt(lit('s'), seq(lit('e'), lit('x')));
        Pat swr = theory.left().get("SWR");

        assertThat(swr.kind()).isEqualTo(Pat.Kind.ALTERNATION);
        assertThat(swr.children()).last()
                .isEqualTo(seq(s, GAP, lit('h'), lit('r')));
    }

    @Test
    void rightRMayComeBeforeOrAfter() {
        assertThat(theory.right().get("R"))
                .isEqualTo(alt(seq(lit('r'), GAP), seq(GAP, lit('r'))));
        assertThat(theory.right().get("F"))
                .isEqualTo(seq(alt(lit('f'), lit('v')), GAP));
    }

    @Test
    void rightZAloneIsZ() {
        assertThat(theory.right().get("Z")).isEqualTo(lit('z'));
    }

    @Test
    void rightFrPbCanBeM() {
        Pat frpbt = theory.right().get("FRPBT");

        assertThat(frpbt).isNotNull();
        assertThat(frpbt.toString()).contains("'m'").contains("'n'");
    }

    @Test
    void briefsExpandIntoPhrases() {
        assertThat(theory.island("^W")).isEqualTo("with");
        assertThat(theory.island("W-T")).isEqualTo("with the");
        assertThat(theory.island("W-FBT")).isEqualTo("with of be the");
        assertThat(theory.island("-PB")).isEqualTo("and");
        assertThat(theory.island("-F")).isEqualTo("of");
        assertThat(theory.island("W-RTS")).isEqualTo("would a");
    }

    @Test
    void hyphenatedBriefsSkipOf() {
        assertThat(theory.island("W-RF")).isNull();
        assertThat(theory.island("W-R")).isNull();
        assertThat(theory.island("^W-R")).isEqualTo("would");
    }

    @Test
    void fixedIslandsAndFragments() {
        assertThat(theory.island("*S")).isEqualTo("{^}'s");
        assertThat(theory.island("KPW-S")).isEqualTo("becomes");
        assertThat(theory.island("-PG")).isEqualTo("I");
        assertThat(theory.isFragment("KWR")).isTrue();
        assertThat(theory.isFragment("W")).isTrue();
        assertThat(theory.isFragment("W-T")).isFalse();
    }
}
