package stenojava;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static stenojava.Pat.alt;
import static stenojava.Pat.lit;
import static stenojava.Pat.seq;

class PatTest {

    @Test
    void emptyAlternationNeverMatches() {
        assertThat(alt().kind()).isEqualTo(Pat.Kind.ALTERNATION);
        assertThat(alt().children()).isEmpty();
        assertThat(alt()).hasToString("alt()");
    }

    @Test
    void singletonsCollapse() {
        assertThat(alt(lit('a'))).isEqualTo(lit('a'));
        assertThat(seq(lit('a'))).isEqualTo(lit('a'));
    }

    @Test
    void nestedNodesOfTheSameKindAreSpliced() {
        assertThat(alt(alt(lit('b'), lit('c')), lit('d')))
                .isEqualTo(alt(lit('b'), lit('c'), lit('d')))
                .hasToString("alt('b', 'c', 'd')");
        assertThat(seq(seq(lit('b'), lit('c')), lit('d')))
                .hasToString("seq('b', 'c', 'd')");
    }

    @Test
    void emptySequenceIsKeptInsideAlternation() {
        Pat optionalU = alt(seq(), lit('u'));

        assertThat(optionalU.children()).containsExactly(seq(), lit('u'));
        assertThat(optionalU).hasToString("alt(seq(), 'u')");
    }

    @Test
    void lettersBuildsLiteralSequence() {
        assertThat(Pat.letters("ing")).isEqualTo(seq(lit('i'), lit('n'), lit('g')));
        assertThat(Pat.letters("")).isEqualTo(seq());
    }

    @Test
    void letterIsOnlyDefinedForLiterals() {
        assertThat(lit('x').letter()).isEqualTo('x');
        assertThatThrownBy(() -> seq(lit('a'), lit('b')).letter())
                .isInstanceOf(IllegalStateException.class);
    }
}
