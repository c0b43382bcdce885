package stenojava;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static stenojava.Pat.alt;
import static stenojava.Pat.lit;
import static stenojava.Pat.seq;

class PatCompilerTest {

    @Test
    void shouldCompileGroupsAndAlternatives() {
        assertThat(PatCompiler.compile("a(b|c)")).isEqualTo(seq(lit('a'), alt(lit('b'), lit('c'))));
    }

    @Test
    void shouldCompileEmptyAlternative() {
        assertThat(PatCompiler.compile("q(|u)")).isEqualTo(seq(lit('q'), alt(seq(), lit('u'))));
        assertThat(PatCompiler.compile("a|")).isEqualTo(alt(lit('a'), seq()));
    }

    @Test
    void shouldKeepSpecialSymbolsAsLiterals() {
        assertThat(PatCompiler.compile("p!l")).isEqualTo(seq(lit('p'), lit('!'), lit('l')));
    }

    @Test
    void emptyStringIsEmptySequence() {
        assertThat(PatCompiler.compile("")).isEqualTo(seq());
    }

    @Test
    void unclosedGroupEndsAtEndOfInput() {
        assertThat(PatCompiler.compile("(a|b")).isEqualTo(alt(lit('a'), lit('b')));
    }

    @Test
    void shouldRejectStrayClosingParenthesis() {
        assertThatThrownBy(() -> PatCompiler.compile("d)e"))
                .isInstanceOf(PatSyntaxException.class)
                .hasMessageContaining("unbalanced parentheses")
                .satisfies(e -> {
                    PatSyntaxException pse = (PatSyntaxException) e;
                    assertThat(pse.getPattern()).isEqualTo("d)e");
                    assertThat(pse.getIndex()).isEqualTo(1);
                });
        assertThatThrownBy(() -> PatCompiler.compile("(a))"))
                .isInstanceOf(PatSyntaxException.class);
    }
}
