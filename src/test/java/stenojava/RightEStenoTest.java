package stenojava;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RightEStenoTest {

    private static RightESteno steno;

    @BeforeAll
    static void setUp() {
        steno = new RightESteno(WordList.fromResource("/dicts/test-words.txt"));
    }

    @Test
    void shouldTranslateOutlines() {
        assertThat(steno.lookup("HEL/O")).isEqualTo("hello");
        assertThat(steno.lookup("PHRO/SRER")).isEqualTo("plover");
        assertThat(steno.lookup("TKUFRPBT")).isEqualTo("different");
        assertThat(steno.lookup("TKO/-G")).isEqualTo("doing");
        assertThat(steno.lookup("KAT")).isEqualTo("cat");
    }

    @Test
    void shouldTranslateIslands() {
        assertThat(steno.lookup("^W")).isEqualTo("with");
        assertThat(steno.lookup("W-T")).isEqualTo("with the");
        assertThat(steno.lookup("-PB")).isEqualTo("and");
        assertThat(steno.lookup("TP-PL")).isEqualTo("{.}");
    }

    @Test
    void splitOutlineKeepsEmptyStrokes() {
        assertThat(RightESteno.splitOutline(" HEL/O ")).containsExactly("HEL", "O");
        assertThat(RightESteno.splitOutline("HEL//O")).containsExactly("HEL", "", "O");
    }

    @Test
    void emptyStrokeIsUnrecognized() {
        assertThatThrownBy(() -> steno.lookup("HEL//O"))
                .isInstanceOf(UnrecognizedChordException.class);
    }

    @Test
    void failuresShareOneBaseType() {
        assertThatThrownBy(() -> steno.lookup("TPHOP"))
                .isInstanceOf(NoMatchException.class)
                .isInstanceOf(StenoException.class);
        assertThatThrownBy(() -> steno.lookup("HEX")).isInstanceOf(StenoException.class);
    }

    @Test
    void defaultTheoryIsShared() {
        RightESteno other = new RightESteno(WordList.of("cat"));

        assertThat(other.getTheory()).isSameAs(steno.getTheory());
        assertThat(other.getWords().size()).isEqualTo(1);
    }

    @Test
    void verboseLoggingCanBeToggled() {
        RightESteno.setVerboseLogging(true);
        try {
            assertThat(Logger.getLogger("stenojava").isLoggable(Level.INFO)).isTrue();
        } finally {
            RightESteno.setVerboseLogging(false);
        }
        assertThat(Logger.getLogger("stenojava").isLoggable(Level.SEVERE)).isFalse();
    }
}
