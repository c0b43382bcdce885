package stenojavacli;

import org.junit.jupiter.api.Test;
import stenojava.RightESteno;
import stenojava.WordList;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class LookupCommandTest {

    private final RightESteno steno = new RightESteno(WordList.of("hello", "plover"));

    @Test
    void shouldPrintOneLinePerOutline() throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, "UTF-8");

        int code = LookupCommand.lookupAll(steno, Arrays.asList("HEL/O", "", "PHRO/SRER"), out);

        assertThat(code).isZero();
        assertThat(buf.toString(StandardCharsets.UTF_8.name()).split("\\R"))
                .containsExactly("HEL/O -> hello", "PHRO/SRER -> plover");
    }

    @Test
    void failuresArePrintedAndSetExitCode() throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, "UTF-8");

        int code = LookupCommand.lookupAll(steno, Arrays.asList("HEX", "HEL/O"), out);

        assertThat(code).isEqualTo(1);
        assertThat(buf.toString(StandardCharsets.UTF_8.name()))
                .contains("HEX !! Unrecognized stroke shape: HEX")
                .contains("HEL/O -> hello");
    }
}
