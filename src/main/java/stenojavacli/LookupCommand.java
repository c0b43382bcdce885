package stenojavacli;

import picocli.CommandLine.*;
import stenojava.RightESteno;
import stenojava.StenoException;
import stenojava.WordList;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand for translating outlines into words.
 *
 * <p>Outlines are taken from the command line, or read from stdin one per line when none
 * are given. Each result is printed as {@code OUTLINE -> word}; failures are printed as
 * {@code OUTLINE !! reason} and make the command exit with status 1.</p>
 */
@Command(name = "lookup", description = "\033[1;34mTranslate steno outlines into words\033[0m", mixinStandardHelpOptions = true)
public class LookupCommand implements Callable<Integer> {

    @Option(names = {"-w", "--words"}, paramLabel = "<file>", defaultValue = "/usr/share/dict/words",
            description = "Word list, one word per line (default: ${DEFAULT-VALUE})")
    private File words;

    @Option(names = {"-v", "--verbose"}, description = "Log theory compilation and word list loading")
    private boolean verbose;

    @Parameters(paramLabel = "<outline>", arity = "0..*", description = "Outlines such as HEL/O or TKUFRPBT")
    private List<String> outlines = new ArrayList<>();

    private static final Logger LOGGER = Logger.getLogger(LookupCommand.class.getName());

    @Override
    public Integer call() {
        RightESteno.setVerboseLogging(verbose);
        try {
            RightESteno steno = new RightESteno(WordList.fromFile(words.toPath()));
            List<String> todo = outlines.isEmpty() ? readStdin() : outlines;
            return lookupAll(steno, todo, System.out);
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during lookup", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Looks up every outline and prints one line per outline.
     *
     * @param steno    the engine
     * @param outlines the outlines
     * @param out      where results are printed
     * @return 0 if every outline translated, 1 otherwise
     */
    static int lookupAll(RightESteno steno, List<String> outlines, PrintStream out) {
        int failures = 0;
        for (String outline : outlines) {
            if (outline.trim().isEmpty()) continue;
            try {
                out.println(outline + " -> " + steno.lookup(outline));
            } catch (StenoException e) {
                failures++;
                out.println(outline + " !! " + e.getMessage());
            }
        }
        return failures == 0 ? 0 : 1;
    }

    private List<String> readStdin() throws IOException {
        if (System.console() != null) {
            System.err.println("Input outlines, one per line, <Ctrl+D> (Unix) <Ctrl-Z> (Windows) to submit:");
        }
        List<String> lines = new ArrayList<>();
        BufferedReader br = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        for (String line; (line = br.readLine()) != null; ) {
            lines.add(line.trim());
        }
        return lines;
    }
}
