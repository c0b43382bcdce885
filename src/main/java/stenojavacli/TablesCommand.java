package stenojavacli;

import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.*;
import stenojava.ChordTable;
import stenojava.Pat;
import stenojava.RightESteno;
import stenojava.RightETheory;
import stenojava.VowelClusters;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand for exporting the compiled theory tables as JSON.
 */
@Command(name = "tables", description = "\033[1;34mExport compiled Right-E chord tables as JSON\033[0m", mixinStandardHelpOptions = true)
public class TablesCommand implements Callable<Integer> {

    enum Side {left, right, vowels, islands}

    @Option(names = {"-s", "--side"}, paramLabel = "<table>", defaultValue = "left",
            description = "Table to export: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Side side;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    private File output;

    private static final Logger LOGGER = Logger.getLogger(TablesCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        try {
            Map<String, String> table = export(RightESteno.TheoryHolder.get(), side);
            ObjectMapper mapper = new ObjectMapper();
            if (output != null) {
                try (Writer writer = new OutputStreamWriter(Files.newOutputStream(output.toPath()), StandardCharsets.UTF_8)) {
                    mapper.writerWithDefaultPrettyPrinter().writeValue(writer, table);
                }
                System.err.println(BLUE + table.size() + " " + side + " entries saved at: " + output.getAbsolutePath() + RESET);
            } else {
                System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(table));
            }
            return 0;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Exception during table export", e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Renders one table of the theory as chord to pattern text.
     *
     * @param theory the compiled theory
     * @param side   which table
     * @return an ordered map suitable for JSON output
     */
    static Map<String, String> export(RightETheory theory, Side side) {
        Map<String, String> out = new LinkedHashMap<>();
        switch (side) {
            case left:
                putAll(out, theory.left());
                break;
            case right:
                putAll(out, theory.right());
                break;
            case vowels: {
                VowelClusters vowels = theory.vowels();
                for (int mask = 0; mask < 16; mask++) {
                    StringBuilder middle = new StringBuilder();
                    for (int i = 0; i < VowelClusters.KEYS.length(); i++) {
                        if ((mask & (1 << i)) != 0) middle.append(VowelClusters.KEYS.charAt(i));
                    }
                    String m = middle.toString();
                    out.put(m, vowels.patternFor(m).toString());
                }
                break;
            }
            case islands:
                out.putAll(theory.islands());
                break;
            default:
                throw new IllegalArgumentException("Unhandled table: " + side);
        }
        return out;
    }

    private static void putAll(Map<String, String> out, ChordTable table) {
        for (Map.Entry<String, Pat> e : table.asMap().entrySet()) {
            out.put(e.getKey(), e.getValue().toString());
        }
    }
}
