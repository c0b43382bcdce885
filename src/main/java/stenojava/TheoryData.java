package stenojava;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Raw, uncompiled theory tables as stored in JSON.
 *
 * <p>The tables are plain data; {@link RightETheory} compiles them into chord tables,
 * vowel patterns and islands. The JSON layout mirrors the public fields:</p>
 *
 * <pre>{@code
 * {
 *   "leftColumns":  ["+=e|i|a|o|u", "S=s|ex", ...],
 *   "rightColumns": ["P=p B=b PB=n", ...],
 *   "threeVowels":  {"A": ["ee", "ui"], ...},
 *   "briefs":       {"": "", "T": "to", ...},
 *   "phraseGroups": [{"options": {"F": "of"}, "skipForRightBriefs": true}, ...],
 *   "islands":      {"*PB": "{^}n't", ...},
 *   "fragments":    {"KWR": "you", ...}
 * }
 * }</pre>
 *
 * <p>Maps keep their JSON order; the order of columns and of entries inside a column is
 * significant.</p>
 */
public class TheoryData {

    /**
     * Default location of the bundled theory, both on the file system (relative to the
     * working directory) and on the classpath.
     */
    public static final String DEFAULT_PATH = "theory/right_e.json";

    /**
     * Left-hand columns, one line of {@code chord=pattern} entries per column.
     */
    public List<String> leftColumns = new ArrayList<>();

    /**
     * Right-hand columns, one line of {@code chord=pattern} entries per column.
     */
    public List<String> rightColumns = new ArrayList<>();

    /**
     * Vowel clusters written by a three-vowel chord, keyed by the vowel key left out.
     */
    public Map<String, List<String>> threeVowels = new LinkedHashMap<>();

    /**
     * Phrase briefs: left-hand (or hyphenated) stroke prefix to its word.
     */
    public Map<String, String> briefs = new LinkedHashMap<>();

    /**
     * Optional phrase endings appended to briefs, one group after the other.
     */
    public List<PhraseGroup> phraseGroups = new ArrayList<>();

    /**
     * Fixed single-stroke outputs.
     */
    public Map<String, String> islands = new LinkedHashMap<>();

    /**
     * Strokes consumed silently inside an outline.
     */
    public Map<String, String> fragments = new LinkedHashMap<>();

    /**
     * Mutually exclusive phrase endings; at most one option of a group is used.
     */
    public static class PhraseGroup {
        /**
         * Right-hand keys to the word they add.
         */
        public Map<String, String> options = new LinkedHashMap<>();

        /**
         * Whether the group is left out for briefs that already contain right-hand keys.
         */
        public boolean skipForRightBriefs;

        public PhraseGroup() {
            // for deserialization
        }

        public PhraseGroup(Map<String, String> options, boolean skipForRightBriefs) {
            this.options = new LinkedHashMap<>(options);
            this.skipForRightBriefs = skipForRightBriefs;
        }
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    /**
     * Reads theory data from a JSON file.
     *
     * @param jsonFile the JSON file
     * @return the parsed data
     * @throws IOException if reading or parsing fails
     */
    public static TheoryData fromJson(Path jsonFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(jsonFile, StandardCharsets.UTF_8)) {
            return mapper().readValue(reader, TheoryData.class);
        }
    }

    /**
     * Reads theory data from a JSON stream.
     *
     * @param in the stream
     * @return the parsed data
     * @throws IOException if reading or parsing fails
     */
    public static TheoryData fromJson(InputStream in) throws IOException {
        return mapper().readValue(in, TheoryData.class);
    }

    /**
     * Loads the default theory.
     *
     * <p>Resolution order:</p>
     * <ol>
     *   <li>{@code theory/right_e.json} in the current working directory;</li>
     *   <li>{@code /theory/right_e.json} on the classpath.</li>
     * </ol>
     *
     * @return the parsed data
     * @throws IOException if neither source exists or parsing fails
     */
    public static TheoryData loadDefault() throws IOException {
        Path fsPath = Paths.get(DEFAULT_PATH);
        if (Files.exists(fsPath)) {
            return fromJson(fsPath);
        }
        try (InputStream in = TheoryData.class.getResourceAsStream("/" + DEFAULT_PATH)) {
            if (in == null) {
                throw new FileNotFoundException("Missing resource: /" + DEFAULT_PATH
                        + " (also checked FS: " + fsPath.toAbsolutePath() + ")");
            }
            return fromJson(in);
        }
    }

    /**
     * Writes this data as pretty-printed JSON.
     *
     * @param out the destination
     * @throws IOException if writing fails
     */
    public void writeJson(Writer out) throws IOException {
        mapper().writerWithDefaultPrettyPrinter().writeValue(out, this);
    }

    @Override
    public String toString() {
        return "<TheoryData with " + leftColumns.size() + " left columns, "
                + rightColumns.size() + " right columns, "
                + islands.size() + " islands>";
    }
}
