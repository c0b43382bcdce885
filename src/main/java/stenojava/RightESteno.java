package stenojava;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RightESteno translates stenotype outlines into words by phonetic matching against a
 * word list, following the Right-E steno theory.
 *
 * <p>Unlike a dictionary-based steno system, no outline-to-word table is stored: each
 * stroke is turned into a phonetic pattern and the word list is searched for the cheapest
 * word consistent with the whole outline. Only a handful of phrases, punctuation and
 * formatting strokes ("islands") are fixed.</p>
 *
 * <pre>{@code
 * RightESteno steno = new RightESteno(WordList.fromFile(Paths.get("/usr/share/dict/words")));
 * steno.lookup("HEL/O");      // "hello"
 * steno.lookup("TKUFRPBT");   // "different"
 * }</pre>
 *
 * <p>Lookups are stateless and thread-safe. The compiled theory is shared by all
 * instances created with the default theory.</p>
 */
public class RightESteno {
    /**
     * Logger shared by the whole {@code stenojava} package.
     * Logging is disabled by default to avoid console output in host applications.
     */
    private static final Logger LOGGER = Logger.getLogger("stenojava");

    static {
        // Disable logging by default
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables verbose logging for the engine.
     *
     * <p>When enabled, theory compilation and word list loading are logged at
     * {@code INFO}; when disabled (default), nothing is logged.</p>
     *
     * @param enabled {@code true} to enable logging, {@code false} to disable it
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    /**
     * Maximum number of strokes in an outline.
     */
    public static final int LONGEST_KEY = RightEDecoder.LONGEST_KEY;

    /**
     * Stroke separator in outline strings.
     */
    public static final String STROKE_SEPARATOR = "/";

    /**
     * Provides the lazily compiled default {@link RightETheory}.
     *
     * <p>The theory is loaded and compiled on the first call to {@link #get()}, exactly
     * once per JVM, following the initialization-on-demand holder idiom. The data is read
     * from {@code theory/right_e.json} in the working directory if present, otherwise from
     * the bundled classpath resource.</p>
     */
    public static final class TheoryHolder {
        private TheoryHolder() {
        }

        private static class Holder {
            private static final RightETheory DEFAULT = load();
        }

        /**
         * Returns the shared default theory.
         *
         * @return the compiled theory
         * @throws IllegalStateException if the theory cannot be loaded
         */
        public static RightETheory get() {
            return Holder.DEFAULT;
        }

        private static RightETheory load() {
            try {
                return RightETheory.compile(TheoryData.loadDefault());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load theory data", e);
            }
        }
    }

    private final RightEDecoder decoder;

    /**
     * Constructs an instance using the default theory.
     *
     * @param words the word list to match against
     */
    public RightESteno(WordList words) {
        this(TheoryHolder.get(), words);
    }

    /**
     * Constructs an instance using the default theory and a word list file.
     *
     * @param wordsFile a text file with one word per line
     * @throws java.io.UncheckedIOException if the file cannot be read
     */
    public RightESteno(Path wordsFile) {
        this(WordList.fromFile(wordsFile));
    }

    /**
     * Constructs an instance with an explicit theory.
     *
     * @param theory the compiled theory
     * @param words  the word list to match against
     */
    public RightESteno(RightETheory theory, WordList words) {
        this.decoder = new RightEDecoder(Objects.requireNonNull(theory, "theory"),
                Objects.requireNonNull(words, "words"));
    }

    /**
     * Splits an outline string such as {@code "PHRO/SRER"} into strokes.
     *
     * @param outline the outline
     * @return the strokes
     */
    public static List<String> splitOutline(String outline) {
        return Arrays.asList(outline.trim().split(STROKE_SEPARATOR, -1));
    }

    /**
     * Looks up an outline given as {@code /}-separated strokes.
     *
     * @param outline the outline, e.g. {@code "HEL/O"}
     * @return the translation
     * @throws InvalidStrokeException if the outline is malformed
     * @throws NoMatchException       if no word matches
     */
    public String lookup(String outline) {
        return lookup(splitOutline(outline));
    }

    /**
     * Looks up an outline.
     *
     * @param strokes the strokes, e.g. {@code ["HEL", "O"]}
     * @return the translation
     * @throws InvalidStrokeException if the outline is malformed
     * @throws NoMatchException       if no word matches
     */
    public String lookup(List<String> strokes) {
        return decoder.lookup(strokes);
    }

    public RightETheory getTheory() {
        return decoder.getTheory();
    }

    public WordList getWords() {
        return decoder.getWords();
    }
}
