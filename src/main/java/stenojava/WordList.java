package stenojava;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Immutable, ascending, deduplicated list of lowercase words.
 *
 * <p>The list supports lower-bound searches restricted to an index range, which is
 * all the {@link Cursor} engine needs to narrow a range of candidate words letter by
 * letter. Words are compared with {@link String#compareTo(String)}.</p>
 *
 * <p>Only entries consisting entirely of the letters {@code a-z} are kept when loading
 * from text; anything else (proper nouns, possessives, hyphenated forms) is skipped.</p>
 */
public final class WordList {
    private static final Logger LOGGER = Logger.getLogger(WordList.class.getName());

    /**
     * Accepted word shape.
     */
    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private final String[] words;

    private WordList(String[] words) {
        this.words = words;
    }

    /**
     * Builds a word list from arbitrary words. The input is sorted and deduplicated;
     * words that are not all lowercase ASCII letters are rejected.
     *
     * @param words the words
     * @return the word list
     * @throws IllegalArgumentException if a word contains anything other than {@code a-z}
     */
    public static WordList of(Collection<String> words) {
        TreeSet<String> sorted = new TreeSet<>();
        for (String w : words) {
            if (w == null || !WORD.matcher(w).matches()) {
                throw new IllegalArgumentException("Not a lowercase word: " + w);
            }
            sorted.add(w);
        }
        return new WordList(sorted.toArray(new String[0]));
    }

    /**
     * Varargs convenience for {@link #of(Collection)}.
     *
     * @param words the words
     * @return the word list
     */
    public static WordList of(String... words) {
        return of(Arrays.asList(words));
    }

    /**
     * Reads one word per line. Lines are trimmed; lines that are not entirely
     * {@code a-z} are skipped. A leading BOM is stripped.
     *
     * @param br a reader supplying the word list
     * @return the word list
     * @throws IOException if reading fails
     */
    public static WordList fromReader(BufferedReader br) throws IOException {
        TreeSet<String> sorted = new TreeSet<>();
        int lineNo = 0;
        int skipped = 0;
        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = raw.trim();
            if (lineNo == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1); // strip BOM
            }
            if (WORD.matcher(line).matches()) {
                sorted.add(line);
            } else if (!line.isEmpty()) {
                skipped++;
            }
        }
        LOGGER.info("Loaded " + sorted.size() + " words from " + lineNo + " lines");
        if (skipped > 0) {
            LOGGER.fine("Skipped " + skipped + " entries that are not lowercase a-z words");
        }
        return new WordList(sorted.toArray(new String[0]));
    }

    /**
     * Loads a word list from a UTF-8 text file.
     *
     * @param file the word list file
     * @return the word list
     * @throws UncheckedIOException if the file cannot be read
     */
    public static WordList fromFile(Path file) {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromReader(br);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read word list: " + file.toAbsolutePath(), e);
        }
    }

    /**
     * Loads a word list from a classpath resource.
     *
     * @param resource absolute resource path, e.g. {@code /dicts/words.txt}
     * @return the word list
     * @throws UncheckedIOException if the resource is missing or cannot be read
     */
    public static WordList fromResource(String resource) {
        try (InputStream in = WordList.class.getResourceAsStream(resource)) {
            if (in == null) throw new FileNotFoundException("Missing resource: " + resource);
            try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return fromReader(br);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read word list resource: " + resource, e);
        }
    }

    /**
     * Returns the number of words.
     *
     * @return the size
     */
    public int size() {
        return words.length;
    }

    /**
     * Returns the word at the given index.
     *
     * @param index the index
     * @return the word
     */
    public String get(int index) {
        return words[index];
    }

    /**
     * Returns whether the list contains the given word.
     *
     * @param word the word
     * @return {@code true} if present
     */
    public boolean contains(String word) {
        return Arrays.binarySearch(words, word) >= 0;
    }

    /**
     * Returns the first index in {@code [lo, hi)} whose word is not less than
     * {@code needle}, or {@code hi} if there is none.
     *
     * @param needle the search key
     * @param lo     inclusive lower index
     * @param hi     exclusive upper index
     * @return the lower bound
     */
    public int lowerBound(String needle, int lo, int hi) {
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (words[mid].compareTo(needle) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Returns the words in {@code [from, to)} as an unmodifiable list view.
     *
     * @param from inclusive start index
     * @param to   exclusive end index
     * @return the words in range
     */
    public List<String> subList(int from, int to) {
        return Collections.unmodifiableList(Arrays.asList(words).subList(from, to));
    }

    @Override
    public String toString() {
        return "<WordList with " + words.length + " words>";
    }
}
