package stenojava;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import static stenojava.Pat.lit;
import static stenojava.Pat.seq;

/**
 * Decodes outlines (sequences of strokes) into words using a {@link RightETheory} and a
 * {@link WordList}.
 *
 * <p>Each stroke narrows the set of {@link Cursor}s: first by the left-hand chord, then by
 * the vowels followed by the right-hand chord. Between strokes an optional vowel gap
 * ({@link Pat#OPTIONAL_VOWELS}) is allowed, except directly after a stroke that ended in a
 * vowel, whose following consonants attach to that vowel. After the last stroke a silent
 * trailing {@code e} is allowed and the cheapest complete word wins.</p>
 *
 * <p>A decoder holds no mutable state and can be shared between threads.</p>
 */
public final class RightEDecoder {
    private static final Logger LOGGER = Logger.getLogger(RightEDecoder.class.getName());

    /**
     * Maximum number of strokes in an outline.
     */
    public static final int LONGEST_KEY = 10;

    private static final Pat GAP = lit(Pat.OPTIONAL_VOWELS);
    private static final Pat TRAILING_E = lit(Pat.OPTIONAL_E);
    private static final Pat GLIDE = lit(Pat.OPTIONAL_SEMIVOWEL);
    private static final Pat ING = Pat.letters("ing");
    private static final Pat I_OR_Y = VowelClusters.vowelsToPat("i");

    private final RightETheory theory;
    private final WordList words;

    /**
     * @param theory the compiled theory
     * @param words  the dictionary
     */
    public RightEDecoder(RightETheory theory, WordList words) {
        this.theory = Objects.requireNonNull(theory, "theory");
        this.words = Objects.requireNonNull(words, "words");
    }

    /**
     * Decodes an outline.
     *
     * @param outline the strokes, in order
     * @return the word, phrase or island text
     * @throws UnrecognizedChordException     if a stroke has an unknown shape or chord
     * @throws IllegalChordPlacementException if a stroke is not allowed at its position
     * @throws NoMatchException               if no dictionary word matches
     */
    public String lookup(List<String> outline) {
        if (outline.isEmpty() || outline.size() > LONGEST_KEY) {
            throw new NoMatchException(outline);
        }

        List<Cursor> cursors = Collections.singletonList(Cursor.root(words));
        // true when the previous stroke ended in a vowel; also true at the start
        boolean inhibitVowelInsertion = true;

        for (int i = 0; i < outline.size(); i++) {
            String key = outline.get(i);

            if (theory.isFragment(key)) {
                // fragments always allow vowel insertion
                if (!inhibitVowelInsertion) {
                    cursors = Cursor.advanceAll(cursors, GAP);
                }
                inhibitVowelInsertion = false;
                continue;
            }

            String island = theory.island(key);
            if (island != null) {
                if (outline.size() == 1) return island;
                throw new IllegalChordPlacementException("Island stroke inside a longer outline", key, i);
            }

            Stroke stroke = Stroke.parse(key);
            if (i > 0 && stroke.isVowelInitialWithRight()) {
                throw new IllegalChordPlacementException("Vowel-initial stroke must start the word", key, i);
            }
            if (i > 0 && stroke.hasCombinedContinuation()) {
                throw new IllegalChordPlacementException("+ with other left keys must start the word", key, i);
            }
            Pat leftPat = theory.left().get(stroke.left());
            if (leftPat == null) {
                throw new UnrecognizedChordException("Unknown left-hand chord " + stroke.left(), key);
            }
            Pat rightPat = theory.right().get(stroke.right());
            if (rightPat == null) {
                throw new UnrecognizedChordException("Unknown right-hand chord " + stroke.right(), key);
            }
            String middle = stroke.middle();
            String right = stroke.right();

            if (!inhibitVowelInsertion && (!stroke.left().isEmpty() || middle.isEmpty())) {
                cursors = Cursor.advanceAll(cursors, GAP);
            }
            cursors = Cursor.advanceAll(cursors, leftPat);

            List<String> vcs = theory.vowels().clustersFor(middle);
            List<Cursor> next = new ArrayList<>(
                    Cursor.advanceAll(cursors, seq(theory.vowels().patternFor(middle), rightPat)));
            if (i == outline.size() - 1) {
                next.addAll(untuckRightVowel(cursors, vcs, rightPat));
            }
            if (middle.isEmpty() && right.equals("G")) {
                next.addAll(Cursor.advanceAll(cursors, ING));
            }
            cursors = next;
            inhibitVowelInsertion = !middle.isEmpty() && right.isEmpty();

            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Stroke " + stroke + ": " + cursors.size() + " cursors");
            }
        }

        cursors = Cursor.advanceAll(cursors, TRAILING_E);
        Optional<String> word = Cursor.bestWord(cursors);
        if (!word.isPresent()) {
            throw new NoMatchException(outline);
        }
        return word.get();
    }

    /**
     * Returns the cursors reached if the {@code i} of each cluster were pronounced after
     * the right-hand chord instead of before it, e.g. {@code a} + {@code T} + {@code y}
     * for the cluster {@code ai}.
     *
     * <p>For a two-letter cluster the remaining vowel may be followed by an optional
     * glide before the right-hand chord.</p>
     *
     * @param cursors  the cursors after the left-hand chord
     * @param vcs      the vowel clusters of the stroke
     * @param rightPat the right-hand chord pattern
     * @return the extra cursors
     */
    static List<Cursor> untuckRightVowel(List<Cursor> cursors, List<String> vcs, Pat rightPat) {
        List<Cursor> ret = new ArrayList<>();
        for (String vc : vcs) {
            int i = vc.indexOf('i');
            if (i < 0) continue;
            List<Cursor> toAdd = Cursor.advanceAll(cursors,
                    VowelClusters.vowelsToPat(vc.substring(0, i) + vc.substring(i + 1)));
            if (vc.length() > 1) {
                toAdd = Cursor.advanceAll(toAdd, GLIDE);
            }
            toAdd = Cursor.advanceAll(toAdd, rightPat);
            toAdd = Cursor.advanceAll(toAdd, I_OR_Y);
            ret.addAll(toAdd);
        }
        return ret;
    }

    public RightETheory getTheory() {
        return theory;
    }

    public WordList getWords() {
        return words;
    }
}
