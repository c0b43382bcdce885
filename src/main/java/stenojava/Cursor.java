package stenojava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Matching state over a {@link WordList}.
 *
 * <p>A cursor stands for every word in the index range {@code [start, stop)}; all of
 * them begin with {@link #lettersRead()}. Advancing a cursor through a {@link Pat}
 * narrows the range with two lower-bound searches per letter instead of rescanning
 * the word list, so each step costs {@code O(log n)}.</p>
 *
 * <p>The {@link #score()} accumulates the cost of optional phonetic liberties taken
 * while matching (inserted vowels, a trailing {@code e}, a glide). Lower is better.</p>
 *
 * <p>Cursors are immutable. The word list is shared by reference and never copied.</p>
 */
public final class Cursor {
    static final String VOWELS = "aeiou";
    static final String SEMIVOWELS = "aeiouw";

    static final int VOWEL_INSERTION_COST = 10;
    static final int TRAILING_E_COST = 100;
    static final int SEMIVOWEL_COST = 1;

    private final WordList wordList;
    private final int start;
    private final int stop;
    private final String lettersRead;
    private final int score;

    private Cursor(WordList wordList, int start, int stop, String lettersRead, int score) {
        this.wordList = wordList;
        this.start = start;
        this.stop = stop;
        this.lettersRead = lettersRead;
        this.score = score;
    }

    /**
     * Returns a cursor covering the whole word list with nothing read yet.
     *
     * @param wordList the word list
     * @return the root cursor
     */
    public static Cursor root(WordList wordList) {
        Objects.requireNonNull(wordList, "wordList");
        return new Cursor(wordList, 0, wordList.size(), "", 0);
    }

    public int start() {
        return start;
    }

    public int stop() {
        return stop;
    }

    public String lettersRead() {
        return lettersRead;
    }

    public int score() {
        return score;
    }

    /**
     * Returns whether {@link #lettersRead()} is itself a word of the list.
     *
     * @return {@code true} if the cursor sits on a complete word
     */
    public boolean onWord() {
        return start < stop && wordList.get(start).equals(lettersRead);
    }

    /**
     * Advances by any one of the given letters, each letter producing at most one cursor.
     *
     * @param letters  the candidate letters, tried in order
     * @param addScore cost added to every resulting cursor
     * @return the resulting cursors, in the order of {@code letters}
     */
    public List<Cursor> advanceAnyLetter(String letters, int addScore) {
        List<Cursor> ret = new ArrayList<>(letters.length());
        for (int i = 0; i < letters.length(); i++) {
            char letter = letters.charAt(i);
            String startNeedle = lettersRead + letter;
            String stopNeedle = lettersRead + (char) (letter + 1);
            int newStart = wordList.lowerBound(startNeedle, start, stop);
            int newStop = wordList.lowerBound(stopNeedle, newStart, stop);
            if (newStart != newStop) {
                ret.add(new Cursor(wordList, newStart, newStop, startNeedle, score + addScore));
            }
        }
        return ret;
    }

    /**
     * Advances through a pattern.
     *
     * <p>Returned cursors may overlap; cursors reaching the same letters with different
     * scores are all kept so that the cheapest can be chosen at the end.</p>
     *
     * @param pat the pattern
     * @return the resulting cursors, possibly empty
     */
    public List<Cursor> advance(Pat pat) {
        switch (pat.kind()) {
            case LITERAL:
                return advanceLiteral(pat.letter());
            case ALTERNATION: {
                List<Cursor> ret = new ArrayList<>();
                for (Pat choice : pat.children()) {
                    ret.addAll(advance(choice));
                }
                return ret;
            }
            case SEQUENCE: {
                List<Cursor> current = Collections.singletonList(this);
                for (Pat element : pat.children()) {
                    current = advanceAll(current, element);
                    if (current.isEmpty()) break;
                }
                return current;
            }
            default:
                throw new IllegalStateException("Unexpected pattern kind: " + pat.kind());
        }
    }

    private List<Cursor> advanceLiteral(char c) {
        List<Cursor> ret = new ArrayList<>();
        switch (c) {
            case Pat.OPTIONAL_VOWELS: {
                ret.add(this);
                List<Cursor> oneVowel = advanceAnyLetter(VOWELS, VOWEL_INSERTION_COST);
                ret.addAll(oneVowel);
                for (Cursor ov : oneVowel) {
                    ret.addAll(ov.advanceAnyLetter(VOWELS, VOWEL_INSERTION_COST));
                }
                return ret;
            }
            case Pat.OPTIONAL_E:
                ret.add(this);
                ret.addAll(advanceAnyLetter("e", TRAILING_E_COST));
                return ret;
            case Pat.OPTIONAL_SEMIVOWEL:
                ret.add(this);
                ret.addAll(advanceAnyLetter(SEMIVOWELS, SEMIVOWEL_COST));
                return ret;
            default:
                break;
        }
        String letter = String.valueOf(c);
        List<Cursor> once = advanceAnyLetter(letter, 0);
        if (once.isEmpty() || VOWELS.indexOf(c) >= 0) {
            return once;
        }
        // consonants may be doubled for free
        ret.addAll(once);
        ret.addAll(once.get(0).advanceAnyLetter(letter, 0));
        return ret;
    }

    /**
     * Advances every cursor through the pattern and concatenates the results.
     *
     * @param cursors the cursors
     * @param pat     the pattern
     * @return the resulting cursors
     */
    public static List<Cursor> advanceAll(List<Cursor> cursors, Pat pat) {
        List<Cursor> ret = new ArrayList<>();
        for (Cursor c : cursors) {
            ret.addAll(c.advance(pat));
        }
        return ret;
    }

    /**
     * Returns the lowest-score cursor that sits on a complete word.
     * Ties go to the cursor with the lowest start index, i.e. the alphabetically
     * first word.
     *
     * @param cursors the cursors
     * @return the best cursor, or empty if no cursor sits on a word
     */
    public static Optional<Cursor> best(List<Cursor> cursors) {
        Cursor best = null;
        for (Cursor c : cursors) {
            if (!c.onWord()) continue;
            if (best == null
                    || c.score < best.score
                    || (c.score == best.score && c.start < best.start)) {
                best = c;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns the lowest-score complete word reached by the cursors.
     *
     * @param cursors the cursors
     * @return the best word, or empty if no cursor sits on a word
     * @see #best(List)
     */
    public static Optional<String> bestWord(List<Cursor> cursors) {
        return best(cursors).map(Cursor::lettersRead);
    }

    @Override
    public String toString() {
        return "Cursor(range=[" + start + ", " + stop + "), lettersRead='" + lettersRead
                + "', score=" + score + ")";
    }
}
