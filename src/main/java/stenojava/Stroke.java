package stenojava;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A stroke split into its left-hand, vowel and right-hand chords.
 *
 * <p>Accepted shapes are left keys alone ({@code TK}), or optional left keys, vowel keys
 * and/or a hyphen, and optional right keys ({@code TKUFRPBT}, {@code -G}, {@code O}).
 * The hyphen only separates the hands and is dropped from {@link #middle()}.</p>
 */
public final class Stroke {
    private static final Pattern LEFT_ONLY = Pattern.compile("[+STKPWHR]+");
    private static final Pattern FULL = Pattern.compile("([+STKPWHR]*)([AOEU-]+)([FRPBLGTSDZ]*)");
    private static final Pattern CANONICAL_MIDDLE = Pattern.compile("A?O?E?U?");

    private final String text;
    private final String left;
    private final String middle;
    private final String right;

    private Stroke(String text, String left, String middle, String right) {
        this.text = text;
        this.left = left;
        this.middle = middle;
        this.right = right;
    }

    /**
     * Splits a stroke into its parts.
     *
     * @param stroke the stroke, e.g. {@code "HEL"}
     * @return the parsed stroke
     * @throws UnrecognizedChordException if the stroke has no recognised shape
     */
    public static Stroke parse(String stroke) {
        if (stroke == null || stroke.isEmpty()) {
            throw new UnrecognizedChordException("Empty stroke", String.valueOf(stroke));
        }
        if (LEFT_ONLY.matcher(stroke).matches()) {
            return new Stroke(stroke, stroke, "", "");
        }
        Matcher m = FULL.matcher(stroke);
        if (!m.matches()) {
            throw new UnrecognizedChordException("Unrecognized stroke shape", stroke);
        }
        String middle = m.group(2).replace("-", "");
        if (!CANONICAL_MIDDLE.matcher(middle).matches()) {
            throw new UnrecognizedChordException("Vowel keys out of order", stroke);
        }
        return new Stroke(stroke, m.group(1), middle, m.group(3));
    }

    public String text() {
        return text;
    }

    public String left() {
        return left;
    }

    public String middle() {
        return middle;
    }

    public String right() {
        return right;
    }

    /**
     * Returns whether the stroke starts with a vowel and has right-hand keys, a shape only
     * allowed at the start of an outline.
     *
     * @return {@code true} for vowel-initial strokes with right-hand keys
     */
    boolean isVowelInitialWithRight() {
        return left.isEmpty() && !middle.isEmpty() && !right.isEmpty();
    }

    /**
     * Returns whether the continuation key {@code +} is combined with other left-hand keys,
     * a shape only allowed at the start of an outline.
     *
     * @return {@code true} if {@code +} appears together with other left keys
     */
    boolean hasCombinedContinuation() {
        return left.indexOf('+') >= 0 && !left.equals("+");
    }

    @Override
    public String toString() {
        return text + " [" + left + "|" + middle + "|" + right + "]";
    }
}
