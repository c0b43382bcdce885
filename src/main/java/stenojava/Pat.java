package stenojava;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable phonetic pattern tree.
 *
 * <p>A pattern is exactly one of three kinds, identified by {@link #kind()}:</p>
 * <ul>
 *   <li>{@link Kind#LITERAL}: a single letter, or one of the special symbols
 *       {@link #OPTIONAL_VOWELS}, {@link #OPTIONAL_E} and {@link #OPTIONAL_SEMIVOWEL};</li>
 *   <li>{@link Kind#SEQUENCE}: children matched strictly in order
 *       (the empty sequence matches the empty string);</li>
 *   <li>{@link Kind#ALTERNATION}: any one child (the empty alternation never matches).</li>
 * </ul>
 *
 * <p>The set of kinds is closed: the constructor is private and the only subclasses are
 * the nested {@link Literal}, {@link Sequence} and {@link Alternation}. Callers dispatch
 * with a {@code switch} over {@link #kind()}.</p>
 *
 * <p>The factories {@link #seq(Pat...)} and {@link #alt(Pat...)} keep trees canonical:
 * nested nodes of the same kind are spliced into their parent and a node with a single
 * child collapses to that child. Two trees built from the same parts are therefore
 * {@link #equals(Object) equal} and print identically.</p>
 */
public abstract class Pat {

    /**
     * Special symbol matching zero, one or two vowels (10 points per vowel).
     */
    public static final char OPTIONAL_VOWELS = '!';

    /**
     * Special symbol optionally matching an {@code e} (100 points if it does).
     */
    public static final char OPTIONAL_E = 'E';

    /**
     * Special symbol optionally matching one of {@code aeiouw} (1 point if it does).
     */
    public static final char OPTIONAL_SEMIVOWEL = 'W';

    /**
     * Pattern kinds.
     */
    public enum Kind {
        LITERAL, SEQUENCE, ALTERNATION
    }

    private static final Pat EMPTY_SEQUENCE = new Sequence(Collections.emptyList());
    private static final Pat NEVER = new Alternation(Collections.emptyList());

    private Pat() {
    }

    /**
     * Returns the kind of this node.
     *
     * @return the node kind
     */
    public abstract Kind kind();

    /**
     * Returns the literal character of a {@link Kind#LITERAL} node.
     *
     * @return the literal character
     * @throws IllegalStateException if this node is not a literal
     */
    public char letter() {
        throw new IllegalStateException("Not a literal: " + this);
    }

    /**
     * Returns the children of a sequence or alternation.
     *
     * @return an unmodifiable list of children; empty for literals
     */
    public List<Pat> children() {
        return Collections.emptyList();
    }

    // ---- factories ----------------------------------------------------------

    /**
     * Returns a literal pattern.
     *
     * @param c the letter or special symbol
     * @return the literal
     */
    public static Pat lit(char c) {
        return new Literal(c);
    }

    /**
     * Returns a pattern matching every element in order.
     *
     * @param elements the elements
     * @return the canonical sequence
     */
    public static Pat seq(Pat... elements) {
        return seq(Arrays.asList(elements));
    }

    /**
     * Returns a pattern matching every element in order.
     * Nested sequences are spliced in and a single element is returned as-is.
     *
     * @param elements the elements
     * @return the canonical sequence
     */
    public static Pat seq(List<Pat> elements) {
        List<Pat> flat = new ArrayList<>();
        for (Pat p : elements) {
            if (p.kind() == Kind.SEQUENCE) {
                flat.addAll(p.children());
            } else {
                flat.add(p);
            }
        }
        if (flat.size() == 1) return flat.get(0);
        if (flat.isEmpty()) return EMPTY_SEQUENCE;
        return new Sequence(flat);
    }

    /**
     * Returns a pattern matching any one of the choices.
     *
     * @param choices the choices
     * @return the canonical alternation
     */
    public static Pat alt(Pat... choices) {
        return alt(Arrays.asList(choices));
    }

    /**
     * Returns a pattern matching any one of the choices.
     * Nested alternations are spliced in and a single choice is returned as-is.
     *
     * @param choices the choices
     * @return the canonical alternation
     */
    public static Pat alt(List<Pat> choices) {
        List<Pat> flat = new ArrayList<>();
        for (Pat p : choices) {
            if (p.kind() == Kind.ALTERNATION) {
                flat.addAll(p.children());
            } else {
                flat.add(p);
            }
        }
        if (flat.size() == 1) return flat.get(0);
        if (flat.isEmpty()) return NEVER;
        return new Alternation(flat);
    }

    /**
     * Builds a sequence of literals, one per character.
     *
     * @param letters the characters
     * @return the sequence (or a single literal, or the empty sequence)
     */
    public static Pat letters(String letters) {
        List<Pat> out = new ArrayList<>(letters.length());
        for (int i = 0; i < letters.length(); i++) {
            out.add(lit(letters.charAt(i)));
        }
        return seq(out);
    }

    /**
     * Shorthand for {@link PatCompiler#compile(String)}.
     *
     * @param pattern the pattern string
     * @return the compiled pattern
     * @throws PatSyntaxException if the parentheses are unbalanced
     */
    public static Pat compile(String pattern) {
        return PatCompiler.compile(pattern);
    }

    // ---- object methods -----------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pat)) return false;
        Pat other = (Pat) o;
        if (kind() != other.kind()) return false;
        if (kind() == Kind.LITERAL) return letter() == other.letter();
        return children().equals(other.children());
    }

    @Override
    public int hashCode() {
        if (kind() == Kind.LITERAL) return Character.hashCode(letter());
        return Objects.hash(kind(), children());
    }

    // ---- variants -----------------------------------------------------------

    /**
     * A single letter or special symbol.
     */
    public static final class Literal extends Pat {
        private final char letter;

        private Literal(char letter) {
            this.letter = letter;
        }

        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }

        @Override
        public char letter() {
            return letter;
        }

        @Override
        public String toString() {
            return "'" + letter + "'";
        }
    }

    /**
     * Children matched in order.
     */
    public static final class Sequence extends Pat {
        private final List<Pat> elements;

        private Sequence(List<Pat> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }

        @Override
        public List<Pat> children() {
            return elements;
        }

        @Override
        public String toString() {
            return join("seq(", elements);
        }
    }

    /**
     * Any one of the children.
     */
    public static final class Alternation extends Pat {
        private final List<Pat> choices;

        private Alternation(List<Pat> choices) {
            this.choices = Collections.unmodifiableList(new ArrayList<>(choices));
        }

        @Override
        public Kind kind() {
            return Kind.ALTERNATION;
        }

        @Override
        public List<Pat> children() {
            return choices;
        }

        @Override
        public String toString() {
            return join("alt(", choices);
        }
    }

    private static String join(String head, List<Pat> parts) {
        StringBuilder sb = new StringBuilder(head);
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parts.get(i));
        }
        return sb.append(')').toString();
    }
}
