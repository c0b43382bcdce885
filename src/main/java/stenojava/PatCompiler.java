package stenojava;

/**
 * Compiles the compact pattern syntax into {@link Pat} trees.
 *
 * <p>Syntax:</p>
 * <ul>
 *   <li>any character other than {@code ( | )} is a literal;</li>
 *   <li>{@code (} ... {@code )} groups a nested pattern;</li>
 *   <li>{@code |} separates alternatives at the current nesting level;</li>
 *   <li>concatenation is implicit.</li>
 * </ul>
 *
 * <p>Examples: {@code "a(b|c)"} compiles to {@code seq('a', alt('b', 'c'))};
 * {@code "q(|u)"} compiles to {@code seq('q', alt(seq(), 'u'))}.</p>
 */
public final class PatCompiler {

    private final String source;
    private int pos;
    private int depth;

    private PatCompiler(String source) {
        this.source = source;
    }

    /**
     * Compiles a pattern string.
     *
     * @param pattern the pattern string
     * @return the compiled pattern
     * @throws PatSyntaxException if a {@code )} has no matching {@code (}
     */
    public static Pat compile(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("Pattern string cannot be null");
        }
        return new PatCompiler(pattern).compilePart();
    }

    /**
     * Compiles until the {@code )} closing the current group (which is consumed)
     * or the end of input. An unclosed {@code (} is closed by the end of input.
     */
    private Pat compilePart() {
        Pat ret = Pat.alt();
        Pat current = Pat.seq();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '(') {
                depth++;
                current = Pat.seq(current, compilePart());
                depth--;
            } else if (c == '|') {
                ret = Pat.alt(ret, current);
                current = Pat.seq();
            } else if (c == ')') {
                if (depth == 0) {
                    throw new PatSyntaxException("unbalanced parentheses", source, pos - 1);
                }
                break;
            } else {
                current = Pat.seq(current, Pat.lit(c));
            }
        }
        return Pat.alt(ret, current);
    }
}
