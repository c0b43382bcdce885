package stenojava;

/**
 * Thrown when a pattern string has unbalanced parentheses.
 */
public class PatSyntaxException extends StenoException {
    private final String pattern;
    private final int index;

    /**
     * @param message description of the problem
     * @param pattern the offending pattern string
     * @param index   index of the offending character
     */
    public PatSyntaxException(String message, String pattern, int index) {
        super(message + " near index " + index + ": " + pattern);
        this.pattern = pattern;
        this.index = index;
    }

    public String getPattern() {
        return pattern;
    }

    public int getIndex() {
        return index;
    }
}
