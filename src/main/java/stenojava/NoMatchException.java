package stenojava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when an outline is well-formed but no dictionary word matches it.
 */
public class NoMatchException extends StenoException {
    private final List<String> outline;

    /**
     * @param outline the strokes that were looked up
     */
    public NoMatchException(List<String> outline) {
        super("No word matches " + String.join("/", outline));
        this.outline = Collections.unmodifiableList(new ArrayList<>(outline));
    }

    /**
     * Returns the strokes that failed to match.
     *
     * @return an unmodifiable list of strokes
     */
    public List<String> getOutline() {
        return outline;
    }
}
