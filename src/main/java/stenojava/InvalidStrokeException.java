package stenojava;

/**
 * Thrown when an outline is malformed: a stroke has an unknown shape or
 * appears where it is not allowed.
 */
public class InvalidStrokeException extends StenoException {
    private final String stroke;

    /**
     * @param message description of the problem
     * @param stroke  the offending stroke
     */
    public InvalidStrokeException(String message, String stroke) {
        super(message + ": " + stroke);
        this.stroke = stroke;
    }

    /**
     * Returns the stroke that was rejected.
     *
     * @return the stroke
     */
    public String getStroke() {
        return stroke;
    }
}
