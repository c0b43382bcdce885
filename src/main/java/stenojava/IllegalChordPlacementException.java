package stenojava;

/**
 * Thrown when a well-formed stroke is used at a position of the outline where it is not
 * permitted, e.g. an island inside a multi-stroke outline, or a vowel-initial stroke after
 * the first one.
 */
public class IllegalChordPlacementException extends InvalidStrokeException {
    private final int position;

    /**
     * @param message  description of the problem
     * @param stroke   the offending stroke
     * @param position zero-based index of the stroke in the outline
     */
    public IllegalChordPlacementException(String message, String stroke, int position) {
        super(message + " (stroke " + (position + 1) + ")", stroke);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
