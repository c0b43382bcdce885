package stenojava;

/**
 * Thrown when a stroke does not split into known left, middle and right chords.
 */
public class UnrecognizedChordException extends InvalidStrokeException {

    public UnrecognizedChordException(String message, String stroke) {
        super(message, stroke);
    }
}
