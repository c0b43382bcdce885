package stenojava;

/**
 * Base class of all failures raised by the steno engine.
 *
 * <p>Subclasses distinguish malformed input ({@link InvalidStrokeException}),
 * malformed theory data ({@link PatSyntaxException}) and well-formed input that
 * matches no dictionary word ({@link NoMatchException}).</p>
 */
public class StenoException extends RuntimeException {

    /**
     * Constructs an exception with the given message.
     *
     * @param message the detail message
     */
    public StenoException(String message) {
        super(message);
    }

    /**
     * Constructs an exception with the given message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public StenoException(String message, Throwable cause) {
        super(message, cause);
    }
}
