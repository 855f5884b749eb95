package rmq;

/**
 * Validation failure raised by a {@link RangeMinimumQuery} operation.
 * The structure is left untouched and remains usable after the call.
 */
public class RmqException extends IllegalArgumentException {

    public enum Kind {
        INVALID_TYPE,
        EMPTY_INPUT,
        INDEX_OUT_OF_BOUNDS,
        INVALID_RANGE
    }

    private final Kind kind;

    public RmqException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    static RmqException invalidType(String message) {
        return new RmqException(Kind.INVALID_TYPE, message);
    }

    static RmqException emptyInput() {
        return new RmqException(Kind.EMPTY_INPUT, "Input array cannot be empty.");
    }

    static RmqException indexOutOfBounds(String message) {
        return new RmqException(Kind.INDEX_OUT_OF_BOUNDS, message);
    }

    static RmqException invalidRange(int left, int right) {
        return new RmqException(Kind.INVALID_RANGE,
                "Left index " + left + " cannot be greater than right index " + right + ".");
    }
}
