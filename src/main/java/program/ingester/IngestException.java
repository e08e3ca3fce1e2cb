package program.ingester;

import java.util.Objects;

/**
 * Aborts the whole batch. No partial graph is ever produced alongside one of these.
 */
public final class IngestException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public IngestException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public IngestException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static IngestException invalidInput(String message) {
        return new IngestException(ErrorKind.INVALID_INPUT, message);
    }

    public static IngestException invalidTimestamp(String text, Throwable cause) {
        return new IngestException(ErrorKind.INVALID_TIMESTAMP,
                "The timestamp '" + text + "' could not be parsed", cause);
    }

    public static IngestException ioFailure(String message, Throwable cause) {
        return new IngestException(ErrorKind.IO_FAILURE, message, cause);
    }

    public static IngestException cyclicReference(String message) {
        return new IngestException(ErrorKind.CYCLIC_REFERENCE, message);
    }

    public static IngestException depthLimit(String message) {
        return new IngestException(ErrorKind.DEPTH_LIMIT, message);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Same message with a 1-based input line number prefixed.
     */
    public IngestException atLine(int lineNumber) {
        return new IngestException(kind, "line " + lineNumber + ": " + getMessage(), getCause());
    }
}
