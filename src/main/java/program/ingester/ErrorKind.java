package program.ingester;

/**
 * Failure categories surfaced by ingestion and resolution.
 */
public enum ErrorKind {
    INVALID_INPUT,
    INVALID_TIMESTAMP,
    IO_FAILURE,
    CYCLIC_REFERENCE,
    DEPTH_LIMIT
}
