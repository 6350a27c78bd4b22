package org.carball.probe.exception;

/**
 * Thrown when a single result row cannot be bound to its record type.
 */
public class RowBindException extends QueryAnalysisException {

    public RowBindException(String message) {
        super(message);
    }

    public RowBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
