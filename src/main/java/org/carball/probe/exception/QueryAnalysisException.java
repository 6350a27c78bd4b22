package org.carball.probe.exception;

/**
 * Base type for failures raised by the query analysis pipeline.
 */
public class QueryAnalysisException extends RuntimeException {

    public QueryAnalysisException(String message) {
        super(message);
    }

    public QueryAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
