package org.carball.probe.exception;

/**
 * Thrown when a query definition names a record category with no registered binder.
 */
public class UnknownCategoryException extends QueryAnalysisException {

    public UnknownCategoryException(String identifier) {
        super("Unknown query type: " + identifier);
    }
}
