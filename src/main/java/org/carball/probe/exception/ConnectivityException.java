package org.carball.probe.exception;

/**
 * Thrown when the probe cannot reach SQL Server. Ends the whole analysis cycle.
 */
public class ConnectivityException extends QueryAnalysisException {

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
