package org.carball.probe.exception;

/**
 * Final failure after the retry budget is spent. The cause is the last observed failure.
 */
public class RetryExhaustedException extends QueryAnalysisException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Operation failed after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
