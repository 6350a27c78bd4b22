package org.carball.probe.exception;

/**
 * Thrown when a batch cannot be delivered to the telemetry sink.
 * Carries the half-open index range {@code [startIndex, endIndex)} of the failing batch.
 */
public class IngestionException extends QueryAnalysisException {

    private final int startIndex;
    private final int endIndex;

    public IngestionException(int startIndex, int endIndex, Throwable cause) {
        super(String.format("Error ingesting batch from %d to %d: %s", startIndex, endIndex,
                cause.getMessage()), cause);
        this.startIndex = startIndex;
        this.endIndex = endIndex;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }
}
