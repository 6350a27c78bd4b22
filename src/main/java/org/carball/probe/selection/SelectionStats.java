package org.carball.probe.selection;

/**
 * Counts and bounds from one selection pass, logged once per cycle.
 */
public record SelectionStats(
        int totalCandidates,
        int matchedThreshold,
        int returned,
        double thresholdMs,
        int limit,
        double slowestCostMs,
        double fastestCostMs
) {

    public String getSummary() {
        if (returned == 0) {
            return String.format("%d candidates, %d >= %.2f ms, none returned (limit %d)",
                    totalCandidates, matchedThreshold, thresholdMs, limit);
        }
        return String.format("%d candidates, %d >= %.2f ms, returned %d (limit %d), slowest %.2f ms, fastest %.2f ms",
                totalCandidates, matchedThreshold, thresholdMs, returned, limit, slowestCostMs, fastestCostMs);
    }
}
