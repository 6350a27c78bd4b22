package org.carball.probe.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.probe.selection.SelectionAlgorithm;

@Data
@Builder(toBuilder = true)
@Slf4j
public class ProbeSettings {

    public static final int DEFAULT_FETCH_INTERVAL_SECONDS = 15;
    public static final int DEFAULT_COUNT_THRESHOLD = 20;
    public static final int MAX_COUNT_THRESHOLD = 30;
    public static final int DEFAULT_RESPONSE_TIME_THRESHOLD_MS = 500;
    public static final int DEFAULT_TEXT_TRUNCATE_LIMIT = 4094;
    public static final int DEFAULT_BATCH_SIZE = 600;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final int MAX_PLANS_PER_QUERY = 10;

    // Sampling window
    @Builder.Default
    private int fetchIntervalSeconds = DEFAULT_FETCH_INTERVAL_SECONDS;

    // Slow query selection
    @Builder.Default
    private int countThreshold = DEFAULT_COUNT_THRESHOLD;

    @Builder.Default
    private int responseTimeThresholdMs = DEFAULT_RESPONSE_TIME_THRESHOLD_MS;

    @Builder.Default
    private SelectionAlgorithm selectionAlgorithm = SelectionAlgorithm.DEFAULT;

    // Output shaping
    @Builder.Default
    private int textTruncateLimit = DEFAULT_TEXT_TRUNCATE_LIMIT;

    @Builder.Default
    private int batchSize = DEFAULT_BATCH_SIZE;

    // Environment capability
    @Builder.Default
    private boolean legacyMode = false;

    @Builder.Default
    private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;

    /**
     * Creates settings with every value at its default.
     */
    public static ProbeSettings defaults() {
        return ProbeSettings.builder().build();
    }

    /**
     * Replaces out-of-range values with usable ones, logging a warning for each adjustment.
     */
    public void validate() {
        if (countThreshold < 0) {
            log.warn("Count threshold ({}) is negative, using default {}", countThreshold, DEFAULT_COUNT_THRESHOLD);
            countThreshold = DEFAULT_COUNT_THRESHOLD;
        } else if (countThreshold > MAX_COUNT_THRESHOLD) {
            log.warn("Count threshold ({}) exceeds maximum, clamping to {}", countThreshold, MAX_COUNT_THRESHOLD);
            countThreshold = MAX_COUNT_THRESHOLD;
        }

        if (responseTimeThresholdMs < 0) {
            log.warn("Response time threshold ({} ms) is negative, using default {} ms",
                    responseTimeThresholdMs, DEFAULT_RESPONSE_TIME_THRESHOLD_MS);
            responseTimeThresholdMs = DEFAULT_RESPONSE_TIME_THRESHOLD_MS;
        }

        if (fetchIntervalSeconds <= 0) {
            log.warn("Fetch interval ({} s) should be positive, using default {} s",
                    fetchIntervalSeconds, DEFAULT_FETCH_INTERVAL_SECONDS);
            fetchIntervalSeconds = DEFAULT_FETCH_INTERVAL_SECONDS;
        }

        if (textTruncateLimit <= 0) {
            log.warn("Text truncate limit ({}) should be positive, using default {}",
                    textTruncateLimit, DEFAULT_TEXT_TRUNCATE_LIMIT);
            textTruncateLimit = DEFAULT_TEXT_TRUNCATE_LIMIT;
        }

        if (batchSize <= 0) {
            log.warn("Batch size ({}) should be positive, using default {}", batchSize, DEFAULT_BATCH_SIZE);
            batchSize = DEFAULT_BATCH_SIZE;
        }

        if (retryAttempts < 1) {
            log.warn("Retry attempts ({}) should be at least 1, using default {}", retryAttempts, DEFAULT_RETRY_ATTEMPTS);
            retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        }

        if (selectionAlgorithm == null) {
            selectionAlgorithm = SelectionAlgorithm.DEFAULT;
        }

        log.debug("Using settings - Interval: {}s, Count: {}, Response time: {}ms, Algorithm: {}",
                fetchIntervalSeconds, countThreshold, responseTimeThresholdMs, selectionAlgorithm.getName());
    }

    /**
     * Number of execution plans fetched per slow query: never more than {@value #MAX_PLANS_PER_QUERY}
     * nor more than the count threshold.
     */
    public int getPlanCountLimit() {
        return countThreshold <= 0 ? MAX_PLANS_PER_QUERY : Math.min(MAX_PLANS_PER_QUERY, countThreshold);
    }

    /**
     * Row limit the diagnostic queries run with. A count threshold of zero lifts the selection limit,
     * but the server side stays bounded by {@value #MAX_COUNT_THRESHOLD} rows.
     */
    public int getQueryRowLimit() {
        return countThreshold <= 0 ? MAX_COUNT_THRESHOLD : countThreshold;
    }

    public String getConfigurationSummary() {
        return String.format("Interval: %ds | Count: %d | Response time: %dms | Algorithm: %s | Batch: %d | Legacy: %s",
                fetchIntervalSeconds, countThreshold, responseTimeThresholdMs,
                selectionAlgorithm.getName(), batchSize, legacyMode);
    }
}
