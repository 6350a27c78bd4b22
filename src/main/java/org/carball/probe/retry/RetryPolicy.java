package org.carball.probe.retry;

/**
 * Fixed attempt budget. There is no backoff between attempts.
 */
public record RetryPolicy(int maxAttempts) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS);
    }
}
