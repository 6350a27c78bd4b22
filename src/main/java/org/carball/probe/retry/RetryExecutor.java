package org.carball.probe.retry;

import lombok.extern.slf4j.Slf4j;
import org.carball.probe.exception.RetryExhaustedException;

import java.util.concurrent.Callable;

/**
 * Re-invokes a fallible operation until it succeeds or the attempt budget runs out.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;

    public RetryExecutor(RetryPolicy policy) {
        this.policy = policy;
    }

    public RetryExecutor() {
        this(RetryPolicy.defaults());
    }

    /**
     * Runs {@code operation}, returning its first successful result.
     *
     * @throws RetryExhaustedException with the last failure as cause once every attempt has failed
     */
    public <T> T execute(String operationName, Callable<T> operation) {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastFailure = e;
                log.warn("{} failed on attempt {}/{}: {}", operationName, attempt, policy.maxAttempts(), e.getMessage());
            }
        }
        throw new RetryExhaustedException(policy.maxAttempts(), lastFailure);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
