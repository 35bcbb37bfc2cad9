package catalogwatch.config;

import java.time.Duration;

/**
 * How often and how patiently a page fetch is retried.
 *
 * @param maxAttempts   total attempts, the first call included
 * @param initialDelay  wait before the second attempt
 * @param backoffFactor multiplier applied to the wait after every failed attempt
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double backoffFactor) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.toMillis() < 1) {
            throw new IllegalArgumentException("initialDelay must be at least 1 ms");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0, got " + backoffFactor);
        }
    }
}
