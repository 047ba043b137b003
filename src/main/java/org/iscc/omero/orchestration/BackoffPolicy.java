package org.iscc.omero.orchestration;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential reconnect backoff: {@code initialDelay * multiplier^(attempt-1)}, capped at
 * {@code maxDelay}, then reduced by up to {@code jitter} (a fraction in [0, 1]).
 */
public record BackoffPolicy(
        Duration initialDelay,
        double multiplier,
        Duration maxDelay,
        double jitter
) {
    public BackoffPolicy {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be between 0 and 1");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(2), 1.5, Duration.ofSeconds(30), 0.1);
    }

    public Duration delayFor(int attempt) {
        return delayFor(attempt, ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param attempt 1-based attempt number
     * @param random  value in [0, 1) selecting the jitter
     */
    public Duration delayFor(int attempt, double random) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        double base = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        double capped = Math.min(base, maxDelay.toMillis());
        return Duration.ofMillis(Math.round(capped * (1.0 - jitter * random)));
    }
}
