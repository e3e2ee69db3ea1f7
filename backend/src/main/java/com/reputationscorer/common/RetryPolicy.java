package com.reputationscorer.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Reconnect backoff: fixed or exponential (capped) delay with optional ± jitter.
 * {@code maxAttempts} is the number of consecutive failures after which callers escalate;
 * the policy itself never gives up.
 */
public final class RetryPolicy {

    public enum BackoffStrategy {
        FIXED,
        EXPONENTIAL
    }

    private final BackoffStrategy strategy;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(BackoffStrategy strategy, long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        this.strategy = strategy;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * FIXED: baseDelay. EXPONENTIAL: min(baseDelay * 2^attempt, maxDelay). Jitter applied last.
     */
    public long delayMs(int attempt) {
        if (strategy == BackoffStrategy.FIXED || attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Fixed delay, no jitter, escalate after 5 consecutive failures.
     */
    public static RetryPolicy fixed(long delayMs) {
        return new RetryPolicy(BackoffStrategy.FIXED, delayMs, delayMs, 0.0, 5);
    }
}
