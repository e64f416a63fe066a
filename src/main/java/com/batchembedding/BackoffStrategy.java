package com.batchembedding;

/**
 * Exponential delay before retrying a batch after a transient server error.
 * Stateless: the caller passes the number of retries already made for the batch.
 */
public class BackoffStrategy {
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;

    public BackoffStrategy(long initialDelayMs, long maxDelayMs, double multiplier) {
        if (initialDelayMs < 0 || maxDelayMs < 0 || multiplier < 1.0) {
            throw new IllegalArgumentException("backoff delays must be non-negative and multiplier at least 1.0");
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
    }

    public static BackoffStrategy none() {
        return new BackoffStrategy(0L, 0L, 1.0);
    }

    public long delayFor(int attempt) {
        if (initialDelayMs == 0L) {
            return 0L;
        }
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt));
        return (long) Math.min(delay, (double) maxDelayMs);
    }
}
