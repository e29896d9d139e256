package com.sortableid.application.service;

import java.time.Duration;

/**
 * What to do when a bucket's chrono and suffix capacity is used up.
 * Failing immediately is the default; waiting retries a bounded number of times.
 */
public record ExhaustionPolicy(boolean waitForNextBucket, int maxRetries, Duration pause) {

    public static final ExhaustionPolicy FAIL_FAST = new ExhaustionPolicy(false, 0, Duration.ZERO);

    public ExhaustionPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative (was " + maxRetries + ")");
        }
        if (pause == null || pause.isNegative()) {
            throw new IllegalArgumentException("pause must be a non-negative duration");
        }
    }

    public static ExhaustionPolicy waitForNextBucket(int maxRetries, Duration pause) {
        return new ExhaustionPolicy(true, maxRetries, pause);
    }
}
