package com.sortableid.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementIdsGenerated(int count);

    void incrementRateExceeded();

    void incrementTimestampExhausted();

    void incrementDecodeFailures();

    void incrementBucketWaits();

    void incrementRandomFallbacks();

    <T> T recordGenerateDuration(Supplier<T> operation);
}
