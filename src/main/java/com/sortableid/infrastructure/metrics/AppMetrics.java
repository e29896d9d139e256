package com.sortableid.infrastructure.metrics;

import com.sortableid.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter idsGenerated;
    private final Counter rateExceeded;
    private final Counter timestampExhausted;
    private final Counter decodeFailures;
    private final Counter bucketWaits;
    private final Counter randomFallbacks;
    private final Timer generateDuration;

    public AppMetrics(MeterRegistry registry) {
        this.idsGenerated = Counter.builder("sortable_ids_generated_total")
            .description("Total number of IDs issued")
            .register(registry);

        this.rateExceeded = Counter.builder("sortable_id_rate_exceeded_total")
            .description("Generate calls rejected because the current bucket was exhausted")
            .register(registry);

        this.timestampExhausted = Counter.builder("sortable_id_timestamp_exhausted_total")
            .description("Generate calls rejected because the clock is past the max supported instant")
            .register(registry);

        this.decodeFailures = Counter.builder("sortable_id_decode_failures_total")
            .description("Decode calls rejected as malformed")
            .register(registry);

        this.bucketWaits = Counter.builder("sortable_id_bucket_waits_total")
            .description("Pauses spent waiting for the next bucket after exhaustion")
            .register(registry);

        this.randomFallbacks = Counter.builder("sortable_id_random_fallbacks_total")
            .description("Suffix pool refills served by the insecure fallback")
            .register(registry);

        this.generateDuration = Timer.builder("sortable_id_generate_duration_seconds")
            .description("Time taken to issue one ID, including waits for the next bucket")
            .register(registry);
    }

    @Override
    public void incrementIdsGenerated(int count) {
        idsGenerated.increment(count);
    }

    @Override
    public void incrementRateExceeded() {
        rateExceeded.increment();
    }

    @Override
    public void incrementTimestampExhausted() {
        timestampExhausted.increment();
    }

    @Override
    public void incrementDecodeFailures() {
        decodeFailures.increment();
    }

    @Override
    public void incrementBucketWaits() {
        bucketWaits.increment();
    }

    @Override
    public void incrementRandomFallbacks() {
        randomFallbacks.increment();
    }

    @Override
    public <T> T recordGenerateDuration(Supplier<T> operation) {
        return generateDuration.record(operation);
    }
}
