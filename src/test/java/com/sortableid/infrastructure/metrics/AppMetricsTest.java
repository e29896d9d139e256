package com.sortableid.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppMetricsTest {

    private SimpleMeterRegistry registry;
    private AppMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AppMetrics(registry);
    }

    @Test
    void shouldCountIssuedIds() {
        metrics.incrementIdsGenerated(1);
        metrics.incrementIdsGenerated(25);

        assertEquals(26.0, registry.get("sortable_ids_generated_total").counter().count());
    }

    @Test
    void shouldCountFailuresSeparately() {
        metrics.incrementRateExceeded();
        metrics.incrementRateExceeded();
        metrics.incrementTimestampExhausted();
        metrics.incrementDecodeFailures();
        metrics.incrementBucketWaits();
        metrics.incrementRandomFallbacks();

        assertEquals(2.0, registry.get("sortable_id_rate_exceeded_total").counter().count());
        assertEquals(1.0, registry.get("sortable_id_timestamp_exhausted_total").counter().count());
        assertEquals(1.0, registry.get("sortable_id_decode_failures_total").counter().count());
        assertEquals(1.0, registry.get("sortable_id_bucket_waits_total").counter().count());
        assertEquals(1.0, registry.get("sortable_id_random_fallbacks_total").counter().count());
    }

    @Test
    void shouldTimeGenerateCalls() {
        String result = metrics.recordGenerateDuration(() -> "id");

        assertEquals("id", result);
        assertEquals(1L, registry.get("sortable_id_generate_duration_seconds").timer().count());
    }
}
