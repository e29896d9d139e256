package com.sortableid.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeGranularity")
class TimeGranularityTest {

    private static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    @ParameterizedTest(name = "{0} bucket is {1} ns")
    @CsvSource({
        "NANOSECOND, 1",
        "MICROSECOND, 1000",
        "MILLISECOND, 1000000",
        "SECOND, 1000000000",
        "DAY, 86400000000000",
        "MONTH, 2592000000000000",
        "YEAR, 31536000000000000"
    })
    void bucketNanosShouldMatchTable(TimeGranularity granularity, String nanos) {
        assertEquals(new BigInteger(nanos), granularity.bucketNanos());
    }

    @Test
    @DisplayName("bucketIndex should count whole buckets from the epoch")
    void bucketIndexShouldCountWholeBuckets() {
        Instant instant = Instant.parse("2024-01-01T00:00:01.000002500Z");

        assertEquals(1_000_002_500L, TimeGranularity.NANOSECOND.bucketIndex(EPOCH, instant));
        assertEquals(1_000_002L, TimeGranularity.MICROSECOND.bucketIndex(EPOCH, instant));
        assertEquals(1_000L, TimeGranularity.MILLISECOND.bucketIndex(EPOCH, instant));
        assertEquals(1L, TimeGranularity.SECOND.bucketIndex(EPOCH, instant));
        assertEquals(0L, TimeGranularity.DAY.bucketIndex(EPOCH, instant));
    }

    @Test
    @DisplayName("bucketIndex should be negative before the epoch")
    void bucketIndexShouldBeNegativeBeforeEpoch() {
        assertTrue(TimeGranularity.SECOND.bucketIndex(EPOCH, EPOCH.minusMillis(1)) < 0);
        assertTrue(TimeGranularity.MICROSECOND.bucketIndex(EPOCH, EPOCH.minusSeconds(5)) < 0);
    }

    @Test
    @DisplayName("bucketIndex should throw when the index exceeds a long")
    void bucketIndexShouldThrowOnOverflow() {
        Instant farFuture = EPOCH.plusSeconds(300_000L * 365 * 86_400);

        assertThrows(ArithmeticException.class, () -> TimeGranularity.NANOSECOND.bucketIndex(EPOCH, farFuture));
    }

    @Test
    @DisplayName("bucketsBetween should use arbitrary precision")
    void bucketsBetweenShouldNotOverflow() {
        Instant end = EPOCH.plusSeconds(400L * 365 * 86_400);

        BigInteger buckets = TimeGranularity.NANOSECOND.bucketsBetween(EPOCH, end);

        assertEquals(BigInteger.valueOf(400L * 365 * 86_400).multiply(BigInteger.valueOf(1_000_000_000L)), buckets);
        assertTrue(buckets.compareTo(BigInteger.valueOf(Long.MAX_VALUE)) > 0);
    }

    @Test
    @DisplayName("truncate should return the start of the containing bucket")
    void truncateShouldReturnBucketStart() {
        Instant instant = Instant.parse("2024-02-20T12:34:56.789123456Z");

        assertEquals(Instant.parse("2024-02-20T12:34:56.789123Z"), TimeGranularity.MICROSECOND.truncate(EPOCH, instant));
        assertEquals(Instant.parse("2024-02-20T12:34:00Z"), TimeGranularity.MINUTE.truncate(EPOCH, instant));
        assertEquals(Instant.parse("2024-01-31T00:00:00Z"), TimeGranularity.MONTH.truncate(EPOCH, instant));
    }

    @Test
    @DisplayName("instantAt should be empty beyond the Instant range")
    void instantAtShouldBeEmptyBeyondRange() {
        BigInteger huge = BigInteger.TWO.pow(100);

        assertTrue(TimeGranularity.YEAR.instantAt(EPOCH, huge).isEmpty());
        assertEquals(EPOCH.plusSeconds(3_600), TimeGranularity.HOUR.instantAt(EPOCH, BigInteger.ONE).orElseThrow());
    }

    @Test
    @DisplayName("fromLabel should accept labels and constant names")
    void fromLabelShouldAcceptLabelsAndNames() {
        assertEquals(TimeGranularity.MICROSECOND, TimeGranularity.fromLabel("microsecond").orElseThrow());
        assertEquals(TimeGranularity.YEAR, TimeGranularity.fromLabel("YEAR").orElseThrow());
        assertTrue(TimeGranularity.fromLabel("fortnight").isEmpty());
    }
}
