package com.sortableid.domain.model;

import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Width of one time bucket. Month and year are fixed approximations (30 and 365 days).
 */
public enum TimeGranularity {

    NANOSECOND("nanosecond", Duration.ofNanos(1)),
    MICROSECOND("microsecond", Duration.ofNanos(1_000)),
    MILLISECOND("millisecond", Duration.ofMillis(1)),
    SECOND("second", Duration.ofSeconds(1)),
    MINUTE("minute", Duration.ofMinutes(1)),
    HOUR("hour", Duration.ofHours(1)),
    DAY("day", Duration.ofDays(1)),
    MONTH("month", Duration.ofDays(30)),
    YEAR("year", Duration.ofDays(365));

    static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final BigInteger BIG_NANOS_PER_SECOND = BigInteger.valueOf(NANOS_PER_SECOND);

    private final String label;
    private final Duration bucket;
    private final BigInteger bucketNanos;

    TimeGranularity(String label, Duration bucket) {
        this.label = label;
        this.bucket = bucket;
        this.bucketNanos = BigInteger.valueOf(bucket.getSeconds())
            .multiply(BigInteger.valueOf(NANOS_PER_SECOND))
            .add(BigInteger.valueOf(bucket.getNano()));
    }

    public String label() {
        return label;
    }

    public Duration bucket() {
        return bucket;
    }

    public BigInteger bucketNanos() {
        return bucketNanos;
    }

    /**
     * Number of whole buckets between two instants, rounded down.
     */
    public BigInteger bucketsBetween(Instant start, Instant end) {
        Duration span = Duration.between(start, end);
        BigInteger nanos = BigInteger.valueOf(span.getSeconds())
            .multiply(BIG_NANOS_PER_SECOND)
            .add(BigInteger.valueOf(span.getNano()));
        return nanos.divide(bucketNanos);
    }

    /**
     * Index of the bucket containing {@code instant}, counted from {@code epochStart}.
     * Negative for instants before the epoch.
     *
     * @throws ArithmeticException if the index does not fit in a long
     */
    public long bucketIndex(Instant epochStart, Instant instant) {
        Duration span = Duration.between(epochStart, instant);
        long seconds = span.getSeconds();
        long nanos = span.getNano();
        if (bucket.getSeconds() == 0) {
            long perBucket = bucket.getNano();
            long bucketsPerSecond = NANOS_PER_SECOND / perBucket;
            return Math.addExact(Math.multiplyExact(seconds, bucketsPerSecond), nanos / perBucket);
        }
        return Math.floorDiv(seconds, bucket.getSeconds());
    }

    /**
     * Start instant of the given bucket, or empty if it lies beyond the range of {@link Instant}.
     */
    public Optional<Instant> instantAt(Instant epochStart, BigInteger bucketIndex) {
        BigInteger[] split = bucketIndex.multiply(bucketNanos).divideAndRemainder(BIG_NANOS_PER_SECOND);
        BigInteger seconds = split[0].add(BigInteger.valueOf(epochStart.getEpochSecond()));
        if (seconds.bitLength() >= Long.SIZE) {
            return Optional.empty();
        }
        long nanos = split[1].longValue() + epochStart.getNano();
        try {
            return Optional.of(Instant.ofEpochSecond(seconds.longValue(), nanos));
        } catch (DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * Truncates {@code instant} to the start of its bucket.
     */
    public Instant truncate(Instant epochStart, Instant instant) {
        long index = bucketIndex(epochStart, instant);
        return instantAt(epochStart, BigInteger.valueOf(index)).orElseThrow();
    }

    public static Optional<TimeGranularity> fromLabel(String label) {
        for (TimeGranularity granularity : values()) {
            if (granularity.label.equalsIgnoreCase(label) || granularity.name().equalsIgnoreCase(label)) {
                return Optional.of(granularity);
            }
        }
        return Optional.empty();
    }
}
