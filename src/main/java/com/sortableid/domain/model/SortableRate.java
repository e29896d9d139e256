package com.sortableid.domain.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Maximum issuance rate that must stay sortable through the chrono field.
 * The per-second counts below are the only conversion table; chrono sizing derives from them.
 */
public enum SortableRate {

    TEN_PER_NANOSECOND("10_per_nanosecond", 10_000_000_000L),
    HUNDRED_PER_MICROSECOND("100_per_microsecond", 100_000_000L),
    ONE_PER_MICROSECOND("1_per_microsecond", 1_000_000L),
    TEN_PER_MILLISECOND("10_per_millisecond", 10_000L),
    HUNDRED_PER_SECOND("100_per_second", 100L),
    ONE_PER_SECOND("1_per_second", 1L);

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private final String label;
    private final long perSecond;

    SortableRate(String label, long perSecond) {
        this.label = label;
        this.perSecond = perSecond;
    }

    public String label() {
        return label;
    }

    public long perSecond() {
        return perSecond;
    }

    /**
     * Expected issuances within one bucket of the given granularity, rounded down.
     * Zero for sub-unit loads (e.g. 100 per second at millisecond buckets).
     */
    public BigInteger expectedPerBucket(TimeGranularity granularity) {
        return BigInteger.valueOf(perSecond)
            .multiply(granularity.bucketNanos())
            .divide(NANOS_PER_SECOND);
    }

    public static Optional<SortableRate> fromLabel(String label) {
        for (SortableRate rate : values()) {
            if (rate.label.equalsIgnoreCase(label) || rate.name().equalsIgnoreCase(label)) {
                return Optional.of(rate);
            }
        }
        return Optional.empty();
    }
}
