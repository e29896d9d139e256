package com.sortableid.domain.model;

import java.time.Instant;

/**
 * Raw generator configuration as supplied by the caller. Resolved into a {@link GeneratorConfig}.
 *
 * @param epochEnd        optional; defaults to ten thousand years after the epoch start
 * @param timestampLength optional; overrides the width derived from the epoch range
 */
public record GeneratorSettings(
    String alphabet,
    int totalLength,
    Instant epochStart,
    Instant epochEnd,
    Integer timestampLength,
    TimeGranularity granularity,
    SortableRate rate
) {
    public static final String DEFAULT_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ-_";
    public static final int DEFAULT_TOTAL_LENGTH = 32;
    public static final Instant DEFAULT_EPOCH_START = Instant.parse("2024-01-01T00:00:00Z");
    public static final TimeGranularity DEFAULT_GRANULARITY = TimeGranularity.MICROSECOND;
    public static final SortableRate DEFAULT_RATE = SortableRate.HUNDRED_PER_MICROSECOND;

    public GeneratorSettings {
        if (alphabet == null) {
            alphabet = DEFAULT_ALPHABET;
        }
        if (epochStart == null) {
            epochStart = DEFAULT_EPOCH_START;
        }
        if (granularity == null) {
            granularity = DEFAULT_GRANULARITY;
        }
        if (rate == null) {
            rate = DEFAULT_RATE;
        }
    }

    public static GeneratorSettings defaults() {
        return new GeneratorSettings(DEFAULT_ALPHABET, DEFAULT_TOTAL_LENGTH, DEFAULT_EPOCH_START, null, null,
            DEFAULT_GRANULARITY, DEFAULT_RATE);
    }

    public GeneratorSettings withAlphabet(String value) {
        return new GeneratorSettings(value, totalLength, epochStart, epochEnd, timestampLength, granularity, rate);
    }

    public GeneratorSettings withTotalLength(int value) {
        return new GeneratorSettings(alphabet, value, epochStart, epochEnd, timestampLength, granularity, rate);
    }

    public GeneratorSettings withEpoch(Instant start, Instant end) {
        return new GeneratorSettings(alphabet, totalLength, start, end, timestampLength, granularity, rate);
    }

    public GeneratorSettings withTimestampLength(Integer value) {
        return new GeneratorSettings(alphabet, totalLength, epochStart, epochEnd, value, granularity, rate);
    }

    public GeneratorSettings withGranularity(TimeGranularity value) {
        return new GeneratorSettings(alphabet, totalLength, epochStart, epochEnd, timestampLength, value, rate);
    }

    public GeneratorSettings withRate(SortableRate value) {
        return new GeneratorSettings(alphabet, totalLength, epochStart, epochEnd, timestampLength, granularity, value);
    }
}
