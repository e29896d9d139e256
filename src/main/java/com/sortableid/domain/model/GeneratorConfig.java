package com.sortableid.domain.model;

import com.sortableid.domain.codec.BaseNCodec;
import com.sortableid.domain.error.ConfigurationError;

import java.math.BigInteger;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Validated, immutable generator configuration with the derived field widths.
 * Layout of every ID: {@code [timestamp][chrono][suffix]}.
 */
public record GeneratorConfig(
    Alphabet alphabet,
    int totalLength,
    int timestampLength,
    int chronoLength,
    Instant epochStart,
    Instant epochEnd,
    TimeGranularity granularity,
    SortableRate rate,
    BigInteger timestampCapacity
) {
    public static final int MIN_TOTAL_LENGTH = 2;
    public static final int DEFAULT_EPOCH_YEARS = 10_000;

    public int suffixLength() {
        return totalLength - timestampLength - chronoLength;
    }

    public int trailingLength() {
        return totalLength - timestampLength;
    }

    /**
     * Resolves raw settings, returning a Result for expected validation failures.
     */
    public static Result<GeneratorConfig, ConfigurationError> resolve(GeneratorSettings settings) {
        var alphabetResult = Alphabet.of(settings.alphabet());
        if (alphabetResult.isFailure()) {
            return Result.failure(alphabetResult.errorOrNull());
        }
        Alphabet alphabet = alphabetResult.getOrThrow();
        BaseNCodec codec = new BaseNCodec(alphabet);

        if (settings.totalLength() < MIN_TOTAL_LENGTH) {
            return Result.failure(new ConfigurationError.InvalidTotalLength(settings.totalLength(), MIN_TOTAL_LENGTH));
        }

        Instant start = settings.epochStart();
        Instant end = settings.epochEnd() != null
            ? settings.epochEnd()
            : start.atOffset(ZoneOffset.UTC).plusYears(DEFAULT_EPOCH_YEARS).toInstant();
        if (end.isBefore(start)) {
            return Result.failure(new ConfigurationError.InvalidEpochRange(start, end));
        }

        TimeGranularity granularity = settings.granularity();
        int timestampLength;
        if (settings.timestampLength() != null) {
            if (settings.timestampLength() < 1) {
                return Result.failure(new ConfigurationError.InvalidTimestampLength(settings.timestampLength()));
            }
            timestampLength = settings.timestampLength();
        } else {
            timestampLength = codec.widthFor(granularity.bucketsBetween(start, end));
        }

        int chronoLength = codec.widthFor(settings.rate().expectedPerBucket(granularity));

        if ((long) timestampLength + chronoLength + 1 > settings.totalLength()) {
            return Result.failure(new ConfigurationError.LengthBudgetExceeded(
                settings.totalLength(), timestampLength, chronoLength));
        }

        return Result.success(new GeneratorConfig(
            alphabet,
            settings.totalLength(),
            timestampLength,
            chronoLength,
            start,
            end,
            granularity,
            settings.rate(),
            codec.capacity(timestampLength)
        ));
    }

    /**
     * First instant that can no longer be issued, derived from {@link #maxBucketExclusive()}
     * and clamped to {@link Instant#MAX}.
     */
    public Instant maxSupportedInstant() {
        return granularity.instantAt(epochStart, BigInteger.valueOf(maxBucketExclusive())).orElse(Instant.MAX);
    }

    /**
     * Exclusive bucket bound used for issuance: the field capacity, capped at {@link Long#MAX_VALUE}
     * since bucket indices are longs.
     */
    public long maxBucketExclusive() {
        return timestampCapacity.bitLength() < Long.SIZE ? timestampCapacity.longValue() : Long.MAX_VALUE;
    }
}
