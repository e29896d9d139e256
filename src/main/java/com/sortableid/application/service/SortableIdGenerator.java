package com.sortableid.application.service;

import com.sortableid.application.port.out.MetricsPort;
import com.sortableid.application.port.out.RandomSource;
import com.sortableid.application.port.out.RandomSourceException;
import com.sortableid.domain.codec.BaseNCodec;
import com.sortableid.domain.codec.SequenceCascade;
import com.sortableid.domain.error.ConfigurationError;
import com.sortableid.domain.error.DecodeError;
import com.sortableid.domain.error.GenerationError;
import com.sortableid.domain.model.DecodedId;
import com.sortableid.domain.model.GeneratorConfig;
import com.sortableid.domain.model.GeneratorInfo;
import com.sortableid.domain.model.GeneratorSettings;
import com.sortableid.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Issues sortable IDs for one configuration.
 *
 * <p>The generator is idle until its first issuance, then remembers the last bucket and the last
 * ID it returned. A call in a new bucket encodes the bucket, resets the chrono field to its lowest
 * value and draws a fresh suffix. A call in the same bucket advances the chrono field of the last
 * ID, falling back to advancing chrono and suffix together, and fails with
 * {@link GenerationError.RateExceeded} once both are exhausted.
 *
 * <p>The whole decision runs under a single lock, so IDs returned by successive completed calls
 * are strictly increasing.
 */
public final class SortableIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(SortableIdGenerator.class);

    private final GeneratorConfig config;
    private final BaseNCodec codec;
    private final SequenceCascade cascade;
    private final RandomSuffixPool suffixPool;
    private final Clock clock;
    private final long maxBucketExclusive;

    private final ReentrantLock lock = new ReentrantLock();
    private boolean issued;
    private long lastBucket;
    private String lastId;

    public SortableIdGenerator(GeneratorConfig config, RandomSuffixPool suffixPool, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.suffixPool = Objects.requireNonNull(suffixPool, "suffixPool must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.codec = new BaseNCodec(config.alphabet());
        this.cascade = new SequenceCascade(config.alphabet());
        this.maxBucketExclusive = config.maxBucketExclusive();

        Instant maxSupported = config.maxSupportedInstant();
        if (maxSupported.isBefore(clock.instant())) {
            log.warn("Max supported instant {} is already in the past; generate will fail until reconfigured "
                + "(timestampLength={}, granularity={})", maxSupported, config.timestampLength(), config.granularity().label());
        }
    }

    /**
     * Resolves settings and builds a generator with its own suffix pool.
     */
    public static Result<SortableIdGenerator, ConfigurationError> create(
            GeneratorSettings settings,
            RandomSource randomSource,
            Clock clock,
            MetricsPort metrics) {
        return GeneratorConfig.resolve(settings).map(config -> new SortableIdGenerator(
            config,
            new RandomSuffixPool(config.alphabet(), randomSource, RandomSuffixPool.DEFAULT_POOL_SIZE, false, metrics),
            clock));
    }

    public GeneratorConfig config() {
        return config;
    }

    public Result<String, GenerationError> generate() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (now.isBefore(config.epochStart())) {
                return Result.failure(new GenerationError.ClockBeforeEpoch(now, config.epochStart()));
            }

            long bucket;
            try {
                bucket = config.granularity().bucketIndex(config.epochStart(), now);
            } catch (ArithmeticException e) {
                bucket = Long.MAX_VALUE;
            }
            if (bucket >= maxBucketExclusive) {
                return Result.failure(new GenerationError.TimestampExhausted(bucket, config.maxSupportedInstant()));
            }

            if (issued && bucket <= lastBucket) {
                if (bucket < lastBucket) {
                    log.debug("Clock moved back from bucket {} to {}; continuing sequence of bucket {}", lastBucket, bucket, lastBucket);
                }
                return advanceWithinBucket();
            }
            return startBucket(bucket);
        } finally {
            lock.unlock();
        }
    }

    private Result<String, GenerationError> startBucket(long bucket) {
        String suffix;
        try {
            suffix = suffixPool.nextSymbols(config.suffixLength());
        } catch (RandomSourceException e) {
            log.error("Secure random source failed while starting bucket {}", bucket, e);
            return Result.failure(new GenerationError.RandomnessUnavailable(e.getMessage()));
        }
        String id = codec.encode(bucket, config.timestampLength())
            + config.alphabet().repeatFirst(config.chronoLength())
            + suffix;
        return issue(bucket, id);
    }

    private Result<String, GenerationError> advanceWithinBucket() {
        int timestampLength = config.timestampLength();
        int chronoEnd = timestampLength + config.chronoLength();
        String timestampPart = lastId.substring(0, timestampLength);

        Optional<String> chrono = cascade.advance(lastId.substring(timestampLength, chronoEnd));
        if (chrono.isPresent()) {
            return issue(lastBucket, timestampPart + chrono.get() + lastId.substring(chronoEnd));
        }

        Optional<String> trailing = cascade.advance(lastId.substring(timestampLength));
        if (trailing.isPresent()) {
            log.debug("Chrono field exhausted in bucket {}; advancing into the suffix", lastBucket);
            return issue(lastBucket, timestampPart + trailing.get());
        }

        return Result.failure(new GenerationError.RateExceeded(config.granularity(), config.totalLength()));
    }

    private Result<String, GenerationError> issue(long bucket, String id) {
        issued = true;
        lastBucket = bucket;
        lastId = id;
        return Result.success(id);
    }

    /**
     * Splits and validates an ID. Does not touch issuance state.
     */
    public Result<DecodedId, DecodeError> decode(String id) {
        if (id == null || id.isEmpty()) {
            return Result.failure(DecodeError.Empty.INSTANCE);
        }
        if (id.length() != config.totalLength()) {
            return Result.failure(new DecodeError.WrongLength(config.totalLength(), id.length()));
        }
        for (int i = 0; i < id.length(); i++) {
            if (!config.alphabet().contains(id.charAt(i))) {
                return Result.failure(new DecodeError.ForeignSymbol(id.charAt(i), i));
            }
        }

        int timestampLength = config.timestampLength();
        int chronoEnd = timestampLength + config.chronoLength();
        String timestampPart = id.substring(0, timestampLength);

        return codec.decode(timestampPart, timestampLength).flatMap(bucket ->
            config.granularity().instantAt(config.epochStart(), BigInteger.valueOf(bucket))
                .<Result<DecodedId, DecodeError>>map(instant -> Result.success(new DecodedId(
                    instant,
                    bucket,
                    timestampPart,
                    id.substring(timestampLength, chronoEnd),
                    id.substring(chronoEnd))))
                .orElseGet(() -> Result.failure(new DecodeError.TimestampOutOfRange(timestampPart))));
    }

    public Instant maxSupportedInstant() {
        return config.maxSupportedInstant();
    }

    public GeneratorInfo describe() {
        lock.lock();
        try {
            return GeneratorInfo.from(config, suffixPool.insecureFallbackUsed());
        } finally {
            lock.unlock();
        }
    }
}
