package com.sortableid.application.service;

import com.sortableid.application.port.in.DecodeIdUseCase;
import com.sortableid.application.port.in.DescribeGeneratorUseCase;
import com.sortableid.application.port.in.GenerateIdUseCase;
import com.sortableid.application.port.out.MetricsPort;
import com.sortableid.application.port.out.Sleeper;
import com.sortableid.domain.error.DecodeError;
import com.sortableid.domain.error.GenerationError;
import com.sortableid.domain.model.DecodedId;
import com.sortableid.domain.model.GeneratorInfo;
import com.sortableid.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class SortableIdService implements GenerateIdUseCase, DecodeIdUseCase, DescribeGeneratorUseCase {

    private static final Logger log = LoggerFactory.getLogger(SortableIdService.class);

    public static final int MAX_BATCH_SIZE = 1000;

    private final SortableIdGenerator generator;
    private final ExhaustionPolicy exhaustionPolicy;
    private final Sleeper sleeper;
    private final MetricsPort metrics;

    public SortableIdService(
            SortableIdGenerator generator,
            ExhaustionPolicy exhaustionPolicy,
            Sleeper sleeper,
            MetricsPort metrics) {
        this.generator = generator;
        this.exhaustionPolicy = exhaustionPolicy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    @Override
    public Result<String, GenerationError> generate() {
        Result<String, GenerationError> result = metrics.recordGenerateDuration(this::generateWithPolicy);
        if (result.isSuccess()) {
            metrics.incrementIdsGenerated(1);
            log.debug("Generated id={}", result.getOrThrow());
        } else {
            recordFailure(result.errorOrNull());
        }
        return result;
    }

    @Override
    public Result<List<String>, GenerationError> generateBatch(int count) {
        if (count < 1 || count > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("Batch size must be between 1 and " + MAX_BATCH_SIZE + " (was " + count + ")");
        }
        log.debug("Generating batch of {} ids", count);

        List<String> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Result<String, GenerationError> result = metrics.recordGenerateDuration(this::generateWithPolicy);
            if (result.isFailure()) {
                if (!ids.isEmpty()) {
                    metrics.incrementIdsGenerated(ids.size());
                }
                recordFailure(result.errorOrNull());
                log.warn("Batch generation stopped after {} of {} ids: {}", ids.size(), count, result.errorOrNull().code());
                return Result.failure(result.errorOrNull());
            }
            ids.add(result.getOrThrow());
        }
        metrics.incrementIdsGenerated(ids.size());
        return Result.success(ids);
    }

    private Result<String, GenerationError> generateWithPolicy() {
        Result<String, GenerationError> result = generator.generate();
        int retries = 0;
        while (shouldWait(result, retries)) {
            retries++;
            metrics.incrementBucketWaits();
            log.debug("Bucket exhausted, waiting {} before retry {}/{}", exhaustionPolicy.pause(), retries, exhaustionPolicy.maxRetries());
            try {
                // the generator lock is not held here
                sleeper.sleep(exhaustionPolicy.pause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for the next bucket after {} retries", retries);
                return result;
            }
            result = generator.generate();
        }
        return result;
    }

    private boolean shouldWait(Result<String, GenerationError> result, int retries) {
        return result.isFailure()
            && result.errorOrNull() instanceof GenerationError.RateExceeded
            && exhaustionPolicy.waitForNextBucket()
            && retries < exhaustionPolicy.maxRetries();
    }

    private void recordFailure(GenerationError error) {
        if (error instanceof GenerationError.RateExceeded) {
            metrics.incrementRateExceeded();
            log.warn("Generation rate exceeded: {}", error.message());
        } else if (error instanceof GenerationError.TimestampExhausted) {
            metrics.incrementTimestampExhausted();
            log.error("Timestamp field exhausted: {}", error.message());
        } else {
            log.error("Generation failed [{}]: {}", error.code(), error.message());
        }
    }

    @Override
    public Result<DecodedId, DecodeError> decode(String id) {
        Result<DecodedId, DecodeError> result = generator.decode(id);
        if (result.isFailure()) {
            metrics.incrementDecodeFailures();
            log.warn("Decode failed for id={}: {}", id, result.errorOrNull().message());
        }
        return result;
    }

    @Override
    public GeneratorInfo describe() {
        return generator.describe();
    }

    @Override
    public Instant maxSupportedInstant() {
        return generator.maxSupportedInstant();
    }
}
