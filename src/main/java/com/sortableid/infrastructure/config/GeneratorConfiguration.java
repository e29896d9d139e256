package com.sortableid.infrastructure.config;

import com.sortableid.application.port.out.MetricsPort;
import com.sortableid.application.port.out.RandomSource;
import com.sortableid.application.port.out.Sleeper;
import com.sortableid.application.service.ExhaustionPolicy;
import com.sortableid.application.service.RandomSuffixPool;
import com.sortableid.application.service.SortableIdGenerator;
import com.sortableid.application.service.SortableIdService;
import com.sortableid.domain.error.ConfigurationError;
import com.sortableid.domain.model.GeneratorConfig;
import com.sortableid.domain.model.GeneratorInfo;
import com.sortableid.domain.model.GeneratorSettings;
import com.sortableid.domain.model.Result;
import com.sortableid.infrastructure.exception.GeneratorConfigurationException;
import com.sortableid.infrastructure.random.SecureRandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Builds the generator from {@link SortableIdProperties}. Invalid settings fail the context at startup.
 */
@Configuration
public class GeneratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GeneratorConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RandomSource randomSource(SortableIdProperties properties) {
        String algorithm = properties.getRandom().getAlgorithm();
        try {
            return SecureRandomSource.create(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new GeneratorConfigurationException("UNKNOWN_RANDOM_ALGORITHM",
                "Secure random algorithm not available: " + algorithm, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public SortableIdGenerator sortableIdGenerator(
            SortableIdProperties properties,
            RandomSource randomSource,
            Clock clock,
            MetricsPort metrics) {
        GeneratorConfig config = toSettings(properties)
            .flatMap(GeneratorConfig::resolve)
            .orElseThrow(error -> {
                log.error("Invalid sortable-id configuration [{}]: {}", error.code(), error.message());
                return new GeneratorConfigurationException(error);
            });

        RandomSuffixPool pool = new RandomSuffixPool(
            config.alphabet(),
            randomSource,
            properties.getRandom().getPoolSize(),
            properties.getRandom().isAllowInsecureFallback(),
            metrics);
        if (properties.getRandom().isAllowInsecureFallback()) {
            log.warn("Insecure random fallback is enabled; suffixes may be predictable if the secure source fails");
        }

        SortableIdGenerator generator = new SortableIdGenerator(config, pool, clock);
        logInfo(generator.describe());
        return generator;
    }

    @Bean
    public ExhaustionPolicy exhaustionPolicy(SortableIdProperties properties) {
        SortableIdProperties.Exhaustion exhaustion = properties.getExhaustion();
        if (!exhaustion.isWaitForNextBucket()) {
            return ExhaustionPolicy.FAIL_FAST;
        }
        return ExhaustionPolicy.waitForNextBucket(exhaustion.getMaxRetries(), Duration.ofMillis(exhaustion.getPauseMs()));
    }

    @Bean
    public SortableIdService sortableIdService(
            SortableIdGenerator generator,
            ExhaustionPolicy exhaustionPolicy,
            Sleeper sleeper,
            MetricsPort metrics) {
        return new SortableIdService(generator, exhaustionPolicy, sleeper, metrics);
    }

    static Result<GeneratorSettings, ConfigurationError> toSettings(SortableIdProperties properties) {
        var start = parseInstant("sortable-id.epoch-start", properties.getEpochStart());
        if (start.isFailure()) {
            return Result.failure(start.errorOrNull());
        }
        var end = parseInstant("sortable-id.epoch-end", properties.getEpochEnd());
        if (end.isFailure()) {
            return Result.failure(end.errorOrNull());
        }
        return Result.success(new GeneratorSettings(
            properties.getAlphabet(),
            properties.getTotalLength(),
            start.getOrThrow(),
            end.getOrThrow(),
            properties.getTimestampLength(),
            properties.getGranularity(),
            properties.getRate()
        ));
    }

    private static Result<Instant, ConfigurationError> parseInstant(String property, String value) {
        if (value == null || value.isBlank()) {
            return Result.success(null);
        }
        try {
            return Result.success(Instant.parse(value.trim()));
        } catch (DateTimeParseException e) {
            return Result.failure(new ConfigurationError.InvalidEpochFormat(property, value));
        }
    }

    private void logInfo(GeneratorInfo info) {
        log.info("Sortable ID generator configured: totalLength={}, timestampLength={}, chronoLength={}, suffixLength={}, "
                + "granularity={}, rate={}, epochStart={}, epochEnd={}, maxSupportedInstant={}, alphabet({} symbols)={}",
            info.totalLength(), info.timestampLength(), info.chronoLength(), info.suffixLength(),
            info.granularity().label(), info.rate().label(), info.epochStart(), info.epochEnd(),
            info.maxSupportedInstant(), info.alphabetSize(), info.alphabet());
    }
}
