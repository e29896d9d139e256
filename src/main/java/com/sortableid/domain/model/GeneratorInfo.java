package com.sortableid.domain.model;

import java.time.Instant;

/**
 * Diagnostic snapshot of a generator's configuration.
 */
public record GeneratorInfo(
    String alphabet,
    int alphabetSize,
    int totalLength,
    int timestampLength,
    int chronoLength,
    int suffixLength,
    TimeGranularity granularity,
    SortableRate rate,
    Instant epochStart,
    Instant epochEnd,
    Instant maxSupportedInstant,
    boolean insecureRandomFallbackUsed
) {
    public static GeneratorInfo from(GeneratorConfig config, boolean insecureRandomFallbackUsed) {
        return new GeneratorInfo(
            config.alphabet().asString(),
            config.alphabet().size(),
            config.totalLength(),
            config.timestampLength(),
            config.chronoLength(),
            config.suffixLength(),
            config.granularity(),
            config.rate(),
            config.epochStart(),
            config.epochEnd(),
            config.maxSupportedInstant(),
            insecureRandomFallbackUsed
        );
    }
}
