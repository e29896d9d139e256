package com.sortableid.infrastructure.config;

import com.sortableid.domain.model.GeneratorSettings;
import com.sortableid.domain.model.SortableRate;
import com.sortableid.domain.model.TimeGranularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "sortable-id")
public class SortableIdProperties {

    private String alphabet = GeneratorSettings.DEFAULT_ALPHABET;
    private int totalLength = GeneratorSettings.DEFAULT_TOTAL_LENGTH;
    private String epochStart = GeneratorSettings.DEFAULT_EPOCH_START.toString();
    private String epochEnd;
    private Integer timestampLength;
    private TimeGranularity granularity = GeneratorSettings.DEFAULT_GRANULARITY;
    private SortableRate rate = GeneratorSettings.DEFAULT_RATE;
    @Valid
    private Random random = new Random();
    @Valid
    private Exhaustion exhaustion = new Exhaustion();

    public String getAlphabet() {
        return alphabet;
    }

    public void setAlphabet(String alphabet) {
        this.alphabet = alphabet;
    }

    public int getTotalLength() {
        return totalLength;
    }

    public void setTotalLength(int totalLength) {
        this.totalLength = totalLength;
    }

    public String getEpochStart() {
        return epochStart;
    }

    public void setEpochStart(String epochStart) {
        this.epochStart = epochStart;
    }

    public String getEpochEnd() {
        return epochEnd;
    }

    public void setEpochEnd(String epochEnd) {
        this.epochEnd = epochEnd;
    }

    public Integer getTimestampLength() {
        return timestampLength;
    }

    public void setTimestampLength(Integer timestampLength) {
        this.timestampLength = timestampLength;
    }

    public TimeGranularity getGranularity() {
        return granularity;
    }

    public void setGranularity(TimeGranularity granularity) {
        this.granularity = granularity;
    }

    public SortableRate getRate() {
        return rate;
    }

    public void setRate(SortableRate rate) {
        this.rate = rate;
    }

    public Random getRandom() {
        return random;
    }

    public void setRandom(Random random) {
        this.random = random;
    }

    public Exhaustion getExhaustion() {
        return exhaustion;
    }

    public void setExhaustion(Exhaustion exhaustion) {
        this.exhaustion = exhaustion;
    }

    public static class Random {
        @Min(1)
        private int poolSize = 1024;
        private String algorithm;
        private boolean allowInsecureFallback;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(String algorithm) {
            this.algorithm = algorithm;
        }

        public boolean isAllowInsecureFallback() {
            return allowInsecureFallback;
        }

        public void setAllowInsecureFallback(boolean allowInsecureFallback) {
            this.allowInsecureFallback = allowInsecureFallback;
        }
    }

    public static class Exhaustion {
        private boolean waitForNextBucket;
        @Min(0)
        private int maxRetries = 3;
        @Min(0)
        private long pauseMs = 1;

        public boolean isWaitForNextBucket() {
            return waitForNextBucket;
        }

        public void setWaitForNextBucket(boolean waitForNextBucket) {
            this.waitForNextBucket = waitForNextBucket;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getPauseMs() {
            return pauseMs;
        }

        public void setPauseMs(long pauseMs) {
            this.pauseMs = pauseMs;
        }
    }
}
