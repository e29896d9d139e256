package com.sortableid.domain.error;

import com.sortableid.domain.model.TimeGranularity;

import java.time.Instant;

/**
 * Sealed type representing expected failures of a single generate call.
 * None of these leave the generator in a corrupted state.
 */
public sealed interface GenerationError {

    String message();

    String code();

    /**
     * The current bucket no longer fits in the timestamp field. Only reconfiguration helps.
     */
    record TimestampExhausted(long bucket, Instant maxSupportedInstant) implements GenerationError {
        @Override
        public String message() {
            return "Current time exceeds maximum supported timestamp " + maxSupportedInstant
                + "; increase the timestamp length or use a coarser granularity";
        }

        @Override
        public String code() {
            return "TIMESTAMP_EXHAUSTED";
        }
    }

    /**
     * Both the chrono field and the chrono+suffix fields are exhausted for the current bucket.
     * The caller may wait for the next bucket.
     */
    record RateExceeded(TimeGranularity granularity, int totalLength) implements GenerationError {
        @Override
        public String message() {
            return "Too many IDs generated within one " + granularity.label()
                + " bucket (total length " + totalLength + "); slow down or widen the chrono field";
        }

        @Override
        public String code() {
            return "RATE_EXCEEDED";
        }
    }

    record ClockBeforeEpoch(Instant now, Instant epochStart) implements GenerationError {
        @Override
        public String message() {
            return "Clock reads " + now + " which is before the configured epoch start " + epochStart;
        }

        @Override
        public String code() {
            return "CLOCK_BEFORE_EPOCH";
        }
    }

    record RandomnessUnavailable(String reason) implements GenerationError {
        @Override
        public String message() {
            return "Secure random source failed: " + reason;
        }

        @Override
        public String code() {
            return "RANDOMNESS_UNAVAILABLE";
        }
    }
}
