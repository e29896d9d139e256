package com.sortableid.domain.error;

import java.time.Instant;

/**
 * Sealed type representing invalid generator configuration.
 * Detected while resolving settings; a generator is never built from a configuration that fails here.
 */
public sealed interface ConfigurationError {

    String message();

    String code();

    record AlphabetTooShort(int size, int minimum) implements ConfigurationError {
        @Override
        public String message() {
            return "Alphabet must contain at least " + minimum + " symbols (was " + size + ")";
        }

        @Override
        public String code() {
            return "ALPHABET_TOO_SHORT";
        }
    }

    record AlphabetTooLong(int size, int maximum) implements ConfigurationError {
        @Override
        public String message() {
            return "Alphabet must contain no more than " + maximum + " symbols (was " + size + ")";
        }

        @Override
        public String code() {
            return "ALPHABET_TOO_LONG";
        }
    }

    record DuplicateSymbol(char symbol) implements ConfigurationError {
        @Override
        public String message() {
            return "Alphabet must contain unique symbols, '" + symbol + "' appears more than once";
        }

        @Override
        public String code() {
            return "ALPHABET_DUPLICATE_SYMBOL";
        }
    }

    /**
     * Symbols outside the Basic Multilingual Plane would occupy two chars and break fixed-width IDs.
     */
    record UnsupportedSymbol(int position) implements ConfigurationError {
        @Override
        public String message() {
            return "Alphabet symbol at position " + position + " is a surrogate; only single-char symbols are supported";
        }

        @Override
        public String code() {
            return "ALPHABET_UNSUPPORTED_SYMBOL";
        }
    }

    record InvalidEpochRange(Instant start, Instant end) implements ConfigurationError {
        @Override
        public String message() {
            return "Epoch end " + end + " cannot be before epoch start " + start;
        }

        @Override
        public String code() {
            return "INVALID_EPOCH_RANGE";
        }
    }

    record InvalidEpochFormat(String property, String value) implements ConfigurationError {
        @Override
        public String message() {
            return "Property " + property + " must be an ISO-8601 instant (was '" + value + "')";
        }

        @Override
        public String code() {
            return "INVALID_EPOCH_FORMAT";
        }
    }

    record InvalidTotalLength(int totalLength, int minimum) implements ConfigurationError {
        @Override
        public String message() {
            return "Total length must be at least " + minimum + " (was " + totalLength + ")";
        }

        @Override
        public String code() {
            return "INVALID_TOTAL_LENGTH";
        }
    }

    record InvalidTimestampLength(int timestampLength) implements ConfigurationError {
        @Override
        public String message() {
            return "Explicit timestamp length must be at least 1 (was " + timestampLength + ")";
        }

        @Override
        public String code() {
            return "INVALID_TIMESTAMP_LENGTH";
        }
    }

    record LengthBudgetExceeded(int totalLength, int timestampLength, int chronoLength) implements ConfigurationError {
        public int requiredLength() {
            return timestampLength + chronoLength + 1;
        }

        @Override
        public String message() {
            return "Total length must be at least " + requiredLength()
                + " (timestamp: " + timestampLength + ", chrono: " + chronoLength + ", minimum suffix: 1), was "
                + totalLength;
        }

        @Override
        public String code() {
            return "LENGTH_BUDGET_EXCEEDED";
        }
    }
}
