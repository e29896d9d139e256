package com.sortableid.domain.error;

/**
 * Sealed type representing malformed identifiers handed to decode.
 * Always a caller-input problem.
 */
public sealed interface DecodeError {

    String message();

    String code();

    record Empty() implements DecodeError {
        public static final Empty INSTANCE = new Empty();
        @Override
        public String message() {
            return "ID cannot be empty";
        }

        @Override
        public String code() {
            return "ID_EMPTY";
        }
    }

    record WrongLength(int expected, int actual) implements DecodeError {
        @Override
        public String message() {
            return "ID must be exactly " + expected + " characters long (was " + actual + ")";
        }

        @Override
        public String code() {
            return "ID_WRONG_LENGTH";
        }
    }

    record ForeignSymbol(char symbol, int position) implements DecodeError {
        @Override
        public String message() {
            return "ID contains invalid character '" + symbol + "' at position " + position;
        }

        @Override
        public String code() {
            return "ID_INVALID_CHARACTER";
        }
    }

    record TimestampOutOfRange(String timestampPart) implements DecodeError {
        @Override
        public String message() {
            return "Timestamp field '" + timestampPart + "' is outside the representable time range";
        }

        @Override
        public String code() {
            return "ID_TIMESTAMP_OUT_OF_RANGE";
        }
    }
}
