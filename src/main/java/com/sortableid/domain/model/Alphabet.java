package com.sortableid.domain.model;

import com.sortableid.domain.error.ConfigurationError;

import java.util.Arrays;

/**
 * Value Object for the canonical alphabet: distinct single-char symbols sorted by char value.
 * A symbol's position is its digit value, so comparing IDs as strings compares them numerically.
 */
public final class Alphabet {

    public static final int MIN_SIZE = 2;
    public static final int MAX_SIZE = 255;

    private final char[] symbols;
    private final String canonical;

    private Alphabet(char[] sortedSymbols) {
        this.symbols = sortedSymbols;
        this.canonical = new String(sortedSymbols);
    }

    /**
     * Normalizes a raw alphabet, returning a Result for expected validation failures.
     */
    public static Result<Alphabet, ConfigurationError> of(String raw) {
        if (raw == null || raw.length() < MIN_SIZE) {
            return Result.failure(new ConfigurationError.AlphabetTooShort(raw == null ? 0 : raw.length(), MIN_SIZE));
        }
        if (raw.length() > MAX_SIZE) {
            return Result.failure(new ConfigurationError.AlphabetTooLong(raw.length(), MAX_SIZE));
        }
        for (int i = 0; i < raw.length(); i++) {
            if (Character.isSurrogate(raw.charAt(i))) {
                return Result.failure(new ConfigurationError.UnsupportedSymbol(i));
            }
        }

        char[] sorted = raw.toCharArray();
        Arrays.sort(sorted);
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] == sorted[i - 1]) {
                return Result.failure(new ConfigurationError.DuplicateSymbol(sorted[i]));
            }
        }
        return Result.success(new Alphabet(sorted));
    }

    public int size() {
        return symbols.length;
    }

    public int maxIndex() {
        return symbols.length - 1;
    }

    public char symbolAt(int index) {
        return symbols[index];
    }

    public char first() {
        return symbols[0];
    }

    public char last() {
        return symbols[symbols.length - 1];
    }

    /**
     * Returns the digit value of the symbol, or -1 if it is not part of the alphabet.
     */
    public int indexOf(char symbol) {
        int index = Arrays.binarySearch(symbols, symbol);
        return index >= 0 ? index : -1;
    }

    public boolean contains(char symbol) {
        return indexOf(symbol) >= 0;
    }

    /**
     * Returns {@code count} repetitions of the lowest symbol.
     */
    public String repeatFirst(int count) {
        return String.valueOf(first()).repeat(count);
    }

    public String asString() {
        return canonical;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet)) return false;
        return canonical.equals(((Alphabet) o).canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
