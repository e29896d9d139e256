package com.sortableid.domain.codec;

import com.sortableid.domain.model.Alphabet;

import java.util.Objects;
import java.util.Optional;

/**
 * Odometer increment over a string of alphabet symbols.
 * The result is always exactly one unit above the input in the alphabet's base, so string order is kept
 * without converting the field to a native integer.
 */
public final class SequenceCascade {

    private final Alphabet alphabet;

    public SequenceCascade(Alphabet alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet must not be null");
    }

    /**
     * Returns the successor of {@code symbols}, or empty when every symbol is already the highest one.
     *
     * @throws IllegalArgumentException if a symbol is not part of the alphabet
     */
    public Optional<String> advance(String symbols) {
        char[] chars = symbols.toCharArray();
        int[] digits = new int[chars.length];
        for (int i = 0; i < chars.length; i++) {
            digits[i] = alphabet.indexOf(chars[i]);
            if (digits[i] < 0) {
                throw new IllegalArgumentException("Symbol '" + chars[i] + "' at position " + i + " is not in the alphabet");
            }
        }
        for (int i = chars.length - 1; i >= 0; i--) {
            int index = digits[i];
            if (index < alphabet.maxIndex()) {
                chars[i] = alphabet.symbolAt(index + 1);
                return Optional.of(new String(chars));
            }
            // rollover, carry left
            chars[i] = alphabet.first();
        }
        return Optional.empty();
    }
}
