package com.sortableid.domain.codec;

import com.sortableid.domain.error.DecodeError;
import com.sortableid.domain.model.Alphabet;
import com.sortableid.domain.model.Result;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fixed-width, big-endian base-N codec over an {@link Alphabet}.
 * Values are non-negative bucket counts; the left is padded with the alphabet's lowest symbol.
 */
public final class BaseNCodec {

    private final Alphabet alphabet;
    private final int base;

    public BaseNCodec(Alphabet alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet must not be null");
        this.base = alphabet.size();
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * Encodes {@code value} into exactly {@code width} symbols.
     *
     * @throws IllegalArgumentException if the value is negative or needs more than {@code width} symbols
     */
    public String encode(long value, int width) {
        if (value < 0) {
            throw new IllegalArgumentException("Cannot encode negative value " + value);
        }
        char[] out = new char[width];
        long remaining = value;
        for (int i = width - 1; i >= 0; i--) {
            out[i] = alphabet.symbolAt((int) (remaining % base));
            remaining /= base;
        }
        if (remaining != 0) {
            throw new IllegalArgumentException("Value " + value + " does not fit in " + width + " base-" + base + " symbols");
        }
        return new String(out);
    }

    /**
     * Decodes exactly {@code width} symbols back into their value.
     */
    public Result<Long, DecodeError> decode(String symbols, int width) {
        if (symbols == null || symbols.isEmpty()) {
            return Result.failure(DecodeError.Empty.INSTANCE);
        }
        if (symbols.length() != width) {
            return Result.failure(new DecodeError.WrongLength(width, symbols.length()));
        }
        long limit = (Long.MAX_VALUE - alphabet.maxIndex()) / base;
        long total = 0;
        for (int i = 0; i < symbols.length(); i++) {
            int digit = alphabet.indexOf(symbols.charAt(i));
            if (digit < 0) {
                return Result.failure(new DecodeError.ForeignSymbol(symbols.charAt(i), i));
            }
            if (total > limit) {
                return Result.failure(new DecodeError.TimestampOutOfRange(symbols));
            }
            total = total * base + digit;
        }
        return Result.success(total);
    }

    /**
     * Capacity of a field: {@code base ^ width}.
     */
    public BigInteger capacity(int width) {
        return BigInteger.valueOf(base).pow(width);
    }

    /**
     * Smallest width of at least one symbol whose capacity exceeds {@code count}.
     */
    public int widthFor(BigInteger count) {
        return widthFor(count, base);
    }

    static int widthFor(BigInteger count, int base) {
        BigInteger radix = BigInteger.valueOf(base);
        BigInteger capacity = radix;
        int width = 1;
        while (capacity.compareTo(count) <= 0) {
            capacity = capacity.multiply(radix);
            width++;
        }
        return width;
    }
}
