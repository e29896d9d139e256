package com.sortableid.application.port.out;

/**
 * Port for cryptographically secure random bytes.
 * Abstracts the entropy source so tests can supply fixed byte sequences.
 */
public interface RandomSource {

    /**
     * Fills {@code target} completely with random bytes.
     *
     * @throws RandomSourceException if the source cannot deliver
     */
    void nextBytes(byte[] target);
}
