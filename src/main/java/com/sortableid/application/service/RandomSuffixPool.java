package com.sortableid.application.service;

import com.sortableid.application.port.out.MetricsPort;
import com.sortableid.application.port.out.RandomSource;
import com.sortableid.application.port.out.RandomSourceException;
import com.sortableid.domain.model.Alphabet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Buffered source of uniformly distributed alphabet symbols.
 *
 * <p>Bytes are fetched from the {@link RandomSource} in batches. Each byte is masked down to the
 * smallest {@code 2^k - 1} covering the alphabet's highest index and redrawn when it lands past it,
 * so low-index symbols are not favoured the way a plain modulo would.
 *
 * <p>Not thread-safe; the owning generator calls it under its own lock.
 */
public final class RandomSuffixPool {

    private static final Logger log = LoggerFactory.getLogger(RandomSuffixPool.class);

    public static final int DEFAULT_POOL_SIZE = 1024;

    private final Alphabet alphabet;
    private final RandomSource source;
    private final boolean allowInsecureFallback;
    private final MetricsPort metrics;
    private final byte[] pool;
    private final int mask;

    private int offset;
    private SplittableRandom fallback;
    private boolean insecureFallbackUsed;

    public RandomSuffixPool(
            Alphabet alphabet,
            RandomSource source,
            int poolSize,
            boolean allowInsecureFallback,
            MetricsPort metrics) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be positive (was " + poolSize + ")");
        }
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.allowInsecureFallback = allowInsecureFallback;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.pool = new byte[poolSize];
        this.mask = maskFor(alphabet.size());
        this.offset = poolSize; // first draw triggers a refill
    }

    /**
     * Smallest all-ones bit mask that covers {@code size - 1}.
     */
    static int maskFor(int size) {
        int highest = size - 1;
        return (Integer.highestOneBit(highest) << 1) - 1;
    }

    /**
     * @throws RandomSourceException if the secure source fails and the insecure fallback is disabled
     */
    public char nextSymbol() {
        while (true) {
            if (offset >= pool.length) {
                refill();
            }
            int index = pool[offset++] & mask;
            if (index < alphabet.size()) {
                return alphabet.symbolAt(index);
            }
        }
    }

    public String nextSymbols(int count) {
        char[] out = new char[count];
        for (int i = 0; i < count; i++) {
            out[i] = nextSymbol();
        }
        return new String(out);
    }

    public boolean insecureFallbackUsed() {
        return insecureFallbackUsed;
    }

    int mask() {
        return mask;
    }

    private void refill() {
        try {
            source.nextBytes(pool);
        } catch (RandomSourceException e) {
            if (!allowInsecureFallback) {
                throw e;
            }
            log.warn("Secure random source failed, refilling {} bytes from insecure fallback: {}", pool.length, e.getMessage());
            fillInsecure();
            insecureFallbackUsed = true;
            metrics.incrementRandomFallbacks();
        }
        offset = 0;
    }

    private void fillInsecure() {
        if (fallback == null) {
            fallback = new SplittableRandom(System.nanoTime() ^ System.currentTimeMillis());
        }
        for (int i = 0; i < pool.length; i++) {
            pool[i] = (byte) fallback.nextInt(256);
        }
    }
}
