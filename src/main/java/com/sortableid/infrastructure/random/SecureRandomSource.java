package com.sortableid.infrastructure.random;

import com.sortableid.application.port.out.RandomSource;
import com.sortableid.application.port.out.RandomSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * {@link RandomSource} backed by the JDK's {@link SecureRandom}.
 */
public class SecureRandomSource implements RandomSource {

    private static final Logger log = LoggerFactory.getLogger(SecureRandomSource.class);

    private final SecureRandom secureRandom;

    public SecureRandomSource(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Uses the platform default algorithm, or the named one when {@code algorithm} is set.
     *
     * @throws NoSuchAlgorithmException if the named algorithm is not available
     */
    public static SecureRandomSource create(String algorithm) throws NoSuchAlgorithmException {
        SecureRandom random = algorithm == null || algorithm.isBlank()
            ? new SecureRandom()
            : SecureRandom.getInstance(algorithm);
        log.info("Using secure random algorithm {} from provider {}", random.getAlgorithm(), random.getProvider().getName());
        return new SecureRandomSource(random);
    }

    @Override
    public void nextBytes(byte[] target) {
        try {
            secureRandom.nextBytes(target);
        } catch (RuntimeException e) {
            throw new RandomSourceException("SecureRandom " + secureRandom.getAlgorithm() + " failed to produce bytes", e);
        }
    }
}
