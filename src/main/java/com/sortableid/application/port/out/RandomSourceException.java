package com.sortableid.application.port.out;

/**
 * Thrown by a {@link RandomSource} that cannot produce secure bytes.
 */
public class RandomSourceException extends RuntimeException {

    public RandomSourceException(String message) {
        super(message);
    }

    public RandomSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
