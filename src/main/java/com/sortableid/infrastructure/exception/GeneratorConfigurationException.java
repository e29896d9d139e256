package com.sortableid.infrastructure.exception;

import com.sortableid.domain.error.ConfigurationError;

/**
 * Raised at startup when the configured generator settings do not resolve.
 */
public class GeneratorConfigurationException extends RuntimeException {

    private final String errorCode;

    public GeneratorConfigurationException(ConfigurationError error) {
        super(error.message());
        this.errorCode = error.code();
    }

    public GeneratorConfigurationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
