package com.depintel.core.exception;

/**
 * Base exception for engine errors.
 *
 * <p>Carries a stable error code so callers can map failures to API responses
 * without parsing messages.
 */
public class DependencyIntelligenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates an exception with a message and error code.
     *
     * @param message the error message
     * @param errorCode stable error code
     */
    public DependencyIntelligenceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates an exception with message, error code, and cause.
     *
     * @param message the error message
     * @param errorCode stable error code
     * @param cause the underlying cause
     */
    public DependencyIntelligenceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Returns the error code for this exception.
     *
     * @return the error code
     */
    public String getErrorCode() {
        return errorCode;
    }
}
