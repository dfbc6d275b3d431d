package com.depintel.core.exception;

/**
 * Thrown when an analysis type or configuration value is not acceptable.
 */
public class InvalidConfigurationException extends DependencyIntelligenceException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message, "INVALID_CONFIGURATION");
    }
}
