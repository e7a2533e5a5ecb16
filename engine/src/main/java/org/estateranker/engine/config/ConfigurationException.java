package org.estateranker.engine.config;

/**
 * Thrown when the scoring configuration cannot be loaded or is malformed.
 * Fatal at startup; a failed reload keeps the previous configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
