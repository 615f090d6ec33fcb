package io.fullerstack.observables.config;

/**
 * Thrown when a required configuration key is missing or holds an invalid value.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
