package dev.fumaz.instill.exception;

/**
 * Indicates an invalid environment setting supplied through system properties or environment variables.
 */
public class ConfigurationException extends InstillException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
