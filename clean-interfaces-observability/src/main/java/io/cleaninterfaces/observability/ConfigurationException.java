package io.cleaninterfaces.observability;

/**
 * Thrown when the observability configuration is invalid or incomplete, for example a file
 * export mode without a file path or a log directory that does not exist. Raised while the
 * pipeline is being constructed so that startup fails instead of silently losing logs.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
