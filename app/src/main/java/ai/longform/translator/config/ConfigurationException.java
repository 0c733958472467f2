package ai.longform.translator.config;

/**
 * Invalid or missing settings. Raised before any request is issued.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
