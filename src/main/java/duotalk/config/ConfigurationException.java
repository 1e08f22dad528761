package duotalk.config;

/**
 * Thrown when the process configuration is missing or invalid.
 * This is the only failure allowed to stop the whole server.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
