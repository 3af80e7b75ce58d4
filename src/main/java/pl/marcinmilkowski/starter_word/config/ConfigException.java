package pl.marcinmilkowski.starter_word.config;

/**
 * Thrown when configuration is missing, unreadable or invalid.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
