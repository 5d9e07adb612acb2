package kinet.deckkit;

/**
 * Invalid deck configuration: an unknown theme color, an unsupported shape kind or a manifest that
 * cannot be read. The message names the offending key or source.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
