package dev.linguaroute.exception;

/**
 * Structural misconfiguration of locales or routes.
 * Thrown while the application context starts; never recovered from.
 */
public class LocaleConfigurationException extends IllegalStateException {

    public LocaleConfigurationException(String message) {
        super(message);
    }

    public LocaleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
