package dev.linguaroute.routing;

/**
 * Locale chosen for one request, passed explicitly to handlers and services.
 *
 * @param code     active locale code
 * @param path     request path with the locale segment stripped, always starting with {@code /}
 * @param prefixed whether the locale came from the first path segment
 */
public record ActiveLocale(String code, String path, boolean prefixed) {

    /** Exchange attribute under which {@link dev.linguaroute.config.LocalePrefixFilter} stores the value. */
    public static final String ATTRIBUTE = ActiveLocale.class.getName();

    /** Reactor context key. */
    public static final String CONTEXT_KEY = "locale";

    public java.util.Locale toLocale() {
        return java.util.Locale.forLanguageTag(code);
    }
}
