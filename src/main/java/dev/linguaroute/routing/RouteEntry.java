package dev.linguaroute.routing;

/**
 * One concrete route generated for a (logical route, locale) pair.
 *
 * @param method     HTTP method
 * @param fullPath   path without leading slash; unprefixed for the default locale
 * @param handlerRef bean name of the handler
 * @param name       {@code key.locale}, unique across the table
 * @param routeKey   logical route key
 * @param locale     locale this entry serves
 */
public record RouteEntry(String method, String fullPath, String handlerRef, String name,
                         String routeKey, String locale) {

    public String pattern() {
        return "/" + fullPath;
    }
}
