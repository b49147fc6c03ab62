package dev.linguaroute.routing;

import java.util.Map;

/**
 * Language-independent route definition as read from {@code routes.json}.
 *
 * @param key     stable key, also the path fallback for locales without a translation
 * @param method  HTTP method, {@code GET} when omitted
 * @param handler bean name of the {@link LocalizedHandler} serving the route
 * @param paths   per-locale path segment, may contain URI template variables
 */
public record LogicalRoute(String key, String method, String handler, Map<String, String> paths) {

    public LogicalRoute {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(java.util.Locale.ROOT);
        paths = paths == null ? Map.of() : Map.copyOf(paths);
    }

    public static LogicalRoute get(String key, String handler, Map<String, String> paths) {
        return new LogicalRoute(key, "GET", handler, paths);
    }
}
