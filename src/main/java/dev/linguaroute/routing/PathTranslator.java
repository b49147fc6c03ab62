package dev.linguaroute.routing;

import dev.linguaroute.exception.LocaleConfigurationException;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps (logical route key, locale) to the path segment used in URLs.
 * Immutable after construction.
 */
public final class PathTranslator {

    private final Map<String, Map<String, String>> segmentsByKey;

    private PathTranslator(Map<String, Map<String, String>> segmentsByKey) {
        this.segmentsByKey = Map.copyOf(segmentsByKey);
    }

    public static PathTranslator from(Collection<LogicalRoute> routes) {
        Map<String, Map<String, String>> segments = new HashMap<>();
        for (LogicalRoute route : routes) {
            if (route.key() == null || route.key().isBlank()) {
                throw new LocaleConfigurationException("Route key must not be blank");
            }
            Map<String, String> normalized = new HashMap<>();
            route.paths().forEach((locale, segment) -> normalized.put(locale, normalizeSegment(segment)));
            if (segments.putIfAbsent(route.key(), Map.copyOf(normalized)) != null) {
                throw new LocaleConfigurationException("Duplicate logical route key: " + route.key());
            }
        }
        return new PathTranslator(segments);
    }

    /**
     * Resolve the path segment for a route in a locale.
     * Falls back to the key itself when no translation is defined.
     */
    public String resolve(String logicalKey, String locale) {
        Map<String, String> translations = segmentsByKey.get(logicalKey);
        if (translations == null) {
            return logicalKey;
        }
        String segment = translations.get(locale);
        return segment != null ? segment : logicalKey;
    }

    /**
     * Strip surrounding slashes and whitespace; {@code ""} denotes the site root.
     */
    static String normalizeSegment(String segment) {
        if (segment == null) {
            return "";
        }
        String value = segment.trim();
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
