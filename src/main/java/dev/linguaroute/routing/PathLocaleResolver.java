package dev.linguaroute.routing;

import dev.linguaroute.config.LocaleRegistry;
import lombok.RequiredArgsConstructor;

/**
 * Picks the active locale from the first path segment.
 * <p>
 * A segment that matches a supported code activates that locale and is stripped
 * from the path; anything else leaves the path alone and activates the default.
 * Never throws: unknown or malformed prefixes simply mean "no prefix".
 * </p>
 */
@RequiredArgsConstructor
public class PathLocaleResolver {

    private final LocaleRegistry registry;

    public ActiveLocale resolve(String requestPath) {
        if (requestPath == null || requestPath.isBlank()) {
            return new ActiveLocale(registry.defaultLocale(), "/", false);
        }

        String trimmed = requestPath.startsWith("/") ? requestPath.substring(1) : requestPath;
        int slash = trimmed.indexOf('/');
        String first = slash < 0 ? trimmed : trimmed.substring(0, slash);

        if (registry.isSupported(first)) {
            String remaining = slash < 0 ? "/" : trimmed.substring(slash);
            return new ActiveLocale(first, remaining, true);
        }

        String path = requestPath.startsWith("/") ? requestPath : "/" + requestPath;
        return new ActiveLocale(registry.defaultLocale(), path, false);
    }

    public LocaleRegistry registry() {
        return registry;
    }
}
