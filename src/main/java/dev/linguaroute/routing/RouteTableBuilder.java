package dev.linguaroute.routing;

import dev.linguaroute.config.LocaleRegistry;
import dev.linguaroute.exception.LocaleConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Expands logical routes into one concrete route per supported locale.
 * <p>
 * The default locale is served unprefixed ({@code about}); every other locale
 * carries its code as the first segment ({@code fr/a-propos}). Entry names are
 * {@code key.locale}. Duplicate names or paths are configuration errors.
 * </p>
 */
@Slf4j
public final class RouteTableBuilder {

    private static final Pattern URI_VARIABLE = Pattern.compile("\\{[^}]+}");

    private RouteTableBuilder() {}

    public static RouteTable build(List<LogicalRoute> routes, LocaleRegistry registry, PathTranslator translator) {
        List<RouteEntry> entries = new ArrayList<>(routes.size() * registry.supportedLocales().size());
        Map<String, RouteEntry> byName = new LinkedHashMap<>();
        Map<String, RouteEntry> byPath = new HashMap<>();

        for (LogicalRoute route : routes) {
            if (route.handler() == null || route.handler().isBlank()) {
                throw new LocaleConfigurationException("Route '" + route.key() + "' has no handler");
            }
            for (String locale : registry.supportedLocales()) {
                String segment = translator.resolve(route.key(), locale);
                String fullPath = fullPath(segment, locale, registry);
                String name = route.key() + "." + locale;

                if (registry.isDefault(locale)) {
                    checkNotShadowed(fullPath, name, registry);
                }

                RouteEntry entry = new RouteEntry(route.method(), fullPath, route.handler(), name, route.key(), locale);

                RouteEntry clash = byName.putIfAbsent(name, entry);
                if (clash != null) {
                    throw new LocaleConfigurationException("Duplicate route name: " + name);
                }
                String pathKey = route.method() + " " + URI_VARIABLE.matcher(fullPath).replaceAll("{}");
                clash = byPath.putIfAbsent(pathKey, entry);
                if (clash != null) {
                    throw new LocaleConfigurationException("Routes '" + clash.name() + "' and '" + name
                            + "' both map to " + route.method() + " /" + fullPath);
                }
                entries.add(entry);
            }
        }

        log.info("Built route table: {} routes x {} locales = {} entries",
                routes.size(), registry.supportedLocales().size(), entries.size());
        if (log.isDebugEnabled()) {
            entries.forEach(e -> log.debug("  {} {} -> {} ({})", e.method(), e.pattern(), e.handlerRef(), e.name()));
        }
        return new RouteTable(entries, registry.supportedLocales(), byName);
    }

    static String fullPath(String segment, String locale, LocaleRegistry registry) {
        if (registry.isDefault(locale)) {
            return segment;
        }
        return segment.isEmpty() ? locale : locale + "/" + segment;
    }

    // An unprefixed path starting with a locale code would be captured by the locale resolver.
    private static void checkNotShadowed(String fullPath, String name, LocaleRegistry registry) {
        int slash = fullPath.indexOf('/');
        String first = slash < 0 ? fullPath : fullPath.substring(0, slash);
        if (registry.isSupported(first)) {
            throw new LocaleConfigurationException("Default-locale route '" + name + "' path /" + fullPath
                    + " starts with locale code '" + first + "'");
        }
    }
}
