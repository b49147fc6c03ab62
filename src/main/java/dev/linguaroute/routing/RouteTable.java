package dev.linguaroute.routing;

import org.springframework.web.util.UriTemplate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable route table generated at startup by {@link RouteTableBuilder}.
 * Entries keep build order; lookups by name and by (key, locale) are O(1).
 */
public final class RouteTable {

    private final List<RouteEntry> entries;
    private final List<String> locales;
    private final Map<String, RouteEntry> byName;

    RouteTable(List<RouteEntry> entries, List<String> locales, Map<String, RouteEntry> byName) {
        this.entries = List.copyOf(entries);
        this.locales = List.copyOf(locales);
        this.byName = Map.copyOf(byName);
    }

    public List<RouteEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Optional<RouteEntry> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<RouteEntry> lookup(String routeKey, String locale) {
        return findByName(routeKey + "." + locale);
    }

    /**
     * Absolute URL of a route in a locale, with template variables expanded.
     *
     * @throws IllegalArgumentException if the route does not exist for the locale
     *                                  or a template variable is missing
     */
    public String urlFor(String routeKey, String locale, Map<String, ?> variables) {
        RouteEntry entry = lookup(routeKey, locale)
                .orElseThrow(() -> new IllegalArgumentException("No route '" + routeKey + "' for locale " + locale));
        return expand(entry, variables != null ? variables : Map.of());
    }

    public String urlFor(String routeKey, String locale) {
        return urlFor(routeKey, locale, Map.of());
    }

    /**
     * Language switcher links for one logical route: locale to URL, in registry order.
     * Locales whose variables are not supplied (e.g. no localized slug exists) are left out.
     *
     * @param variablesByLocale template variables per locale; a locale absent here gets none
     */
    public Map<String, String> alternates(String routeKey, Map<String, ? extends Map<String, ?>> variablesByLocale) {
        Map<String, String> links = new LinkedHashMap<>();
        for (String locale : locales) {
            Optional<RouteEntry> entry = lookup(routeKey, locale);
            if (entry.isEmpty()) {
                continue;
            }
            Map<String, ?> variables = variablesByLocale.get(locale);
            UriTemplate template = new UriTemplate(entry.get().pattern());
            if (!template.getVariableNames().isEmpty()
                    && (variables == null || !variables.keySet().containsAll(template.getVariableNames()))) {
                continue;
            }
            links.put(locale, template.expand(variables != null ? variables : Map.of()).toString());
        }
        return Collections.unmodifiableMap(links);
    }

    public Map<String, String> alternates(String routeKey) {
        return alternates(routeKey, Map.of());
    }

    private String expand(RouteEntry entry, Map<String, ?> variables) {
        UriTemplate template = new UriTemplate(entry.pattern());
        if (!variables.keySet().containsAll(template.getVariableNames())) {
            throw new IllegalArgumentException("Route '" + entry.name() + "' requires variables "
                    + template.getVariableNames() + " but got " + variables.keySet());
        }
        return template.expand(variables).toString();
    }
}
