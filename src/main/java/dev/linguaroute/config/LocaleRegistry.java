package dev.linguaroute.config;

import dev.linguaroute.exception.LocaleConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Single source of truth for the locales the site is served in.
 * Immutable once built; safe to share across request threads.
 */
public final class LocaleRegistry {

    private final List<String> supportedLocales;
    private final Set<String> supportedLookup;
    private final String defaultLocale;
    private final String fallbackLocale;

    private LocaleRegistry(List<String> supportedLocales, String defaultLocale, String fallbackLocale) {
        this.supportedLocales = List.copyOf(supportedLocales);
        this.supportedLookup = Set.copyOf(supportedLocales);
        this.defaultLocale = defaultLocale;
        this.fallbackLocale = fallbackLocale;
    }

    /**
     * Build a registry, failing fast on structural mistakes.
     *
     * @param codes    supported locale codes, in the order routes are generated
     * @param defaultCode the unprefixed locale; must be one of {@code codes}
     * @param fallbackCode locale served when a translation is missing; {@code null} means the default
     * @throws LocaleConfigurationException if the set is empty, a code is malformed,
     *                                      or the default/fallback is not supported
     */
    public static LocaleRegistry of(Collection<String> codes, String defaultCode, String fallbackCode) {
        if (codes == null || codes.isEmpty()) {
            throw new LocaleConfigurationException("At least one supported locale must be configured");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String code : codes) {
            String value = normalize(code);
            if (value == null || value.contains("/")) {
                throw new LocaleConfigurationException("Invalid locale code: '" + code + "'");
            }
            normalized.add(value);
        }

        String defaultLocale = normalize(defaultCode);
        if (defaultLocale == null || !normalized.contains(defaultLocale)) {
            throw new LocaleConfigurationException(
                    "Default locale '" + defaultCode + "' is not in the supported set " + normalized);
        }

        String fallbackLocale = normalize(fallbackCode);
        if (fallbackLocale == null) {
            fallbackLocale = defaultLocale;
        } else if (!normalized.contains(fallbackLocale)) {
            throw new LocaleConfigurationException(
                    "Fallback locale '" + fallbackCode + "' is not in the supported set " + normalized);
        }

        return new LocaleRegistry(new ArrayList<>(normalized), defaultLocale, fallbackLocale);
    }

    public List<String> supportedLocales() {
        return supportedLocales;
    }

    public String defaultLocale() {
        return defaultLocale;
    }

    public String fallbackLocale() {
        return fallbackLocale;
    }

    /**
     * Exact, case-sensitive membership test. Path segments are matched verbatim.
     */
    public boolean isSupported(String code) {
        return code != null && supportedLookup.contains(code);
    }

    public boolean isDefault(String code) {
        return defaultLocale.equals(code);
    }

    private static String normalize(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "LocaleRegistry" + supportedLocales + " default=" + defaultLocale + " fallback=" + fallbackLocale;
    }
}
