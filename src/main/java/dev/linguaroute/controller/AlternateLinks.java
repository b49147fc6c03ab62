package dev.linguaroute.controller;

import dev.linguaroute.config.LocaleRegistry;
import dev.linguaroute.entity.Translation;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds the per-locale {@code slug} variables for language switcher links.
 */
final class AlternateLinks {

    private AlternateLinks() {}

    /**
     * Each locale gets its own slug. A locale without a translation gets the default-locale slug,
     * then the fallback-locale slug, which is what the slug lookup accepts for that locale.
     * Locales with neither are left out.
     */
    static Map<String, Map<String, String>> slugVariables(LocaleRegistry registry,
                                                           Map<String, Translation> translations) {
        Map<String, Map<String, String>> variables = new HashMap<>();
        for (String locale : registry.supportedLocales()) {
            Translation translation = translations.get(locale);
            if (translation == null) {
                translation = translations.get(registry.defaultLocale());
            }
            if (translation == null) {
                translation = translations.get(registry.fallbackLocale());
            }
            if (translation != null) {
                variables.put(locale, Map.of("slug", translation.getSlug()));
            }
        }
        return variables;
    }
}
