package dev.linguaroute.service;

import dev.linguaroute.entity.Translation;

/**
 * Outcome of a fallback-aware lookup.
 *
 * @param translation     the translation that was served
 * @param requestedLocale the locale the caller asked for
 */
public record ResolvedTranslation(Translation translation, String requestedLocale) {

    public String servedLocale() {
        return translation.getLocale();
    }

    public boolean fallback() {
        return !translation.getLocale().equals(requestedLocale);
    }
}
