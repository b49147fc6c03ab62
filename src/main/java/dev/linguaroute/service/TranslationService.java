package dev.linguaroute.service;

import dev.linguaroute.config.LocaleRegistry;
import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.entity.Translation;
import dev.linguaroute.metrics.TranslationMetrics;
import dev.linguaroute.repository.TranslationStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Locale-parameterized access to translation stores, with the fallback chain
 * requested locale, default locale, fallback locale, entity's original locale.
 */
@Service
@RequiredArgsConstructor
@Validated
@Slf4j
public class TranslationService {

    private final LocaleRegistry localeRegistry;
    private final TranslationMetrics metrics;

    /**
     * Locales tried, in order, when serving {@code requestedLocale}. Duplicates and nulls are dropped.
     */
    public List<String> fallbackChain(String requestedLocale, String originalLocale) {
        Set<String> chain = new LinkedHashSet<>();
        if (requestedLocale != null) {
            chain.add(requestedLocale);
        }
        chain.add(localeRegistry.defaultLocale());
        chain.add(localeRegistry.fallbackLocale());
        if (originalLocale != null) {
            chain.add(originalLocale);
        }
        return new ArrayList<>(chain);
    }

    /**
     * Serve an entity's translation in the requested locale or the first available one along the chain.
     * Makes a single {@code getAll} call on the store.
     *
     * @return the resolved translation, or empty when the entity has none along the chain
     */
    public Mono<ResolvedTranslation> resolve(TranslationStore store, Long entityId,
                                             String originalLocale, String requestedLocale) {
        List<String> chain = fallbackChain(requestedLocale, originalLocale);
        return store.getAll(entityId)
                .flatMap(all -> {
                    for (String locale : chain) {
                        Translation translation = all.get(locale);
                        if (translation != null) {
                            ResolvedTranslation resolved = new ResolvedTranslation(translation, requestedLocale);
                            if (resolved.fallback()) {
                                log.debug("Entity {} has no '{}' translation, serving '{}'", entityId, requestedLocale, locale);
                                metrics.recordFallback(requestedLocale, locale);
                            } else {
                                metrics.recordHit();
                            }
                            return Mono.just(resolved);
                        }
                    }
                    log.debug("Entity {} has no translation along {}", entityId, chain);
                    metrics.recordMiss();
                    return Mono.empty();
                });
    }

    /**
     * Find the translation owning a localized slug, trying the requested locale first and then
     * the default and fallback locales, so untranslated pages stay reachable under the fallback slug.
     */
    public Mono<Translation> findBySlug(TranslationStore store, String requestedLocale, String slug) {
        return Flux.fromIterable(fallbackChain(requestedLocale, null))
                .concatMap(locale -> store.findBySlug(locale, slug))
                .next();
    }

    public Mono<Map<String, Translation>> translations(TranslationStore store, Long entityId) {
        return store.getAll(entityId);
    }

    /**
     * Insert or overwrite one translation.
     *
     * @param label table label used for metrics
     * @throws IllegalArgumentException (as error signal) if the locale is not supported
     */
    public Mono<Translation> put(TranslationStore store, String label, Long entityId,
                                 String locale, @Valid TranslationFields fields) {
        if (!localeRegistry.isSupported(locale)) {
            return Mono.error(new IllegalArgumentException("Unsupported locale: " + locale));
        }
        return store.put(entityId, locale, fields)
                .doOnSuccess(t -> {
                    metrics.recordWrite(label);
                    log.info("Saved {} translation {}/{} (slug={})", label, entityId, locale, fields.getSlug());
                });
    }
}
