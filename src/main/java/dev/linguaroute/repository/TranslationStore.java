package dev.linguaroute.repository;

import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.entity.Translation;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Key-based access to one satellite translation table.
 * <p>
 * Exactly one translation exists per (entity id, locale). Writes are atomic upserts:
 * concurrent {@link #put} calls for the same key serialize and the last writer wins.
 * Each method is a single bounded call to the backing store; there is no retry here.
 * </p>
 */
public interface TranslationStore {

    /**
     * @return the translation, or empty when none exists for the pair
     */
    Mono<Translation> get(Long entityId, String locale);

    /**
     * @return all translations of the entity keyed by locale; an empty map when there are none
     */
    Mono<Map<String, Translation>> getAll(Long entityId);

    /**
     * Insert or overwrite the translation for the pair.
     */
    Mono<Translation> put(Long entityId, String locale, TranslationFields fields);

    /**
     * @return the translation whose slug in {@code locale} equals {@code slug}, or empty
     */
    Mono<Translation> findBySlug(String locale, String slug);

    Mono<Void> delete(Long entityId, String locale);

    Mono<Void> deleteAll(Long entityId);
}
