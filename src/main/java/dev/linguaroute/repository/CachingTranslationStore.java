package dev.linguaroute.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.entity.Translation;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Read-through cache in front of a {@link TranslationStore}.
 * <p>
 * Caches the whole locale map of an entity, so repeated lookups for any locale are O(1).
 * Every write to an entity evicts its entry, whether the write succeeded or not, before the
 * write's outcome is signalled, so a read chained after the write never sees the old map.
 * Slug lookups always go to the delegate.
 * </p>
 */
@Slf4j
public class CachingTranslationStore implements TranslationStore {

    private final TranslationStore delegate;
    private final Cache<Long, Map<String, Translation>> cache;

    public CachingTranslationStore(TranslationStore delegate, long maxSize, Duration ttl) {
        this(delegate, Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .build());
    }

    CachingTranslationStore(TranslationStore delegate, Cache<Long, Map<String, Translation>> cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    @Override
    public Mono<Translation> get(Long entityId, String locale) {
        return Mono.defer(() -> {
            Map<String, Translation> cached = cache.getIfPresent(entityId);
            if (cached != null) {
                log.trace("Translation cache hit for {}/{}", entityId, locale);
                return Mono.justOrEmpty(cached.get(locale));
            }
            return delegate.get(entityId, locale);
        });
    }

    @Override
    public Mono<Map<String, Translation>> getAll(Long entityId) {
        return Mono.defer(() -> {
            Map<String, Translation> cached = cache.getIfPresent(entityId);
            if (cached != null) {
                log.trace("Translation cache hit for {}", entityId);
                return Mono.just(cached);
            }
            return delegate.getAll(entityId)
                    .map(Map::copyOf)
                    .doOnNext(all -> cache.put(entityId, all));
        });
    }

    @Override
    public Mono<Translation> put(Long entityId, String locale, TranslationFields fields) {
        return evicting(entityId, delegate.put(entityId, locale, fields));
    }

    @Override
    public Mono<Translation> findBySlug(String locale, String slug) {
        return delegate.findBySlug(locale, slug);
    }

    @Override
    public Mono<Void> delete(Long entityId, String locale) {
        return evicting(entityId, delegate.delete(entityId, locale));
    }

    @Override
    public Mono<Void> deleteAll(Long entityId) {
        return evicting(entityId, delegate.deleteAll(entityId));
    }

    // Evicts before the write runs and again before its outcome reaches downstream operators.
    private <T> Mono<T> evicting(Long entityId, Mono<T> write) {
        return Mono.defer(() -> {
                    cache.invalidate(entityId);
                    return write;
                })
                .doOnSuccess(result -> cache.invalidate(entityId))
                .doOnError(error -> cache.invalidate(entityId))
                .doOnCancel(() -> cache.invalidate(entityId));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
