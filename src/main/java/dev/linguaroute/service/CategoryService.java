package dev.linguaroute.service;

import dev.linguaroute.config.TranslationStoreConfig;
import dev.linguaroute.dto.LocalizedCategory;
import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.entity.Category;
import dev.linguaroute.entity.Translation;
import dev.linguaroute.exception.EntityInUseException;
import dev.linguaroute.exception.ResourceNotFoundException;
import dev.linguaroute.repository.CategoryRepository;
import dev.linguaroute.repository.PostRepository;
import dev.linguaroute.repository.TranslationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Categories and their translations in {@code category_translations}.
 */
@Service
@Slf4j
public class CategoryService {

    static final String LABEL = "category";

    private final CategoryRepository categoryRepository;
    private final PostRepository postRepository;
    private final TranslationStore translationStore;
    private final TranslationService translationService;

    public CategoryService(CategoryRepository categoryRepository,
                           PostRepository postRepository,
                           @Qualifier(TranslationStoreConfig.CATEGORY_STORE) TranslationStore translationStore,
                           TranslationService translationService) {
        this.categoryRepository = categoryRepository;
        this.postRepository = postRepository;
        this.translationStore = translationStore;
        this.translationService = translationService;
    }

    /**
     * Create a category together with its first translation, written in {@code originalLocale}.
     */
    @Transactional
    public Mono<LocalizedCategory> create(String originalLocale, TranslationFields fields) {
        Category category = Category.builder()
                .originalLocale(originalLocale)
                .createdAt(LocalDateTime.now())
                .build();

        return categoryRepository.save(category)
                .flatMap(saved -> translationService.put(translationStore, LABEL, saved.getId(), originalLocale, fields)
                        .map(t -> toLocalized(saved, new ResolvedTranslation(t, originalLocale))))
                .doOnSuccess(c -> log.info("Category created: {} ({})", c.getId(), c.getSlug()));
    }

    /**
     * Add or overwrite the translation of a category in one locale.
     */
    public Mono<Translation> translate(Long id, String locale, TranslationFields fields) {
        return categoryRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "id", id)))
                .flatMap(category -> translationService.put(translationStore, LABEL, category.getId(), locale, fields));
    }

    public Mono<LocalizedCategory> getLocalized(Long id, String locale) {
        return categoryRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "id", id)))
                .flatMap(category -> localize(category, locale));
    }

    /**
     * Find a category by its slug in {@code locale}, or by the default/fallback slug when
     * the category is not translated into {@code locale}.
     */
    public Mono<LocalizedCategory> findBySlug(String locale, String slug) {
        return translationService.findBySlug(translationStore, locale, slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "slug", slug)))
                .flatMap(t -> getLocalized(t.getEntityId(), locale));
    }

    public Flux<LocalizedCategory> listLocalized(String locale) {
        return categoryRepository.findAll()
                .concatMap(category -> localize(category, locale));
    }

    public Mono<Map<String, Translation>> translations(Long id) {
        return translationService.translations(translationStore, id);
    }

    /**
     * Delete a category and all its translations. Fails while posts still reference it.
     */
    @Transactional
    public Mono<Void> delete(Long id) {
        return categoryRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "id", id)))
                .flatMap(category -> postRepository.countByCategoryId(id))
                .flatMap(posts -> {
                    if (posts > 0) {
                        return Mono.<Void>error(new EntityInUseException("Category", id, posts + " post(s)"));
                    }
                    return translationStore.deleteAll(id)
                            .then(categoryRepository.deleteById(id));
                })
                .doOnSuccess(v -> log.info("Category deleted: {}", id));
    }

    private Mono<LocalizedCategory> localize(Category category, String locale) {
        return translationService.resolve(translationStore, category.getId(), category.getOriginalLocale(), locale)
                .map(resolved -> toLocalized(category, resolved))
                .defaultIfEmpty(LocalizedCategory.builder()
                        .id(category.getId())
                        .originalLocale(category.getOriginalLocale())
                        .build());
    }

    private LocalizedCategory toLocalized(Category category, ResolvedTranslation resolved) {
        Translation t = resolved.translation();
        return LocalizedCategory.builder()
                .id(category.getId())
                .locale(resolved.servedLocale())
                .fallback(resolved.fallback())
                .name(t.getName())
                .slug(t.getSlug())
                .originalLocale(category.getOriginalLocale())
                .build();
    }
}
