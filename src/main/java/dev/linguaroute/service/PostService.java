package dev.linguaroute.service;

import dev.linguaroute.config.TranslationStoreConfig;
import dev.linguaroute.dto.LocalizedPost;
import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.entity.Post;
import dev.linguaroute.entity.Translation;
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
 * Posts and their translations in {@code post_translations}.
 * A post belongs to a category through the category's locale-independent id.
 */
@Service
@Slf4j
public class PostService {

    static final String LABEL = "post";

    private final PostRepository postRepository;
    private final CategoryRepository categoryRepository;
    private final TranslationStore translationStore;
    private final TranslationService translationService;

    public PostService(PostRepository postRepository,
                       CategoryRepository categoryRepository,
                       @Qualifier(TranslationStoreConfig.POST_STORE) TranslationStore translationStore,
                       TranslationService translationService) {
        this.postRepository = postRepository;
        this.categoryRepository = categoryRepository;
        this.translationStore = translationStore;
        this.translationService = translationService;
    }

    @Transactional
    public Mono<LocalizedPost> create(Long categoryId, String originalLocale, TranslationFields fields) {
        return categoryRepository.existsById(categoryId)
                .flatMap(exists -> {
                    if (!exists) {
                        return Mono.<Post>error(new ResourceNotFoundException("Category", "id", categoryId));
                    }
                    LocalDateTime now = LocalDateTime.now();
                    return postRepository.save(Post.builder()
                            .categoryId(categoryId)
                            .originalLocale(originalLocale)
                            .publishedAt(now)
                            .createdAt(now)
                            .build());
                })
                .flatMap(saved -> translationService.put(translationStore, LABEL, saved.getId(), originalLocale, fields)
                        .map(t -> toLocalized(saved, new ResolvedTranslation(t, originalLocale))))
                .doOnSuccess(p -> log.info("Post created: {} in category {}", p.getId(), categoryId));
    }

    public Mono<Translation> translate(Long id, String locale, TranslationFields fields) {
        return postRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", id)))
                .flatMap(post -> translationService.put(translationStore, LABEL, post.getId(), locale, fields));
    }

    public Mono<LocalizedPost> getLocalized(Long id, String locale) {
        return postRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", id)))
                .flatMap(post -> localize(post, locale));
    }

    public Mono<LocalizedPost> findBySlug(String locale, String slug) {
        return translationService.findBySlug(translationStore, locale, slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "slug", slug)))
                .flatMap(t -> getLocalized(t.getEntityId(), locale));
    }

    /**
     * Localized summaries of a category's posts, newest first. Content is left out.
     */
    public Flux<LocalizedPost> listByCategory(Long categoryId, String locale) {
        return postRepository.findByCategoryId(categoryId)
                .concatMap(post -> localize(post, locale))
                .map(post -> post.toBuilder().content(null).build());
    }

    public Mono<Map<String, Translation>> translations(Long id) {
        return translationService.translations(translationStore, id);
    }

    @Transactional
    public Mono<Void> delete(Long id) {
        return postRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "id", id)))
                .flatMap(post -> translationStore.deleteAll(id))
                .then(Mono.defer(() -> postRepository.deleteById(id)))
                .doOnSuccess(v -> log.info("Post deleted: {}", id));
    }

    private Mono<LocalizedPost> localize(Post post, String locale) {
        return translationService.resolve(translationStore, post.getId(), post.getOriginalLocale(), locale)
                .map(resolved -> toLocalized(post, resolved))
                .defaultIfEmpty(LocalizedPost.builder()
                        .id(post.getId())
                        .categoryId(post.getCategoryId())
                        .originalLocale(post.getOriginalLocale())
                        .publishedAt(post.getPublishedAt())
                        .build());
    }

    private LocalizedPost toLocalized(Post post, ResolvedTranslation resolved) {
        Translation t = resolved.translation();
        return LocalizedPost.builder()
                .id(post.getId())
                .categoryId(post.getCategoryId())
                .locale(resolved.servedLocale())
                .fallback(resolved.fallback())
                .title(t.getName())
                .slug(t.getSlug())
                .content(t.getContent())
                .originalLocale(post.getOriginalLocale())
                .publishedAt(post.getPublishedAt())
                .build();
    }
}
