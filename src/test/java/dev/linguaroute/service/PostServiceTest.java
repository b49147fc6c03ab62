package dev.linguaroute.service;

import dev.linguaroute.config.LocaleRegistry;
import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.entity.Post;
import dev.linguaroute.entity.Translation;
import dev.linguaroute.exception.ResourceNotFoundException;
import dev.linguaroute.metrics.TranslationMetrics;
import dev.linguaroute.repository.CategoryRepository;
import dev.linguaroute.repository.PostRepository;
import dev.linguaroute.repository.TranslationStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PostServiceTest {

    @Mock private PostRepository postRepository;
    @Mock private CategoryRepository categoryRepository;
    @Mock private TranslationStore translationStore;

    private PostService postService;

    private Post hello;
    private Translation helloEn;
    private Translation helloFr;

    @BeforeEach
    void setUp() {
        TranslationService translationService = new TranslationService(
                LocaleRegistry.of(List.of("en", "pt", "fr", "jp"), "en", null),
                new TranslationMetrics(new SimpleMeterRegistry()));
        postService = new PostService(postRepository, categoryRepository, translationStore, translationService);

        hello = Post.builder().id(10L).categoryId(1L).originalLocale("en")
                .publishedAt(LocalDateTime.now().minusDays(1)).build();
        helloEn = Translation.builder().entityId(10L).locale("en")
                .name("Hello world").slug("hello-world").content("Body").build();
        helloFr = Translation.builder().entityId(10L).locale("fr")
                .name("Bonjour le monde").slug("bonjour-le-monde").content("Corps").build();
    }

    @Test
    @DisplayName("Should create a post in an existing category")
    void shouldCreate() {
        TranslationFields fields = TranslationFields.of("Hello world", "hello-world", "Body");
        when(categoryRepository.existsById(1L)).thenReturn(Mono.just(true));
        when(postRepository.save(any(Post.class))).thenReturn(Mono.just(hello));
        when(translationStore.put(10L, "en", fields)).thenReturn(Mono.just(helloEn));

        StepVerifier.create(postService.create(1L, "en", fields))
                .assertNext(post -> {
                    assertThat(post.getId()).isEqualTo(10L);
                    assertThat(post.getCategoryId()).isEqualTo(1L);
                    assertThat(post.getTitle()).isEqualTo("Hello world");
                    assertThat(post.getContent()).isEqualTo("Body");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should refuse to create a post in an unknown category")
    void shouldRejectUnknownCategory() {
        when(categoryRepository.existsById(99L)).thenReturn(Mono.just(false));

        StepVerifier.create(postService.create(99L, "en", TranslationFields.of("Hello", "hello")))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verify(postRepository, never()).save(any(Post.class));
    }

    @Test
    @DisplayName("Should resolve a localized slug to the post in that locale")
    void shouldFindBySlug() {
        when(translationStore.findBySlug("fr", "bonjour-le-monde")).thenReturn(Mono.just(helloFr));
        when(postRepository.findById(10L)).thenReturn(Mono.just(hello));
        when(translationStore.getAll(10L)).thenReturn(Mono.just(Map.of("en", helloEn, "fr", helloFr)));

        StepVerifier.create(postService.findBySlug("fr", "bonjour-le-monde"))
                .assertNext(post -> {
                    assertThat(post.getTitle()).isEqualTo("Bonjour le monde");
                    assertThat(post.getLocale()).isEqualTo("fr");
                    assertThat(post.isFallback()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should list a category's posts without content, with fallback per post")
    void shouldListByCategory() {
        Post second = Post.builder().id(11L).categoryId(1L).originalLocale("en").build();
        Translation secondEn = Translation.builder().entityId(11L).locale("en")
                .name("Routing").slug("routing").content("Long body").build();
        when(postRepository.findByCategoryId(1L)).thenReturn(Flux.just(hello, second));
        when(translationStore.getAll(10L)).thenReturn(Mono.just(Map.of("en", helloEn, "fr", helloFr)));
        when(translationStore.getAll(11L)).thenReturn(Mono.just(Map.of("en", secondEn)));

        StepVerifier.create(postService.listByCategory(1L, "fr").collectList())
                .assertNext(posts -> {
                    assertThat(posts).extracting("title").containsExactly("Bonjour le monde", "Routing");
                    assertThat(posts).extracting("fallback").containsExactly(false, true);
                    assertThat(posts).allSatisfy(p -> assertThat(p.getContent()).isNull());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should delete translations before the post")
    void shouldDelete() {
        when(postRepository.findById(10L)).thenReturn(Mono.just(hello));
        when(translationStore.deleteAll(10L)).thenReturn(Mono.empty());
        when(postRepository.deleteById(10L)).thenReturn(Mono.empty());

        StepVerifier.create(postService.delete(10L)).verifyComplete();

        verify(translationStore).deleteAll(10L);
        verify(postRepository).deleteById(10L);
    }

    @Test
    @DisplayName("Should fail to delete an unknown post")
    void shouldFailToDeleteUnknownPost() {
        when(postRepository.findById(99L)).thenReturn(Mono.empty());

        StepVerifier.create(postService.delete(99L))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verify(postRepository, never()).deleteById(anyLong());
    }
}
