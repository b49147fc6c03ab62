package dev.linguaroute.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.linguaroute.dto.LocalizedCategory;
import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.repository.CategoryRepository;
import dev.linguaroute.service.CategoryService;
import dev.linguaroute.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Seeds demo categories and posts, with translations, from {@code classpath:dev/demo-content.json}.
 * Only active in the 'dev' profile and only when no category exists yet.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DevDataInitializer {

    private final CategoryRepository categoryRepository;
    private final CategoryService categoryService;
    private final PostService postService;
    private final ObjectMapper objectMapper;

    @Value("${dev.content.path:dev/demo-content.json}")
    private String contentPath;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeDevData() {
        categoryRepository.count()
                .filter(count -> count == 0)
                .flatMapMany(empty -> Flux.fromIterable(loadJson(contentPath).path("categories")))
                .concatMap(this::seedCategory)
                .count()
                .subscribe(
                        seeded -> log.info("Dev data initialized: {} categories", seeded),
                        error -> log.error("Failed to initialize dev data", error));
    }

    private Mono<LocalizedCategory> seedCategory(JsonNode node) {
        String originalLocale = node.path("originalLocale").asText("en");
        List<Map.Entry<String, TranslationFields>> translations = translations(node);
        TranslationFields original = fieldsFor(translations, originalLocale);

        return categoryService.create(originalLocale, original)
                .flatMap(category -> Flux.fromIterable(translations)
                        .filter(e -> !e.getKey().equals(originalLocale))
                        .concatMap(e -> categoryService.translate(category.getId(), e.getKey(), e.getValue()))
                        .thenMany(Flux.fromIterable(node.path("posts")))
                        .concatMap(post -> seedPost(category.getId(), post))
                        .then(Mono.just(category)));
    }

    private Mono<Void> seedPost(Long categoryId, JsonNode node) {
        String originalLocale = node.path("originalLocale").asText("en");
        List<Map.Entry<String, TranslationFields>> translations = translations(node);

        return postService.create(categoryId, originalLocale, fieldsFor(translations, originalLocale))
                .flatMap(post -> Flux.fromIterable(translations)
                        .filter(e -> !e.getKey().equals(originalLocale))
                        .concatMap(e -> postService.translate(post.getId(), e.getKey(), e.getValue()))
                        .then());
    }

    private List<Map.Entry<String, TranslationFields>> translations(JsonNode node) {
        List<Map.Entry<String, TranslationFields>> result = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.path("translations").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode t = field.getValue();
            result.add(Map.entry(field.getKey(), TranslationFields.of(
                    t.path("name").asText(),
                    t.path("slug").asText(),
                    t.hasNonNull("content") ? t.get("content").asText() : null)));
        }
        return result;
    }

    private TranslationFields fieldsFor(List<Map.Entry<String, TranslationFields>> translations, String locale) {
        return translations.stream()
                .filter(e -> e.getKey().equals(locale))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Seed entry has no translation in its original locale " + locale));
    }

    private JsonNode loadJson(String path) {
        try (InputStream is = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse JSON: " + path, e);
        }
    }
}
