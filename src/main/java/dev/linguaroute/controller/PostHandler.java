package dev.linguaroute.controller;

import dev.linguaroute.config.LocaleRegistry;
import dev.linguaroute.dto.PostView;
import dev.linguaroute.routing.ActiveLocale;
import dev.linguaroute.routing.LocalizedHandler;
import dev.linguaroute.routing.RouteEntry;
import dev.linguaroute.routing.RouteTable;
import dev.linguaroute.service.CategoryService;
import dev.linguaroute.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
@Slf4j
public class PostHandler implements LocalizedHandler {

    private final PostService postService;
    private final CategoryService categoryService;
    private final RouteTable routeTable;
    private final LocaleRegistry localeRegistry;

    @Override
    public Mono<ServerResponse> handle(ServerRequest request, RouteEntry route, ActiveLocale locale) {
        String slug = request.pathVariable("slug");
        log.debug("Fetching post by slug={} in {}", slug, locale.code());

        return postService.findBySlug(locale.code(), slug)
                .flatMap(post -> Mono.zip(
                                categoryService.getLocalized(post.getCategoryId(), locale.code()),
                                postService.translations(post.getId()))
                        .map(tuple -> PostView.builder()
                                .route(route.routeKey())
                                .locale(locale.code())
                                .post(post)
                                .category(tuple.getT1())
                                .alternates(routeTable.alternates(route.routeKey(), AlternateLinks.slugVariables(
                                        localeRegistry, tuple.getT2())))
                                .build()))
                .flatMap(view -> ServerResponse.ok()
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(view));
    }
}
