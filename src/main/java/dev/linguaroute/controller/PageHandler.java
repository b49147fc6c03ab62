package dev.linguaroute.controller;

import dev.linguaroute.dto.PageView;
import dev.linguaroute.routing.ActiveLocale;
import dev.linguaroute.routing.LocalizedHandler;
import dev.linguaroute.routing.RouteEntry;
import dev.linguaroute.routing.RouteTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

/**
 * Static pages (home, about, contact): route identity, active locale and language switcher links.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageHandler implements LocalizedHandler {

    private final RouteTable routeTable;

    @Override
    public Mono<ServerResponse> handle(ServerRequest request, RouteEntry route, ActiveLocale locale) {
        log.debug("Serving page {} in {}", route.routeKey(), locale.code());
        PageView view = PageView.builder()
                .route(route.routeKey())
                .locale(locale.code())
                .path(locale.path())
                .alternates(routeTable.alternates(route.routeKey()))
                .build();
        return ServerResponse.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(view);
    }
}
