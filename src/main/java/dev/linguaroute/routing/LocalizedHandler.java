package dev.linguaroute.routing;

import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

/**
 * Produces the response for a matched localized route.
 * Implementations are Spring beans; the bean name is the {@code handler} used in route definitions.
 */
@FunctionalInterface
public interface LocalizedHandler {

    Mono<ServerResponse> handle(ServerRequest request, RouteEntry route, ActiveLocale locale);
}
