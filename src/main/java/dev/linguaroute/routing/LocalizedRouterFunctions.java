package dev.linguaroute.routing;

import dev.linguaroute.exception.LocaleConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.server.RequestPredicate;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.BiFunction;

/**
 * Compiles a {@link RouteTable} into a WebFlux {@link RouterFunction}, one route per entry.
 */
@Slf4j
public final class LocalizedRouterFunctions {

    private LocalizedRouterFunctions() {}

    /**
     * @param handlers     handler beans keyed by bean name
     * @param errorHandler applied to every generated route, may be {@code null}
     * @throws LocaleConfigurationException if an entry names a handler that does not exist
     */
    public static RouterFunction<ServerResponse> build(
            RouteTable table,
            Map<String, ? extends LocalizedHandler> handlers,
            PathLocaleResolver resolver,
            BiFunction<Throwable, ServerRequest, Mono<ServerResponse>> errorHandler) {

        if (table.entries().isEmpty()) {
            log.warn("Route table is empty; no localized routes registered");
            return request -> Mono.empty();
        }

        RouterFunctions.Builder builder = RouterFunctions.route();
        for (RouteEntry entry : table.entries()) {
            LocalizedHandler handler = handlers.get(entry.handlerRef());
            if (handler == null) {
                throw new LocaleConfigurationException("Route '" + entry.name()
                        + "' refers to unknown handler '" + entry.handlerRef() + "'");
            }
            RequestPredicate predicate = RequestPredicates.method(HttpMethod.valueOf(entry.method()))
                    .and(RequestPredicates.path(entry.pattern()));
            builder.route(predicate, request -> handler.handle(request, entry, activeLocale(request, resolver)));
        }
        if (errorHandler != null) {
            builder.onError(Throwable.class, errorHandler);
        }
        return builder.build();
    }

    /**
     * Locale stored by the prefix filter, or resolved on the spot when the filter did not run.
     */
    public static ActiveLocale activeLocale(ServerRequest request, PathLocaleResolver resolver) {
        ActiveLocale active = request.exchange().getAttribute(ActiveLocale.ATTRIBUTE);
        return active != null ? active : resolver.resolve(request.path());
    }
}
