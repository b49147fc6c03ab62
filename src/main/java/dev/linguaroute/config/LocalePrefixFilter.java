package dev.linguaroute.config;

import dev.linguaroute.routing.ActiveLocale;
import dev.linguaroute.routing.PathLocaleResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * WebFilter that resolves the active locale from the first path segment
 * and hands it downstream through the exchange attributes and the reactive context.
 * <p>
 * URLs prefixed with the default locale ({@code /en/about}) are redirected to their
 * canonical unprefixed form when {@code app.locales.redirect-default-prefix} is on,
 * and dispatched under that form when it is off.
 * </p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@Slf4j
public class LocalePrefixFilter implements WebFilter {

    private final PathLocaleResolver resolver;
    private final boolean redirectDefaultPrefix;

    public LocalePrefixFilter(PathLocaleResolver resolver,
                              @Value("${app.locales.redirect-default-prefix:true}") boolean redirectDefaultPrefix) {
        this.resolver = resolver;
        this.redirectDefaultPrefix = redirectDefaultPrefix;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        ActiveLocale locale = resolver.resolve(path);
        log.debug("Resolved locale {} for {}", locale.code(), path);

        ServerWebExchange target = exchange;
        if (locale.prefixed() && resolver.registry().isDefault(locale.code())) {
            if (redirectDefaultPrefix) {
                return redirectToCanonical(exchange, locale);
            }
            target = stripPrefix(exchange, locale);
        }

        target.getAttributes().put(ActiveLocale.ATTRIBUTE, locale);
        target.getResponse().getHeaders().set(HttpHeaders.CONTENT_LANGUAGE, locale.code());
        return chain.filter(target)
                .contextWrite(ctx -> ctx.put(ActiveLocale.CONTEXT_KEY, locale));
    }

    // Default-locale routes are generated unprefixed, so /en/about is dispatched as /about.
    private ServerWebExchange stripPrefix(ServerWebExchange exchange, ActiveLocale locale) {
        String contextPath = exchange.getRequest().getPath().contextPath().value();
        log.debug("Serving default-locale URL {} as {}", exchange.getRequest().getPath().value(), locale.path());
        return exchange.mutate()
                .request(request -> request.path(contextPath + locale.path()))
                .build();
    }

    private Mono<Void> redirectToCanonical(ServerWebExchange exchange, ActiveLocale locale) {
        String contextPath = exchange.getRequest().getPath().contextPath().value();
        String query = exchange.getRequest().getURI().getRawQuery();
        String target = contextPath + locale.path() + (query != null ? "?" + query : "");
        log.debug("Redirecting default-locale URL {} to {}", exchange.getRequest().getPath().value(), target);

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.MOVED_PERMANENTLY);
        response.getHeaders().setLocation(URI.create(target));
        return response.setComplete();
    }
}
