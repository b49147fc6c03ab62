package dev.linguaroute.routing;

import dev.linguaroute.config.LocaleRegistry;

import java.util.List;
import java.util.Map;

/**
 * Route set shared by the routing and handler tests; mirrors {@code routes.json}.
 */
public final class RouteFixtures {

    public static final LocaleRegistry REGISTRY = LocaleRegistry.of(List.of("en", "pt", "fr", "jp"), "en", null);

    public static final List<LogicalRoute> ROUTES = List.of(
            LogicalRoute.get("home", "pageHandler", Map.of("en", "", "pt", "", "fr", "", "jp", "")),
            LogicalRoute.get("about", "pageHandler", Map.of("pt", "sobre", "fr", "a-propos")),
            LogicalRoute.get("contact", "pageHandler", Map.of("pt", "contato", "fr", "contact")),
            LogicalRoute.get("category", "categoryHandler", Map.of(
                    "en", "categories/{slug}", "pt", "categorias/{slug}",
                    "fr", "categories/{slug}", "jp", "categories/{slug}")),
            LogicalRoute.get("post", "postHandler", Map.of(
                    "en", "posts/{slug}", "pt", "artigos/{slug}",
                    "fr", "articles/{slug}", "jp", "posts/{slug}")));

    private RouteFixtures() {}

    public static RouteTable routeTable() {
        return RouteTableBuilder.build(ROUTES, REGISTRY, PathTranslator.from(ROUTES));
    }

    public static PathLocaleResolver resolver() {
        return new PathLocaleResolver(REGISTRY);
    }
}
