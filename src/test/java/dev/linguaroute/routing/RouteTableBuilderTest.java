package dev.linguaroute.routing;

import dev.linguaroute.config.LocaleRegistry;
import dev.linguaroute.exception.LocaleConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RouteTableBuilder Tests")
class RouteTableBuilderTest {

    private static RouteTable build(List<LogicalRoute> routes, LocaleRegistry registry) {
        return RouteTableBuilder.build(routes, registry, PathTranslator.from(routes));
    }

    @Nested
    @DisplayName("generated entries")
    class GeneratedEntries {

        private final RouteTable table = RouteFixtures.routeTable();

        @Test
        @DisplayName("Should generate one entry per route and locale")
        void shouldGenerateOneEntryPerPair() {
            assertThat(table.size()).isEqualTo(RouteFixtures.ROUTES.size() * 4);
            assertThat(table.entries()).extracting(RouteEntry::name).doesNotHaveDuplicates();
            assertThat(table.entries())
                    .extracting(e -> e.method() + " " + e.fullPath())
                    .doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Should leave default-locale paths unprefixed and prefix every other locale")
        void shouldPrefixNonDefaultLocales() {
            Map<String, String> about = table.entries().stream()
                    .filter(e -> e.routeKey().equals("about"))
                    .collect(Collectors.toMap(RouteEntry::locale, RouteEntry::fullPath));

            assertThat(about).containsExactlyInAnyOrderEntriesOf(Map.of(
                    "en", "about",
                    "pt", "pt/sobre",
                    "fr", "fr/a-propos",
                    "jp", "jp/about"));
        }

        @Test
        @DisplayName("Should map the root route to the bare locale prefix")
        void shouldMapRootToBarePrefix() {
            assertThat(table.lookup("home", "en")).get().extracting(RouteEntry::pattern).isEqualTo("/");
            assertThat(table.lookup("home", "fr")).get().extracting(RouteEntry::pattern).isEqualTo("/fr");
        }

        @Test
        @DisplayName("Should name entries key.locale and keep the handler reference")
        void shouldNameEntries() {
            RouteEntry entry = table.findByName("post.fr").orElseThrow();

            assertThat(entry.routeKey()).isEqualTo("post");
            assertThat(entry.locale()).isEqualTo("fr");
            assertThat(entry.handlerRef()).isEqualTo("postHandler");
            assertThat(entry.method()).isEqualTo("GET");
            assertThat(entry.fullPath()).isEqualTo("fr/articles/{slug}");
        }

        @Test
        @DisplayName("Should keep definition order, locales in registry order")
        void shouldKeepOrder() {
            assertThat(table.entries().subList(0, 4))
                    .extracting(RouteEntry::name)
                    .containsExactly("home.en", "home.pt", "home.fr", "home.jp");
        }
    }

    @Nested
    @DisplayName("configuration errors")
    class ConfigurationErrors {

        private final LocaleRegistry registry = RouteFixtures.REGISTRY;

        @Test
        @DisplayName("Should reject two routes mapping to the same path")
        void shouldRejectDuplicatePaths() {
            List<LogicalRoute> routes = List.of(
                    LogicalRoute.get("about", "pageHandler", Map.of()),
                    LogicalRoute.get("team", "pageHandler", Map.of("en", "about")));

            assertThatThrownBy(() -> build(routes, registry))
                    .isInstanceOf(LocaleConfigurationException.class)
                    .hasMessageContaining("about.en")
                    .hasMessageContaining("team.en");
        }

        @Test
        @DisplayName("Should treat paths that differ only in variable names as duplicates")
        void shouldRejectDuplicateTemplates() {
            List<LogicalRoute> routes = List.of(
                    LogicalRoute.get("post", "postHandler", Map.of("en", "posts/{slug}")),
                    LogicalRoute.get("postById", "postHandler", Map.of("en", "posts/{id}")));

            assertThatThrownBy(() -> build(routes, registry))
                    .isInstanceOf(LocaleConfigurationException.class);
        }

        @Test
        @DisplayName("Should allow the same path under different methods")
        void shouldAllowSamePathDifferentMethod() {
            List<LogicalRoute> routes = List.of(
                    LogicalRoute.get("contact", "pageHandler", Map.of()),
                    new LogicalRoute("contactSubmit", "post", "pageHandler", Map.of(
                            "en", "contact", "pt", "contact", "fr", "contact", "jp", "contact")));

            RouteTable table = build(routes, registry);

            assertThat(table.size()).isEqualTo(8);
            assertThat(table.findByName("contactSubmit.fr")).get()
                    .extracting(RouteEntry::method).isEqualTo("POST");
        }

        @Test
        @DisplayName("Should reject duplicate route names")
        void shouldRejectDuplicateNames() {
            List<LogicalRoute> routes = List.of(
                    LogicalRoute.get("about", "pageHandler", Map.of()),
                    LogicalRoute.get("about", "pageHandler", Map.of("en", "about-us")));
            PathTranslator translator = PathTranslator.from(routes.subList(0, 1));

            assertThatThrownBy(() -> RouteTableBuilder.build(routes, registry, translator))
                    .isInstanceOf(LocaleConfigurationException.class)
                    .hasMessageContaining("about.en");
        }

        @Test
        @DisplayName("Should reject a default-locale path shadowed by a locale prefix")
        void shouldRejectShadowedDefaultPath() {
            List<LogicalRoute> routes = List.of(LogicalRoute.get("french", "pageHandler", Map.of("en", "fr/intro")));

            assertThatThrownBy(() -> build(routes, registry))
                    .isInstanceOf(LocaleConfigurationException.class)
                    .hasMessageContaining("fr");
        }

        @Test
        @DisplayName("Should reject a route without handler")
        void shouldRejectMissingHandler() {
            List<LogicalRoute> routes = List.of(LogicalRoute.get("about", " ", Map.of()));

            assertThatThrownBy(() -> build(routes, registry))
                    .isInstanceOf(LocaleConfigurationException.class);
        }
    }
}
