package dev.linguaroute.routing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RouteTable Tests")
class RouteTableTest {

    private final RouteTable table = RouteFixtures.routeTable();

    @Nested
    @DisplayName("urlFor")
    class UrlFor {

        @Test
        @DisplayName("Should expand template variables in the locale's path")
        void shouldExpandVariables() {
            assertThat(table.urlFor("post", "fr", Map.of("slug", "bonjour"))).isEqualTo("/fr/articles/bonjour");
            assertThat(table.urlFor("post", "en", Map.of("slug", "hello"))).isEqualTo("/posts/hello");
        }

        @Test
        @DisplayName("Should build static URLs")
        void shouldBuildStaticUrls() {
            assertThat(table.urlFor("about", "pt")).isEqualTo("/pt/sobre");
            assertThat(table.urlFor("about", "jp")).isEqualTo("/jp/about");
            assertThat(table.urlFor("home", "en")).isEqualTo("/");
        }

        @Test
        @DisplayName("Should reject unknown routes and locales")
        void shouldRejectUnknownRoute() {
            assertThatThrownBy(() -> table.urlFor("missing", "en")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> table.urlFor("about", "de")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject missing template variables")
        void shouldRejectMissingVariables() {
            assertThatThrownBy(() -> table.urlFor("post", "fr"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("slug");
        }
    }

    @Nested
    @DisplayName("alternates")
    class Alternates {

        @Test
        @DisplayName("Should list one link per locale in registry order")
        void shouldListAllLocales() {
            assertThat(table.alternates("about")).containsExactly(
                    Map.entry("en", "/about"),
                    Map.entry("pt", "/pt/sobre"),
                    Map.entry("fr", "/fr/a-propos"),
                    Map.entry("jp", "/jp/about"));
        }

        @Test
        @DisplayName("Should use per-locale variables and skip locales without them")
        void shouldUsePerLocaleVariables() {
            Map<String, String> links = table.alternates("post", Map.of(
                    "en", Map.of("slug", "hello-world"),
                    "fr", Map.of("slug", "bonjour-le-monde")));

            assertThat(links).containsExactly(
                    Map.entry("en", "/posts/hello-world"),
                    Map.entry("fr", "/fr/articles/bonjour-le-monde"));
        }

        @Test
        @DisplayName("Should return no links for an unknown route")
        void shouldReturnEmptyForUnknownRoute() {
            assertThat(table.alternates("missing")).isEmpty();
        }
    }
}
