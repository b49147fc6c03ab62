package dev.linguaroute.routing;

import dev.linguaroute.config.LocaleRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PathLocaleResolver Tests")
class PathLocaleResolverTest {

    private final PathLocaleResolver resolver =
            new PathLocaleResolver(LocaleRegistry.of(List.of("en", "pt", "fr", "jp"), "en", null));

    @Test
    @DisplayName("Should activate and strip a supported prefix")
    void shouldStripSupportedPrefix() {
        ActiveLocale locale = resolver.resolve("/fr/a-propos");

        assertThat(locale.code()).isEqualTo("fr");
        assertThat(locale.path()).isEqualTo("/a-propos");
        assertThat(locale.prefixed()).isTrue();
    }

    @Test
    @DisplayName("Should keep nested segments after the prefix")
    void shouldKeepNestedSegments() {
        ActiveLocale locale = resolver.resolve("/pt/artigos/ola-mundo");

        assertThat(locale.code()).isEqualTo("pt");
        assertThat(locale.path()).isEqualTo("/artigos/ola-mundo");
    }

    @Test
    @DisplayName("Should map a bare prefix to the locale root")
    void shouldMapBarePrefixToRoot() {
        assertThat(resolver.resolve("/fr")).isEqualTo(new ActiveLocale("fr", "/", true));
        assertThat(resolver.resolve("/fr/")).isEqualTo(new ActiveLocale("fr", "/", true));
    }

    @Test
    @DisplayName("Should use the default locale for unprefixed paths and leave them unchanged")
    void shouldUseDefaultForUnprefixedPath() {
        ActiveLocale locale = resolver.resolve("/about");

        assertThat(locale.code()).isEqualTo("en");
        assertThat(locale.path()).isEqualTo("/about");
        assertThat(locale.prefixed()).isFalse();
    }

    @Test
    @DisplayName("Should report the default locale prefix as prefixed")
    void shouldReportDefaultPrefix() {
        assertThat(resolver.resolve("/en/about")).isEqualTo(new ActiveLocale("en", "/about", true));
    }

    @ParameterizedTest
    @ValueSource(strings = {"/de/ueber", "/FR/a-propos", "/french/a-propos", "/f/x"})
    @DisplayName("Should treat unknown first segments as unprefixed paths")
    void shouldIgnoreUnknownPrefixes(String path) {
        ActiveLocale locale = resolver.resolve(path);

        assertThat(locale.code()).isEqualTo("en");
        assertThat(locale.path()).isEqualTo(path);
        assertThat(locale.prefixed()).isFalse();
    }

    @Test
    @DisplayName("Should resolve root and empty paths to the default locale")
    void shouldResolveRoot() {
        assertThat(resolver.resolve("/")).isEqualTo(new ActiveLocale("en", "/", false));
        assertThat(resolver.resolve("")).isEqualTo(new ActiveLocale("en", "/", false));
        assertThat(resolver.resolve(null)).isEqualTo(new ActiveLocale("en", "/", false));
    }
}
