package dev.linguaroute.config;

import dev.linguaroute.routing.PathLocaleResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Locale set configuration.
 *
 * <p>The supported locales, default and fallback are read from:</p>
 * <ul>
 *   <li>{@code app.locales.supported} - comma separated, order is significant</li>
 *   <li>{@code app.locales.default} - served without a path prefix</li>
 *   <li>{@code app.locales.fallback} - optional, defaults to the default locale</li>
 * </ul>
 * A default or fallback outside the supported set aborts startup.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class LocaleConfig {

    @Value("${app.locales.supported:en,pt,fr,jp}")
    private List<String> supportedLocales;

    @Value("${app.locales.default:en}")
    private String defaultLocale;

    @Value("${app.locales.fallback:#{null}}")
    private String fallbackLocale;

    @Bean
    public LocaleRegistry localeRegistry() {
        LocaleRegistry registry = LocaleRegistry.of(supportedLocales, defaultLocale, fallbackLocale);
        log.info("Locales configured: supported={}, default={}, fallback={}",
                registry.supportedLocales(), registry.defaultLocale(), registry.fallbackLocale());
        return registry;
    }

    @Bean
    public PathLocaleResolver pathLocaleResolver(LocaleRegistry localeRegistry) {
        return new PathLocaleResolver(localeRegistry);
    }
}
