package dev.linguaroute.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.linguaroute.exception.GlobalExceptionHandler;
import dev.linguaroute.exception.LocaleConfigurationException;
import dev.linguaroute.routing.LocalizedHandler;
import dev.linguaroute.routing.LocalizedRouterFunctions;
import dev.linguaroute.routing.PathLocaleResolver;
import dev.linguaroute.routing.PathTranslator;
import dev.linguaroute.routing.RouteDefinitions;
import dev.linguaroute.routing.RouteTable;
import dev.linguaroute.routing.RouteTableBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Localized route table, generated once at startup from the route definition file
 * ({@code app.routes.file}, default {@code routes.json} on the classpath).
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RouteConfig {

    @Value("${app.routes.file:routes.json}")
    private String routesFile;

    @Bean
    public RouteDefinitions routeDefinitions(ObjectMapper objectMapper) {
        try (InputStream is = new ClassPathResource(routesFile).getInputStream()) {
            RouteDefinitions definitions = objectMapper.readValue(is, RouteDefinitions.class);
            log.info("Loaded {} logical routes from {}", definitions.routes().size(), routesFile);
            return definitions;
        } catch (IOException e) {
            throw new LocaleConfigurationException("Failed to load route definitions from " + routesFile, e);
        }
    }

    @Bean
    public PathTranslator pathTranslator(RouteDefinitions routeDefinitions) {
        return PathTranslator.from(routeDefinitions.routes());
    }

    @Bean
    public RouteTable routeTable(RouteDefinitions routeDefinitions, LocaleRegistry localeRegistry,
                                 PathTranslator pathTranslator) {
        return RouteTableBuilder.build(routeDefinitions.routes(), localeRegistry, pathTranslator);
    }

    @Bean
    public RouterFunction<ServerResponse> localizedRoutes(RouteTable routeTable,
                                                          Map<String, LocalizedHandler> handlers,
                                                          PathLocaleResolver pathLocaleResolver,
                                                          GlobalExceptionHandler exceptionHandler) {
        return LocalizedRouterFunctions.build(routeTable, handlers, pathLocaleResolver, exceptionHandler::handle);
    }
}
