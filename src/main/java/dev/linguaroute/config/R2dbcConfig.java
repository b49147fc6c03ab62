package dev.linguaroute.config;

import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration(proxyBeanMethods = false)
@EnableR2dbcRepositories(basePackages = "dev.linguaroute.repository")
@EnableTransactionManagement
@Slf4j
public class R2dbcConfig {

    @Value("${app.schema.file:schema.sql}")
    private String schemaFile;

    /**
     * Create the entity and translation tables on startup.
     * Disabled by default (set {@code app.schema.init=true} to enable); the dev profile turns it on with H2.
     */
    @Bean
    @ConditionalOnProperty(name = "app.schema.init", havingValue = "true", matchIfMissing = false)
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        log.info("Initializing schema from {}", schemaFile);
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(schemaFile)));
        return initializer;
    }
}
