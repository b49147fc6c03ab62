package dev.linguaroute.config;

import dev.linguaroute.repository.CachingTranslationStore;
import dev.linguaroute.repository.R2dbcTranslationStore;
import dev.linguaroute.repository.TranslationStore;
import dev.linguaroute.repository.TranslationTable;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.dialect.DialectResolver;
import org.springframework.data.r2dbc.dialect.H2Dialect;
import org.springframework.data.r2dbc.dialect.R2dbcDialect;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Duration;

/**
 * Translation stores for the satellite tables, each behind a Caffeine cache.
 * <p>
 * Cache sizing via {@code app.translations.cache.max-size} (entities per table)
 * and {@code app.translations.cache.ttl}.
 * </p>
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class TranslationStoreConfig {

    public static final String CATEGORY_STORE = "categoryTranslationStore";
    public static final String POST_STORE = "postTranslationStore";

    @Value("${app.translations.cache.max-size:10000}")
    private long cacheMaxSize;

    @Value("${app.translations.cache.ttl:PT10M}")
    private Duration cacheTtl;

    @Bean(CATEGORY_STORE)
    public TranslationStore categoryTranslationStore(DatabaseClient databaseClient, ConnectionFactory connectionFactory) {
        return cachedStore(databaseClient, connectionFactory, TranslationTable.CATEGORY);
    }

    @Bean(POST_STORE)
    public TranslationStore postTranslationStore(DatabaseClient databaseClient, ConnectionFactory connectionFactory) {
        return cachedStore(databaseClient, connectionFactory, TranslationTable.POST);
    }

    private TranslationStore cachedStore(DatabaseClient databaseClient, ConnectionFactory connectionFactory,
                                         TranslationTable table) {
        R2dbcTranslationStore.UpsertSyntax syntax = upsertSyntax(DialectResolver.getDialect(connectionFactory));
        log.info("Translation store for {}: upsert={}, cache max-size={}, ttl={}", table, syntax, cacheMaxSize, cacheTtl);
        return new CachingTranslationStore(
                new R2dbcTranslationStore(databaseClient, table, syntax), cacheMaxSize, cacheTtl);
    }

    static R2dbcTranslationStore.UpsertSyntax upsertSyntax(R2dbcDialect dialect) {
        return dialect instanceof H2Dialect
                ? R2dbcTranslationStore.UpsertSyntax.MERGE_KEY
                : R2dbcTranslationStore.UpsertSyntax.ON_CONFLICT;
    }
}
