package dev.linguaroute.repository;

import dev.linguaroute.dto.TranslationFields;
import dev.linguaroute.entity.Translation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * {@link TranslationStore} over a satellite table with columns
 * {@code (<id_col>, locale, name, slug, content, updated_at)} and a unique key on {@code (<id_col>, locale)}.
 * <p>
 * The upsert is one statement, so the database serializes concurrent writers to the same key.
 * </p>
 */
@Slf4j
public class R2dbcTranslationStore implements TranslationStore {

    /**
     * Single-statement upsert dialects.
     */
    public enum UpsertSyntax {
        /** PostgreSQL {@code INSERT ... ON CONFLICT DO UPDATE}. */
        ON_CONFLICT,
        /** H2 {@code MERGE INTO ... KEY (...)}. */
        MERGE_KEY
    }

    private final DatabaseClient databaseClient;
    private final TranslationTable table;

    private final String selectOne;
    private final String selectAll;
    private final String selectBySlug;
    private final String upsert;
    private final String deleteOne;
    private final String deleteAll;

    public R2dbcTranslationStore(DatabaseClient databaseClient, TranslationTable table, UpsertSyntax syntax) {
        this.databaseClient = databaseClient;
        this.table = table;

        String t = table.tableName();
        String id = table.idColumn();
        String columns = id + ", locale, name, slug, content, updated_at";
        this.selectOne = "SELECT " + columns + " FROM " + t + " WHERE " + id + " = :entityId AND locale = :locale";
        this.selectAll = "SELECT " + columns + " FROM " + t + " WHERE " + id + " = :entityId";
        this.selectBySlug = "SELECT " + columns + " FROM " + t + " WHERE locale = :locale AND slug = :slug";
        this.deleteOne = "DELETE FROM " + t + " WHERE " + id + " = :entityId AND locale = :locale";
        this.deleteAll = "DELETE FROM " + t + " WHERE " + id + " = :entityId";
        String values = "VALUES (:entityId, :locale, :name, :slug, :content, :updatedAt)";
        this.upsert = switch (syntax) {
            case ON_CONFLICT -> "INSERT INTO " + t + " (" + columns + ") " + values
                    + " ON CONFLICT (" + id + ", locale) DO UPDATE SET name = EXCLUDED.name, slug = EXCLUDED.slug,"
                    + " content = EXCLUDED.content, updated_at = EXCLUDED.updated_at";
            case MERGE_KEY -> "MERGE INTO " + t + " (" + columns + ") KEY (" + id + ", locale) " + values;
        };
    }

    @Override
    public Mono<Translation> get(Long entityId, String locale) {
        return databaseClient.sql(selectOne)
                .bind("entityId", entityId)
                .bind("locale", locale)
                .map(this::mapRow)
                .one();
    }

    @Override
    public Mono<Map<String, Translation>> getAll(Long entityId) {
        return databaseClient.sql(selectAll)
                .bind("entityId", entityId)
                .map(this::mapRow)
                .all()
                .collectMap(Translation::getLocale)
                .map(Map::copyOf);
    }

    @Override
    public Mono<Translation> put(Long entityId, String locale, TranslationFields fields) {
        Translation translation = Translation.builder()
                .entityId(entityId)
                .locale(locale)
                .name(fields.getName())
                .slug(fields.getSlug())
                .content(fields.getContent())
                .updatedAt(LocalDateTime.now())
                .build();

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(upsert)
                .bind("entityId", entityId)
                .bind("locale", locale)
                .bind("name", translation.getName())
                .bind("slug", translation.getSlug())
                .bind("updatedAt", translation.getUpdatedAt());
        spec = translation.getContent() != null
                ? spec.bind("content", translation.getContent())
                : spec.bindNull("content", String.class);

        return spec.then()
                .doOnSuccess(v -> log.debug("Upserted {} translation {}/{}", table, entityId, locale))
                .thenReturn(translation);
    }

    @Override
    public Mono<Translation> findBySlug(String locale, String slug) {
        return databaseClient.sql(selectBySlug)
                .bind("locale", locale)
                .bind("slug", slug)
                .map(this::mapRow)
                .one();
    }

    @Override
    public Mono<Void> delete(Long entityId, String locale) {
        return databaseClient.sql(deleteOne)
                .bind("entityId", entityId)
                .bind("locale", locale)
                .then();
    }

    @Override
    public Mono<Void> deleteAll(Long entityId) {
        return databaseClient.sql(deleteAll)
                .bind("entityId", entityId)
                .fetch()
                .rowsUpdated()
                .doOnNext(rows -> log.debug("Deleted {} {} translations of {}", rows, table, entityId))
                .then();
    }

    private Translation mapRow(io.r2dbc.spi.Readable row) {
        return Translation.builder()
                .entityId(row.get(table.idColumn(), Long.class))
                .locale(row.get("locale", String.class))
                .name(row.get("name", String.class))
                .slug(row.get("slug", String.class))
                .content(row.get("content", String.class))
                .updatedAt(row.get("updated_at", LocalDateTime.class))
                .build();
    }
}
