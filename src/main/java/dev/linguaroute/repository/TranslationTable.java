package dev.linguaroute.repository;

/**
 * Satellite translation tables. SQL identifiers are taken from here only.
 */
public enum TranslationTable {

    CATEGORY("category_translations", "category_id"),
    POST("post_translations", "post_id");

    private final String tableName;
    private final String idColumn;

    TranslationTable(String tableName, String idColumn) {
        this.tableName = tableName;
        this.idColumn = idColumn;
    }

    public String tableName() {
        return tableName;
    }

    public String idColumn() {
        return idColumn;
    }
}
