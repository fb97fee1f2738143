package io.github.yok.crmexport.db;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * SQLite implementation of {@link DbDialectHandler}. Every property is stored as {@code TEXT}.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
public class SqliteDialectHandler implements DbDialectHandler {

    static final String ASSOCIATIONS_UNIQUE_INDEX = "ux_associations_edge";

    static final List<String> ASSOCIATION_COLUMNS = List.of("from_object_type", "from_object_id",
            "to_object_type", "to_object_id");

    /**
     * Quotes with double quotes, doubling any embedded quote.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String createRecordTableSql(String table, List<String> columns) {
        String cols = Stream
                .concat(Stream.of(quoteIdentifier("id") + " TEXT PRIMARY KEY"),
                        columns.stream().map(c -> quoteIdentifier(c) + " TEXT"))
                .collect(Collectors.joining(", "));
        return "CREATE TABLE IF NOT EXISTS " + quoteIdentifier(table) + " (" + cols + ")";
    }

    @Override
    public String addColumnSql(String table, String column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + quoteIdentifier(column)
                + " TEXT";
    }

    @Override
    public String upsertSql(String table, List<String> columns) {
        String names = Stream.concat(Stream.of("id"), columns.stream()).map(this::quoteIdentifier)
                .collect(Collectors.joining(", "));
        String marks = String.join(", ", Collections.nCopies(columns.size() + 1, "?"));
        return "INSERT OR REPLACE INTO " + quoteIdentifier(table) + " (" + names + ") VALUES ("
                + marks + ")";
    }

    @Override
    public String createAssociationTableSql() {
        String cols = ASSOCIATION_COLUMNS.stream().map(c -> quoteIdentifier(c) + " TEXT")
                .collect(Collectors.joining(", "));
        return "CREATE TABLE IF NOT EXISTS " + quoteIdentifier(ASSOCIATIONS_TABLE) + " (" + cols
                + ")";
    }

    @Override
    public String insertAssociationSql(boolean ignoreDuplicates) {
        return (ignoreDuplicates ? "INSERT OR IGNORE INTO " : "INSERT INTO ")
                + quoteIdentifier(ASSOCIATIONS_TABLE) + " (" + associationColumnList()
                + ") VALUES (?, ?, ?, ?)";
    }

    @Override
    public String removeDuplicateAssociationsSql() {
        String table = quoteIdentifier(ASSOCIATIONS_TABLE);
        return "DELETE FROM " + table + " WHERE rowid NOT IN (SELECT MIN(rowid) FROM " + table
                + " GROUP BY " + associationColumnList() + ")";
    }

    @Override
    public String createAssociationUniqueIndexSql() {
        return "CREATE UNIQUE INDEX IF NOT EXISTS " + quoteIdentifier(ASSOCIATIONS_UNIQUE_INDEX)
                + " ON " + quoteIdentifier(ASSOCIATIONS_TABLE) + " (" + associationColumnList()
                + ")";
    }

    private String associationColumnList() {
        return ASSOCIATION_COLUMNS.stream().map(this::quoteIdentifier)
                .collect(Collectors.joining(", "));
    }
}
