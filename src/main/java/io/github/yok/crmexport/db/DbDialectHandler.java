package io.github.yok.crmexport.db;

import java.util.List;

/**
 * SQL grammar of the local store.
 *
 * <p>
 * Keeps identifier quoting and statement text out of {@link JdbcRecordSink},
 * {@link SchemaInitializer} and the CSV snapshot exporter so they only deal with JDBC.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler {

    /** Name of the association edge table. */
    String ASSOCIATIONS_TABLE = "associations";

    /**
     * Quotes identifier in dialect style.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Returns DDL creating a resource table keyed by {@code id} when it does not exist yet.
     *
     * @param table table name
     * @param columns property columns, excluding {@code id}
     * @return DDL statement
     */
    String createRecordTableSql(String table, List<String> columns);

    /**
     * Returns DDL adding one text column to an existing table.
     *
     * @param table table name
     * @param column column name
     * @return DDL statement
     */
    String addColumnSql(String table, String column);

    /**
     * Returns an insert-or-replace statement keyed by {@code id}, with one placeholder for the id
     * followed by one per column.
     *
     * @param table table name
     * @param columns property columns, excluding {@code id}
     * @return parameterized DML
     */
    String upsertSql(String table, List<String> columns);

    /**
     * Returns DDL creating the association edge table when it does not exist yet.
     *
     * @return DDL statement
     */
    String createAssociationTableSql();

    /**
     * Returns the association edge insert with four placeholders.
     *
     * @param ignoreDuplicates whether an edge already present is silently skipped
     * @return parameterized DML
     */
    String insertAssociationSql(boolean ignoreDuplicates);

    /**
     * Returns DML removing duplicate association edges, keeping one row per edge.
     *
     * @return DML statement
     */
    String removeDuplicateAssociationsSql();

    /**
     * Returns DDL creating the unique index over the association edge columns.
     *
     * @return DDL statement
     */
    String createAssociationUniqueIndexSql();
}
