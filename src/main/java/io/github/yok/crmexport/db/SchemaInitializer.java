package io.github.yok.crmexport.db;

import io.github.yok.crmexport.fetch.PropertyCatalog;
import io.github.yok.crmexport.model.ResourceType;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Creates the store schema from the properties the API reports for each resource type.
 *
 * <p>
 * Resource tables hold {@code id} as primary key plus one text column per property. A table that
 * already exists gains columns for properties discovered since it was created; columns are never
 * dropped. The {@code associations} table has no key; when deduplication is requested, existing
 * duplicate edges are removed before the unique index is created.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaInitializer {

    private static final String ID_COLUMN = "id";

    private final PropertyCatalog catalog;
    private final DbDialectHandler dialect;

    /**
     * Brings the schema up to date.
     *
     * @param conn open connection
     * @param types resource types to prepare
     * @param deduplicateAssociations whether to enforce one row per association edge
     * @return property columns per resource table, in discovery order, excluding {@code id}
     * @throws SQLException on DDL error
     */
    public Map<ResourceType, List<String>> initialize(Connection conn,
            Collection<ResourceType> types, boolean deduplicateAssociations) throws SQLException {
        Map<ResourceType, List<String>> columns = new EnumMap<>(ResourceType.class);
        try (Statement stmt = conn.createStatement()) {
            for (ResourceType type : types) {
                List<String> props = columnsFor(type);
                String table = type.getTableName();
                Set<String> existing = existingColumns(conn, table);
                if (existing.isEmpty()) {
                    stmt.execute(dialect.createRecordTableSql(table, props));
                    log.info("Table[{}] created with {} property columns", table, props.size());
                } else {
                    for (String prop : props) {
                        if (!existing.contains(prop.toLowerCase(Locale.ROOT))) {
                            stmt.execute(dialect.addColumnSql(table, prop));
                            log.info("Table[{}] added column {}", table, prop);
                        }
                    }
                }
                columns.put(type, Collections.unmodifiableList(props));
            }

            stmt.execute(dialect.createAssociationTableSql());
            if (deduplicateAssociations) {
                int removed = stmt.executeUpdate(dialect.removeDuplicateAssociationsSql());
                if (removed > 0) {
                    log.info("Removed {} duplicate association rows", removed);
                }
                stmt.execute(dialect.createAssociationUniqueIndexSql());
            }
        }
        return columns;
    }

    private List<String> columnsFor(ResourceType type) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(ID_COLUMN);
        for (String name : catalog.propertiesOf(type)) {
            if (StringUtils.isBlank(name)) {
                continue;
            }
            // SQLite column names are case-insensitive
            if (seen.add(name.toLowerCase(Locale.ROOT))) {
                result.add(name);
            } else if (!ID_COLUMN.equalsIgnoreCase(name)) {
                log.warn("[{}] Skipping duplicate property name {}", type.getApiName(), name);
            }
        }
        return result;
    }

    private Set<String> existingColumns(Connection conn, String table) throws SQLException {
        Set<String> names = new HashSet<>();
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getColumns(null, null, table, null)) {
            while (rs.next()) {
                names.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }
}
