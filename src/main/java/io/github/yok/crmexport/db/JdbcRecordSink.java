package io.github.yok.crmexport.db;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import io.github.yok.crmexport.model.AssociationEdge;
import io.github.yok.crmexport.model.CrmRecord;
import io.github.yok.crmexport.model.ResourceType;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RecordSink} writing to a JDBC connection owned by the caller.
 *
 * <p>
 * Each call runs in its own transaction: auto-commit is switched off, the statements are batched,
 * then the transaction is committed or rolled back on failure and auto-commit is restored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcRecordSink implements RecordSink {

    private final Connection conn;
    private final DbDialectHandler dialect;
    private final Map<ResourceType, List<String>> columns;
    private final boolean deduplicateAssociations;

    /**
     * Creates a sink.
     *
     * @param conn open connection; not closed by the sink
     * @param dialect SQL grammar
     * @param columns property columns of each resource table, as returned by
     *        {@link SchemaInitializer#initialize}
     * @param deduplicateAssociations whether already stored edges are skipped
     */
    public JdbcRecordSink(Connection conn, DbDialectHandler dialect,
            Map<ResourceType, List<String>> columns, boolean deduplicateAssociations) {
        this.conn = checkNotNull(conn, "conn");
        this.dialect = checkNotNull(dialect, "dialect");
        this.columns = ImmutableMap.copyOf(columns);
        this.deduplicateAssociations = deduplicateAssociations;
    }

    @Override
    public void upsertRecords(ResourceType type, List<CrmRecord> batch) throws SQLException {
        if (batch.isEmpty()) {
            return;
        }
        List<String> cols = columnsOf(type);
        String sql = dialect.upsertSql(type.getTableName(), cols);
        inTransaction(() -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (CrmRecord record : batch) {
                    ps.setString(1, record.getId());
                    for (int i = 0; i < cols.size(); i++) {
                        ps.setString(i + 2, record.getProperty(cols.get(i)));
                    }
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        });
        log.debug("[{}] Upserted {} records", type.getApiName(), batch.size());
    }

    @Override
    public void insertAssociations(List<AssociationEdge> edges) throws SQLException {
        if (edges.isEmpty()) {
            return;
        }
        String sql = dialect.insertAssociationSql(deduplicateAssociations);
        inTransaction(() -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (AssociationEdge edge : edges) {
                    ps.setString(1, edge.getFromType().getApiName());
                    ps.setString(2, edge.getFromId());
                    ps.setString(3, edge.getToType().getApiName());
                    ps.setString(4, edge.getToId());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        });
    }

    @Override
    public List<String> listIds(ResourceType type) throws SQLException {
        String id = dialect.quoteIdentifier("id");
        String sql = "SELECT " + id + " FROM " + dialect.quoteIdentifier(type.getTableName())
                + " ORDER BY " + id + " ASC";
        List<String> ids = new ArrayList<>();
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        }
        return ids;
    }

    @Override
    public long countRecords(ResourceType type) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + dialect.quoteIdentifier(type.getTableName());
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private List<String> columnsOf(ResourceType type) {
        List<String> cols = columns.get(type);
        if (cols == null) {
            throw new IllegalStateException("Schema of " + type.getApiName()
                    + " has not been initialized");
        }
        return cols;
    }

    private void inTransaction(SqlWork work) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            work.run();
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }
}
