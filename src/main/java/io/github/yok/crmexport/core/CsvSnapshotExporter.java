package io.github.yok.crmexport.core;

import io.github.yok.crmexport.db.DbDialectHandler;
import io.github.yok.crmexport.util.CsvUtils;
import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

/**
 * Dumps store tables to UTF-8 CSV files named {@code {table}.csv}.
 *
 * <p>
 * Rows are sorted in memory by primary key, or by every column when the table has none, so the
 * output is deterministic. NULL cells are written as empty strings.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvSnapshotExporter {

    private final DbDialectHandler dialect;

    /**
     * Exports each table.
     *
     * @param conn JDBC connection
     * @param tables table names
     * @param outputDir destination directory, created when missing
     * @return number of rows written per table, in call order
     * @throws SQLException on read error
     * @throws IOException on write error
     */
    public List<Integer> exportAll(Connection conn, List<String> tables, File outputDir)
            throws SQLException, IOException {
        FileUtils.forceMkdir(outputDir);
        List<Integer> counts = new ArrayList<>();
        for (String table : tables) {
            File csvFile = new File(outputDir, table + ".csv");
            int rows = export(conn, table, csvFile);
            log.info("Table[{}] exported {} rows to {}", table, rows, csvFile);
            counts.add(rows);
        }
        return counts;
    }

    /**
     * Executes {@code SELECT *} for the table and writes the sorted result.
     *
     * @param conn JDBC connection
     * @param table table name
     * @param csvFile destination CSV file
     * @return number of rows written
     * @throws SQLException on read error
     * @throws IOException on write error
     */
    int export(Connection conn, String table, File csvFile) throws SQLException, IOException {
        List<String> pkColumns = fetchPrimaryKeyColumns(conn, table);

        String[] headerArray;
        List<List<String>> rows = new ArrayList<>();
        String sql = "SELECT * FROM " + dialect.quoteIdentifier(table);
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData md = rs.getMetaData();
            int colCount = md.getColumnCount();
            headerArray = new String[colCount];
            for (int i = 1; i <= colCount; i++) {
                headerArray[i - 1] = md.getColumnLabel(i);
            }
            while (rs.next()) {
                List<String> row = new ArrayList<>(colCount);
                for (int i = 1; i <= colCount; i++) {
                    String val = rs.getString(i);
                    row.add(val == null ? "" : val);
                }
                rows.add(row);
            }
        }

        List<Integer> sortIdx = CsvUtils.buildSortIndices(headerArray, pkColumns);
        log.debug("Table[{}] sorting by column indices {}", table, sortIdx);
        rows.sort(CsvUtils.rowComparator(sortIdx));

        CsvUtils.writeCsvUtf8(csvFile, headerArray, rows);
        return rows.size();
    }

    List<String> fetchPrimaryKeyColumns(Connection conn, String table) throws SQLException {
        List<String> pkColumns = new ArrayList<>();
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getPrimaryKeys(null, null, table)) {
            while (rs.next()) {
                pkColumns.add(rs.getString("COLUMN_NAME"));
            }
        }
        return pkColumns;
    }
}
