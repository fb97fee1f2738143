package io.github.yok.crmexport.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.lang3.StringUtils;

/**
 * Helpers for writing CSV snapshots.
 *
 * <p>
 * Files are UTF-8 with minimal quoting, a header row, the platform line separator and backslash as
 * escape character.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Builds the list of column indices to sort by.
     *
     * <p>
     * Primary key columns are used in key order. Without a primary key every column is used, left
     * to right, so that tables such as {@code associations} are fully ordered. When duplicated
     * header names exist, the first occurrence wins.
     * </p>
     *
     * @param headers CSV header names
     * @param pkColumns PK column names (empty list means no primary key)
     * @return list of zero-based column indices to sort by
     */
    public static List<Integer> buildSortIndices(String[] headers, List<String> pkColumns) {
        Map<String, Integer> headerIndex = IntStream.range(0, headers.length).boxed().collect(
                Collectors.toMap(i -> headers[i], i -> i, (a, b) -> a, LinkedHashMap::new));
        if (pkColumns.isEmpty()) {
            return IntStream.range(0, headers.length).boxed().collect(Collectors.toList());
        }
        return pkColumns.stream().map(headerIndex::get).collect(Collectors.toList());
    }

    /**
     * Returns a comparator ordering rows by the given column indices.
     *
     * <p>
     * Cells are trimmed, then compared with {@link #compareCells(String, String)}.
     * </p>
     *
     * @param sortIdx zero-based column indices in priority order
     * @return row comparator
     */
    public static Comparator<List<String>> rowComparator(List<Integer> sortIdx) {
        return (a, b) -> {
            for (int idx : sortIdx) {
                int cmp = compareCells(StringUtils.trimToEmpty(a.get(idx)),
                        StringUtils.trimToEmpty(b.get(idx)));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }

    /**
     * Compares two cells: unsigned integers sort numerically and before any other text, other
     * text sorts lexicographically. Ids of any length are handled.
     *
     * @param a first cell
     * @param b second cell
     * @return comparison result
     */
    public static int compareCells(String a, String b) {
        boolean numA = StringUtils.isNumeric(a);
        boolean numB = StringUtils.isNumeric(b);
        if (numA && numB) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        if (numA != numB) {
            return numA ? -1 : 1;
        }
        return a.compareTo(b);
    }

    /**
     * Writes the given header and rows to a UTF-8 CSV file.
     *
     * @param csvFile the destination CSV file (will be created or overwritten)
     * @param headers the header columns to write as the first record
     * @param rows the data rows; each inner list represents one CSV record
     * @throws IOException if an I/O error occurs while writing the file
     */
    public static void writeCsvUtf8(File csvFile, String[] headers, List<List<String>> rows)
            throws IOException {
        CSVFormat fmt =
                CSVFormat.DEFAULT.builder().setHeader(headers).setQuoteMode(QuoteMode.MINIMAL)
                        .setEscape('\\').setRecordSeparator(System.lineSeparator()).build();
        try (Writer w =
                new OutputStreamWriter(new FileOutputStream(csvFile), StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
    }
}
