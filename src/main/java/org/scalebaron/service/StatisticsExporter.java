package org.scalebaron.service;

import org.scalebaron.model.StatisticsRecord;
import org.scalebaron.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Reads and writes the per-element statistics table.
 *
 * <p>Format: one header line and one row per sample,
 * <pre>
 * Sample,25th Percentile,50th Percentile,75th Percentile,99th Percentile,IQR,Mean,Alias
 * </pre>
 * Numbers are rounded to five significant figures. Writing merges with an existing table: rows of
 * samples that were recomputed are replaced in place, other existing rows are kept, and new samples
 * are appended. A row that cannot be parsed is skipped with a warning.
 */
public class StatisticsExporter {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsExporter.class);

    public static final List<String> HEADER = List.of("Sample", "25th Percentile", "50th Percentile",
            "75th Percentile", "99th Percentile", "IQR", "Mean", "Alias");

    private static final int SIGNIFICANT_DIGITS = 5;

    /**
     * One table row.
     *
     * @param sample sample name
     * @param statistics the values; {@code validPixels} is 0 for rows read back from disk
     * @param alias display alias, equal to the sample name when none is set
     */
    public record Row(String sample, StatisticsRecord statistics, String alias) {
    }

    /**
     * Reads a statistics table.
     *
     * @return rows by sample in file order; empty if the file does not exist
     */
    public Map<String, Row> read(Path table) throws IOException {
        Map<String, Row> rows = new LinkedHashMap<>();
        if (!Files.isRegularFile(table)) {
            return rows;
        }
        List<String> lines = Files.readAllLines(table, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            return rows;
        }
        Map<String, Integer> columns = columnIndex(MinorFunctions.splitCsvLine(lines.get(0)));
        Integer sampleCol = columns.get("sample");
        if (sampleCol == null) {
            logger.warn("Statistics table {} has no Sample column - ignoring it", table);
            return rows;
        }
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = MinorFunctions.splitCsvLine(line);
            try {
                String sample = fields.get(sampleCol);
                StatisticsRecord record = new StatisticsRecord(
                        number(fields, columns, "25th percentile"),
                        number(fields, columns, "50th percentile"),
                        number(fields, columns, "75th percentile"),
                        number(fields, columns, "99th percentile"),
                        number(fields, columns, "iqr"),
                        number(fields, columns, "mean"),
                        0);
                Integer aliasCol = columns.get("alias");
                String alias = aliasCol != null && aliasCol < fields.size() && !fields.get(aliasCol).isEmpty()
                        ? fields.get(aliasCol) : sample;
                rows.put(sample, new Row(sample, record, alias));
            } catch (RuntimeException e) {
                logger.warn("Skipping malformed row {} in {}: {}", i + 1, table.getFileName(), e.getMessage());
            }
        }
        return rows;
    }

    /**
     * Merges freshly computed statistics into the table at {@code table}, creating it if needed.
     *
     * @param table target file
     * @param fresh statistics computed in this pass, by sample, in display order
     * @param aliasOf alias lookup for the Alias column
     * @return the rows as written
     */
    public List<Row> merge(Path table, Map<String, StatisticsRecord> fresh,
                           UnaryOperator<String> aliasOf) throws IOException {
        Map<String, Row> merged = read(table);
        for (Map.Entry<String, StatisticsRecord> entry : fresh.entrySet()) {
            String sample = entry.getKey();
            merged.put(sample, new Row(sample, entry.getValue(), aliasOf.apply(sample)));
        }
        // Existing rows pick up alias changes as well
        List<Row> rows = new ArrayList<>();
        for (Row row : merged.values()) {
            rows.add(new Row(row.sample(), row.statistics(), aliasOf.apply(row.sample())));
        }
        write(table, rows);
        logger.info("Wrote statistics for {} sample(s) ({} new or updated) to {}",
                rows.size(), fresh.size(), table.getFileName());
        return rows;
    }

    /**
     * Writes {@code rows} to {@code table}, replacing any existing file.
     */
    public void write(Path table, List<Row> rows) throws IOException {
        Path parent = table.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(table, StandardCharsets.UTF_8)) {
            w.write(String.join(",", HEADER));
            w.newLine();
            for (Row row : rows) {
                StatisticsRecord s = row.statistics();
                w.write(String.join(",",
                        MinorFunctions.escapeCsv(row.sample()),
                        format(s.p25()), format(s.p50()), format(s.p75()), format(s.p99()),
                        format(s.iqr()), format(s.mean()),
                        MinorFunctions.escapeCsv(row.alias())));
                w.newLine();
            }
        }
    }

    private static String format(double value) {
        return MinorFunctions.formatSignificant(MinorFunctions.roundSignificant(value, SIGNIFICANT_DIGITS),
                SIGNIFICANT_DIGITS);
    }

    private static Map<String, Integer> columnIndex(List<String> header) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            index.put(header.get(i).toLowerCase(Locale.ROOT), i);
        }
        return index;
    }

    private static double number(List<String> fields, Map<String, Integer> columns, String column) {
        Integer idx = columns.get(column);
        if (idx == null) {
            throw new IllegalArgumentException("missing column '" + column + "'");
        }
        return Double.parseDouble(fields.get(idx));
    }
}
