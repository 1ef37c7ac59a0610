package org.scalebaron.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scalebaron.model.StatisticsRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatisticsExporter.
 */
class StatisticsExporterTest {

    @TempDir Path tmp;

    private final StatisticsExporter exporter = new StatisticsExporter();

    private static StatisticsRecord record(double base) {
        return new StatisticsRecord(base, base * 2, base * 3, base * 4, base * 2, base * 2.5, 10);
    }

    @Test
    void testWrite_roundsToFiveSignificantFigures() throws IOException {
        Path table = tmp.resolve("Fe56_ppm").resolve("Fe56_ppm_statistics.csv");
        StatisticsRecord r = new StatisticsRecord(1234.5678, 0.000123456, 3, 4, 5, 6.0, 10);
        exporter.write(table, List.of(new StatisticsExporter.Row("S1", r, "Alias, one")));

        List<String> lines = Files.readAllLines(table, StandardCharsets.UTF_8);
        assertEquals(String.join(",", StatisticsExporter.HEADER), lines.get(0));
        assertEquals("S1,1234.6,0.00012346,3,4,5,6,\"Alias, one\"", lines.get(1));
    }

    @Test
    void testMerge_keepsExistingRowsAndAppendsNewOnes() throws IOException {
        Path table = tmp.resolve("stats.csv");
        Map<String, StatisticsRecord> first = new LinkedHashMap<>();
        first.put("S1", record(1));
        first.put("S2", record(2));
        exporter.merge(table, first, s -> s);

        Map<String, StatisticsRecord> second = new LinkedHashMap<>();
        second.put("S2", record(20));
        second.put("S3", record(3));
        List<StatisticsExporter.Row> rows = exporter.merge(table, second, s -> s.equals("S1") ? "First" : s);

        assertEquals(List.of("S1", "S2", "S3"), rows.stream().map(StatisticsExporter.Row::sample).toList());
        Map<String, StatisticsExporter.Row> read = exporter.read(table);
        assertEquals(1.0, read.get("S1").statistics().p25());
        assertEquals("First", read.get("S1").alias());
        assertEquals(20.0, read.get("S2").statistics().p25());
        assertEquals(12.0, read.get("S3").statistics().p99());
    }

    @Test
    void testRead_skipsMalformedRows() throws IOException {
        Path table = tmp.resolve("stats.csv");
        Files.write(table, List.of(
                String.join(",", StatisticsExporter.HEADER),
                "S1,1,2,3,4,2,2.5,S1",
                "S2,not-a-number,2,3,4,2,2.5,S2",
                "S3,1,2",
                "",
                "S4,1,2,3,4,2,2.5,"), StandardCharsets.UTF_8);

        Map<String, StatisticsExporter.Row> rows = exporter.read(table);

        assertEquals(List.of("S1", "S4"), List.copyOf(rows.keySet()));
        assertEquals("S4", rows.get("S4").alias(), "Blank alias falls back to the sample name");
    }

    @Test
    void testRead_missingFileIsEmpty() throws IOException {
        assertTrue(exporter.read(tmp.resolve("absent.csv")).isEmpty());
    }
}
