package org.scalebaron.service;

import org.scalebaron.exceptions.MissingFileException;
import org.scalebaron.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Custom pixel-size table: maps sample names to pixel edge lengths in microns.
 *
 * <p>File format is a header {@code Sample,Pixel Size} followed by one row per sample. Rows with a
 * missing name, a non-numeric size or a size that is not positive are rejected one by one and
 * reported in {@link ImportResult#rowErrors()}; the rest of the table still imports.
 *
 * <p>{@link #writeTemplate(Path, Collection, double)} produces a table pre-filled with the batch
 * default for the user to edit.
 */
public class PixelSizeTable {
    private static final Logger logger = LoggerFactory.getLogger(PixelSizeTable.class);

    public static final String SAMPLE_COLUMN = "Sample";
    public static final String SIZE_COLUMN = "Pixel Size";

    /**
     * @param pixelSizes accepted sizes by sample, in file order
     * @param rowErrors one message per rejected row, naming the line number
     */
    public record ImportResult(Map<String, Double> pixelSizes, List<String> rowErrors) {
        public ImportResult {
            pixelSizes = java.util.Collections.unmodifiableMap(new LinkedHashMap<>(pixelSizes));
            rowErrors = List.copyOf(rowErrors);
        }
    }

    /**
     * Imports a pixel-size table.
     *
     * @throws MissingFileException if the file does not exist
     * @throws IOException if it cannot be read or its header lacks the required columns
     */
    public ImportResult importTable(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new MissingFileException(file);
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            throw new IOException("Pixel size table is empty: " + file);
        }
        List<String> header = MinorFunctions.splitCsvLine(stripBom(lines.get(0)));
        int sampleCol = indexOf(header, SAMPLE_COLUMN);
        int sizeCol = indexOf(header, SIZE_COLUMN);
        if (sampleCol < 0 || sizeCol < 0) {
            throw new IOException("Pixel size table must have '" + SAMPLE_COLUMN + "' and '"
                    + SIZE_COLUMN + "' columns, found " + header);
        }

        Map<String, Double> sizes = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = MinorFunctions.splitCsvLine(line);
            int lineNo = i + 1;
            if (fields.size() <= Math.max(sampleCol, sizeCol)) {
                errors.add("Line " + lineNo + ": expected at least " + (Math.max(sampleCol, sizeCol) + 1) + " columns");
                continue;
            }
            String sample = fields.get(sampleCol);
            if (sample.isEmpty()) {
                errors.add("Line " + lineNo + ": sample name is empty");
                continue;
            }
            double size;
            try {
                size = Double.parseDouble(fields.get(sizeCol));
            } catch (NumberFormatException e) {
                errors.add("Line " + lineNo + ": '" + fields.get(sizeCol) + "' is not a number");
                continue;
            }
            if (!(size > 0) || Double.isInfinite(size)) {
                errors.add("Line " + lineNo + ": pixel size must be positive, got " + size);
                continue;
            }
            if (sizes.put(sample, size) != null) {
                logger.warn("Pixel size for {} given more than once - using line {}", sample, lineNo);
            }
        }
        errors.forEach(e -> logger.warn("Pixel size table {}: {}", file.getFileName(), e));
        logger.info("Imported custom pixel sizes for {} sample(s) from {} ({} row error(s))",
                sizes.size(), file.getFileName(), errors.size());
        return new ImportResult(sizes, errors);
    }

    /**
     * Writes a template listing {@code samples} (sorted) with {@code defaultSize} filled in.
     */
    public void writeTemplate(Path file, Collection<String> samples, double defaultSize) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            w.write(SAMPLE_COLUMN + "," + SIZE_COLUMN);
            w.newLine();
            for (String sample : new TreeSet<>(samples)) {
                w.write(MinorFunctions.escapeCsv(sample) + "," + defaultSize);
                w.newLine();
            }
        }
        logger.info("Saved pixel size template for {} sample(s) to {}", samples.size(), file);
    }

    private static int indexOf(List<String> header, String column) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).toLowerCase(Locale.ROOT).equals(column.toLowerCase(Locale.ROOT))) {
                return i;
            }
        }
        return -1;
    }

    private static String stripBom(String line) {
        return line.startsWith("﻿") ? line.substring(1) : line;
    }
}
