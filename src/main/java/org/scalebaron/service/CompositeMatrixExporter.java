package org.scalebaron.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a composite matrix as header-less comma-separated values; absent pixels are empty cells.
 */
public class CompositeMatrixExporter {
    private static final Logger logger = LoggerFactory.getLogger(CompositeMatrixExporter.class);

    public void write(Path file, double[][] composite) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            StringBuilder line = new StringBuilder();
            for (double[] row : composite) {
                line.setLength(0);
                for (int c = 0; c < row.length; c++) {
                    if (c > 0) {
                        line.append(',');
                    }
                    if (!Double.isNaN(row[c])) {
                        line.append(row[c]);
                    }
                }
                w.write(line.toString());
                w.newLine();
            }
        }
        logger.info("Composite matrix saved: {} ({} x {})", file.getFileName(),
                composite.length, composite.length == 0 ? 0 : composite[0].length);
    }
}
