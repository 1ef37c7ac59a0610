package org.scalebaron.service;

import org.scalebaron.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Display aliases for samples, persisted as {@code Sample,Alias} rows next to the outputs.
 *
 * <p>An alias equal to the sample name, or blank, means "no alias". Saving with no aliases removes
 * the file rather than leaving an empty table behind.
 */
public class SampleAliasStore {
    private static final Logger logger = LoggerFactory.getLogger(SampleAliasStore.class);

    private final Path file;
    private final Map<String, String> aliases = new TreeMap<>();

    public SampleAliasStore(Path file) {
        this.file = file;
    }

    /**
     * Loads aliases from disk, replacing the ones in memory. A missing file yields no aliases;
     * malformed rows are skipped.
     */
    public void load() throws IOException {
        aliases.clear();
        if (!Files.isRegularFile(file)) {
            return;
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 1; i < lines.size(); i++) {
            if (lines.get(i).isBlank()) {
                continue;
            }
            List<String> fields = MinorFunctions.splitCsvLine(lines.get(i));
            if (fields.size() < 2 || fields.get(0).isEmpty()) {
                logger.warn("Skipping malformed alias row {} in {}", i + 1, file.getFileName());
                continue;
            }
            setAlias(fields.get(0), fields.get(1));
        }
        logger.debug("Loaded {} sample alias(es) from {}", aliases.size(), file);
    }

    public void save() throws IOException {
        if (aliases.isEmpty()) {
            if (Files.deleteIfExists(file)) {
                logger.debug("Removed empty alias table {}", file);
            }
            return;
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            w.write("Sample,Alias");
            w.newLine();
            for (Map.Entry<String, String> entry : aliases.entrySet()) {
                w.write(MinorFunctions.escapeCsv(entry.getKey()) + "," + MinorFunctions.escapeCsv(entry.getValue()));
                w.newLine();
            }
        }
    }

    /**
     * Sets or clears an alias. Blank aliases and aliases equal to the sample name clear it.
     */
    public void setAlias(String sample, String alias) {
        String trimmed = alias == null ? "" : alias.trim();
        if (trimmed.isEmpty() || trimmed.equals(sample)) {
            aliases.remove(sample);
        } else {
            aliases.put(sample, trimmed);
        }
    }

    /**
     * @return the alias, or the sample name itself if none is set
     */
    public String labelFor(String sample) {
        return aliases.getOrDefault(sample, sample);
    }

    public Map<String, String> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }
}
