package org.scalebaron.service;

import org.scalebaron.exceptions.MatrixParseException;
import org.scalebaron.exceptions.MissingFileException;
import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.MatrixStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link MatrixStore} over an input folder of matrix files.
 *
 * <p>The folder is indexed once on construction (file names only, via
 * {@link MatrixFileNameParser}); files are parsed on demand by the supplied {@link MatrixLoader}
 * and are not kept, so memory stays bounded by the element being processed. A zero-byte file, as
 * left behind by cloud-sync placeholders, is reported as unparsable without calling the loader.
 */
public class FolderMatrixStore implements MatrixStore {
    private static final Logger logger = LoggerFactory.getLogger(FolderMatrixStore.class);

    private final Path inputDir;
    private final MatrixLoader loader;
    private final Map<String, Map<ElementKey, Path>> files;

    /**
     * Indexes {@code inputDir}.
     *
     * @throws MissingFileException if the folder does not exist
     * @throws IOException if it cannot be listed
     */
    public FolderMatrixStore(Path inputDir, MatrixLoader loader) throws IOException {
        this.inputDir = Objects.requireNonNull(inputDir, "inputDir");
        this.loader = Objects.requireNonNull(loader, "loader");
        if (!Files.isDirectory(inputDir)) {
            throw new MissingFileException("Input folder does not exist: " + inputDir, inputDir);
        }
        this.files = index(inputDir);
        logger.info("Indexed {} sample(s) with matrix files in {}", files.size(), inputDir);
    }

    private static Map<String, Map<ElementKey, Path>> index(Path dir) throws IOException {
        MatrixFileNameParser parser = new MatrixFileNameParser();
        Map<String, Map<ElementKey, Path>> found = new TreeMap<>();
        int skipped = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, MatrixFileNameParser.MATRIX_GLOB)) {
            for (Path file : stream) {
                Optional<MatrixFileNameParser.ParsedName> parsed = parser.parse(file);
                if (parsed.isEmpty()) {
                    skipped++;
                    logger.debug("Ignoring file with unrecognized name: {}", file.getFileName());
                    continue;
                }
                found.computeIfAbsent(parsed.get().sample(), s -> new LinkedHashMap<>())
                        .put(parsed.get().element(), file);
            }
        }
        if (skipped > 0) {
            logger.warn("{} file(s) in {} did not match the matrix naming convention", skipped, dir);
        }
        return found;
    }

    public Path getInputDir() {
        return inputDir;
    }

    @Override
    public List<String> getSampleNames() {
        return Collections.unmodifiableList(new ArrayList<>(files.keySet()));
    }

    @Override
    public SortedSet<ElementKey> getElements() {
        SortedSet<ElementKey> elements = new TreeSet<>();
        files.values().forEach(m -> elements.addAll(m.keySet()));
        return Collections.unmodifiableSortedSet(elements);
    }

    @Override
    public boolean contains(String sample, ElementKey element) {
        return pathOf(sample, element) != null;
    }

    @Override
    public boolean isReadable(String sample, ElementKey element) {
        Path file = pathOf(sample, element);
        try {
            return file != null && Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            logger.debug("Could not stat {}: {}", file, e.getMessage());
            return false;
        }
    }

    @Override
    public ElementMatrix getMatrix(String sample, ElementKey element) throws IOException {
        Path file = pathOf(sample, element);
        if (file == null || !Files.exists(file)) {
            throw new MissingFileException("No matrix file for " + sample + " / " + element,
                    file != null ? file : inputDir.resolve(MatrixFileNameParser.fileNameFor(sample, element)));
        }
        if (Files.size(file) == 0) {
            throw new MatrixParseException("File is empty or not fully synced: " + file.getFileName());
        }
        logger.debug("Loading {}", file.getFileName());
        return loader.load(file, element.unit());
    }

    @Override
    public Optional<Instant> getLastModified(String sample, ElementKey element) {
        Path file = pathOf(sample, element);
        if (file == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            logger.debug("Could not read timestamp of {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Path pathOf(String sample, ElementKey element) {
        Map<ElementKey, Path> bySample = files.get(sample);
        return bySample == null ? null : bySample.get(element);
    }
}
