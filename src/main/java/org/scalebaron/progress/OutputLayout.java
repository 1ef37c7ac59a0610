package org.scalebaron.progress;

import org.scalebaron.model.ElementKey;
import org.scalebaron.model.UnitType;
import org.scalebaron.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * OutputLayout
 *
 * <p>Names every artifact a batch writes below the output folder. Progress is reconstructed from
 * these names alone, so writers and the {@link ProgressTracker} must agree on them:
 * <pre>
 * &lt;output&gt;/
 *   sample_aliases.csv
 *   batch_summary.json
 *   Fe56_ppm/
 *     Fe56_ppm_composite.png            final artifact (Complete)
 *     Fe56_ppm_statistics.csv           statistics export (Partial per listed sample)
 *     Fe56_ppm_composite_matrix.csv     optional numeric composite
 *     Histograms/S1_histogram.png       intermediate artifact (Partial)
 *     Individual/S1.png, S1_labeled.png per-sample images
 * </pre>
 *
 * <p>Older runs wrote {@code <output>/Fe56/Fe56_composite.png} and {@code <output>/Fe56/Histograms}
 * without the unit; those folders are still recognized when scanning.
 */
public class OutputLayout {
    private static final Logger logger = LoggerFactory.getLogger(OutputLayout.class);

    public static final String HISTOGRAM_DIR = "Histograms";
    public static final String INDIVIDUAL_DIR = "Individual";
    public static final String HISTOGRAM_SUFFIX = "_histogram.png";
    public static final String COMPOSITE_SUFFIX = "_composite.png";
    public static final String STATISTICS_SUFFIX = "_statistics.csv";
    public static final String COMPOSITE_MATRIX_SUFFIX = "_composite_matrix.csv";
    public static final String ALIAS_FILE = "sample_aliases.csv";
    public static final String SUMMARY_FILE = "batch_summary.json";

    private final Path outputRoot;

    public OutputLayout(Path outputRoot) {
        this.outputRoot = outputRoot.toAbsolutePath().normalize();
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    public Path elementDir(ElementKey element) {
        return outputRoot.resolve(element.outputName());
    }

    public Path legacyElementDir(ElementKey element) {
        return outputRoot.resolve(element.element());
    }

    public Path compositeImage(ElementKey element) {
        return elementDir(element).resolve(element.outputName() + COMPOSITE_SUFFIX);
    }

    public Path legacyCompositeImage(ElementKey element) {
        return legacyElementDir(element).resolve(element.element() + COMPOSITE_SUFFIX);
    }

    public Path histogram(ElementKey element, String sample) {
        return elementDir(element).resolve(HISTOGRAM_DIR).resolve(fileStem(sample) + HISTOGRAM_SUFFIX);
    }

    public Path legacyHistogram(ElementKey element, String sample) {
        return legacyElementDir(element).resolve(HISTOGRAM_DIR).resolve(fileStem(sample) + HISTOGRAM_SUFFIX);
    }

    public Path statisticsTable(ElementKey element) {
        return elementDir(element).resolve(element.outputName() + STATISTICS_SUFFIX);
    }

    public Path compositeMatrix(ElementKey element) {
        return elementDir(element).resolve(element.outputName() + COMPOSITE_MATRIX_SUFFIX);
    }

    /**
     * @param labeled whether the image carries the sample label
     */
    public Path individualImage(ElementKey element, String sample, boolean labeled) {
        String name = fileStem(sample) + (labeled ? "_labeled.png" : ".png");
        return elementDir(element).resolve(INDIVIDUAL_DIR).resolve(name);
    }

    public Path aliasTable() {
        return outputRoot.resolve(ALIAS_FILE);
    }

    public Path batchSummary() {
        return outputRoot.resolve(SUMMARY_FILE);
    }

    /**
     * Returns the modification time of the element's composite if one exists and is non-empty,
     * checking the current layout first and the legacy layout second.
     */
    public Optional<FileTime> compositeTimestamp(ElementKey element) {
        Optional<FileTime> current = nonEmptyTimestamp(compositeImage(element));
        return current.isPresent() ? current : nonEmptyTimestamp(legacyCompositeImage(element));
    }

    /**
     * @return true if the sample's histogram exists and is non-empty in either layout
     */
    public boolean hasHistogram(ElementKey element, String sample) {
        return nonEmptyTimestamp(histogram(element, sample)).isPresent()
                || nonEmptyTimestamp(legacyHistogram(element, sample)).isPresent();
    }

    /**
     * Infers element columns and the samples seen in each from the output folder alone. Used when
     * no input folder is available. Folder names ending in a known unit map to that unit; names
     * without one are legacy ppm folders.
     *
     * @return samples with a histogram, by column; columns with only a composite map to an empty set
     */
    public Map<ElementKey, Set<String>> scanOutputColumns() {
        Map<ElementKey, Set<String>> columns = new TreeMap<>();
        if (!Files.isDirectory(outputRoot)) {
            return columns;
        }
        try (Stream<Path> dirs = Files.list(outputRoot)) {
            dirs.filter(Files::isDirectory).forEach(dir -> {
                String name = dir.getFileName().toString();
                boolean hasComposite = nonEmptyTimestamp(dir.resolve(name + COMPOSITE_SUFFIX)).isPresent();
                Set<String> samples = histogramSamples(dir.resolve(HISTOGRAM_DIR));
                if (!hasComposite && samples.isEmpty()) {
                    return;
                }
                ElementKey key = parseFolderName(name);
                columns.computeIfAbsent(key, k -> new TreeSet<>()).addAll(samples);
            });
        } catch (IOException e) {
            logger.error("Failed to scan output folder {}", outputRoot, e);
        }
        return columns;
    }

    /**
     * Parses an element folder name such as {@code Fe56_ppm}; names without a unit suffix are
     * treated as legacy ppm folders.
     */
    public static ElementKey parseFolderName(String folderName) {
        int idx = folderName.lastIndexOf('_');
        if (idx > 0) {
            UnitType unit = UnitType.fromSuffix(folderName.substring(idx + 1));
            if (unit != null) {
                return new ElementKey(folderName.substring(0, idx), unit);
            }
        }
        return new ElementKey(folderName, UnitType.PPM);
    }

    private static Set<String> histogramSamples(Path histogramDir) {
        Set<String> samples = new TreeSet<>();
        if (!Files.isDirectory(histogramDir)) {
            return samples;
        }
        try (Stream<Path> files = Files.list(histogramDir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(HISTOGRAM_SUFFIX))
                    .forEach(n -> samples.add(n.substring(0, n.length() - HISTOGRAM_SUFFIX.length())));
        } catch (IOException e) {
            logger.warn("Could not list histograms in {}", histogramDir, e);
        }
        return samples;
    }

    static Optional<FileTime> nonEmptyTimestamp(Path file) {
        try {
            if (Files.isRegularFile(file) && Files.size(file) > 0) {
                return Optional.of(Files.getLastModifiedTime(file));
            }
        } catch (IOException e) {
            logger.debug("Could not stat {}: {}", file, e.getMessage());
        }
        return Optional.empty();
    }

    private static String fileStem(String sample) {
        return MinorFunctions.sanitizeForFilename(sample);
    }
}
