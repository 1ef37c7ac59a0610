package org.scalebaron.progress;

import org.scalebaron.model.ElementKey;
import org.scalebaron.model.MatrixStore;
import org.scalebaron.model.ProgressRecord;
import org.scalebaron.model.ProgressStatus;
import org.scalebaron.model.SampleSet;
import org.scalebaron.service.StatisticsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * ProgressTracker
 *
 * <p>Projects the output folder onto a status per (sample, element) pair. Nothing is stored
 * between calls: every {@link #refresh()} scans the disk again and returns a new
 * {@link ProgressSnapshot}, so deleting an artifact is reflected on the next refresh.
 *
 * <p>Status rules:
 * <ul>
 *   <li>MISSING: no readable input for the pair, or no artifact for it yet</li>
 *   <li>PARTIAL: the sample's histogram exists, or the element's statistics table lists the sample,
 *       but the composite does not</li>
 *   <li>COMPLETE: the element composite exists, is non-empty and is not older than the input</li>
 * </ul>
 *
 * <p>Without a {@link MatrixStore}, samples and elements are inferred from the output folder.
 */
public class ProgressTracker {
    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    private final OutputLayout layout;
    private final MatrixStore store;
    private final SampleInclusion inclusion;
    private final StatisticsExporter statisticsReader;

    /**
     * @param store input store, or null to infer everything from the output folder
     */
    public ProgressTracker(OutputLayout layout, MatrixStore store, SampleInclusion inclusion) {
        this(layout, store, inclusion, new StatisticsExporter());
    }

    ProgressTracker(OutputLayout layout, MatrixStore store, SampleInclusion inclusion,
                    StatisticsExporter statisticsReader) {
        this.layout = layout;
        this.store = store;
        this.inclusion = inclusion;
        this.statisticsReader = statisticsReader;
    }

    /**
     * Rescans the output folder.
     */
    public ProgressSnapshot refresh() {
        List<String> samples;
        Set<ElementKey> elements;
        if (store != null) {
            samples = store.getSampleNames();
            elements = store.getElements();
        } else {
            Map<ElementKey, Set<String>> columns = layout.scanOutputColumns();
            elements = columns.keySet();
            Set<String> seen = new TreeSet<>();
            for (ElementKey element : elements) {
                seen.addAll(columns.get(element));
                seen.addAll(listedSamples(element));
            }
            samples = new ArrayList<>(seen);
        }

        SampleSet sampleSet = inclusion.current();
        Map<ProgressSnapshot.PairKey, ProgressRecord> records = new LinkedHashMap<>();
        for (ElementKey element : elements) {
            Optional<FileTime> composite = layout.compositeTimestamp(element);
            Set<String> listed = listedSamples(element);
            for (String sample : samples) {
                boolean inputAvailable = store == null || store.isReadable(sample, element);
                ProgressStatus status = inputAvailable
                        ? statusOf(sample, element, composite, listed)
                        : ProgressStatus.MISSING;
                // samples the inclusion holder has not seen yet count as included
                boolean included = !sampleSet.contains(sample) || sampleSet.isIncluded(sample);
                records.put(new ProgressSnapshot.PairKey(sample, element),
                        new ProgressRecord(sample, element, status, included, inputAvailable));
            }
        }
        ProgressSnapshot snapshot = new ProgressSnapshot(samples, elements, records, Instant.now());
        logger.debug("Progress refreshed for {}: {}", layout.getOutputRoot(), snapshot);
        return snapshot;
    }

    private ProgressStatus statusOf(String sample, ElementKey element, Optional<FileTime> composite,
                                    Set<String> listed) {
        if (composite.isPresent() && isCurrent(composite.get(), sample, element)) {
            return ProgressStatus.COMPLETE;
        }
        if (layout.hasHistogram(element, sample) || listed.contains(sample)) {
            return ProgressStatus.PARTIAL;
        }
        return ProgressStatus.MISSING;
    }

    private boolean isCurrent(FileTime composite, String sample, ElementKey element) {
        if (store == null) {
            return true;
        }
        Optional<Instant> input = store.getLastModified(sample, element);
        return input.isEmpty() || !composite.toInstant().isBefore(input.get());
    }

    private Set<String> listedSamples(ElementKey element) {
        try {
            return statisticsReader.read(layout.statisticsTable(element)).keySet();
        } catch (IOException e) {
            logger.warn("Could not read statistics table for {}: {}", element, e.getMessage());
            return Collections.emptySet();
        }
    }

    public OutputLayout getLayout() {
        return layout;
    }

    public SampleInclusion getInclusion() {
        return inclusion;
    }
}
