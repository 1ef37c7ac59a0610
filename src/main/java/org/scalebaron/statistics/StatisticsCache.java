package org.scalebaron.statistics;

import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ElementMatrix;
import org.scalebaron.model.StatisticsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caches statistics keyed by (sample, element).
 *
 * <p>Each entry remembers the matrix instance it was computed from. Matrices are immutable, so a
 * lookup with a different instance (the file was re-read) recomputes instead of returning the old
 * record.
 */
public class StatisticsCache {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsCache.class);

    private final StatisticsEngine engine;
    private final Map<ElementKey, Map<String, Entry>> entries = new HashMap<>();

    private record Entry(ElementMatrix source, StatisticsRecord record) {
    }

    public StatisticsCache(StatisticsEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Returns the statistics of {@code matrix}, computing them if the cached entry is missing or was
     * computed from another matrix instance.
     *
     * @throws org.scalebaron.exceptions.EmptyDataException if the matrix has no valid pixels
     */
    public StatisticsRecord get(String sample, ElementKey element, ElementMatrix matrix) {
        Map<String, Entry> bySample = entries.computeIfAbsent(element, e -> new LinkedHashMap<>());
        Entry entry = bySample.get(sample);
        if (entry != null && entry.source() == matrix) {
            logger.trace("Statistics cache hit for {} / {}", sample, element);
            return entry.record();
        }
        StatisticsRecord record = engine.compute(matrix);
        bySample.put(sample, new Entry(matrix, record));
        return record;
    }

    /**
     * @return cached records of one element, in the order they were first computed
     */
    public Map<String, StatisticsRecord> snapshot(ElementKey element) {
        Map<String, StatisticsRecord> out = new LinkedHashMap<>();
        Map<String, Entry> bySample = entries.get(element);
        if (bySample != null) {
            bySample.forEach((sample, entry) -> out.put(sample, entry.record()));
        }
        return out;
    }

    /**
     * Drops every record of an element, called once its composite is finalized.
     */
    public void discard(ElementKey element) {
        Map<String, Entry> removed = entries.remove(element);
        if (removed != null) {
            logger.debug("Discarded {} cached statistics record(s) for {}", removed.size(), element);
        }
    }

    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }
}
