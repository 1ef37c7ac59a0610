package org.scalebaron.progress;

import org.scalebaron.model.ElementKey;
import org.scalebaron.model.ProgressRecord;
import org.scalebaron.model.ProgressStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable result of one {@link ProgressTracker#refresh()}.
 */
public final class ProgressSnapshot {

    /**
     * Key of one progress cell.
     */
    public record PairKey(String sample, ElementKey element) {
    }

    private final Map<PairKey, ProgressRecord> records;
    private final List<String> samples;
    private final SortedSet<ElementKey> elements;
    private final Instant scannedAt;

    ProgressSnapshot(List<String> samples, Collection<ElementKey> elements,
                     Map<PairKey, ProgressRecord> records, Instant scannedAt) {
        this.samples = List.copyOf(samples);
        this.elements = Collections.unmodifiableSortedSet(new TreeSet<>(elements));
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.scannedAt = scannedAt;
    }

    public Optional<ProgressRecord> get(String sample, ElementKey element) {
        return Optional.ofNullable(records.get(new PairKey(sample, element)));
    }

    /**
     * @return the status of a pair, {@link ProgressStatus#MISSING} if the pair is unknown
     */
    public ProgressStatus statusOf(String sample, ElementKey element) {
        ProgressRecord record = records.get(new PairKey(sample, element));
        return record == null ? ProgressStatus.MISSING : record.status();
    }

    public Map<PairKey, ProgressRecord> records() {
        return records;
    }

    public List<ProgressRecord> forElement(ElementKey element) {
        List<ProgressRecord> result = new ArrayList<>();
        for (String sample : samples) {
            ProgressRecord record = records.get(new PairKey(sample, element));
            if (record != null) {
                result.add(record);
            }
        }
        return result;
    }

    /**
     * True when every included sample that has input is Complete. An element with no such
     * sample is not complete, since there is nothing to show for it.
     */
    public boolean isElementComplete(ElementKey element) {
        int candidates = 0;
        for (ProgressRecord record : forElement(element)) {
            if (!record.included() || !record.inputAvailable()) {
                continue;
            }
            candidates++;
            if (!record.status().isComplete()) {
                return false;
            }
        }
        return candidates > 0;
    }

    public int count(ProgressStatus status) {
        return (int) records.values().stream().filter(r -> r.status() == status).count();
    }

    public List<String> getSamples() {
        return samples;
    }

    public SortedSet<ElementKey> getElements() {
        return elements;
    }

    public Instant getScannedAt() {
        return scannedAt;
    }

    @Override
    public String toString() {
        return String.format("ProgressSnapshot[%d samples x %d elements: %d complete, %d partial, %d missing]",
                samples.size(), elements.size(), count(ProgressStatus.COMPLETE),
                count(ProgressStatus.PARTIAL), count(ProgressStatus.MISSING));
    }
}
