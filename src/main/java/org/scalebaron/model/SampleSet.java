package org.scalebaron.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable, ordered collection of samples with their inclusion flags and pixel sizes.
 *
 * <p>Order is the display order and is never changed by inclusion: excluding a sample removes it
 * from {@link #includedNames()} while the remaining samples keep their relative order.
 */
public final class SampleSet {

    private final Map<String, Sample> samples;

    private SampleSet(Map<String, Sample> samples) {
        this.samples = Collections.unmodifiableMap(samples);
    }

    /**
     * @param names sample names in display order; every sample starts included
     */
    public static SampleSet of(Collection<String> names) {
        Map<String, Sample> map = new LinkedHashMap<>();
        for (String name : names) {
            map.putIfAbsent(name, Sample.of(name));
        }
        return new SampleSet(map);
    }

    public static SampleSet ofSamples(Collection<Sample> samples) {
        Map<String, Sample> map = new LinkedHashMap<>();
        for (Sample sample : samples) {
            map.put(sample.name(), sample);
        }
        return new SampleSet(map);
    }

    public Optional<Sample> get(String name) {
        return Optional.ofNullable(samples.get(name));
    }

    public boolean contains(String name) {
        return samples.containsKey(name);
    }

    /**
     * @return true if the sample is known and included; unknown samples are not included
     */
    public boolean isIncluded(String name) {
        Sample sample = samples.get(name);
        return sample != null && sample.included();
    }

    public List<Sample> all() {
        return List.copyOf(samples.values());
    }

    public List<String> names() {
        return List.copyOf(samples.keySet());
    }

    public List<String> includedNames() {
        return samples.values().stream()
                .filter(Sample::included)
                .map(Sample::name)
                .collect(Collectors.toList());
    }

    public int size() {
        return samples.size();
    }

    /**
     * Returns a copy with {@code sample} replaced. Unknown samples are appended at the end.
     */
    public SampleSet with(Sample sample) {
        Map<String, Sample> copy = new LinkedHashMap<>(samples);
        copy.put(sample.name(), sample);
        return new SampleSet(copy);
    }

    /**
     * Returns a copy that also contains {@code names} not yet present, each included by default.
     * Known samples keep their flags.
     */
    public SampleSet mergeNames(Collection<String> names) {
        Map<String, Sample> copy = new LinkedHashMap<>(samples);
        for (String name : names) {
            copy.putIfAbsent(name, Sample.of(name));
        }
        return new SampleSet(copy);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        samples.values().forEach(s -> parts.add(s.name() + (s.included() ? "" : "(excluded)")));
        return "SampleSet" + parts;
    }
}
